package organizer.constraints;

import organizer.core.AssignmentGrid;

import java.util.ArrayList;
import java.util.List;

/**
 * Placement rules checked together, in the order they were added.
 */
public class ConstraintSet {
    private final List<Constraint> rules = new ArrayList<>();

    public ConstraintSet add(Constraint rule) {
        rules.add(rule);
        return this;
    }

    /** True when the candidate passes every rule; stops at the first failure. */
    public boolean ok(AssignmentGrid grid, Candidate candidate) {
        for (Constraint rule : rules) {
            if (!rule.test(grid, candidate)) return false;
        }
        return true;
    }

    /** Messages of all rules the candidate breaks, empty if it may be placed. */
    public List<String> explain(AssignmentGrid grid, Candidate candidate) {
        List<String> broken = new ArrayList<>();
        for (Constraint rule : violated(grid, candidate)) {
            broken.add(rule.getViolationMessage());
        }
        return broken;
    }

    public List<Constraint> violated(AssignmentGrid grid, Candidate candidate) {
        List<Constraint> failed = new ArrayList<>();
        for (Constraint rule : rules) {
            if (!rule.test(grid, candidate)) failed.add(rule);
        }
        return failed;
    }
}
