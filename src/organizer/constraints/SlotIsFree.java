package organizer.constraints;

import organizer.core.AssignmentGrid;

/**
 * One lesson per classroom and time slot.
 */
public class SlotIsFree implements Constraint {

    @Override
    public boolean test(AssignmentGrid grid, Candidate cand) {
        return grid.isFree(cand.position);
    }

    @Override
    public String getViolationMessage() {
        return "Classroom is already occupied at that time";
    }
}
