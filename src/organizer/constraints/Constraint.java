package organizer.constraints;

import organizer.core.AssignmentGrid;

public interface Constraint {
    // Can the candidate lesson be placed on this grid?
    boolean test(AssignmentGrid grid, Candidate candidate);

    // Reason reported when the candidate is rejected
    String getViolationMessage();
}
