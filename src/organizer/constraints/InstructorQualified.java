package organizer.constraints;

import organizer.core.AssignmentGrid;

public class InstructorQualified implements Constraint {

    @Override
    public boolean test(AssignmentGrid grid, Candidate cand) {
        return cand.instructor.canTeach(cand.lessonType);
    }

    @Override
    public String getViolationMessage() {
        return "Instructor is not qualified for the lesson type";
    }
}
