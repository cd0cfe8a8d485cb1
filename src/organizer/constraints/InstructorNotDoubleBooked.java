package organizer.constraints;

import organizer.core.AssignmentGrid;
import organizer.model.Lesson;

/**
 * An instructor teaches at most one lesson per day and time slot across all classrooms.
 */
public class InstructorNotDoubleBooked implements Constraint {

    @Override
    public boolean test(AssignmentGrid grid, Candidate cand) {
        int index = grid.indexOf(cand.position);
        for (Lesson other : grid.lessonsAtSameTime(index)) {
            if (other.getInstructor().getId() == cand.instructor.getId()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String getViolationMessage() {
        return "Instructor already teaches in another classroom at that time";
    }
}
