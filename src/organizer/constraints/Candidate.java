package organizer.constraints;

import organizer.model.Instructor;
import organizer.model.LessonType;
import organizer.model.SlotPosition;

public class Candidate {
    public final Instructor instructor;
    public final LessonType lessonType;
    public final SlotPosition position;

    public Candidate(Instructor instructor, LessonType lessonType, SlotPosition position) {
        this.instructor = instructor;
        this.lessonType = lessonType;
        this.position = position;
    }
}
