package organizer.model;

import java.util.List;

/**
 * One weekly group lesson. Immutable, so grid copies may share instances.
 */
public class Lesson {
    private final Instructor instructor;
    private final LessonType lessonType;
    private final List<Client> participants;

    public Lesson(Instructor instructor, LessonType lessonType, List<Client> participants) {
        if (instructor == null || lessonType == null)
            throw new IllegalArgumentException("instructor and lesson type are required");
        this.instructor = instructor;
        this.lessonType = lessonType;
        this.participants = participants == null ? List.of() : List.copyOf(participants);
    }

    public Instructor getInstructor() {
        return instructor;
    }

    public LessonType getLessonType() {
        return lessonType;
    }

    public List<Client> getParticipants() {
        return participants;
    }

    public int getParticipantCount() {
        return participants.size();
    }

    @Override
    public String toString() {
        return "I: " + instructor.getId() + ", L: " + lessonType.name();
    }
}
