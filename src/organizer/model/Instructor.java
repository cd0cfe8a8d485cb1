package organizer.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public class Instructor {
    private final int id;
    private final Set<LessonType> qualifications;

    public Instructor(int id, Collection<LessonType> qualifications) {
        this.id = id;
        EnumSet<LessonType> copy = EnumSet.noneOf(LessonType.class);
        if (qualifications != null) {
            copy.addAll(qualifications);
        }
        this.qualifications = Collections.unmodifiableSet(copy);
    }

    public int getId() {
        return id;
    }

    public Set<LessonType> getQualifications() {
        return qualifications;
    }

    public boolean canTeach(LessonType type) {
        return qualifications.contains(type);
    }

    @Override
    public String toString() {
        return "id: " + id + ", qualifications: " + qualifications;
    }
}
