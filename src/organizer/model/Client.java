package organizer.model;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

public class Client {
    private final int id;
    private final Set<LessonType> selectedTrainings;

    public Client(int id, Collection<LessonType> selectedTrainings) {
        this.id = id;
        EnumSet<LessonType> copy = EnumSet.noneOf(LessonType.class);
        if (selectedTrainings != null) {
            copy.addAll(selectedTrainings);
        }
        this.selectedTrainings = Collections.unmodifiableSet(copy);
    }

    public int getId() {
        return id;
    }

    public Set<LessonType> getSelectedTrainings() {
        return selectedTrainings;
    }

    public boolean wants(LessonType type) {
        return selectedTrainings.contains(type);
    }

    @Override
    public String toString() {
        return "id: " + id + ", selected_training: " + selectedTrainings;
    }
}
