package organizer;

import organizer.config.ScheduleConfig;
import organizer.model.Client;
import organizer.model.Instructor;
import organizer.model.Lesson;
import organizer.model.LessonType;

import java.util.ArrayList;
import java.util.List;

public final class Fixtures {

    private Fixtures() {
    }

    public static ScheduleConfig config(int classrooms, int days, int slots, int maxParticipants) {
        return new ScheduleConfig(classrooms, days, slots, maxParticipants, 40, 50, 50, 200);
    }

    public static Client client(int id, LessonType... types) {
        return new Client(id, List.of(types));
    }

    public static Instructor instructor(int id, LessonType... types) {
        return new Instructor(id, List.of(types));
    }

    /** clients with ids from {@code firstId}, all wanting the same lesson type */
    public static List<Client> clients(int firstId, int count, LessonType type) {
        List<Client> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            out.add(client(firstId + i, type));
        }
        return out;
    }

    public static Lesson lesson(Instructor instructor, LessonType type, int participants) {
        return new Lesson(instructor, type, clients(1000, participants, type));
    }
}
