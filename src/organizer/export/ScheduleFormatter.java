package organizer.export;

import organizer.core.AssignmentGrid;
import organizer.model.Lesson;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Plain text and tabular views of a grid.
 */
public class ScheduleFormatter {

    private static final String[] DAYS = {"MONDAY", "TUESDAY", "WEDNESDAY", "THURSDAY", "FRIDAY", "SATURDAY", "SUNDAY"};
    // first lesson of the day starts at 16:00
    private static final int FIRST_HOUR = 16;

    public static final String[] HEADER = {"Classroom", "Day", "Time", "Lesson", "Instructor", "Participants"};

    public static String dayName(int day) {
        return day < DAYS.length ? DAYS[day] : "DAY " + (day + 1);
    }

    public static String slotLabel(int slot) {
        int start = (FIRST_HOUR + slot) % 24;
        return String.format("%02d:00 - %02d:00", start, (start + 1) % 24);
    }

    public static String format(AssignmentGrid grid) {
        StringBuilder sb = new StringBuilder();
        for (int c = 0; c < grid.getClassroomCount(); c++) {
            if (grid.getClassroomCount() > 1) {
                sb.append("\n===== CLASSROOM ").append(c).append(" =====\n");
            }
            for (int d = 0; d < grid.getDayCount(); d++) {
                sb.append("\n----- ").append(dayName(d)).append(" -----\n\n");
                for (int ts = 0; ts < grid.getSlotCount(); ts++) {
                    sb.append(slotLabel(ts)).append('\t');
                    sb.append(grid.get(c, d, ts).map(Lesson::toString).orElse("Free")).append('\n');
                }
            }
        }
        return sb.toString();
    }

    /** One row per occupied cell, in grid order. */
    public static List<String[]> rows(AssignmentGrid grid) {
        List<String[]> rows = new ArrayList<>();
        for (int c = 0; c < grid.getClassroomCount(); c++) {
            for (int d = 0; d < grid.getDayCount(); d++) {
                for (int ts = 0; ts < grid.getSlotCount(); ts++) {
                    Lesson lesson = grid.get(c, d, ts).orElse(null);
                    if (lesson == null) continue;
                    String participants = lesson.getParticipants().stream()
                            .map(p -> String.valueOf(p.getId()))
                            .collect(Collectors.joining(" "));
                    rows.add(new String[]{
                            String.valueOf(c),
                            dayName(d),
                            slotLabel(ts),
                            lesson.getLessonType().getDisplayName(),
                            String.valueOf(lesson.getInstructor().getId()),
                            participants
                    });
                }
            }
        }
        return rows;
    }
}
