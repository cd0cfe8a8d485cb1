package organizer.core;

import organizer.config.ScheduleConfig;
import organizer.model.Lesson;

import java.util.HashSet;
import java.util.Set;

/**
 * Net weekly earnings of a grid: ticket revenue minus instructor pay and classroom rent.
 */
public class CostEvaluator {
    private final ScheduleConfig config;

    public CostEvaluator(ScheduleConfig config) {
        this.config = config;
    }

    public double cost(AssignmentGrid grid) {
        return breakdown(grid).getTotal();
    }

    public CostBreakdown breakdown(AssignmentGrid grid) {
        int participants = 0;
        int hours = 0;
        // (instructor, day) and (classroom, day) pairs packed into one long
        Set<Long> presence = new HashSet<>();
        Set<Long> rented = new HashSet<>();

        int classrooms = grid.getClassroomCount();
        int days = grid.getDayCount();
        int slots = grid.getSlotCount();
        for (int c = 0; c < classrooms; c++) {
            for (int d = 0; d < days; d++) {
                for (int ts = 0; ts < slots; ts++) {
                    Lesson lesson = grid.get(c, d, ts).orElse(null);
                    if (lesson == null) continue;
                    participants += lesson.getParticipantCount();
                    hours++;
                    presence.add(pair(lesson.getInstructor().getId(), d));
                    rented.add(pair(c, d));
                }
            }
        }

        double revenue = config.getTicketPrice() * participants;
        double total = revenue
                - config.getHourlyPay() * hours
                - config.getPresenceBonus() * presence.size()
                - config.getRentalCost() * rented.size();
        return new CostBreakdown(participants, hours, presence.size(), rented.size(), revenue, total);
    }

    private static long pair(int a, int b) {
        return ((long) a << 32) | (b & 0xffffffffL);
    }
}
