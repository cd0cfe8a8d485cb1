package organizer.core;

/**
 * Terms of the schedule earnings, as counted by {@link CostEvaluator}.
 */
public class CostBreakdown {
    private final int participants;
    private final int instructorHours;
    private final int instructorPresenceDays;
    private final int rentedClassroomDays;
    private final double revenue;
    private final double total;

    public CostBreakdown(int participants, int instructorHours, int instructorPresenceDays,
                         int rentedClassroomDays, double revenue, double total) {
        this.participants = participants;
        this.instructorHours = instructorHours;
        this.instructorPresenceDays = instructorPresenceDays;
        this.rentedClassroomDays = rentedClassroomDays;
        this.revenue = revenue;
        this.total = total;
    }

    public int getParticipants() { return participants; }
    public int getInstructorHours() { return instructorHours; }
    public int getInstructorPresenceDays() { return instructorPresenceDays; }
    public int getRentedClassroomDays() { return rentedClassroomDays; }
    public double getRevenue() { return revenue; }
    public double getTotal() { return total; }

    @Override
    public String toString() {
        return "participants=" + participants + ", hours=" + instructorHours
                + ", presenceDays=" + instructorPresenceDays + ", classroomDays=" + rentedClassroomDays
                + ", revenue=" + revenue + ", total=" + total;
    }
}
