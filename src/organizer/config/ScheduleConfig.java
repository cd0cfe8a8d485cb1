package organizer.config;

/**
 * Grid dimensions and the economy used to score a schedule.
 */
public class ScheduleConfig {
    private final int classroomCount;
    private final int dayCount;
    private final int slotCount;
    private final int maxParticipantsPerLesson;
    private final double ticketPrice;
    private final double hourlyPay;
    private final double presenceBonus;
    private final double rentalCost;

    public ScheduleConfig(int classroomCount, int dayCount, int slotCount, int maxParticipantsPerLesson,
                          double ticketPrice, double hourlyPay, double presenceBonus, double rentalCost) {
        requireNonNegative("classroom_count", classroomCount);
        requireNonNegative("day_count", dayCount);
        requireNonNegative("slot_count", slotCount);
        requireNonNegative("max_participants_per_lesson", maxParticipantsPerLesson);
        requireNonNegative("ticket_price", ticketPrice);
        requireNonNegative("hourly_pay", hourlyPay);
        requireNonNegative("presence_bonus", presenceBonus);
        requireNonNegative("rental_cost", rentalCost);
        this.classroomCount = classroomCount;
        this.dayCount = dayCount;
        this.slotCount = slotCount;
        this.maxParticipantsPerLesson = maxParticipantsPerLesson;
        this.ticketPrice = ticketPrice;
        this.hourlyPay = hourlyPay;
        this.presenceBonus = presenceBonus;
        this.rentalCost = rentalCost;
    }

    private static void requireNonNegative(String name, double value) {
        if (value < 0 || Double.isNaN(value))
            throw new IllegalArgumentException(name + " must not be negative: " + value);
    }

    public int getClassroomCount() { return classroomCount; }
    public int getDayCount() { return dayCount; }
    public int getSlotCount() { return slotCount; }
    public int getMaxParticipantsPerLesson() { return maxParticipantsPerLesson; }
    public double getTicketPrice() { return ticketPrice; }
    public double getHourlyPay() { return hourlyPay; }
    public double getPresenceBonus() { return presenceBonus; }
    public double getRentalCost() { return rentalCost; }

    @Override
    public String toString() {
        return "ScheduleConfig{classrooms=" + classroomCount + ", days=" + dayCount + ", slots=" + slotCount
                + ", maxParticipants=" + maxParticipantsPerLesson + ", ticket=" + ticketPrice
                + ", hourlyPay=" + hourlyPay + ", presenceBonus=" + presenceBonus + ", rental=" + rentalCost + "}";
    }
}
