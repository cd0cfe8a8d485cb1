package organizer.model;

import java.util.Objects;

/**
 * Coordinate of one grid cell: classroom, day and time slot of the day.
 */
public class SlotPosition {
    private final int classroom;
    private final int day;
    private final int slot;

    public SlotPosition(int classroom, int day, int slot) {
        if (classroom < 0 || day < 0 || slot < 0)
            throw new IllegalArgumentException("negative coordinate");
        this.classroom = classroom;
        this.day = day;
        this.slot = slot;
    }

    public int getClassroom() { return classroom; }
    public int getDay() { return day; }
    public int getSlot() { return slot; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SlotPosition)) return false;
        SlotPosition other = (SlotPosition) o;
        return classroom == other.classroom && day == other.day && slot == other.slot;
    }

    @Override
    public int hashCode() {
        return Objects.hash(classroom, day, slot);
    }

    @Override
    public String toString() {
        return "classroom " + classroom + ", day " + day + ", slot " + slot;
    }
}
