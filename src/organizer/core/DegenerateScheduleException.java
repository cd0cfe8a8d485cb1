package organizer.core;

/**
 * Thrown when no neighbor exists, e.g. the grid has no lesson or no free slot.
 */
public class DegenerateScheduleException extends IllegalStateException {

    public DegenerateScheduleException(String message) {
        super(message);
    }
}
