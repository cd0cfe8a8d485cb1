package organizer.core;

/**
 * The demand cannot be placed with the given grid and instructors.
 */
public class ScheduleConfigurationException extends RuntimeException {

    public ScheduleConfigurationException(String message) {
        super(message);
    }
}
