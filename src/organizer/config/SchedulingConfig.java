package organizer.config;

public class SchedulingConfig {
    // grid
    public static final int CLASSROOM_COUNT = 1;
    public static final int DAY_COUNT = 6;
    public static final int SLOT_COUNT = 6;
    public static final int MAX_PARTICIPANTS_PER_LESSON = 5;

    // economy
    public static final double TICKET_PRICE = 40;
    public static final double HOURLY_PAY = 50;
    public static final double PRESENCE_BONUS = 50;
    public static final double RENTAL_COST = 200;

    // annealing
    public static final double ALPHA = 0.9999;
    public static final double INITIAL_TEMPERATURE = 1000;
    public static final int ITERATIONS_PER_TEMPERATURE = 50;
    public static final double MIN_TEMPERATURE = 0.1;
    public static final double EPSILON = 0.01;
    public static final int MAX_STAGNANT_EPOCHS = 1000;

    public static final long RANDOM_SEED = 42L;
    public static final String DEFAULTS_RESOURCE = "organizer.properties";
}
