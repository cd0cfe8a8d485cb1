package organizer.config;

import organizer.core.NeighborMoveType;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Properties;

/**
 * Reads schedule and annealing options from flat key/value properties.
 * <p>
 * Numeric options are lenient: text that is not a number is read as 0 (a warning
 * is printed) instead of being rejected.
 * Range checks in {@link ScheduleConfig} and {@link AnnealingParameters} still apply.
 */
public class ConfigLoader {

    public static final String CLASSROOM_COUNT = "classroom_count";
    public static final String DAY_COUNT = "day_count";
    public static final String SLOT_COUNT = "slot_count";
    public static final String MAX_PARTICIPANTS = "max_participants_per_lesson";
    public static final String TICKET_PRICE = "ticket_price";
    public static final String HOURLY_PAY = "hourly_pay";
    public static final String PRESENCE_BONUS = "presence_bonus";
    public static final String RENTAL_COST = "rental_cost";

    public static final String ALPHA = "alpha";
    public static final String INITIAL_TEMPERATURE = "initial_temperature";
    public static final String ITERATIONS_PER_TEMPERATURE = "iterations_per_temperature";
    public static final String MIN_TEMPERATURE = "min_temperature";
    public static final String EPSILON = "epsilon";
    public static final String MAX_STAGNANT_EPOCHS = "max_stagnant_epochs";
    public static final String GREEDY_INITIAL_PLACEMENT = "use_greedy_initial_placement";
    public static final String ALLOWED_MOVE_TYPES = "allowed_neighbor_move_types";

    public static Properties loadDefaults() throws IOException {
        Properties props = new Properties();
        try (InputStream in = ConfigLoader.class.getClassLoader()
                .getResourceAsStream(SchedulingConfig.DEFAULTS_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        }
        return props;
    }

    /** Defaults from the classpath, overridden by the given file. */
    public static Properties load(Path path) throws IOException {
        Properties props = loadDefaults();
        if (path != null) {
            try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                props.load(reader);
            }
        }
        return props;
    }

    public static ScheduleConfig toScheduleConfig(Properties props) {
        return new ScheduleConfig(
                readInt(props, CLASSROOM_COUNT, SchedulingConfig.CLASSROOM_COUNT),
                readInt(props, DAY_COUNT, SchedulingConfig.DAY_COUNT),
                readInt(props, SLOT_COUNT, SchedulingConfig.SLOT_COUNT),
                readInt(props, MAX_PARTICIPANTS, SchedulingConfig.MAX_PARTICIPANTS_PER_LESSON),
                readDouble(props, TICKET_PRICE, SchedulingConfig.TICKET_PRICE),
                readDouble(props, HOURLY_PAY, SchedulingConfig.HOURLY_PAY),
                readDouble(props, PRESENCE_BONUS, SchedulingConfig.PRESENCE_BONUS),
                readDouble(props, RENTAL_COST, SchedulingConfig.RENTAL_COST));
    }

    public static AnnealingParameters toAnnealingParameters(Properties props) {
        return new AnnealingParameters(
                readDouble(props, ALPHA, SchedulingConfig.ALPHA),
                readDouble(props, INITIAL_TEMPERATURE, SchedulingConfig.INITIAL_TEMPERATURE),
                readInt(props, ITERATIONS_PER_TEMPERATURE, SchedulingConfig.ITERATIONS_PER_TEMPERATURE),
                readDouble(props, MIN_TEMPERATURE, SchedulingConfig.MIN_TEMPERATURE),
                readDouble(props, EPSILON, SchedulingConfig.EPSILON),
                readInt(props, MAX_STAGNANT_EPOCHS, SchedulingConfig.MAX_STAGNANT_EPOCHS),
                Boolean.parseBoolean(props.getProperty(GREEDY_INITIAL_PLACEMENT, "false").trim()),
                readMoveTypes(props.getProperty(ALLOWED_MOVE_TYPES)));
    }

    static int readInt(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            System.err.println("Invalid number for '" + key + "': '" + raw + "', using 0.");
            return 0;
        }
    }

    static double readDouble(Properties props, String key, double fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            System.err.println("Invalid number for '" + key + "': '" + raw + "', using 0.");
            return 0;
        }
    }

    static EnumSet<NeighborMoveType> readMoveTypes(String raw) {
        EnumSet<NeighborMoveType> types = EnumSet.noneOf(NeighborMoveType.class);
        if (raw == null) return types;
        for (String token : raw.split("[,;\\s]+")) {
            String t = token.trim();
            if (t.isEmpty()) continue;
            try {
                types.add(NeighborMoveType.valueOf(t.toUpperCase()));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown neighbor move type: " + t, e);
            }
        }
        return types;
    }
}
