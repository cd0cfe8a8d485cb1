package organizer.config;

import organizer.core.NeighborMoveType;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Simulated annealing settings and the initial placement policy.
 */
public class AnnealingParameters {
    private final double alpha;
    private final double initialTemperature;
    private final int iterationsPerTemperature;
    private final double minTemperature;
    private final double epsilon;
    private final int maxStagnantEpochs;
    private final boolean greedyInitialPlacement;
    private final Set<NeighborMoveType> allowedMoveTypes;

    public AnnealingParameters(double alpha, double initialTemperature, int iterationsPerTemperature,
                               double minTemperature, double epsilon, int maxStagnantEpochs,
                               boolean greedyInitialPlacement, Collection<NeighborMoveType> allowedMoveTypes) {
        if (!(alpha > 0 && alpha < 1))
            throw new IllegalArgumentException("alpha must be in (0, 1): " + alpha);
        if (!(initialTemperature > 0))
            throw new IllegalArgumentException("initial_temperature must be positive: " + initialTemperature);
        if (!(minTemperature >= 0))
            throw new IllegalArgumentException("min_temperature must not be negative: " + minTemperature);
        if (iterationsPerTemperature < 0)
            throw new IllegalArgumentException("iterations_per_temperature must not be negative");
        if (maxStagnantEpochs < 0)
            throw new IllegalArgumentException("max_stagnant_epochs must not be negative");
        if (epsilon < 0)
            throw new IllegalArgumentException("epsilon must not be negative");
        this.alpha = alpha;
        this.initialTemperature = initialTemperature;
        this.iterationsPerTemperature = iterationsPerTemperature;
        this.minTemperature = minTemperature;
        this.epsilon = epsilon;
        this.maxStagnantEpochs = maxStagnantEpochs;
        this.greedyInitialPlacement = greedyInitialPlacement;

        EnumSet<NeighborMoveType> types = EnumSet.noneOf(NeighborMoveType.class);
        if (allowedMoveTypes != null) {
            types.addAll(allowedMoveTypes);
        }
        // nothing selected means plain relocation
        if (types.isEmpty()) {
            types.add(NeighborMoveType.RELOCATE);
        }
        this.allowedMoveTypes = Collections.unmodifiableSet(types);
    }

    public static AnnealingParameters defaults() {
        return new AnnealingParameters(
                SchedulingConfig.ALPHA,
                SchedulingConfig.INITIAL_TEMPERATURE,
                SchedulingConfig.ITERATIONS_PER_TEMPERATURE,
                SchedulingConfig.MIN_TEMPERATURE,
                SchedulingConfig.EPSILON,
                SchedulingConfig.MAX_STAGNANT_EPOCHS,
                false,
                EnumSet.of(NeighborMoveType.RELOCATE));
    }

    public double getAlpha() { return alpha; }
    public double getInitialTemperature() { return initialTemperature; }
    public int getIterationsPerTemperature() { return iterationsPerTemperature; }
    public double getMinTemperature() { return minTemperature; }
    public double getEpsilon() { return epsilon; }
    public int getMaxStagnantEpochs() { return maxStagnantEpochs; }
    public boolean isGreedyInitialPlacement() { return greedyInitialPlacement; }
    public Set<NeighborMoveType> getAllowedMoveTypes() { return allowedMoveTypes; }

    @Override
    public String toString() {
        return "AnnealingParameters{alpha=" + alpha + ", initialTemperature=" + initialTemperature
                + ", iterationsPerTemperature=" + iterationsPerTemperature + ", minTemperature=" + minTemperature
                + ", epsilon=" + epsilon + ", maxStagnantEpochs=" + maxStagnantEpochs
                + ", greedy=" + greedyInitialPlacement + ", moves=" + allowedMoveTypes + "}";
    }
}
