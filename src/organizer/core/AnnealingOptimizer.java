package organizer.core;

import organizer.config.AnnealingParameters;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;
import java.util.function.DoubleConsumer;

/**
 * Simulated annealing that maximizes schedule earnings.
 * <p>
 * Each epoch evaluates {@code iterations_per_temperature} neighbor proposals at a fixed
 * temperature, then cools by {@code alpha}. Improving moves are always kept, worsening
 * ones with probability {@code exp(delta / T)}. A rejected move is undone, so the
 * working grid always scores {@code currentCost}. The run stops when the temperature
 * drops to {@code min_temperature} or after {@code max_stagnant_epochs} epochs ending
 * within {@code epsilon} of the best cost.
 */
public class AnnealingOptimizer {
    private final CostEvaluator evaluator;
    private final NeighborOperator neighbors;
    private final AnnealingParameters parameters;
    private final Random random;

    public AnnealingOptimizer(CostEvaluator evaluator, NeighborOperator neighbors,
                              AnnealingParameters parameters, Random random) {
        this.evaluator = evaluator;
        this.neighbors = neighbors;
        this.parameters = parameters;
        this.random = random;
    }

    public AnnealingResult optimize(AssignmentGrid initial) {
        return optimize(initial, () -> false, null);
    }

    /**
     * Runs the search on a copy of {@code initial}; the argument is never modified.
     *
     * @param cancelled checked before every proposal
     * @param listener  receives each trace value as it is recorded, may be null
     * @throws CancellationException       if {@code cancelled} turns true
     * @throws DegenerateScheduleException if the grid has no neighbor
     */
    public AnnealingResult optimize(AssignmentGrid initial, BooleanSupplier cancelled, DoubleConsumer listener) {
        AssignmentGrid current = initial.copy();
        double currentCost = evaluator.cost(current);
        double initialCost = currentCost;

        AssignmentGrid best = current.copy();
        double bestCost = currentCost;

        double temperature = parameters.getInitialTemperature();
        int stagnant = 0;
        int total = 0;
        int epochs = 0;
        List<Double> trace = new ArrayList<>();

        while (temperature > parameters.getMinTemperature() && stagnant < parameters.getMaxStagnantEpochs()) {
            for (int j = 0; j < parameters.getIterationsPerTemperature(); j++) {
                if (cancelled.getAsBoolean()) {
                    throw new CancellationException("Annealing cancelled after " + total + " iterations");
                }
                total++;

                NeighborMove move = neighbors.propose(current);
                move.apply(current);
                double neighborCost = evaluator.cost(current);
                double delta = neighborCost - currentCost;

                if (delta >= 0) {
                    currentCost = neighborCost;
                    if (currentCost > bestCost) {
                        best = current.copy();
                        bestCost = currentCost;
                    }
                } else if (random.nextDouble() < Math.exp(delta / temperature)) {
                    currentCost = neighborCost;
                } else {
                    move.undo(current);
                }

                trace.add(currentCost);
                if (listener != null) {
                    listener.accept(currentCost);
                }
            }

            temperature *= parameters.getAlpha();
            epochs++;

            if (Math.abs(currentCost - bestCost) < parameters.getEpsilon()) {
                stagnant++;
            } else {
                stagnant = 0;
            }
        }

        return new AnnealingResult(best, bestCost, initialCost, total, epochs, trace);
    }
}
