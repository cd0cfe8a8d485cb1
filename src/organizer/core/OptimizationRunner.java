package organizer.core;

import organizer.config.AnnealingParameters;

import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.DoubleConsumer;

/**
 * Runs initialize, anneal and consolidate on a background thread.
 * <p>
 * Runs are executed one at a time. The schedule's grid is replaced only when a run
 * completes; a cancelled or failed run leaves it as it was. A run whose starting grid
 * was replaced in the meantime fails with {@link IllegalStateException}.
 */
public class OptimizationRunner implements AutoCloseable {
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "schedule-optimizer-task");
        t.setDaemon(true);
        return t;
    });

    /**
     * @param listener receives every trace value on the worker thread, may be null
     */
    public OptimizationJob submit(Schedule schedule, AnnealingParameters parameters, long seed,
                                  DoubleConsumer listener) {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        return new OptimizationJob(
                executor.submit(() -> run(schedule, parameters, new Random(seed), cancelled::get, listener)),
                cancelled);
    }

    static OptimizationReport run(Schedule schedule, AnnealingParameters parameters, Random random,
                                  BooleanSupplier cancelled, DoubleConsumer listener) {
        long tic = System.currentTimeMillis();
        System.out.println("Optimization started...");

        AssignmentGrid base = schedule.committedGrid();
        AssignmentGrid start;
        if (!base.isEmpty()) {
            start = base;
        } else {
            start = new RandomScheduleInitializer(schedule.getConfig(), random)
                    .generate(schedule.getClients(), schedule.getInstructors(), parameters.isGreedyInitialPlacement());
        }

        CostEvaluator evaluator = schedule.getEvaluator();
        NeighborOperator neighbors = new NeighborOperator(parameters.getAllowedMoveTypes(), random);
        AnnealingResult annealed = new AnnealingOptimizer(evaluator, neighbors, parameters, random)
                .optimize(start, cancelled, listener);

        AssignmentGrid finalGrid = annealed.getBestGrid().copy();
        int moved = new ConsolidationPass().consolidate(finalGrid);

        if (cancelled.getAsBoolean()) {
            throw new CancellationException("Optimization cancelled before commit");
        }
        schedule.install(base, finalGrid, annealed.getCostTrace());

        long elapsed = System.currentTimeMillis() - tic;
        OptimizationReport report = new OptimizationReport(annealed.getInitialCost(), annealed.getBestCost(),
                evaluator.cost(finalGrid), annealed.getIterations(), moved, elapsed, annealed.getCostTrace());
        System.out.println("Optimization finished: " + report);
        return report;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
