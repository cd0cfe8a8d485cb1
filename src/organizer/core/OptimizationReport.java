package organizer.core;

import java.util.List;

/**
 * Outcome of one full run: initial, annealed and consolidated earnings.
 */
public class OptimizationReport {
    private final double initialCost;
    private final double annealedCost;
    private final double finalCost;
    private final int iterations;
    private final int lessonsMoved;
    private final long elapsedMillis;
    private final List<Double> costTrace;

    public OptimizationReport(double initialCost, double annealedCost, double finalCost, int iterations,
                              int lessonsMoved, long elapsedMillis, List<Double> costTrace) {
        this.initialCost = initialCost;
        this.annealedCost = annealedCost;
        this.finalCost = finalCost;
        this.iterations = iterations;
        this.lessonsMoved = lessonsMoved;
        this.elapsedMillis = elapsedMillis;
        this.costTrace = List.copyOf(costTrace);
    }

    public double getInitialCost() { return initialCost; }
    public double getAnnealedCost() { return annealedCost; }
    public double getFinalCost() { return finalCost; }
    public int getIterations() { return iterations; }
    public int getLessonsMoved() { return lessonsMoved; }
    public long getElapsedMillis() { return elapsedMillis; }
    public List<Double> getCostTrace() { return costTrace; }

    @Override
    public String toString() {
        return initialCost + " $ --> " + annealedCost + " $ --> " + finalCost + " $ ("
                + iterations + " iterations, " + elapsedMillis + " ms)";
    }
}
