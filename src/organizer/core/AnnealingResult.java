package organizer.core;

import java.util.List;

public class AnnealingResult {
    private final AssignmentGrid bestGrid;
    private final double bestCost;
    private final double initialCost;
    private final int iterations;
    private final int epochs;
    private final List<Double> costTrace;

    public AnnealingResult(AssignmentGrid bestGrid, double bestCost, double initialCost,
                           int iterations, int epochs, List<Double> costTrace) {
        this.bestGrid = bestGrid;
        this.bestCost = bestCost;
        this.initialCost = initialCost;
        this.iterations = iterations;
        this.epochs = epochs;
        this.costTrace = List.copyOf(costTrace);
    }

    public AssignmentGrid getBestGrid() { return bestGrid; }
    public double getBestCost() { return bestCost; }
    public double getInitialCost() { return initialCost; }
    public int getIterations() { return iterations; }
    public int getEpochs() { return epochs; }

    /** current_cost after every proposal, in iteration order */
    public List<Double> getCostTrace() { return costTrace; }
}
