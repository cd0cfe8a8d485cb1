package organizer.core;

import organizer.config.AnnealingParameters;
import organizer.config.ScheduleConfig;
import organizer.export.ScheduleFormatter;
import organizer.model.Client;
import organizer.model.Instructor;
import organizer.model.Lesson;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.function.BooleanSupplier;
import java.util.function.DoubleConsumer;

/**
 * Weekly timetable of one club: its settings, clients, instructors and the committed grid.
 * <p>
 * Every operation that changes the timetable builds a new grid and installs it in one
 * step, so a reader on another thread sees either the old or the new grid. A grid
 * computed from an older committed grid is refused, so concurrent changes are never
 * silently overwritten.
 */
public class Schedule {
    private final ScheduleConfig config;
    private final List<Client> clients;
    private final List<Instructor> instructors;
    private final CostEvaluator evaluator;

    private volatile AssignmentGrid grid;
    private volatile List<Double> lastCostTrace = List.of();

    public Schedule(ScheduleConfig config, List<Client> clients, List<Instructor> instructors) {
        this.config = config;
        this.clients = List.copyOf(clients);
        this.instructors = List.copyOf(instructors);
        this.evaluator = new CostEvaluator(config);
        this.grid = new AssignmentGrid(config.getClassroomCount(), config.getDayCount(), config.getSlotCount());
    }

    public ScheduleConfig getConfig() { return config; }
    public List<Client> getClients() { return clients; }
    public List<Instructor> getInstructors() { return instructors; }
    public CostEvaluator getEvaluator() { return evaluator; }

    /**
     * Replaces the timetable with a freshly initialized one.
     *
     * @throws ScheduleConfigurationException when the demand does not fit
     */
    public synchronized void generateRandomSchedule(boolean greedy, Random random) {
        grid = new RandomScheduleInitializer(config, random).generate(clients, instructors, greedy);
        lastCostTrace = List.of();
    }

    public boolean isInitialized() {
        return !grid.isEmpty();
    }

    public Optional<Lesson> getLesson(int classroom, int day, int slot) {
        return grid.get(classroom, day, slot);
    }

    /** Snapshot of the committed grid. */
    public AssignmentGrid getGrid() {
        return grid.copy();
    }

    public double getCost() {
        return evaluator.cost(grid);
    }

    public CostBreakdown getCostBreakdown() {
        return evaluator.breakdown(grid);
    }

    public List<Double> getLastCostTrace() {
        return lastCostTrace;
    }

    public AnnealingResult simulatedAnnealing(AnnealingParameters parameters, Random random) {
        return simulatedAnnealing(parameters, random, () -> false, null);
    }

    /**
     * Optimizes the committed grid and installs the best grid found.
     * Nothing is installed if the run is cancelled or fails.
     */
    public AnnealingResult simulatedAnnealing(AnnealingParameters parameters, Random random,
                                              BooleanSupplier cancelled, DoubleConsumer listener) {
        NeighborOperator neighbors = new NeighborOperator(parameters.getAllowedMoveTypes(), random);
        AnnealingOptimizer optimizer = new AnnealingOptimizer(evaluator, neighbors, parameters, random);
        AssignmentGrid base = committedGrid();
        AnnealingResult result = optimizer.optimize(base, cancelled, listener);
        install(base, result.getBestGrid(), result.getCostTrace());
        return result;
    }

    /**
     * Minimizes the days each instructor has to come in.
     *
     * @return number of lessons moved
     */
    public synchronized int improveResults() {
        AssignmentGrid working = grid.copy();
        int moved = new ConsolidationPass().consolidate(working);
        grid = working;
        return moved;
    }

    /** The committed grid itself, only to be passed back as {@code base} of {@link #install}. */
    AssignmentGrid committedGrid() {
        return grid;
    }

    /**
     * Commits {@code newGrid} if the committed grid is still {@code base}.
     *
     * @throws IllegalStateException if the timetable changed after {@code base} was read
     */
    synchronized void install(AssignmentGrid base, AssignmentGrid newGrid, List<Double> trace) {
        if (newGrid.getClassroomCount() != config.getClassroomCount()
                || newGrid.getDayCount() != config.getDayCount()
                || newGrid.getSlotCount() != config.getSlotCount())
            throw new IllegalArgumentException("grid dimensions do not match the schedule config");
        if (grid != base)
            throw new IllegalStateException("Schedule changed while the optimization was running");
        this.lastCostTrace = List.copyOf(trace);
        this.grid = newGrid;
    }

    @Override
    public String toString() {
        return ScheduleFormatter.format(grid);
    }
}
