package organizer.core;

import org.junit.jupiter.api.Test;
import organizer.Fixtures;
import organizer.config.AnnealingParameters;
import organizer.model.Client;
import organizer.model.Instructor;
import organizer.model.Lesson;
import organizer.model.LessonType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class OptimizationRunnerTest {

    private final Instructor anna = Fixtures.instructor(1, LessonType.values());
    private final Instructor bob = Fixtures.instructor(2, LessonType.values());

    private Schedule schedule() {
        List<Client> clients = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            clients.add(Fixtures.client(i, LessonType.values()[i % 4], LessonType.YOGA));
        }
        return new Schedule(Fixtures.config(2, 3, 4, 5), clients, List.of(anna, bob));
    }

    private static AnnealingParameters shortRun() {
        return new AnnealingParameters(0.9, 300, 20, 0.5, 0.01, 20, false,
                EnumSet.of(NeighborMoveType.RELOCATE, NeighborMoveType.SWAP));
    }

    @Test
    void reportMatchesCommittedSchedule() throws Exception {
        Schedule schedule = schedule();
        try (OptimizationRunner runner = new OptimizationRunner()) {
            OptimizationReport report = runner.submit(schedule, shortRun(), 42L, null).get(30, TimeUnit.SECONDS);

            assertTrue(schedule.isInitialized());
            assertEquals(report.getFinalCost(), schedule.getCost());
            assertTrue(report.getAnnealedCost() >= report.getInitialCost());
            assertTrue(report.getFinalCost() >= report.getAnnealedCost());
            assertEquals(report.getIterations(), report.getCostTrace().size());
            assertEquals(report.getCostTrace(), schedule.getLastCostTrace());
            assertTrue(report.getLessonsMoved() >= 0);
        }
    }

    @Test
    void continuesFromCommittedGrid() {
        Schedule schedule = schedule();
        schedule.generateRandomSchedule(false, new Random(3));
        double committed = schedule.getCost();

        OptimizationReport report = OptimizationRunner.run(schedule, shortRun(), new Random(4), () -> false, null);

        assertEquals(committed, report.getInitialCost());
        assertTrue(schedule.getCost() >= committed);
    }

    @Test
    void cancelledRunLeavesScheduleUntouched() throws Exception {
        Schedule schedule = schedule();
        schedule.generateRandomSchedule(false, new Random(5));
        AssignmentGrid before = schedule.getGrid();

        AnnealingParameters endless = new AnnealingParameters(0.999999, 1000, 1000, 1e-300, 0, Integer.MAX_VALUE,
                false, EnumSet.of(NeighborMoveType.RELOCATE));
        CountDownLatch started = new CountDownLatch(1);

        try (OptimizationRunner runner = new OptimizationRunner()) {
            OptimizationJob job = runner.submit(schedule, endless, 7L, cost -> started.countDown());
            assertTrue(started.await(30, TimeUnit.SECONDS));

            job.cancel();

            assertTrue(job.isCancelRequested());
            assertThrows(CancellationException.class, () -> job.get(30, TimeUnit.SECONDS));
            assertTrue(job.isDone());
        }

        AssignmentGrid after = schedule.getGrid();
        for (int i = 0; i < before.size(); i++) {
            Lesson expected = before.get(i).orElse(null);
            assertSame(expected, after.get(i).orElse(null));
        }
        assertTrue(schedule.getLastCostTrace().isEmpty());
    }

    @Test
    void runDoesNotOverwriteScheduleRegeneratedMeanwhile() {
        Schedule schedule = schedule();
        schedule.generateRandomSchedule(false, new Random(3));
        AssignmentGrid[] regenerated = new AssignmentGrid[1];

        assertThrows(IllegalStateException.class, () -> OptimizationRunner.run(schedule, shortRun(), new Random(4),
                () -> false, cost -> {
                    if (regenerated[0] == null) {
                        schedule.generateRandomSchedule(true, new Random(9));
                        regenerated[0] = schedule.getGrid();
                    }
                }));

        AssignmentGrid after = schedule.getGrid();
        for (int i = 0; i < after.size(); i++) {
            assertSame(regenerated[0].get(i).orElse(null), after.get(i).orElse(null));
        }
        assertTrue(schedule.getLastCostTrace().isEmpty());
    }

    @Test
    void failureSurfacesThroughJob() {
        // 30 yoga clients need 6 lessons, the grid has 2 slots
        Schedule tooSmall = new Schedule(Fixtures.config(1, 1, 2, 5), schedule().getClients(), List.of(anna));

        try (OptimizationRunner runner = new OptimizationRunner()) {
            OptimizationJob job = runner.submit(tooSmall, shortRun(), 1L, null);
            ExecutionException e = assertThrows(ExecutionException.class, () -> job.get(30, TimeUnit.SECONDS));
            assertTrue(e.getCause() instanceof ScheduleConfigurationException);
        }
        assertFalse(tooSmall.isInitialized());
    }
}
