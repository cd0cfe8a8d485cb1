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

import static org.junit.jupiter.api.Assertions.*;

class ScheduleTest {

    private final Instructor anna = Fixtures.instructor(1, LessonType.ZUMBA, LessonType.YOGA);

    @Test
    void startsEmpty() {
        Schedule schedule = new Schedule(Fixtures.config(1, 1, 2, 5), List.of(), List.of(anna));

        assertFalse(schedule.isInitialized());
        assertEquals(0.0, schedule.getCost());
        assertTrue(schedule.getLesson(0, 0, 0).isEmpty());
        assertTrue(schedule.getLastCostTrace().isEmpty());
    }

    @Test
    void twoClientsOneInstructorOneRoom() {
        Schedule schedule = new Schedule(Fixtures.config(1, 1, 2, 5),
                Fixtures.clients(1, 2, LessonType.ZUMBA), List.of(anna));

        schedule.generateRandomSchedule(false, new Random(42));

        assertTrue(schedule.isInitialized());
        assertEquals(80 - 50 - 50 - 200, schedule.getCost());
        String text = schedule.toString();
        assertTrue(text.contains("Free"));
        assertTrue(text.contains("I: 1, L: ZUMBA"));
        assertTrue(text.contains("MONDAY"));
        assertTrue(text.contains("16:00 - 17:00"));
        assertFalse(text.contains("CLASSROOM"));
    }

    @Test
    void annealingInstallsBestGridAndTrace() {
        Schedule schedule = new Schedule(Fixtures.config(1, 2, 3, 3),
                Fixtures.clients(1, 6, LessonType.ZUMBA), List.of(anna));
        schedule.generateRandomSchedule(false, new Random(1));
        double before = schedule.getCost();

        AnnealingParameters params = new AnnealingParameters(0.9, 200, 20, 0.1, 0.01, 50, false,
                EnumSet.of(NeighborMoveType.RELOCATE));
        AnnealingResult result = schedule.simulatedAnnealing(params, new Random(2));

        assertEquals(result.getBestCost(), schedule.getCost());
        assertTrue(schedule.getCost() >= before);
        assertEquals(result.getCostTrace(), schedule.getLastCostTrace());
        assertEquals(2, schedule.getGrid().lessonCount());
    }

    @Test
    void improveResultsNeverLowersEarnings() {
        List<Client> clients = new ArrayList<>();
        clients.addAll(Fixtures.clients(1, 9, LessonType.ZUMBA));
        clients.addAll(Fixtures.clients(50, 6, LessonType.YOGA));
        Schedule schedule = new Schedule(Fixtures.config(1, 3, 4, 3), clients, List.of(anna));
        schedule.generateRandomSchedule(false, new Random(7));
        CostBreakdown before = schedule.getCostBreakdown();

        schedule.improveResults();

        CostBreakdown after = schedule.getCostBreakdown();
        assertEquals(before.getRevenue(), after.getRevenue());
        assertEquals(before.getInstructorHours(), after.getInstructorHours());
        assertTrue(after.getTotal() >= before.getTotal());
        // five lessons fit in two days of four slots
        assertTrue(after.getInstructorPresenceDays() <= 2);
    }

    @Test
    void annealingKeepsConsolidationDoneMeanwhile() {
        List<Client> clients = new ArrayList<>();
        clients.addAll(Fixtures.clients(1, 9, LessonType.ZUMBA));
        clients.addAll(Fixtures.clients(50, 6, LessonType.YOGA));
        Schedule schedule = new Schedule(Fixtures.config(1, 3, 4, 3), clients, List.of(anna));
        schedule.generateRandomSchedule(false, new Random(7));
        AnnealingParameters params = new AnnealingParameters(0.9, 200, 20, 0.1, 0.01, 50, false,
                EnumSet.of(NeighborMoveType.RELOCATE));
        AssignmentGrid[] improved = new AssignmentGrid[1];

        assertThrows(IllegalStateException.class, () -> schedule.simulatedAnnealing(params, new Random(2),
                () -> false, cost -> {
                    if (improved[0] == null) {
                        schedule.improveResults();
                        improved[0] = schedule.getGrid();
                    }
                }));

        assertEquals(improved[0].occupiedIndices(), schedule.getGrid().occupiedIndices());
    }

    @Test
    void gridSnapshotIsDetached() {
        Schedule schedule = new Schedule(Fixtures.config(1, 1, 3, 5),
                Fixtures.clients(1, 2, LessonType.YOGA), List.of(anna));
        schedule.generateRandomSchedule(true, new Random(1));

        AssignmentGrid snapshot = schedule.getGrid();
        snapshot.move(0, 2);

        Lesson committed = schedule.getLesson(0, 0, 0).orElseThrow();
        assertEquals(LessonType.YOGA, committed.getLessonType());
    }

    @Test
    void rejectsGridOfOtherShape() {
        Schedule schedule = new Schedule(Fixtures.config(1, 1, 3, 5), List.of(), List.of(anna));
        assertThrows(IllegalArgumentException.class,
                () -> schedule.install(schedule.committedGrid(), new AssignmentGrid(1, 2, 3), List.of()));
    }
}
