package organizer.core;

import org.junit.jupiter.api.Test;
import organizer.Fixtures;
import organizer.model.Instructor;
import organizer.model.Lesson;
import organizer.model.LessonType;

import java.util.EnumSet;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class NeighborOperatorTest {

    private final Instructor anna = Fixtures.instructor(1, LessonType.FITNESS);

    private AssignmentGrid gridWith(int classrooms, int days, int slots, int lessons) {
        AssignmentGrid grid = new AssignmentGrid(classrooms, days, slots);
        for (int i = 0; i < lessons; i++) {
            grid.place(i, Fixtures.lesson(anna, LessonType.FITNESS, i + 1));
        }
        return grid;
    }

    @Test
    void relocationKeepsLessonCount() {
        NeighborOperator operator = new NeighborOperator(new Random(7));
        AssignmentGrid grid = gridWith(2, 3, 3, 5);

        for (int i = 0; i < 200; i++) {
            NeighborMove move = operator.propose(grid);
            assertTrue(move instanceof RelocateMove);
            move.apply(grid);
            assertEquals(5, grid.lessonCount());
        }
    }

    @Test
    void swapKeepsLessonCount() {
        NeighborOperator operator = new NeighborOperator(EnumSet.of(NeighborMoveType.RELOCATE, NeighborMoveType.SWAP),
                new Random(11));
        AssignmentGrid grid = gridWith(1, 2, 4, 4);

        for (int i = 0; i < 200; i++) {
            operator.propose(grid).apply(grid);
            assertEquals(4, grid.lessonCount());
        }
    }

    @Test
    void neighborLeavesInputUntouched() {
        NeighborOperator operator = new NeighborOperator(new Random(3));
        AssignmentGrid grid = gridWith(1, 1, 4, 2);

        AssignmentGrid next = operator.neighbor(grid);

        assertEquals(List.of(0, 1), grid.occupiedIndices());
        assertEquals(2, next.lessonCount());
        assertNotEquals(grid.occupiedIndices(), next.occupiedIndices());
    }

    @Test
    void undoRestoresGrid() {
        NeighborOperator operator = new NeighborOperator(EnumSet.of(NeighborMoveType.SWAP, NeighborMoveType.RELOCATE),
                new Random(5));
        AssignmentGrid grid = gridWith(1, 2, 3, 3);
        Lesson[] before = new Lesson[grid.size()];
        for (int i = 0; i < grid.size(); i++) before[i] = grid.get(i).orElse(null);

        for (int k = 0; k < 50; k++) {
            NeighborMove move = operator.propose(grid);
            move.apply(grid);
            move.undo(grid);
        }

        for (int i = 0; i < grid.size(); i++) {
            assertSame(before[i], grid.get(i).orElse(null));
        }
    }

    @Test
    void emptyGridHasNoNeighbor() {
        NeighborOperator operator = new NeighborOperator(new Random(1));
        assertThrows(DegenerateScheduleException.class, () -> operator.propose(new AssignmentGrid(1, 2, 2)));
    }

    @Test
    void fullGridHasNoRelocation() {
        NeighborOperator operator = new NeighborOperator(new Random(1));
        AssignmentGrid full = gridWith(1, 1, 3, 3);
        assertThrows(DegenerateScheduleException.class, () -> operator.propose(full));

        NeighborOperator withSwap = new NeighborOperator(EnumSet.of(NeighborMoveType.RELOCATE, NeighborMoveType.SWAP),
                new Random(1));
        assertTrue(withSwap.propose(full) instanceof SwapMove);
    }
}
