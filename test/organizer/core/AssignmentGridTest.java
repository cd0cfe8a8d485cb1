package organizer.core;

import org.junit.jupiter.api.Test;
import organizer.Fixtures;
import organizer.model.Instructor;
import organizer.model.Lesson;
import organizer.model.LessonType;
import organizer.model.SlotPosition;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AssignmentGridTest {

    private final Instructor anna = Fixtures.instructor(1, LessonType.PILATES);

    @Test
    void slotIndicesAreClassroomMajor() {
        AssignmentGrid grid = new AssignmentGrid(2, 3, 4);
        assertEquals(24, grid.size());
        assertEquals(12, grid.getWeekLength());
        assertEquals(0, grid.indexOf(new SlotPosition(0, 0, 0)));
        assertEquals(7, grid.indexOf(new SlotPosition(0, 1, 3)));
        assertEquals(19, grid.indexOf(new SlotPosition(1, 1, 3)));
        assertEquals(new SlotPosition(1, 1, 3), grid.positionOf(19));
        assertEquals(7, grid.weeklyPosition(19));
    }

    @Test
    void cellHoldsAtMostOneLesson() {
        AssignmentGrid grid = new AssignmentGrid(1, 1, 2);
        SlotPosition p = new SlotPosition(0, 0, 1);
        grid.place(p, Fixtures.lesson(anna, LessonType.PILATES, 2));

        assertTrue(grid.get(0, 0, 1).isPresent());
        assertTrue(grid.get(0, 0, 0).isEmpty());
        assertThrows(IllegalStateException.class, () -> grid.place(p, Fixtures.lesson(anna, LessonType.PILATES, 1)));
    }

    @Test
    void moveTransfersLesson() {
        AssignmentGrid grid = new AssignmentGrid(1, 2, 2);
        Lesson lesson = Fixtures.lesson(anna, LessonType.PILATES, 3);
        grid.place(0, lesson);

        grid.move(0, 3);

        assertTrue(grid.get(0).isEmpty());
        assertSame(lesson, grid.get(3).orElseThrow());
        assertEquals(1, grid.lessonCount());
        assertThrows(IllegalStateException.class, () -> grid.move(0, 1));
    }

    @Test
    void copyIsIndependent() {
        AssignmentGrid grid = new AssignmentGrid(1, 1, 3);
        grid.place(0, Fixtures.lesson(anna, LessonType.PILATES, 1));

        AssignmentGrid copy = grid.copy();
        copy.move(0, 2);

        assertTrue(grid.get(0).isPresent());
        assertTrue(grid.get(2).isEmpty());
        assertEquals(List.of(2), copy.occupiedIndices());
    }

    @Test
    void findsLessonsAtSameTimeInOtherClassrooms() {
        AssignmentGrid grid = new AssignmentGrid(3, 2, 2);
        Lesson first = Fixtures.lesson(anna, LessonType.PILATES, 1);
        Lesson second = Fixtures.lesson(Fixtures.instructor(2, LessonType.YOGA), LessonType.YOGA, 1);
        grid.place(new SlotPosition(0, 1, 0), first);
        grid.place(new SlotPosition(2, 1, 0), second);
        grid.place(new SlotPosition(1, 0, 0), Fixtures.lesson(anna, LessonType.PILATES, 1));

        List<Lesson> same = grid.lessonsAtSameTime(grid.indexOf(new SlotPosition(1, 1, 0)));

        assertEquals(2, same.size());
        assertTrue(same.contains(first));
        assertTrue(same.contains(second));
    }

    @Test
    void rejectsOutOfRangePosition() {
        AssignmentGrid grid = new AssignmentGrid(1, 2, 2);
        assertThrows(IndexOutOfBoundsException.class, () -> grid.get(1, 0, 0));
        assertThrows(IndexOutOfBoundsException.class, () -> grid.positionOf(4));
    }
}
