package organizer.core;

import organizer.model.Lesson;
import organizer.model.SlotPosition;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * classroom x day x time slot table, at most one lesson per cell.
 * Cells are stored flat in classroom-major order, the same order used for slot indices.
 */
public class AssignmentGrid {
    private final int classroomCount;
    private final int dayCount;
    private final int slotCount;
    private final Lesson[] cells;

    public AssignmentGrid(int classroomCount, int dayCount, int slotCount) {
        if (classroomCount < 0 || dayCount < 0 || slotCount < 0)
            throw new IllegalArgumentException("grid dimensions must not be negative");
        this.classroomCount = classroomCount;
        this.dayCount = dayCount;
        this.slotCount = slotCount;
        this.cells = new Lesson[classroomCount * dayCount * slotCount];
    }

    private AssignmentGrid(AssignmentGrid other) {
        this.classroomCount = other.classroomCount;
        this.dayCount = other.dayCount;
        this.slotCount = other.slotCount;
        this.cells = other.cells.clone();
    }

    /** Independent copy. Lessons are immutable and shared. */
    public AssignmentGrid copy() {
        return new AssignmentGrid(this);
    }

    public int getClassroomCount() { return classroomCount; }
    public int getDayCount() { return dayCount; }
    public int getSlotCount() { return slotCount; }

    public int size() {
        return cells.length;
    }

    /** Number of (day, slot) pairs in one classroom's week. */
    public int getWeekLength() {
        return dayCount * slotCount;
    }

    public int indexOf(SlotPosition p) {
        checkBounds(p);
        return p.getClassroom() * getWeekLength() + p.getDay() * slotCount + p.getSlot();
    }

    public SlotPosition positionOf(int index) {
        if (index < 0 || index >= cells.length)
            throw new IndexOutOfBoundsException("slot index " + index + " outside grid of " + cells.length);
        int week = getWeekLength();
        int classroom = index / week;
        int rest = index % week;
        return new SlotPosition(classroom, rest / slotCount, rest % slotCount);
    }

    /** Position of the slot within the week, shared by all classrooms. */
    public int weeklyPosition(int index) {
        return index % getWeekLength();
    }

    public Optional<Lesson> get(SlotPosition p) {
        return Optional.ofNullable(cells[indexOf(p)]);
    }

    public Optional<Lesson> get(int classroom, int day, int slot) {
        return get(new SlotPosition(classroom, day, slot));
    }

    public Optional<Lesson> get(int index) {
        return Optional.ofNullable(cells[index]);
    }

    public boolean isFree(SlotPosition p) {
        return cells[indexOf(p)] == null;
    }

    public void place(SlotPosition p, Lesson lesson) {
        place(indexOf(p), lesson);
    }

    public void place(int index, Lesson lesson) {
        if (lesson == null)
            throw new IllegalArgumentException("lesson is null");
        if (cells[index] != null)
            throw new IllegalStateException("slot already taken: " + positionOf(index));
        cells[index] = lesson;
    }

    /** Moves the lesson at {@code from} into the empty cell {@code to}. */
    public void move(int from, int to) {
        if (cells[from] == null)
            throw new IllegalStateException("no lesson at " + positionOf(from));
        if (cells[to] != null)
            throw new IllegalStateException("slot already taken: " + positionOf(to));
        cells[to] = cells[from];
        cells[from] = null;
    }

    public void move(SlotPosition from, SlotPosition to) {
        move(indexOf(from), indexOf(to));
    }

    public void swap(int a, int b) {
        Lesson tmp = cells[a];
        cells[a] = cells[b];
        cells[b] = tmp;
    }

    public List<Integer> occupiedIndices() {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] != null) out.add(i);
        }
        return out;
    }

    public List<Integer> freeIndices() {
        List<Integer> out = new ArrayList<>();
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] == null) out.add(i);
        }
        return out;
    }

    public int lessonCount() {
        int n = 0;
        for (Lesson l : cells) {
            if (l != null) n++;
        }
        return n;
    }

    public boolean isEmpty() {
        return lessonCount() == 0;
    }

    /** Lessons taught at the same day and slot in the other classrooms. */
    public List<Lesson> lessonsAtSameTime(int index) {
        List<Lesson> out = new ArrayList<>();
        int week = getWeekLength();
        for (int i = weeklyPosition(index); i < cells.length; i += week) {
            if (i != index && cells[i] != null) out.add(cells[i]);
        }
        return out;
    }

    private void checkBounds(SlotPosition p) {
        if (p.getClassroom() >= classroomCount || p.getDay() >= dayCount || p.getSlot() >= slotCount)
            throw new IndexOutOfBoundsException(p + " outside grid " + classroomCount + "x" + dayCount + "x" + slotCount);
    }
}
