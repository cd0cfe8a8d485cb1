package organizer.core;

import organizer.constraints.Candidate;
import organizer.constraints.ConstraintSet;
import organizer.constraints.InstructorNotDoubleBooked;
import organizer.constraints.SlotIsFree;
import organizer.model.Instructor;
import organizer.model.Lesson;
import organizer.model.SlotPosition;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Packs each instructor's lessons onto fewer days, classroom by classroom.
 * <p>
 * Lessons are only moved, never changed. A day is drained completely into another day
 * of the same classroom that has enough usable slots, so revenue and paid hours stay the
 * same while presence days and rented classroom days can only go down.
 */
public class ConsolidationPass {

    private final ConstraintSet targetRules = new ConstraintSet()
            .add(new SlotIsFree())
            .add(new InstructorNotDoubleBooked());

    /** Lessons of one instructor in one classroom on one day. */
    private static class DayRecord {
        final int day;
        final List<Integer> taken = new ArrayList<>();
        final List<Integer> usable = new ArrayList<>();

        DayRecord(int day) {
            this.day = day;
        }
    }

    /**
     * Mutates {@code grid} in place.
     *
     * @return number of lessons moved
     */
    public int consolidate(AssignmentGrid grid) {
        int moved = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Instructor instructor : instructorsOf(grid)) {
                for (int c = 0; c < grid.getClassroomCount(); c++) {
                    int n = drainOneDay(grid, instructor, c);
                    if (n > 0) {
                        moved += n;
                        changed = true;
                    }
                }
            }
        }
        return moved;
    }

    // Empties at most one day; the caller rescans because the densities changed.
    private int drainOneDay(AssignmentGrid grid, Instructor instructor, int classroom) {
        List<DayRecord> records = dayRecords(grid, instructor, classroom);
        records.sort(Comparator.comparingInt((DayRecord r) -> r.taken.size()).thenComparingInt(r -> r.day));

        for (int i = 0; i < records.size() - 1; i++) {
            for (int j = i + 1; j < records.size(); j++) {
                DayRecord small = records.get(i);
                DayRecord large = records.get(j);
                if (small.taken.size() <= large.usable.size()) {
                    return drain(grid, classroom, small, large);
                } else if (large.taken.size() <= small.usable.size()) {
                    return drain(grid, classroom, large, small);
                }
            }
        }
        return 0;
    }

    private int drain(AssignmentGrid grid, int classroom, DayRecord from, DayRecord to) {
        for (int k = 0; k < from.taken.size(); k++) {
            grid.move(new SlotPosition(classroom, from.day, from.taken.get(k)),
                    new SlotPosition(classroom, to.day, to.usable.get(k)));
        }
        return from.taken.size();
    }

    private List<DayRecord> dayRecords(AssignmentGrid grid, Instructor instructor, int classroom) {
        List<DayRecord> records = new ArrayList<>();
        for (int d = 0; d < grid.getDayCount(); d++) {
            DayRecord record = new DayRecord(d);
            for (int ts = 0; ts < grid.getSlotCount(); ts++) {
                SlotPosition p = new SlotPosition(classroom, d, ts);
                Lesson lesson = grid.get(p).orElse(null);
                if (lesson != null) {
                    if (lesson.getInstructor().getId() == instructor.getId()) {
                        record.taken.add(ts);
                    }
                } else if (targetRules.ok(grid, new Candidate(instructor, null, p))) {
                    record.usable.add(ts);
                }
            }
            if (!record.taken.isEmpty()) {
                records.add(record);
            }
        }
        return records;
    }

    private List<Instructor> instructorsOf(AssignmentGrid grid) {
        Map<Integer, Instructor> byId = new LinkedHashMap<>();
        for (int index : grid.occupiedIndices()) {
            Instructor in = grid.get(index).get().getInstructor();
            byId.putIfAbsent(in.getId(), in);
        }
        return new ArrayList<>(byId.values());
    }
}
