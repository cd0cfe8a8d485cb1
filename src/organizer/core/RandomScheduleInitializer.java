package organizer.core;

import organizer.config.ScheduleConfig;
import organizer.constraints.Candidate;
import organizer.constraints.ConstraintSet;
import organizer.constraints.InstructorNotDoubleBooked;
import organizer.constraints.InstructorQualified;
import organizer.model.Client;
import organizer.model.Instructor;
import organizer.model.Lesson;
import organizer.model.LessonType;
import organizer.model.SlotPosition;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a starting grid that holds every lesson group the clients asked for.
 * <p>
 * Clients wanting a lesson type are split into groups of at most
 * {@code max_participants_per_lesson}. Each group gets a slot (the next sequential
 * one in greedy mode, a random free one otherwise) and a random qualified instructor
 * who does not already teach at that day and slot in another classroom.
 */
public class RandomScheduleInitializer {
    private final ScheduleConfig config;
    private final Random random;
    private final ConstraintSet instructorRules = new ConstraintSet()
            .add(new InstructorQualified())
            .add(new InstructorNotDoubleBooked());

    public RandomScheduleInitializer(ScheduleConfig config, Random random) {
        this.config = config;
        this.random = random;
    }

    /**
     * @throws ScheduleConfigurationException when the grid is too small or a group has no instructor
     */
    public AssignmentGrid generate(List<Client> clients, List<Instructor> instructors, boolean greedy) {
        AssignmentGrid grid = new AssignmentGrid(config.getClassroomCount(), config.getDayCount(), config.getSlotCount());
        int maxPerLesson = config.getMaxParticipantsPerLesson();

        // 1. Demand per lesson type
        List<LessonType> types = new ArrayList<>();
        List<List<Client>> demand = new ArrayList<>();
        int groupsNeeded = 0;
        for (LessonType type : LessonType.values()) {
            List<Client> wanting = clients.stream().filter(c -> c.wants(type)).collect(Collectors.toList());
            if (wanting.isEmpty()) continue;
            if (maxPerLesson <= 0) {
                throw new ScheduleConfigurationException(
                        "max_participants_per_lesson must be positive, " + type + " has " + wanting.size() + " clients");
            }
            types.add(type);
            demand.add(wanting);
            groupsNeeded += ceilDiv(wanting.size(), maxPerLesson);
        }

        if (groupsNeeded > grid.size()) {
            throw new ScheduleConfigurationException("Insufficient grid capacity: " + groupsNeeded
                    + " lessons needed, grid has " + grid.size() + " slots");
        }

        // 2. Placement
        List<Integer> freeSlots = new ArrayList<>(grid.freeIndices());
        int nextSequential = 0;

        for (int t = 0; t < types.size(); t++) {
            LessonType type = types.get(t);
            List<Client> wanting = demand.get(t);
            int groups = ceilDiv(wanting.size(), maxPerLesson);

            for (int g = 0; g < groups; g++) {
                List<Client> participants = wanting.subList(g * maxPerLesson,
                        Math.min(wanting.size(), (g + 1) * maxPerLesson));

                int index;
                if (greedy) {
                    index = nextSequential++;
                } else {
                    index = freeSlots.remove(random.nextInt(freeSlots.size()));
                }
                SlotPosition position = grid.positionOf(index);

                List<Instructor> available = new ArrayList<>();
                for (Instructor in : instructors) {
                    if (instructorRules.ok(grid, new Candidate(in, type, position))) {
                        available.add(in);
                    }
                }
                if (available.isEmpty()) {
                    throw new ScheduleConfigurationException("No instructor available for " + type
                            + " at " + position + ": " + explain(grid, instructors, type, position));
                }

                Instructor instructor = available.get(random.nextInt(available.size()));
                grid.place(index, new Lesson(instructor, type, participants));
            }
        }
        return grid;
    }

    private String explain(AssignmentGrid grid, List<Instructor> instructors, LessonType type, SlotPosition position) {
        if (instructors.isEmpty()) {
            return "no instructors loaded";
        }
        Set<String> reasons = new LinkedHashSet<>();
        for (Instructor in : instructors) {
            reasons.addAll(instructorRules.explain(grid, new Candidate(in, type, position)));
        }
        return String.join("; ", reasons);
    }

    private static int ceilDiv(int a, int b) {
        return (a + b - 1) / b;
    }
}
