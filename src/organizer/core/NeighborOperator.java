package organizer.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Proposes random moves that relocate lessons without creating or dropping any.
 */
public class NeighborOperator {
    private final List<NeighborMoveType> moveTypes;
    private final Random random;

    public NeighborOperator(Collection<NeighborMoveType> moveTypes, Random random) {
        Set<NeighborMoveType> types = EnumSet.noneOf(NeighborMoveType.class);
        if (moveTypes != null) types.addAll(moveTypes);
        if (types.isEmpty()) types.add(NeighborMoveType.RELOCATE);
        this.moveTypes = new ArrayList<>(types);
        this.random = random;
    }

    public NeighborOperator(Random random) {
        this(EnumSet.of(NeighborMoveType.RELOCATE), random);
    }

    /**
     * Draws a move for the grid without applying it.
     *
     * @throws DegenerateScheduleException when none of the allowed move types is possible
     */
    public NeighborMove propose(AssignmentGrid grid) {
        List<Integer> occupied = grid.occupiedIndices();
        List<Integer> free = grid.freeIndices();

        List<NeighborMoveType> feasible = new ArrayList<>();
        for (NeighborMoveType type : moveTypes) {
            if (type == NeighborMoveType.RELOCATE && !occupied.isEmpty() && !free.isEmpty()) {
                feasible.add(type);
            } else if (type == NeighborMoveType.SWAP && occupied.size() >= 2) {
                feasible.add(type);
            }
        }
        if (feasible.isEmpty()) {
            throw new DegenerateScheduleException("No neighbor for grid with " + occupied.size()
                    + " lessons and " + free.size() + " free slots (moves: " + moveTypes + ")");
        }

        NeighborMoveType type = feasible.get(random.nextInt(feasible.size()));
        switch (type) {
            case SWAP: {
                int a = random.nextInt(occupied.size());
                int b = random.nextInt(occupied.size() - 1);
                if (b >= a) b++;
                return new SwapMove(occupied.get(a), occupied.get(b));
            }
            case RELOCATE:
            default: {
                int from = occupied.get(random.nextInt(occupied.size()));
                int to = free.get(random.nextInt(free.size()));
                return new RelocateMove(from, to);
            }
        }
    }

    /** Returns a new grid one move away from {@code grid}; the argument is left untouched. */
    public AssignmentGrid neighbor(AssignmentGrid grid) {
        AssignmentGrid next = grid.copy();
        propose(next).apply(next);
        return next;
    }
}
