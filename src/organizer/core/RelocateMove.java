package organizer.core;

public class RelocateMove implements NeighborMove {
    private final int from;
    private final int to;

    public RelocateMove(int from, int to) {
        this.from = from;
        this.to = to;
    }

    @Override
    public void apply(AssignmentGrid grid) {
        grid.move(from, to);
    }

    @Override
    public void undo(AssignmentGrid grid) {
        grid.move(to, from);
    }
}
