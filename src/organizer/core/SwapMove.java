package organizer.core;

public class SwapMove implements NeighborMove {
    private final int first;
    private final int second;

    public SwapMove(int first, int second) {
        this.first = first;
        this.second = second;
    }

    @Override
    public void apply(AssignmentGrid grid) {
        grid.swap(first, second);
    }

    @Override
    public void undo(AssignmentGrid grid) {
        grid.swap(first, second);
    }
}
