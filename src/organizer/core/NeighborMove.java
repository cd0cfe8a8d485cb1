package organizer.core;

public interface NeighborMove {

    void apply(AssignmentGrid grid);

    // Restores the grid to its state before apply
    void undo(AssignmentGrid grid);
}
