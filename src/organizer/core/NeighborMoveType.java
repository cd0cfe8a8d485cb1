package organizer.core;

public enum NeighborMoveType {
    /** move one lesson into a free slot */
    RELOCATE,
    /** exchange the slots of two lessons */
    SWAP
}
