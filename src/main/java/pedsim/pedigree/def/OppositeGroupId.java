package pedsim.pedigree.def;

/**
 * Identifies one constraint group. Groups are allocated in pairs whose members must have opposite sexes: the group
 * with an even index is paired with the following odd index, so {@link #paired()} only flips the lowest bit.
 */
public final class OppositeGroupId {
    private final int index;

    private OppositeGroupId(final int index) {
        this.index = index;
    }

    /** The first (even) id of the {@code pairNumber}-th pair. */
    static OppositeGroupId firstOfPair(final int pairNumber) {
        return new OppositeGroupId(2 * pairNumber);
    }

    /** The group whose members must have the opposite sex to this group's members. */
    public OppositeGroupId paired() {
        return new OppositeGroupId(index ^ 1);
    }

    public int pairNumber() { return index >> 1; }

    public boolean isSamePair(final OppositeGroupId other) {
        return pairNumber() == other.pairNumber();
    }

    int index() { return index; }

    @Override
    public boolean equals(final Object o) {
        return o instanceof OppositeGroupId && ((OppositeGroupId) o).index == index;
    }

    @Override
    public int hashCode() {
        return index;
    }

    @Override
    public String toString() {
        return "group " + index;
    }
}
