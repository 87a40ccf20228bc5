package pedsim.pedigree.def;

/**
 * The two parents of one branch. The first parent is the one named first in the def file (or the descending branch
 * for default assignments); the second may be a founder synthesized as its spouse.
 */
public class BranchParents {
    private final Parent first;
    private final Parent second;

    public BranchParents(final Parent first, final Parent second) {
        if (first == null || second == null) throw new IllegalArgumentException("Both parents must be given");
        this.first = first;
        this.second = second;
    }

    public Parent getFirst() { return first; }

    public Parent getSecond() { return second; }

    /** True when neither parent is an existing branch, i.e., the branch consists of a single new founder. */
    public boolean bothFounders() {
        return first.isFounder() && second.isFounder();
    }

    @Override
    public String toString() {
        return first + " and " + second;
    }
}
