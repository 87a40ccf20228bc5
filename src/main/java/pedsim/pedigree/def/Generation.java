package pedsim.pedigree.def;

import pedsim.pedigree.Sex;

/**
 * Read-only view of one fully resolved generation of a pedigree. Generations and branches are 0-based; generation 0
 * holds the founders and has no parents.
 */
public class Generation {
    private final int index;
    private final int[] samplesToPrint;
    private final BranchParents[] parents;
    private final Sex[] sexes;
    private final boolean[] explicitSexes;

    Generation(final int index, final int[] samplesToPrint, final BranchParents[] parents,
               final Sex[] sexes, final boolean[] explicitSexes) {
        this.index = index;
        this.samplesToPrint = samplesToPrint;
        this.parents = parents;
        this.sexes = sexes;
        this.explicitSexes = explicitSexes;
    }

    public int getIndex() { return index; }

    public int getBranchCount() { return samplesToPrint.length; }

    /** False only for the first generation. */
    public boolean hasParents() { return parents != null; }

    /**
     * @throws IllegalStateException for the first generation, whose branches have no parents
     */
    public BranchParents getParents(final int branch) {
        if (parents == null) throw new IllegalStateException("Branches of the first generation have no parents");
        return parents[branch];
    }

    /**
     * True when the branch consists of a single new founder rather than the descendants of an earlier branch, which
     * is the case for branches beyond the default mapping of the previous generation's branches.
     */
    public boolean isFounderBranch(final int branch) {
        return parents != null && parents[branch].bothFounders();
    }

    /** The number of samples the def file asked to print from {@code branch}. */
    public int getRequestedSamplesToPrint(final int branch) { return samplesToPrint[branch]; }

    /** The number of samples to print from {@code branch}: a founder branch holds one individual and prints at most one. */
    public int getNumSamplesToPrint(final int branch) {
        return isFounderBranch(branch) ? Math.min(1, samplesToPrint[branch]) : samplesToPrint[branch];
    }

    /** True if some branch of this generation took part in a marriage between branches or had its sex fixed. */
    public boolean hasSexConstraints() { return sexes != null; }

    /** The fixed or inferred sex of the i1 individual of {@code branch}; Unknown when the simulator may choose. */
    public Sex getSex(final int branch) {
        return sexes == null ? Sex.Unknown : sexes[branch];
    }

    /** True if the sex of {@code branch} was given in the def file rather than inferred. */
    public boolean isSexExplicit(final int branch) {
        return explicitSexes != null && explicitSexes[branch];
    }
}
