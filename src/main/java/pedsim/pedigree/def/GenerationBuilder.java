package pedsim.pedigree.def;

import pedsim.pedigree.Sex;

import java.util.Arrays;

/**
 * One generation of a pedigree while its def file entry (and the default structure derived from it) is being read.
 * Branch indexes are 0-based.
 */
class GenerationBuilder {
    private final int index;
    private final int branchCount;
    private final boolean explicit;
    private final int[] samplesToPrint;
    private final BranchParents[] parents;
    private final boolean[] parentsAssigned;
    /** Number of founders married into each branch so far. */
    private final int[] founderSpouses;
    private SexSlot[] sexSlots;

    /**
     * @param explicit true if the generation is listed in the def file, false if it was filled in by default
     */
    GenerationBuilder(final int index, final int branchCount, final int samplesPerBranch, final boolean explicit) {
        if (branchCount <= 0) throw new IllegalArgumentException("Generations need at least one branch");
        this.index = index;
        this.branchCount = branchCount;
        this.explicit = explicit;
        this.samplesToPrint = new int[branchCount];
        Arrays.fill(samplesToPrint, samplesPerBranch);
        this.parents = index == 0 ? null : new BranchParents[branchCount];
        this.parentsAssigned = new boolean[branchCount];
        this.founderSpouses = new int[branchCount];
    }

    int getIndex() { return index; }

    int getBranchCount() { return branchCount; }

    boolean isExplicit() { return explicit; }

    int getSamplesToPrint(final int branch) { return samplesToPrint[branch]; }

    void setSamplesToPrint(final int branch, final int count) { samplesToPrint[branch] = count; }

    BranchParents getParents(final int branch) {
        return parents == null ? null : parents[branch];
    }

    /** True if the def file gave the parents of {@code branch}. */
    boolean isParentsAssigned(final int branch) { return parentsAssigned[branch]; }

    /** Sets parents given in the def file; a branch's parents may only be given once. */
    void assignParents(final int branch, final BranchParents branchParents, final int lineNumber) {
        if (parentsAssigned[branch]) {
            throw new DefFileException(DefFileErrorKind.DUPLICATE_ASSIGNMENT, lineNumber,
                    "parents of branch number " + (branch + 1) + " assigned multiple times");
        }
        parentsAssigned[branch] = true;
        parents[branch] = branchParents;
    }

    void setDefaultParents(final int branch, final BranchParents branchParents) {
        if (parentsAssigned[branch]) {
            throw new IllegalStateException("Branch " + (branch + 1) + " already has assigned parents");
        }
        parents[branch] = branchParents;
    }

    /** Synthesizes a founder that has not married into {@code branch} before. */
    Parent.NewFounder newFounderSpouse(final int branch) {
        founderSpouses[branch]++;
        return Parent.founderSpouseOf(Parent.branch(index, branch), founderSpouses[branch]);
    }

    boolean hasSexSlots() { return sexSlots != null; }

    /** The sex slot of {@code branch}, allocating the slots of the whole generation on first use. */
    SexSlot sexSlot(final int branch) {
        if (sexSlots == null) {
            sexSlots = new SexSlot[branchCount];
            for (int b = 0; b < branchCount; b++) sexSlots[b] = new SexSlot();
        }
        return sexSlots[branch];
    }

    /** Fixes the sex of the i1 individual of {@code branch}; this may be done only once per branch. */
    void assignSex(final int branch, final Sex sex, final int lineNumber) {
        final SexSlot slot = sexSlot(branch);
        if (slot.isExplicit()) {
            throw new DefFileException(DefFileErrorKind.DUPLICATE_ASSIGNMENT, lineNumber,
                    "sex of branch number " + (branch + 1) + " assigned multiple times");
        }
        slot.setExplicitSex(sex);
    }

    /** Copies the current state into an immutable generation. */
    Generation build() {
        final Sex[] sexes;
        final boolean[] explicitSexes;
        if (sexSlots == null) {
            sexes = null;
            explicitSexes = null;
        } else {
            sexes = new Sex[branchCount];
            explicitSexes = new boolean[branchCount];
            for (int b = 0; b < branchCount; b++) {
                sexes[b] = sexSlots[b].getSex();
                explicitSexes[b] = sexSlots[b].isExplicit();
            }
        }
        if (parents != null) {
            for (int b = 0; b < branchCount; b++) {
                if (parents[b] == null) {
                    throw new IllegalStateException("No parents for branch " + (b + 1) + " of generation " + (index + 1));
                }
            }
        }
        return new Generation(index, samplesToPrint.clone(), parents == null ? null : parents.clone(), sexes, explicitSexes);
    }
}
