package pedsim.pedigree.def;

/**
 * Fills in the parts of a pedigree that the def file leaves out: the branch counts and parents of generations that
 * are not listed, and the parents of listed branches that were not given any.
 *
 * By default each branch of the previous generation has children with one new founder, and those children form
 * {@code max(1, current / previous)} consecutive branches of the current generation. Current branches left over
 * after that mapping are single new founders.
 */
final class DefaultStructureInferencer {
    private DefaultStructureInferencer() { }

    /**
     * The branch count of generation {@code index} when the def file does not give one: 1 for the first generation,
     * 2 for the second if the first has a single branch, and otherwise that of the previous generation.
     */
    static int defaultBranchCount(final PedigreeBuilder pedigree, final int index) {
        if (index == 0) return 1;
        final int previous = pedigree.getGeneration(index - 1).getBranchCount();
        if (index == 1 && previous == 1) return 2;
        return previous;
    }

    /** Creates generation {@code index}, which is not listed in the def file, with default structure and no output. */
    static GenerationBuilder fillGeneration(final PedigreeBuilder pedigree, final int index) {
        final GenerationBuilder generation =
                new GenerationBuilder(index, defaultBranchCount(pedigree, index), 0, false);
        if (index > 0) assignDefaultParents(pedigree.getGeneration(index - 1), generation);
        pedigree.setGeneration(generation);
        return generation;
    }

    /** Gives default parents to every branch of {@code current} whose parents were not assigned in the def file. */
    static void assignDefaultParents(final GenerationBuilder previous, final GenerationBuilder current) {
        final int multFactor = Math.max(1, current.getBranchCount() / previous.getBranchCount());

        for (int prevBranch = 0; prevBranch < previous.getBranchCount(); prevBranch++) {
            if (prevBranch >= current.getBranchCount()) break;

            // all children of prevBranch share one founder spouse, created only if some child needs it
            Parent.NewFounder spouse = null;
            for (int m = 0; m < multFactor; m++) {
                final int branch = prevBranch * multFactor + m;
                if (current.isParentsAssigned(branch)) continue;
                if (spouse == null) spouse = previous.newFounderSpouse(prevBranch);
                current.setDefaultParents(branch,
                        new BranchParents(Parent.branch(previous.getIndex(), prevBranch), spouse));
            }
        }

        for (int branch = previous.getBranchCount() * multFactor; branch < current.getBranchCount(); branch++) {
            if (current.isParentsAssigned(branch)) continue;
            current.setDefaultParents(branch, new BranchParents(
                    Parent.unmarriedFounder(previous.getIndex()), Parent.unmarriedFounder(previous.getIndex())));
        }
    }
}
