package pedsim.pedigree.def;

/**
 * One parent as written after ':' in a branch specification: a 1-based branch number, optionally followed by
 * '^' and the 1-based generation it belongs to. Stored 0-based; without a generation the parent belongs to the
 * generation just before the one being defined.
 */
class ParentSpec {
    private final int branch;
    private final boolean hasGeneration;
    private final int generation;

    ParentSpec(final int branch) {
        this(branch, false, 0);
    }

    ParentSpec(final int branch, final int generation) {
        this(branch, true, generation);
    }

    private ParentSpec(final int branch, final boolean hasGeneration, final int generation) {
        this.branch = branch;
        this.hasGeneration = hasGeneration;
        this.generation = generation;
    }

    /**
     * @param allowGeneration whether '^' may be used; only the second parent may come from an earlier generation
     */
    static ParentSpec parse(final String text, final boolean allowGeneration, final String branches,
                            final int lineNumber) {
        final int caret = text.indexOf('^');
        Integer generation = null;
        if (caret >= 0) {
            if (!allowGeneration) {
                throw new DefFileException(DefFileErrorKind.MALFORMED_DIRECTIVE, lineNumber,
                        "parent assignment for branches " + branches + " gives generation number for the first " +
                                "parent, but this is only allowed for the second parent; for example, 2:1_3^1 has " +
                                "branch 1 from previous generation married to branch 3 from generation 1");
            }
            final String genNumber = text.substring(caret + 1);
            try {
                generation = Integer.parseInt(genNumber) - 1;
            } catch (final NumberFormatException e) {
                throw new DefFileException(DefFileErrorKind.MALFORMED_NUMBER, lineNumber,
                        "unable to parse parent assignment for branches " + branches +
                                ": malformed generation number string for second parent: " + genNumber, e);
            }
        }

        final String branchNumber = caret >= 0 ? text.substring(0, caret) : text;
        try {
            final int branch = Integer.parseInt(branchNumber) - 1;
            return generation == null ? new ParentSpec(branch) : new ParentSpec(branch, generation);
        } catch (final NumberFormatException e) {
            throw new DefFileException(DefFileErrorKind.MALFORMED_NUMBER, lineNumber,
                    "unable to parse parent assignment for branches " + branches + ": bad branch \"" + branchNumber + "\"", e);
        }
    }

    /**
     * Checks the parent against the pedigree read so far and returns the branch it refers to.
     *
     * @param previous index of the generation before the one whose branches receive this parent
     */
    Parent.ExistingBranch resolve(final PedigreeBuilder pedigree, final int previous, final int lineNumber) {
        final int gen = hasGeneration ? generation : previous;
        if (gen > previous) {
            throw new DefFileException(DefFileErrorKind.OUT_OF_RANGE, lineNumber,
                    "generation number " + (gen + 1) + " for second parent is after previous generation");
        }
        if (gen < 0) {
            throw new DefFileException(DefFileErrorKind.OUT_OF_RANGE, lineNumber,
                    "generation number " + (gen + 1) + " for second parent is before first generation");
        }
        if (branch < 0) {
            throw new DefFileException(DefFileErrorKind.OUT_OF_RANGE, lineNumber,
                    "parent assignments must be of positive branch numbers");
        }
        final int branchCount = pedigree.getGeneration(gen).getBranchCount();
        if (branch >= branchCount) {
            throw new DefFileException(DefFileErrorKind.OUT_OF_RANGE, lineNumber,
                    "parent branch number " + (branch + 1) + " is more than the number of branches (" +
                            branchCount + ") in generation " + (gen + 1));
        }
        return Parent.branch(gen, branch);
    }

    int getBranch() { return branch; }

    /** False when the parent belongs to the previous generation. */
    boolean hasGeneration() { return hasGeneration; }

    int getGeneration() { return generation; }
}
