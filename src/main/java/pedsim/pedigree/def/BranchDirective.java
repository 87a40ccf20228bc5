package pedsim.pedigree.def;

import pedsim.pedigree.Sex;

import java.util.function.IntConsumer;

/**
 * One branch specification from a generation line, applied to every branch in its {@link BranchList}. There are
 * three kinds: parent assignments ({@code 1-2:1_3^1}), no-print directives ({@code 2n}) and sex assignments
 * ({@code 1,3sF}).
 */
public abstract class BranchDirective {
    private final BranchList branches;

    BranchDirective(final BranchList branches) {
        this.branches = branches;
    }

    public BranchList getBranches() { return branches; }

    /** Applies the directive to the listed branches of {@code current}, the generation being read. */
    abstract void apply(PedigreeBuilder pedigree, GenerationBuilder current, int lineNumber);

    /** Runs {@code action} on each listed branch, checking each range against the branch count before expanding it. */
    void forEachBranch(final GenerationBuilder current, final int lineNumber, final IntConsumer action) {
        for (final BranchList.Range range : branches.getRanges()) {
            if (range.getEnd() >= current.getBranchCount()) {
                throw new DefFileException(DefFileErrorKind.OUT_OF_RANGE, lineNumber,
                        "request to assign a branch greater than " + current.getBranchCount() +
                                ", the total number of branches in generation " + (current.getIndex() + 1));
            }
            for (int branch = range.getStart(); branch <= range.getEnd(); branch++) action.accept(branch);
        }
    }

    /**
     * Gives the listed branches the same parents. With only one parent written, that parent has the children with
     * a new founder, shared by all branches of the directive; with none (e.g. {@code 3:}) both parents are new
     * founders.
     */
    public static final class ParentAssignment extends BranchDirective {
        private final ParentSpec first;
        private final ParentSpec second;

        ParentAssignment(final BranchList branches, final ParentSpec first, final ParentSpec second) {
            super(branches);
            this.first = first;
            this.second = second;
        }

        @Override
        void apply(final PedigreeBuilder pedigree, final GenerationBuilder current, final int lineNumber) {
            final int previous = current.getIndex() - 1;
            final BranchParents parents;

            if (first == null) {
                parents = new BranchParents(Parent.unmarriedFounder(previous), Parent.unmarriedFounder(previous));
            } else {
                final Parent.ExistingBranch firstParent = first.resolve(pedigree, previous, lineNumber);
                if (second == null) {
                    parents = new BranchParents(firstParent,
                            pedigree.getGeneration(previous).newFounderSpouse(firstParent.getBranch()));
                } else {
                    final Parent.ExistingBranch secondParent = second.resolve(pedigree, previous, lineNumber);
                    if (firstParent.equals(secondParent)) {
                        throw new DefFileException(DefFileErrorKind.SEX_CONFLICT, lineNumber,
                                "cannot have both parents be from same branch");
                    }
                    if (pedigree.getDefaultI1Sex().isKnown()) {
                        throw new DefFileException(DefFileErrorKind.SEX_CONFLICT, lineNumber,
                                "cannot have fixed sex for i1 samples and marriages between branches -- i1's will " +
                                        "have the same sex and cannot reproduce; consider assigning sexes to " +
                                        "individual branches");
                    }
                    pedigree.getSexConstraints().union(firstParent, secondParent, lineNumber);
                    parents = new BranchParents(firstParent, secondParent);
                }
            }

            forEachBranch(current, lineNumber, branch -> current.assignParents(branch, parents, lineNumber));
        }
    }

    /** Sets the number of samples printed from the listed branches to zero. */
    public static final class NoPrint extends BranchDirective {
        NoPrint(final BranchList branches) {
            super(branches);
        }

        @Override
        void apply(final PedigreeBuilder pedigree, final GenerationBuilder current, final int lineNumber) {
            forEachBranch(current, lineNumber, branch -> {
                final int requested = current.getSamplesToPrint(branch);
                if (requested > 0) {
                    pedigree.warn(lineNumber, "generation " + (current.getIndex() + 1) + " branch " + (branch + 1) +
                            " would print " + requested + " individuals, now set to 0");
                } else {
                    pedigree.warn(lineNumber, "generation " + (current.getIndex() + 1) + " branch " + (branch + 1) +
                            ", no-print is redundant");
                }
                current.setSamplesToPrint(branch, 0);
            });
        }
    }

    /** Fixes the sex of the i1 individual of the listed branches. */
    public static final class SexAssignment extends BranchDirective {
        private final Sex sex;

        SexAssignment(final BranchList branches, final Sex sex) {
            super(branches);
            this.sex = sex;
        }

        public Sex getSex() { return sex; }

        @Override
        void apply(final PedigreeBuilder pedigree, final GenerationBuilder current, final int lineNumber) {
            forEachBranch(current, lineNumber, branch -> current.assignSex(branch, sex, lineNumber));
        }
    }
}
