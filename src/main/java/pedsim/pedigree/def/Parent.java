package pedsim.pedigree.def;

import java.util.Comparator;
import java.util.Objects;

/**
 * A parent of a branch: either the i1 individual of an existing branch in some earlier generation, or a founder
 * that has to be created for the simulation. Generations and branches are 0-based.
 */
public abstract class Parent {
    private final int generation;

    private Parent(final int generation) {
        this.generation = generation;
    }

    /** The generation the parent belongs to. For founders this is the generation of the branch they married into. */
    public int getGeneration() { return generation; }

    public abstract boolean isFounder();

    public static ExistingBranch branch(final int generation, final int branch) {
        return new ExistingBranch(generation, branch);
    }

    /** A founder married into {@code spouse}; {@code spouseNumber} tells apart the founders married to one branch. */
    public static NewFounder founderSpouseOf(final ExistingBranch spouse, final int spouseNumber) {
        return new NewFounder(spouse.getGeneration(), spouse, spouseNumber);
    }

    /** A founder that is not married into any branch, as used for branches made up of a single new founder. */
    public static NewFounder unmarriedFounder(final int generation) {
        return new NewFounder(generation, null, 0);
    }

    /**
     * The i1 individual of a branch. These are the individuals whose sexes the sex constraints are about, so they
     * are comparable and usable as set members.
     */
    public static final class ExistingBranch extends Parent implements Comparable<ExistingBranch> {
        private static final Comparator<ExistingBranch> ORDER =
                Comparator.comparingInt(ExistingBranch::getGeneration).thenComparingInt(ExistingBranch::getBranch);

        private final int branch;

        private ExistingBranch(final int generation, final int branch) {
            super(generation);
            if (generation < 0 || branch < 0) {
                throw new IllegalArgumentException("Negative generation or branch: " + generation + ", " + branch);
            }
            this.branch = branch;
        }

        public int getBranch() { return branch; }

        @Override
        public boolean isFounder() { return false; }

        @Override
        public int compareTo(final ExistingBranch o) {
            return ORDER.compare(this, o);
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) return true;
            if (!(o instanceof ExistingBranch)) return false;
            final ExistingBranch that = (ExistingBranch) o;
            return getGeneration() == that.getGeneration() && branch == that.branch;
        }

        @Override
        public int hashCode() {
            return Objects.hash(getGeneration(), branch);
        }

        /** 1-based, as written in def files. */
        @Override
        public String toString() {
            return "branch " + (branch + 1) + " from generation " + (getGeneration() + 1);
        }
    }

    /**
     * A founder to be synthesized by the simulator. Two founders are the same individual only if they married into
     * the same branch with the same spouse number.
     */
    public static final class NewFounder extends Parent {
        private final ExistingBranch spouse;
        private final int spouseNumber;

        private NewFounder(final int generation, final ExistingBranch spouse, final int spouseNumber) {
            super(generation);
            this.spouse = spouse;
            this.spouseNumber = spouseNumber;
        }

        /** The branch this founder married into, or null for a founder that married into no branch. */
        public ExistingBranch getSpouse() { return spouse; }

        public boolean hasSpouse() { return spouse != null; }

        /** 1 for the first founder married into the spouse branch, 2 for the second, and so on. */
        public int getSpouseNumber() { return spouseNumber; }

        @Override
        public boolean isFounder() { return true; }

        @Override
        public boolean equals(final Object o) {
            if (this == o) return true;
            if (!(o instanceof NewFounder)) return false;
            final NewFounder that = (NewFounder) o;
            return getGeneration() == that.getGeneration() && spouseNumber == that.spouseNumber &&
                    Objects.equals(spouse, that.spouse);
        }

        @Override
        public int hashCode() {
            return Objects.hash(getGeneration(), spouse, spouseNumber);
        }

        @Override
        public String toString() {
            return hasSpouse() ? "founder spouse " + spouseNumber + " of " + spouse : "founder";
        }
    }
}
