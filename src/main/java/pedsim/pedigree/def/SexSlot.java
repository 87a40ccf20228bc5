package pedsim.pedigree.def;

import pedsim.pedigree.Sex;

/**
 * Sex bookkeeping for the i1 individual of one branch: the sex fixed for it (explicitly in the def file, or
 * inferred once the pedigree is finalized) and the constraint group it belongs to, if any.
 */
public class SexSlot {
    private OppositeGroupId group;
    private Sex sex = Sex.Unknown;
    private boolean explicit;

    public OppositeGroupId getGroup() { return group; }

    public boolean hasGroup() { return group != null; }

    void setGroup(final OppositeGroupId group) {
        this.group = group;
    }

    public Sex getSex() { return sex; }

    /** True if the sex was given in the def file rather than inferred from marriages. */
    public boolean isExplicit() { return explicit; }

    /** Records a sex given in the def file. Callers check for repeated assignments. */
    void setExplicitSex(final Sex sex) {
        this.sex = sex;
        this.explicit = true;
    }

    /** Records a sex inferred from the constraint groups. A sex once set never changes. */
    void assignInferredSex(final Sex inferred) {
        if (sex.isKnown() && sex != inferred) {
            throw new IllegalStateException("Inferred sex " + inferred + " contradicts " + sex);
        }
        this.sex = inferred;
    }
}
