package pedsim.pedigree.def;

import pedsim.pedigree.Sex;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A set of i1 individuals that must all have the same sex, along with that sex once it is known. A group that has
 * been merged into another is retired and must not be used again.
 */
class ConstraintGroup {
    private final SortedSet<Parent.ExistingBranch> members = new TreeSet<>();
    private Sex sex = Sex.Unknown;
    private boolean live = true;

    SortedSet<Parent.ExistingBranch> getMembers() {
        return Collections.unmodifiableSortedSet(members);
    }

    void add(final Parent.ExistingBranch member) {
        members.add(member);
    }

    void addAll(final ConstraintGroup other) {
        members.addAll(other.members);
    }

    boolean intersects(final ConstraintGroup other) {
        return !Collections.disjoint(members, other.members);
    }

    Sex getSex() { return sex; }

    void setSex(final Sex sex) { this.sex = sex; }

    boolean isLive() { return live; }

    void retire() {
        live = false;
        members.clear();
    }
}
