package pedsim.pedigree.def;

import htsjdk.samtools.util.Log;
import pedsim.pedigree.Sex;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Tracks which i1 individuals must share a sex and which must have opposite sexes because they have children
 * together, and fails as soon as these constraints contradict each other or the sexes fixed in the def file.
 *
 * This is a union-find over two labels: every constraint group is allocated together with an opposite group (see
 * {@link OppositeGroupId}), marrying two individuals places them in opposite groups of one pair, and marrying
 * across two pairs merges the pairs. Groups live in an arena so ids stay stable; merged-away groups are retired.
 *
 * One resolver serves one pedigree.
 */
public class SexConstraintResolver {
    private static final Log log = Log.getInstance(SexConstraintResolver.class);

    private final List<ConstraintGroup> groups = new ArrayList<>();
    private final Function<Parent.ExistingBranch, SexSlot> slots;

    /**
     * @param slots gives the sex slot of a branch's i1 individual, creating it if needed
     */
    public SexConstraintResolver(final Function<Parent.ExistingBranch, SexSlot> slots) {
        this.slots = slots;
    }

    /**
     * Records that the i1 individuals of {@code a} and {@code b} have children together and so must have opposite
     * sexes.
     *
     * @throws DefFileException of kind {@link DefFileErrorKind#SEX_CONFLICT} if that is impossible
     */
    public void union(final Parent.ExistingBranch a, final Parent.ExistingBranch b, final int lineNumber) {
        if (a.equals(b)) {
            throw new DefFileException(DefFileErrorKind.SEX_CONFLICT, lineNumber,
                    "cannot have both parents be from same branch (" + a + ")");
        }
        final SexSlot slotA = slots.apply(a);
        final SexSlot slotB = slots.apply(b);

        if (!slotA.hasGroup() && !slotB.hasGroup()) {
            startPair(a, slotA, b, slotB, lineNumber);
        } else if (!slotA.hasGroup() || !slotB.hasGroup()) {
            if (slotA.hasGroup()) joinOpposite(a, slotA, b, slotB, lineNumber);
            else joinOpposite(b, slotB, a, slotA, lineNumber);
        } else if (slotA.getGroup().isSamePair(slotB.getGroup())) {
            if (slotA.getGroup().equals(slotB.getGroup())) {
                throw new DefFileException(DefFileErrorKind.SEX_CONFLICT, lineNumber,
                        "assigning " + a + " and " + b + " as parents is impossible due to other parent " +
                                "assignments: they necessarily have same sex");
            }
            // already constrained to opposite sexes
        } else {
            mergePairs(a, slotA, b, slotB, lineNumber);
        }
    }

    /** Neither individual is constrained yet: give each one side of a new pair. */
    private void startPair(final Parent.ExistingBranch a, final SexSlot slotA,
                           final Parent.ExistingBranch b, final SexSlot slotB, final int lineNumber) {
        final OppositeGroupId idA = OppositeGroupId.firstOfPair(groups.size() / 2);
        final OppositeGroupId idB = idA.paired();
        groups.add(new ConstraintGroup());
        groups.add(new ConstraintGroup());

        final ConstraintGroup groupA = group(idA);
        final ConstraintGroup groupB = group(idB);
        groupA.add(a);
        groupB.add(b);
        slotA.setGroup(idA);
        slotB.setGroup(idB);
        groupA.setSex(slotA.getSex());
        groupB.setSex(slotB.getSex());

        if (groupA.getSex().isKnown() || groupB.getSex().isKnown()) {
            if (!groupA.getSex().isKnown()) groupA.setSex(groupB.getSex().opposite());
            if (!groupB.getSex().isKnown()) groupB.setSex(groupA.getSex().opposite());
            if (groupA.getSex() == groupB.getSex()) {
                throw new DefFileException(DefFileErrorKind.SEX_CONFLICT, lineNumber,
                        "assigning " + a + " and " + b + " as parents is impossible: they are assigned the same sex");
            }
        }
    }

    /** Only {@code grouped} is constrained: {@code other} joins the group opposite it. */
    private void joinOpposite(final Parent.ExistingBranch grouped, final SexSlot groupedSlot,
                              final Parent.ExistingBranch other, final SexSlot otherSlot, final int lineNumber) {
        final OppositeGroupId otherId = groupedSlot.getGroup().paired();
        final ConstraintGroup otherGroup = group(otherId);
        otherGroup.add(other);
        otherSlot.setGroup(otherId);

        if (otherSlot.getSex().isKnown()) {
            if (!otherGroup.getSex().isKnown()) {
                otherGroup.setSex(otherSlot.getSex());
                group(groupedSlot.getGroup()).setSex(otherSlot.getSex().opposite());
            } else if (otherGroup.getSex() != otherSlot.getSex()) {
                throw new DefFileException(DefFileErrorKind.SEX_CONFLICT, lineNumber,
                        "assigning " + other + " as a parent with " + grouped + " is impossible: due to sex " +
                                "assignments and/or other parent assignments they necessarily have the same sex");
            }
        }
    }

    /**
     * Both individuals belong to different pairs. The pair of {@code b} is folded into the pair of {@code a} so that
     * the spouses of {@code a} end up with {@code b} and the spouses of {@code b} end up with {@code a}.
     */
    private void mergePairs(final Parent.ExistingBranch a, final SexSlot slotA,
                            final Parent.ExistingBranch b, final SexSlot slotB, final int lineNumber) {
        // [which pair][0 = the parent's own group, 1 = its opposite]
        final OppositeGroupId[][] ids = {
                {slotA.getGroup(), slotA.getGroup().paired()},
                {slotB.getGroup(), slotB.getGroup().paired()}
        };

        for (int side = 0; side < 2; side++) {
            final ConstraintGroup into = group(ids[0][side]);
            final ConstraintGroup from = group(ids[1][side ^ 1]);
            if (into.getSex() != from.getSex()) {
                if (!into.getSex().isKnown()) {
                    into.setSex(from.getSex());
                } else if (from.getSex().isKnown()) {
                    throw new DefFileException(DefFileErrorKind.SEX_CONFLICT, lineNumber,
                            "assigning " + a + " as a parent with " + b + " is impossible: due to sex " +
                                    "assignments and/or other parent assignments they necessarily have the same sex");
                }
            }
        }

        group(ids[0][0]).addAll(group(ids[1][1]));
        group(ids[0][1]).addAll(group(ids[1][0]));
        if (group(ids[0][0]).intersects(group(ids[0][1]))) {
            throw new DefFileException(DefFileErrorKind.SEX_CONFLICT, lineNumber,
                    "assigning " + a + " and " + b + " as parents is impossible due to other parent " +
                            "assignments: they necessarily have same sex");
        }

        for (int side = 0; side < 2; side++) {
            final ConstraintGroup absorbed = group(ids[1][side]);
            final OppositeGroupId newId = ids[0][side ^ 1];
            for (final Parent.ExistingBranch member : absorbed.getMembers()) {
                slots.apply(member).setGroup(newId);
            }
            absorbed.retire();
        }
        log.debug("Merged constraint pairs ", ids[1][0].pairNumber(), " into ", ids[0][0].pairNumber());
    }

    /**
     * Writes the sex of every group whose sex is known into the sex slots of its members. Individuals in groups of
     * unknown sex, and those in no group, keep whatever sex their slot already has. Running this more than once
     * gives the same result.
     */
    public void finalizeSexes() {
        for (final ConstraintGroup group : groups) {
            if (!group.isLive() || !group.getSex().isKnown()) continue;
            for (final Parent.ExistingBranch member : group.getMembers()) {
                slots.apply(member).assignInferredSex(group.getSex());
            }
        }
    }

    /** The group with the given id; fails for retired groups. */
    ConstraintGroup group(final OppositeGroupId id) {
        final ConstraintGroup group = groups.get(id.index());
        if (!group.isLive()) throw new IllegalStateException("Constraint " + id + " was merged away");
        return group;
    }

    /** The sex currently required of the group {@code member} belongs to, or Unknown if it is in none. */
    public Sex constrainedSex(final Parent.ExistingBranch member) {
        final SexSlot slot = slots.apply(member);
        return slot.hasGroup() ? group(slot.getGroup()).getSex() : slot.getSex();
    }

    /** Number of live groups; always even. */
    public int liveGroupCount() {
        int count = 0;
        for (final ConstraintGroup group : groups) if (group.isLive()) count++;
        return count;
    }
}
