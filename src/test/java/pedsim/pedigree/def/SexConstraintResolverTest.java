package pedsim.pedigree.def;

import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import pedsim.pedigree.Sex;

import java.util.HashMap;
import java.util.Map;

public class SexConstraintResolverTest {
    private Map<Parent.ExistingBranch, SexSlot> slots;
    private SexConstraintResolver resolver;

    @BeforeMethod
    public void setUp() {
        slots = new HashMap<>();
        resolver = new SexConstraintResolver(p -> slots.computeIfAbsent(p, k -> new SexSlot()));
    }

    private static Parent.ExistingBranch b(final int branch) {
        return Parent.branch(0, branch);
    }

    private void fix(final int branch, final Sex sex) {
        slots.computeIfAbsent(b(branch), k -> new SexSlot()).setExplicitSex(sex);
    }

    private Sex sexOf(final int branch) {
        return slots.get(b(branch)).getSex();
    }

    @Test
    public void testPairedGroupIds() {
        final OppositeGroupId first = OppositeGroupId.firstOfPair(3);
        Assert.assertEquals(first.paired().paired(), first);
        Assert.assertNotEquals(first.paired(), first);
        Assert.assertTrue(first.isSamePair(first.paired()));
        Assert.assertFalse(first.isSamePair(OppositeGroupId.firstOfPair(2).paired()));
        Assert.assertEquals(first.pairNumber(), 3);
    }

    @Test
    public void testUnconstrainedCoupleStaysUnknown() {
        resolver.union(b(0), b(1), 1);
        resolver.finalizeSexes();
        Assert.assertEquals(sexOf(0), Sex.Unknown);
        Assert.assertEquals(sexOf(1), Sex.Unknown);
        Assert.assertTrue(slots.get(b(0)).hasGroup());
        Assert.assertTrue(slots.get(b(0)).getGroup().isSamePair(slots.get(b(1)).getGroup()));
        Assert.assertNotEquals(slots.get(b(0)).getGroup(), slots.get(b(1)).getGroup());
        Assert.assertEquals(resolver.liveGroupCount(), 2);
    }

    @Test
    public void testFixedSexPropagatesToSpouse() {
        fix(0, Sex.Female);
        resolver.union(b(0), b(1), 1);
        resolver.finalizeSexes();
        Assert.assertEquals(sexOf(0), Sex.Female);
        Assert.assertEquals(sexOf(1), Sex.Male);
        Assert.assertTrue(slots.get(b(0)).isExplicit());
        Assert.assertFalse(slots.get(b(1)).isExplicit());
    }

    @Test
    public void testChainAlternatesSexes() {
        fix(0, Sex.Female);
        resolver.union(b(0), b(1), 1);
        resolver.union(b(1), b(2), 2);
        resolver.union(b(2), b(3), 3);
        resolver.finalizeSexes();
        Assert.assertEquals(sexOf(0), Sex.Female);
        Assert.assertEquals(sexOf(1), Sex.Male);
        Assert.assertEquals(sexOf(2), Sex.Female);
        Assert.assertEquals(sexOf(3), Sex.Male);
        Assert.assertEquals(resolver.liveGroupCount(), 2);
    }

    @Test
    public void testJoiningSpouseWithFixedSexSetsPair() {
        resolver.union(b(0), b(1), 1);
        fix(2, Sex.Male);
        resolver.union(b(1), b(2), 2);
        resolver.finalizeSexes();
        // 2 joins the group of 0
        Assert.assertEquals(sexOf(0), Sex.Male);
        Assert.assertEquals(sexOf(1), Sex.Female);
        Assert.assertEquals(sexOf(2), Sex.Male);
    }

    @Test
    public void testMergeTwoPairs() {
        fix(3, Sex.Male);
        resolver.union(b(0), b(1), 1);
        resolver.union(b(2), b(3), 2);
        Assert.assertEquals(resolver.liveGroupCount(), 4);

        resolver.union(b(1), b(2), 3);
        Assert.assertEquals(resolver.liveGroupCount(), 2);
        Assert.assertEquals(slots.get(b(1)).getGroup(), slots.get(b(3)).getGroup());
        Assert.assertEquals(slots.get(b(0)).getGroup(), slots.get(b(2)).getGroup());

        resolver.finalizeSexes();
        Assert.assertEquals(sexOf(0), Sex.Female);
        Assert.assertEquals(sexOf(1), Sex.Male);
        Assert.assertEquals(sexOf(2), Sex.Female);
        Assert.assertEquals(sexOf(3), Sex.Male);
    }

    @Test
    public void testMarryingWithinSamePairIsNoOp() {
        resolver.union(b(0), b(1), 1);
        resolver.union(b(1), b(0), 2);
        Assert.assertEquals(resolver.liveGroupCount(), 2);
    }

    @Test
    public void testFinalizeIsIdempotent() {
        fix(0, Sex.Male);
        resolver.union(b(0), b(1), 1);
        resolver.union(b(2), b(3), 2);
        resolver.union(b(1), b(2), 3);
        resolver.finalizeSexes();
        final Map<Parent.ExistingBranch, Sex> first = new HashMap<>();
        slots.forEach((k, v) -> first.put(k, v.getSex()));

        resolver.finalizeSexes();
        slots.forEach((k, v) -> Assert.assertEquals(v.getSex(), first.get(k), k.toString()));
    }

    @Test
    public void testSameFixedSexesCannotMarry() {
        fix(0, Sex.Male);
        fix(1, Sex.Male);
        assertConflict(0, 1);
    }

    @Test
    public void testSelfMarriage() {
        assertConflict(0, 0);
    }

    @Test
    public void testMarryingWithinSameGroup() {
        resolver.union(b(0), b(1), 1);
        resolver.union(b(1), b(2), 2);
        // 0 and 2 both married 1, so must share a sex
        assertConflict(0, 2);
    }

    @Test
    public void testJoiningSpouseWithConflictingFixedSex() {
        fix(0, Sex.Male);
        resolver.union(b(0), b(1), 1);
        fix(2, Sex.Female);
        // 2 would join the group of 0, which is male
        assertConflict(1, 2);
    }

    @Test
    public void testMergingPairsWithConflictingSexes() {
        fix(0, Sex.Male);
        fix(2, Sex.Male);
        resolver.union(b(0), b(1), 1);
        resolver.union(b(2), b(3), 2);
        // 1 is female, 3 is female
        assertConflict(1, 3);
    }

    private void assertConflict(final int first, final int second) {
        try {
            resolver.union(b(first), b(second), 7);
            Assert.fail("Expected a sex conflict marrying " + first + " and " + second);
        } catch (final DefFileException e) {
            Assert.assertEquals(e.getKind(), DefFileErrorKind.SEX_CONFLICT);
            Assert.assertEquals(e.getLineNumber(), 7);
        }
    }
}
