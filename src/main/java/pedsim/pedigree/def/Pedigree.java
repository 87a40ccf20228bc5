package pedsim.pedigree.def;

import pedsim.pedigree.Sex;

import java.util.Collections;
import java.util.List;

/**
 * Read-only, fully resolved description of one pedigree from a def file: every generation with its branches,
 * their parents, how many samples to print, and the sexes of the i1 individuals where these are determined.
 */
public class Pedigree {
    private final String name;
    private final int numReplicates;
    private final Sex defaultI1Sex;
    private final List<Generation> generations;

    Pedigree(final String name, final int numReplicates, final Sex defaultI1Sex, final List<Generation> generations) {
        this.name = name;
        this.numReplicates = numReplicates;
        this.defaultI1Sex = defaultI1Sex;
        this.generations = Collections.unmodifiableList(generations);
    }

    public String getName() { return name; }

    /** How many copies of the pedigree to simulate. */
    public int getNumReplicates() { return numReplicates; }

    public int getNumGenerations() { return generations.size(); }

    /** The sex the header gives to every i1 individual, or Unknown if it gave none. */
    public Sex getDefaultI1Sex() { return defaultI1Sex; }

    public Generation getGeneration(final int index) { return generations.get(index); }

    public List<Generation> getGenerations() { return generations; }

    public Generation getLastGeneration() { return generations.get(generations.size() - 1); }

    /**
     * The sex of the i1 individual of a branch: fixed or inferred for the branch if possible, otherwise the
     * header's default, otherwise Unknown.
     */
    public Sex getI1Sex(final int generation, final int branch) {
        final Sex sex = generations.get(generation).getSex(branch);
        return sex.isKnown() ? sex : defaultI1Sex;
    }

    @Override
    public String toString() {
        return "Pedigree{" + name + ", " + numReplicates + " replicates, " + generations.size() + " generations}";
    }
}
