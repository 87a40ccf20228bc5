package pedsim.pedigree.def;

import htsjdk.samtools.util.Log;
import pedsim.pedigree.Sex;

import java.util.ArrayList;
import java.util.List;

/**
 * A pedigree whose definition is still being read. Owns the generations read so far and the sex constraints among
 * their branches; {@link #build()} fills in the generations the def file left out, resolves the sexes and freezes
 * everything into a {@link Pedigree}.
 */
class PedigreeBuilder {
    private static final Log log = Log.getInstance(PedigreeBuilder.class);

    private final String name;
    private final int numReplicates;
    private final Sex defaultI1Sex;
    private final int headerLineNumber;
    private final GenerationBuilder[] generations;
    private final SexConstraintResolver sexConstraints;
    private final List<DefFileWarning> warnings;
    private int lastReadGeneration = -1;

    PedigreeBuilder(final String name, final int numReplicates, final int numGenerations, final Sex defaultI1Sex,
                    final int headerLineNumber, final List<DefFileWarning> warnings) {
        this.name = name;
        this.numReplicates = numReplicates;
        this.defaultI1Sex = defaultI1Sex;
        this.headerLineNumber = headerLineNumber;
        this.generations = new GenerationBuilder[numGenerations];
        this.sexConstraints = new SexConstraintResolver(this::sexSlot);
        this.warnings = warnings;
    }

    String getName() { return name; }

    int getNumGenerations() { return generations.length; }

    /** The sex given for all i1 individuals in the pedigree header, or Unknown. */
    Sex getDefaultI1Sex() { return defaultI1Sex; }

    int getHeaderLineNumber() { return headerLineNumber; }

    /** The generation at {@code index}, or null if it has not been read or filled in yet. */
    GenerationBuilder getGeneration(final int index) { return generations[index]; }

    void setGeneration(final GenerationBuilder generation) {
        if (generations[generation.getIndex()] != null) {
            throw new IllegalStateException("Generation " + (generation.getIndex() + 1) + " is already defined");
        }
        generations[generation.getIndex()] = generation;
    }

    /** Index of the last generation listed in the def file so far, or -1. */
    int getLastReadGeneration() { return lastReadGeneration; }

    void setLastReadGeneration(final int index) { this.lastReadGeneration = index; }

    SexConstraintResolver getSexConstraints() { return sexConstraints; }

    SexSlot sexSlot(final Parent.ExistingBranch branch) {
        return generations[branch.getGeneration()].sexSlot(branch.getBranch());
    }

    /** Logs a warning and keeps it to be reported with the compiled pedigrees. */
    void warn(final int lineNumber, final String message) {
        final DefFileWarning warning = new DefFileWarning(lineNumber, message);
        log.warn(warning);
        warnings.add(warning);
    }

    Pedigree build() {
        for (int i = 0; i < generations.length; i++) {
            if (generations[i] == null) DefaultStructureInferencer.fillGeneration(this, i);
        }
        sexConstraints.finalizeSexes();

        final List<Generation> built = new ArrayList<>(generations.length);
        for (final GenerationBuilder generation : generations) built.add(generation.build());
        log.debug("Finished pedigree ", name, " with ", generations.length, " generations");
        return new Pedigree(name, numReplicates, defaultI1Sex, built);
    }
}
