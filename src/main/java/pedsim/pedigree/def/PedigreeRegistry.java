package pedsim.pedigree.def;

import htsjdk.samtools.util.Log;
import pedsim.pedigree.Sex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the pedigrees of a def file in the order they are defined. At most one pedigree is open at a time; it is
 * finalized when the next one begins or when {@link #finish()} is called.
 */
public class PedigreeRegistry {
    private static final Log log = Log.getInstance(PedigreeRegistry.class);

    private final Map<String, Pedigree> pedigrees = new LinkedHashMap<>();
    private final List<DefFileWarning> warnings = new ArrayList<>();
    private PedigreeBuilder open;

    /**
     * Finalizes the open pedigree, if any, and opens a new one with {@code numGenerations} generations still to be
     * read.
     *
     * @param i1Sex the sex of all i1 individuals, or Unknown if the header gives none
     */
    public void beginPedigree(final String name, final int numReplicates, final int numGenerations, final Sex i1Sex,
                              final int lineNumber) {
        if (open != null) finalizePedigree();

        if (pedigrees.containsKey(name)) {
            throw new DefFileException(DefFileErrorKind.DUPLICATE_NAME, lineNumber,
                    "name of pedigree is same as previous pedigree: " + name);
        }
        if (numReplicates <= 0) {
            throw new DefFileException(DefFileErrorKind.INVALID_COUNT, lineNumber,
                    "number of replicates to simulate must be positive, got " + numReplicates);
        }
        if (numGenerations <= 0) {
            throw new DefFileException(DefFileErrorKind.INVALID_COUNT, lineNumber,
                    "number of generations to simulate must be positive, got " + numGenerations);
        }
        open = new PedigreeBuilder(name, numReplicates, numGenerations, i1Sex, lineNumber, warnings);
    }

    /** True if a pedigree is open for generation lines. */
    public boolean hasOpenPedigree() {
        return open != null;
    }

    PedigreeBuilder getOpenPedigree() {
        if (open == null) throw new IllegalStateException("No pedigree definition is open");
        return open;
    }

    /**
     * Resolves the sexes of the open pedigree, checks that it prints something from its last generation and adds it
     * to the registry.
     */
    public Pedigree finalizePedigree() {
        final PedigreeBuilder builder = getOpenPedigree();
        open = null;
        final Pedigree pedigree = builder.build();

        final Generation last = pedigree.getLastGeneration();
        boolean someBranchToPrint = false;
        boolean anyNoPrint = false;
        for (int b = 0; b < last.getBranchCount(); b++) {
            if (last.getRequestedSamplesToPrint(b) == 0) anyNoPrint = true;
            else someBranchToPrint = true;
        }
        if (!someBranchToPrint) {
            throw new DefFileException(DefFileErrorKind.NO_PRINTABLE_OUTPUT, builder.getHeaderLineNumber(),
                    "request to simulate pedigree \"" + pedigree.getName() + "\" with " +
                            pedigree.getNumGenerations() + " generations but no request to print any samples from " +
                            "last generation (number " + pedigree.getNumGenerations() + ")");
        }
        if (anyNoPrint) {
            builder.warn(DefFileException.NO_LINE, "no-print branches in last generation of pedigree " +
                    pedigree.getName() + ": can omit these branches and possibly reduce number of founders needed");
        }

        pedigrees.put(pedigree.getName(), pedigree);
        return pedigree;
    }

    /**
     * Finalizes the open pedigree and returns all pedigrees in definition order.
     *
     * @throws DefFileException of kind {@link DefFileErrorKind#EMPTY_FILE} if no pedigree was defined
     */
    public List<Pedigree> finish() {
        if (open != null) finalizePedigree();
        if (pedigrees.isEmpty()) {
            throw new DefFileException(DefFileErrorKind.EMPTY_FILE, DefFileException.NO_LINE,
                    "def file does not contain pedigree definitions; nothing to simulate");
        }
        log.debug("Registered ", pedigrees.size(), " pedigrees");
        return Collections.unmodifiableList(new ArrayList<>(pedigrees.values()));
    }

    public List<DefFileWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }
}
