package pedsim.pedigree.def;

import htsjdk.samtools.util.Log;
import pedsim.pedigree.Sex;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a def file into fully resolved pedigrees. A def file holds one or more pedigree definitions, each a header
 * line followed by lines describing its generations:
 * <pre>
 *     # comments and blank lines are ignored
 *     def name numReplicates numGenerations [M|F]
 *     generation numToPrint [numBranches] [branch specifications...]
 * </pre>
 * Compilation stops at the first error with a {@link DefFileException}; warnings are logged and returned with the
 * result.
 */
public final class DefFileParser {
    private static final Log log = Log.getInstance(DefFileParser.class);

    static final String DEF_KEYWORD = "def";

    private DefFileParser() { }

    public static DefFile parse(final File file) {
        try (final DefLineIterator lines = DefLineIterator.fromFile(file)) {
            return parse(lines);
        }
    }

    /**
     * @param sourceName name used for the text in log messages
     */
    public static DefFile parse(final String text, final String sourceName) {
        try (final DefLineIterator lines = DefLineIterator.fromString(text, sourceName)) {
            return parse(lines);
        }
    }

    static DefFile parse(final DefLineIterator lines) {
        final PedigreeRegistry registry = new PedigreeRegistry();

        while (lines.hasNext()) {
            final DefLine line = lines.next();
            if (DEF_KEYWORD.equals(line.getToken(0))) {
                readHeader(line, registry);
            } else {
                if (!registry.hasOpenPedigree()) {
                    throw new DefFileException(DefFileErrorKind.MALFORMED_LINE, line.getLineNumber(),
                            "expect four or five fields for pedigree definition: " +
                                    "def [name] [numReps] [numGen] <sex of i1>");
                }
                GenerationLineParser.parse(line, registry.getOpenPedigree());
            }
        }

        final List<Pedigree> pedigrees = registry.finish();
        final List<DefFileWarning> warnings = new ArrayList<>(registry.getWarnings());
        log.info("Read ", pedigrees.size(), " pedigree definition(s) from ", lines.getSourceName(),
                warnings.isEmpty() ? "" : " with " + warnings.size() + " warning(s)");
        return new DefFile(pedigrees, warnings);
    }

    /** Reads {@code def name numReplicates numGenerations [M|F]} and opens the pedigree. */
    private static void readHeader(final DefLine line, final PedigreeRegistry registry) {
        final int lineNumber = line.getLineNumber();
        if (line.size() < 4 || line.size() > 5) {
            throw new DefFileException(DefFileErrorKind.MALFORMED_LINE, lineNumber,
                    "expect four or five fields for pedigree definition: def [name] [numReps] [numGen] <sex of i1>");
        }
        final String name = line.getToken(1);
        final int numReplicates = GenerationLineParser.parseInt(line.getToken(2), lineNumber,
                "expected number of replicates to simulate as second token");
        final int numGenerations = GenerationLineParser.parseInt(line.getToken(3), lineNumber,
                "expected number of generations to simulate as third token");

        Sex i1Sex = Sex.Unknown;
        if (line.hasToken(4)) {
            final String sexField = line.getToken(4);
            if (!sexField.equals(Sex.Male.toSymbol()) && !sexField.equals(Sex.Female.toSymbol())) {
                throw new DefFileException(DefFileErrorKind.MALFORMED_DIRECTIVE, lineNumber,
                        "allowed values for sex of i1 field are 'M' and 'F', got " + sexField);
            }
            i1Sex = Sex.fromDefSymbol(sexField);
        }

        registry.beginPedigree(name, numReplicates, numGenerations, i1Sex, lineNumber);
    }
}
