package pedsim.pedigree.def;

/**
 * Reads one generation line of a pedigree definition:
 * <pre>
 *     generation numToPrint [numBranches] [branch specifications...]
 * </pre>
 * Generations skipped since the last listed one are filled in with the default structure first. After the branch
 * specifications are applied, branches that still have no parents get the default ones.
 */
final class GenerationLineParser {
    private GenerationLineParser() { }

    static void parse(final DefLine line, final PedigreeBuilder pedigree) {
        final int lineNumber = line.getLineNumber();

        final int generationNumber = parseInt(line.getToken(0), lineNumber,
                "expected generation number or \"def\" as first token");
        if (!line.hasToken(1)) {
            throw new DefFileException(DefFileErrorKind.MALFORMED_LINE, lineNumber, "expected at least two fields");
        }
        final int numToPrint = parseInt(line.getToken(1), lineNumber,
                "expected number of samples to print as second token");

        if (generationNumber < 1 || generationNumber > pedigree.getNumGenerations()) {
            throw new DefFileException(DefFileErrorKind.OUT_OF_RANGE, lineNumber,
                    "generation " + generationNumber + " below 1 or above " + pedigree.getNumGenerations() +
                            " (max number of generations)");
        }
        if (numToPrint < 0) {
            throw new DefFileException(DefFileErrorKind.INVALID_COUNT, lineNumber,
                    "in generation " + generationNumber + ", number of samples to print below 0");
        }
        if (generationNumber == 1 && numToPrint > 1) {
            throw new DefFileException(DefFileErrorKind.INVALID_COUNT, lineNumber,
                    "in generation 1, if founders are to be printed must list 1 as the number to be printed " +
                            "(others invalid)");
        }

        final int index = generationNumber - 1;
        if (index == pedigree.getLastReadGeneration()) {
            throw new DefFileException(DefFileErrorKind.DUPLICATE_ASSIGNMENT, lineNumber,
                    "multiple entries for generation " + generationNumber);
        }
        if (index < pedigree.getLastReadGeneration()) {
            throw new DefFileException(DefFileErrorKind.NON_INCREASING, lineNumber,
                    "generation numbers must be in increasing order");
        }

        for (int skipped = pedigree.getLastReadGeneration() + 1; skipped < index; skipped++) {
            DefaultStructureInferencer.fillGeneration(pedigree, skipped);
        }

        final int branchCount;
        if (line.hasToken(2)) {
            branchCount = parseInt(line.getToken(2), lineNumber,
                    "optional third token must be numerical value giving number of branches");
            if (branchCount <= 0) {
                throw new DefFileException(DefFileErrorKind.INVALID_COUNT, lineNumber,
                        "in generation " + generationNumber + ", branch number zero or below");
            }
        } else {
            branchCount = DefaultStructureInferencer.defaultBranchCount(pedigree, index);
        }

        final GenerationBuilder current = new GenerationBuilder(index, branchCount, numToPrint, true);
        pedigree.setGeneration(current);
        pedigree.setLastReadGeneration(index);

        for (final String token : line.tokensFrom(3)) {
            BranchSpecParser.parse(token, index, lineNumber).apply(pedigree, current, lineNumber);
        }

        if (index > 0) {
            DefaultStructureInferencer.assignDefaultParents(pedigree.getGeneration(index - 1), current);
        }
    }

    static int parseInt(final String token, final int lineNumber, final String expected) {
        try {
            return Integer.parseInt(token);
        } catch (final NumberFormatException e) {
            throw new DefFileException(DefFileErrorKind.MALFORMED_NUMBER, lineNumber, expected + ", got " + token, e);
        }
    }
}
