package pedsim.pedigree.def;

import java.util.Arrays;

/**
 * One non-blank, non-comment line of a def file, split into whitespace-delimited tokens. The line number is kept
 * so that every error and warning can point back to the def file.
 */
public class DefLine {
    private final int lineNumber;
    private final String[] tokens;

    public DefLine(final int lineNumber, final String... tokens) {
        if (tokens.length == 0) throw new IllegalArgumentException("A def line must have at least one token");
        this.lineNumber = lineNumber;
        this.tokens = tokens;
    }

    public int getLineNumber() { return lineNumber; }

    public int size() { return tokens.length; }

    public String getToken(final int i) { return tokens[i]; }

    /** True if the line has more than {@code i} tokens. */
    public boolean hasToken(final int i) { return i < tokens.length; }

    /** The tokens from position {@code from} to the end of the line. */
    public String[] tokensFrom(final int from) {
        return Arrays.copyOfRange(tokens, Math.min(from, tokens.length), tokens.length);
    }

    @Override
    public String toString() {
        return lineNumber + ": " + String.join(" ", tokens);
    }
}
