package pedsim.pedigree;

import pedsim.PedSimException;

/**
 * Represents the sex of an individual. {@link #Unknown} means that no sex has been fixed or inferred and
 * assignment is left to whoever consumes the pedigree.
 */
public enum Sex {
    Male("M"), Female("F"), Unknown("U");

    /** The single-character symbol used for this sex in def files. */
    private final String symbol;

    Sex(final String symbol) {
        this.symbol = symbol;
    }

    /** Returns the single-character symbol used to encode sex in a def file */
    public String toSymbol() {
        return this.symbol;
    }

    /** True for {@link #Male} and {@link #Female}. */
    public boolean isKnown() {
        return this != Unknown;
    }

    /** The sex a spouse must have. The opposite of {@link #Unknown} is {@link #Unknown}. */
    public Sex opposite() {
        switch (this) {
            case Male:   return Female;
            case Female: return Male;
            default:     return Unknown;
        }
    }

    /** Decodes the Sex from a def-file symbol: only "M" and "F" are accepted, case sensitively. */
    public static Sex fromDefSymbol(final String symbol) {
        if (Male.symbol.equals(symbol)) return Male;
        if (Female.symbol.equals(symbol)) return Female;
        throw new PedSimException("Unrecognized def file sex symbol: " + symbol);
    }
}
