package pedsim.pedigree.def;

import pedsim.PedSimException;

/**
 * Thrown for any fatal problem in a def file. Compilation stops at the first such problem, so an exception carries
 * exactly one error: its kind and the line of the def file it was found on.
 */
public class DefFileException extends PedSimException {
    /** Line number used for errors that are not tied to a single line of the def file. */
    public static final int NO_LINE = 0;

    private final DefFileErrorKind kind;
    private final int lineNumber;

    public DefFileException(final DefFileErrorKind kind, final int lineNumber, final String message) {
        super(formatMessage(lineNumber, message));
        this.kind = kind;
        this.lineNumber = lineNumber;
    }

    public DefFileException(final DefFileErrorKind kind, final int lineNumber, final String message, final Throwable cause) {
        super(formatMessage(lineNumber, message), cause);
        this.kind = kind;
        this.lineNumber = lineNumber;
    }

    public DefFileErrorKind getKind() { return kind; }

    /** The 1-based line of the def file the error was found on, or {@link #NO_LINE}. */
    public int getLineNumber() { return lineNumber; }

    public int exitStatus() { return kind.exitStatus(); }

    private static String formatMessage(final int lineNumber, final String message) {
        return lineNumber == NO_LINE ? message : "line " + lineNumber + " in def: " + message;
    }
}
