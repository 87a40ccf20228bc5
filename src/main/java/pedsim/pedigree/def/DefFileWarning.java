package pedsim.pedigree.def;

/**
 * A non-fatal observation about a def file, such as a redundant no-print directive. Warnings are logged when found
 * and handed back with the compiled pedigrees.
 */
public class DefFileWarning {
    private final int lineNumber;
    private final String message;

    public DefFileWarning(final int lineNumber, final String message) {
        this.lineNumber = lineNumber;
        this.message = message;
    }

    /** The line the warning was raised on, or {@link DefFileException#NO_LINE} for whole-pedigree warnings. */
    public int getLineNumber() { return lineNumber; }

    public String getMessage() { return message; }

    @Override
    public String toString() {
        return lineNumber == DefFileException.NO_LINE ? message : "line " + lineNumber + " in def: " + message;
    }
}
