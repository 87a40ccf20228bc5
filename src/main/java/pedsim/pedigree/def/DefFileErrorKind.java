package pedsim.pedigree.def;

/**
 * The kinds of fatal errors that can be found while compiling a def file. Every kind has its own exit status so
 * that callers that report through a process exit code can still tell the errors apart, and belongs to one
 * broader {@link Category}.
 */
public enum DefFileErrorKind {
    /** Wrong number of fields on a line, or a generation line before any pedigree definition. */
    MALFORMED_LINE(Category.SYNTAX, 2),
    /** A count, generation or branch number that is not an integer. */
    MALFORMED_NUMBER(Category.SYNTAX, 3),
    /** A branch specification or sex field that does not follow the directive grammar. */
    MALFORMED_DIRECTIVE(Category.SYNTAX, 4),
    /** A branch range such as "2-" that has no end. */
    UNTERMINATED_RANGE(Category.SYNTAX, 5),
    /** A generation or branch number outside the bounds of its pedigree or generation. */
    OUT_OF_RANGE(Category.RANGE, 6),
    /** Generations listed out of order, or a branch range whose end is not after its start. */
    NON_INCREASING(Category.RANGE, 7),
    /** A replicate, generation, branch or print count that is not allowed. */
    INVALID_COUNT(Category.RANGE, 8),
    /** Two pedigrees with the same name. */
    DUPLICATE_NAME(Category.STRUCTURAL, 9),
    /** Parents or sex of one branch given more than once, or one generation listed twice. */
    DUPLICATE_ASSIGNMENT(Category.DUPLICATE_ASSIGNMENT, 10),
    /** Sex assignments and marriages that cannot all hold at once. */
    SEX_CONFLICT(Category.SEX_CONFLICT, 11),
    /** A pedigree whose last generation prints no samples. */
    NO_PRINTABLE_OUTPUT(Category.STRUCTURAL, 12),
    /** A def file without any pedigree definition. */
    EMPTY_FILE(Category.STRUCTURAL, 13),
    /** The def file could not be read. */
    IO_ERROR(Category.RESOURCE, 14);

    public enum Category {
        SYNTAX, RANGE, DUPLICATE_ASSIGNMENT, SEX_CONFLICT, RESOURCE, STRUCTURAL
    }

    private final Category category;
    private final int exitStatus;

    DefFileErrorKind(final Category category, final int exitStatus) {
        this.category = category;
        this.exitStatus = exitStatus;
    }

    public Category getCategory() { return category; }

    /** The non-zero process exit status used to report this kind of error. */
    public int exitStatus() { return exitStatus; }
}
