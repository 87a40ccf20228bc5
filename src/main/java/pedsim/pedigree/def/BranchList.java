package pedsim.pedigree.def;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The branches a directive applies to, written as a comma-separated list of 1-based branch numbers and increasing
 * ranges, e.g. {@code 1,3-5}. Stored as 0-based ranges in the order written; ranges are not expanded here, so their
 * ends can be checked against a generation's branch count first.
 */
public class BranchList {
    private final String text;
    private final List<Range> ranges;

    private BranchList(final String text, final List<Range> ranges) {
        this.text = text;
        this.ranges = Collections.unmodifiableList(ranges);
    }

    /**
     * @param what describes the directive for error messages, e.g. "set as no-print"
     */
    public static BranchList parse(final String text, final String what, final int lineNumber) {
        final List<Range> ranges = new ArrayList<>();
        for (final String element : text.split(",", -1)) {
            final int dash = element.indexOf('-');
            if (dash < 0) {
                final int branch = parseBranch(element, what, lineNumber);
                ranges.add(new Range(branch, branch));
                continue;
            }

            final String start = element.substring(0, dash);
            final String end = element.substring(dash + 1);
            if (end.indexOf('-') >= 0) {
                throw new DefFileException(DefFileErrorKind.MALFORMED_DIRECTIVE, lineNumber,
                        "improperly formatted branch range \"" + element + "\"");
            }
            if (end.isEmpty()) {
                throw new DefFileException(DefFileErrorKind.UNTERMINATED_RANGE, lineNumber,
                        "range of branches \"" + element + "\" to " + what + " does not terminate");
            }
            final int rangeStart = parseBranch(start, what, lineNumber);
            final int rangeEnd = parseBranch(end, what, lineNumber);
            if (rangeStart >= rangeEnd) {
                throw new DefFileException(DefFileErrorKind.NON_INCREASING, lineNumber,
                        "non-increasing branch range " + element + " to " + what);
            }
            ranges.add(new Range(rangeStart, rangeEnd));
        }
        return new BranchList(text, ranges);
    }

    private static int parseBranch(final String number, final String what, final int lineNumber) {
        final int branch;
        try {
            branch = Integer.parseInt(number);
        } catch (final NumberFormatException e) {
            throw new DefFileException(DefFileErrorKind.MALFORMED_NUMBER, lineNumber,
                    "unable to parse branch \"" + number + "\" to " + what, e);
        }
        if (branch < 1) {
            throw new DefFileException(DefFileErrorKind.OUT_OF_RANGE, lineNumber,
                    "branch numbers must be positive, got " + branch + " to " + what);
        }
        return branch - 1;
    }

    /** The listed ranges; a single branch number is a range with equal ends. */
    public List<Range> getRanges() { return ranges; }

    @Override
    public String toString() { return text; }

    /** An inclusive range of 0-based branch indexes. */
    public static final class Range {
        private final int start;
        private final int end;

        Range(final int start, final int end) {
            this.start = start;
            this.end = end;
        }

        public int getStart() { return start; }

        public int getEnd() { return end; }

        @Override
        public String toString() {
            return start == end ? String.valueOf(start + 1) : (start + 1) + "-" + (end + 1);
        }
    }
}
