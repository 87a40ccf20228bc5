package pedsim.pedigree.def;

import org.apache.commons.lang3.StringUtils;
import pedsim.pedigree.Sex;

/**
 * Parses the branch specifications that follow the counts on a generation line. Each token is a branch list followed
 * by one of
 * <ul>
 *     <li>{@code :} and a parent specification {@code branch[_branch[^generation]]},</li>
 *     <li>{@code n} to print no samples from the branches,</li>
 *     <li>{@code s} and {@code M} or {@code F} to fix the sex of the branches' i1 individuals.</li>
 * </ul>
 */
public final class BranchSpecParser {
    private static final String DIRECTIVE_CHARS = ":ns";

    private BranchSpecParser() { }

    /**
     * @param generation 0-based index of the generation the token was given for
     */
    public static BranchDirective parse(final String token, final int generation, final int lineNumber) {
        final int split = StringUtils.indexOfAny(token, DIRECTIVE_CHARS);
        if (split < 0) {
            throw new DefFileException(DefFileErrorKind.MALFORMED_DIRECTIVE, lineNumber,
                    "improperly formatted parent assignment, sex assignment or no-print field " + token);
        }
        final String branchText = token.substring(0, split);
        final String rest = token.substring(split + 1);

        switch (token.charAt(split)) {
            case ':':
                return parseParentAssignment(branchText, rest, generation, lineNumber);
            case 'n':
                if (!rest.isEmpty()) {
                    throw new DefFileException(DefFileErrorKind.MALFORMED_DIRECTIVE, lineNumber,
                            "improperly formatted no-print field \"" + token + "\": no-print character 'n' should be " +
                                    "followed by white space");
                }
                return new BranchDirective.NoPrint(BranchList.parse(branchText, "set as no-print", lineNumber));
            default:
                if (!rest.equals(Sex.Male.toSymbol()) && !rest.equals(Sex.Female.toSymbol())) {
                    throw new DefFileException(DefFileErrorKind.MALFORMED_DIRECTIVE, lineNumber,
                            "improperly formatted sex assignment field \"" + token + "\": character 's' should be " +
                                    "followed either 'M' or 'F' and then white space");
                }
                return new BranchDirective.SexAssignment(
                        BranchList.parse(branchText, "assign sex " + rest + " to", lineNumber), Sex.fromDefSymbol(rest));
        }
    }

    private static BranchDirective parseParentAssignment(final String branchText, final String parentText,
                                                         final int generation, final int lineNumber) {
        if (generation == 0) {
            throw new DefFileException(DefFileErrorKind.MALFORMED_DIRECTIVE, lineNumber,
                    "first generation cannot have parent specifications");
        }

        final int underscore = parentText.indexOf('_');
        final String firstText = underscore < 0 ? parentText : parentText.substring(0, underscore);
        final String secondText = underscore < 0 ? null : parentText.substring(underscore + 1);

        ParentSpec first = null;
        ParentSpec second = null;
        if (firstText.isEmpty()) {
            if (secondText != null) {
                throw new DefFileException(DefFileErrorKind.MALFORMED_DIRECTIVE, lineNumber,
                        "parent assignment for branches " + branchText + " gives a second parent but no first parent");
            }
        } else {
            first = ParentSpec.parse(firstText, false, branchText, lineNumber);
            if (secondText != null) {
                if (secondText.isEmpty()) {
                    throw new DefFileException(DefFileErrorKind.MALFORMED_DIRECTIVE, lineNumber,
                            "parent assignment for branches " + branchText + " has no second parent after '_'");
                }
                second = ParentSpec.parse(secondText, true, branchText, lineNumber);
            }
        }

        final BranchList branches = BranchList.parse(branchText, "assign parent " + parentText + " to", lineNumber);
        return new BranchDirective.ParentAssignment(branches, first, second);
    }
}
