package pedsim.pedigree.def;

import org.apache.commons.lang3.StringUtils;

import java.util.regex.Pattern;

/**
 * Splits def file lines into tokens. Tokens are separated by runs of whitespace; a line that is blank or whose first
 * token starts with '#' carries no tokens at all.
 */
public final class DefLineTokenizer {
    static final Pattern WHITESPACE = Pattern.compile("\\s+");
    static final String COMMENT_PREFIX = "#";

    private static final String[] NO_TOKENS = new String[0];

    private DefLineTokenizer() { }

    /**
     * @return the tokens of the line, or an empty array if the line should be skipped
     */
    public static String[] tokenize(final String line) {
        final String trimmed = StringUtils.strip(line);
        if (StringUtils.isEmpty(trimmed) || trimmed.startsWith(COMMENT_PREFIX)) return NO_TOKENS;
        return WHITESPACE.split(trimmed);
    }
}
