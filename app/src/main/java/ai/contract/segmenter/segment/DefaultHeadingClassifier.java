package ai.contract.segmenter.segment;

import java.util.regex.Pattern;

/**
 * Flags a line as a heading when any of three surface signals fires: a {@code Section}/{@code Article} keyword
 * followed by a numeral, a dotted decimal number followed by text, or a line written mostly in capitals.
 */
public class DefaultHeadingClassifier implements HeadingClassifier {

    // "SECTION 1. TERM", "Article II - Payment"
    private static final Pattern LEGAL_HEADING = Pattern.compile(
            "^(section|article)\\s+[0-9ivxlcdm]+[.\\-)]?\\s+.+",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);

    // "1.1 Scope", "2.3.4 Some Heading"
    private static final Pattern NUMBERED_HEADING = Pattern.compile("^\\d+(\\.\\d+)*\\s+.+",
            Pattern.UNICODE_CHARACTER_CLASS);

    static final int MIN_ALL_CAPS_LENGTH = 5;
    static final double MIN_UPPERCASE_RATIO = 0.8;

    @Override
    public boolean isHeading(String line) {
        if (line == null) {
            return false;
        }
        String trimmed = UnicodeWhitespace.strip(line);
        if (trimmed.isEmpty()) {
            return false;
        }
        return LEGAL_HEADING.matcher(trimmed).lookingAt()
                || NUMBERED_HEADING.matcher(trimmed).lookingAt()
                || looksLikeAllCapsHeading(trimmed);
    }

    static boolean looksLikeAllCapsHeading(String trimmed) {
        if (trimmed.codePointCount(0, trimmed.length()) < MIN_ALL_CAPS_LENGTH) {
            return false;
        }
        int letters = 0;
        int upper = 0;
        for (int i = 0; i < trimmed.length(); ) {
            int codePoint = trimmed.codePointAt(i);
            if (Character.isLetter(codePoint)) {
                letters++;
                if (Character.isUpperCase(codePoint)) {
                    upper++;
                }
            }
            i += Character.charCount(codePoint);
        }
        if (letters == 0) {
            return false;
        }
        return (double) upper / letters >= MIN_UPPERCASE_RATIO;
    }
}
