package ai.contract.segmenter.segment;

/**
 * Trimming and blank checks that also treat Unicode space separators such as U+00A0 as whitespace.
 * {@link String#strip()} and {@link String#isBlank()} do not.
 */
final class UnicodeWhitespace {

    private UnicodeWhitespace() {
    }

    static boolean isWhitespace(int codePoint) {
        return Character.isWhitespace(codePoint) || Character.isSpaceChar(codePoint);
    }

    static boolean isBlank(String value) {
        return value.codePoints().allMatch(UnicodeWhitespace::isWhitespace);
    }

    static String strip(String value) {
        return stripTrailing(stripLeading(value));
    }

    static String stripLeading(String value) {
        int start = 0;
        while (start < value.length()) {
            int codePoint = value.codePointAt(start);
            if (!isWhitespace(codePoint)) {
                break;
            }
            start += Character.charCount(codePoint);
        }
        return value.substring(start);
    }

    static String stripTrailing(String value) {
        int end = value.length();
        while (end > 0) {
            int codePoint = value.codePointBefore(end);
            if (!isWhitespace(codePoint)) {
                break;
            }
            end -= Character.charCount(codePoint);
        }
        return value.substring(0, end);
    }
}
