package ai.contract.segmenter.segment;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes subclause markers at the start of a line, such as {@code (a) }, {@code (iv) } or {@code 2) }.
 *
 * <p>The parenthesized form is always tried before the suffix form. The two patterns cannot match the same line
 * start, so the order only fixes which one is reported first.
 */
public class SubclauseLabelParser {

    // "(a) Text", "(1) Text", "(iv) Text"
    private static final Pattern PARENTHESIZED = Pattern.compile("^\\s*\\(([a-zA-Z0-9ivxlcdm]+)\\)\\s+",
            Pattern.UNICODE_CHARACTER_CLASS);

    // "a) Text", "1) Text"
    private static final Pattern SUFFIX = Pattern.compile("^\\s*([a-zA-Z0-9ivxlcdm]+)\\)\\s+",
            Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Returns the normalized label, {@code (token)} or {@code token)}, or empty when the line carries no marker.
     */
    public Optional<String> parseLabel(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher parenthesized = PARENTHESIZED.matcher(line);
        if (parenthesized.lookingAt()) {
            return Optional.of("(" + parenthesized.group(1) + ")");
        }
        Matcher suffix = SUFFIX.matcher(line);
        if (suffix.lookingAt()) {
            return Optional.of(suffix.group(1) + ")");
        }
        return Optional.empty();
    }

    /**
     * Removes one leading marker, if any, and left-trims what remains.
     */
    public String stripLabel(String line) {
        if (line == null) {
            return "";
        }
        Matcher parenthesized = PARENTHESIZED.matcher(line);
        if (parenthesized.lookingAt()) {
            return UnicodeWhitespace.stripLeading(line.substring(parenthesized.end()));
        }
        Matcher suffix = SUFFIX.matcher(line);
        if (suffix.lookingAt()) {
            return UnicodeWhitespace.stripLeading(line.substring(suffix.end()));
        }
        return UnicodeWhitespace.stripLeading(line);
    }
}
