package ai.contract.segmenter.segment;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Normalizes raw contract text into a canonical newline-separated line sequence.
 */
public class TextPreprocessor {

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t]+");

    /**
     * Unifies line endings to {@code \n}, collapses runs of spaces and tabs into one space and strips trailing
     * whitespace, Unicode spaces included, from every line. The number of lines is preserved.
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String unified = text.replace("\r\n", "\n").replace('\r', '\n');
        String collapsed = HORIZONTAL_WHITESPACE.matcher(unified).replaceAll(" ");
        return Arrays.stream(collapsed.split("\n", -1))
                .map(UnicodeWhitespace::stripTrailing)
                .collect(Collectors.joining("\n"));
    }
}
