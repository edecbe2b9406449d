package ai.contract.segmenter.segment;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TextPreprocessorTest {

    private final TextPreprocessor preprocessor = new TextPreprocessor();

    @Test
    void unifiesLineEndings() {
        assertThat(preprocessor.normalize("a\r\nb\rc\nd")).isEqualTo("a\nb\nc\nd");
    }

    @Test
    void collapsesSpacesAndTabsAndStripsTrailingWhitespace() {
        assertThat(preprocessor.normalize("The  \t quick\t\tfox   \nnext line\t ")).isEqualTo("The quick fox\nnext line");
    }

    @Test
    void keepsLeadingIndentAsSingleSpaceAndPreservesBlankLines() {
        assertThat(preprocessor.normalize("    (a) item\n\n\nend\n")).isEqualTo(" (a) item\n\n\nend\n");
    }

    @Test
    void returnsEmptyStringForMissingText() {
        assertThat(preprocessor.normalize(null)).isEmpty();
        assertThat(preprocessor.normalize("")).isEmpty();
    }

    @Test
    void stripsTrailingNoBreakSpacesButKeepsInnerOnes() {
        assertThat(preprocessor.normalize("(a)\u00a0Grant\u00a0 \n\u00a0\u2003\nend"))
                .isEqualTo("(a)\u00a0Grant\n\nend");
    }
}
