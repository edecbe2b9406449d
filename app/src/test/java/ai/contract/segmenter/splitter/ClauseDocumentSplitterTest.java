package ai.contract.segmenter.splitter;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import java.util.List;
import org.junit.jupiter.api.Test;

class ClauseDocumentSplitterTest {

    @Test
    void producesOneSegmentPerClauseWithCoordinates() {
        Metadata metadata = new Metadata();
        metadata.put("filename", "nda.txt");
        Document document = Document.from("SECTION 1. TERM\n"
                + "(a) The term of this agreement is two years from signature.\n"
                + "(b) Either party may terminate with ninety days written notice.\n"
                + "SECTION 2. PAYMENT\n"
                + "Pay on time.", metadata);

        List<TextSegment> segments = new ClauseDocumentSplitter().split(document);

        assertThat(segments).extracting(TextSegment::text).containsExactly(
                "The term of this agreement is two years from signature.",
                "Either party may terminate with ninety days written notice.",
                "Pay on time.");

        Metadata first = segments.get(0).metadata();
        assertThat(first.getString("filename")).isEqualTo("nda.txt");
        assertThat(first.getInteger(ClauseDocumentSplitter.CLAUSE_ID)).isEqualTo(1);
        assertThat(first.getInteger(ClauseDocumentSplitter.SECTION_ID)).isEqualTo(1);
        assertThat(first.getInteger(ClauseDocumentSplitter.LOCAL_INDEX)).isEqualTo(1);
        assertThat(first.getString(ClauseDocumentSplitter.SECTION_HEADING)).isEqualTo("SECTION 1. TERM");
        assertThat(first.getString(ClauseDocumentSplitter.LABEL)).isEqualTo("(a)");

        Metadata last = segments.get(2).metadata();
        assertThat(last.getInteger(ClauseDocumentSplitter.CLAUSE_ID)).isEqualTo(3);
        assertThat(last.getInteger(ClauseDocumentSplitter.SECTION_ID)).isEqualTo(2);
        assertThat(last.containsKey(ClauseDocumentSplitter.LABEL)).isFalse();
    }

    @Test
    void doesNotShareMetadataBetweenSegments() {
        Document document = Document.from("1.1 Scope\nFirst clause text that is long enough.\n"
                + "1.2 Fees\nSecond clause text that is long enough.");

        List<TextSegment> segments = new ClauseDocumentSplitter().split(document);

        assertThat(segments).hasSize(2);
        assertThat(segments.get(0).metadata().getString(ClauseDocumentSplitter.SECTION_HEADING)).isEqualTo("1.1 Scope");
        assertThat(segments.get(1).metadata().getString(ClauseDocumentSplitter.SECTION_HEADING)).isEqualTo("1.2 Fees");
        assertThat(document.metadata().containsKey(ClauseDocumentSplitter.CLAUSE_ID)).isFalse();
    }
}
