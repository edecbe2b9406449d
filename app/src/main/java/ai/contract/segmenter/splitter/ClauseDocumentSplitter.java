package ai.contract.segmenter.splitter;

import ai.contract.segmenter.segment.Clause;
import ai.contract.segmenter.segment.ContractSegmenter;
import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentSplitter;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link DocumentSplitter} producing one {@link TextSegment} per contract clause, so that clauses can be embedded
 * and retrieved individually.
 *
 * <p>Every segment carries a copy of the document metadata plus the clause coordinates.
 */
public class ClauseDocumentSplitter implements DocumentSplitter {

    public static final String CLAUSE_ID = "clause_id";
    public static final String SECTION_ID = "section_id";
    public static final String SECTION_HEADING = "section_heading";
    public static final String LOCAL_INDEX = "local_index";
    public static final String LABEL = "label";

    private final ContractSegmenter segmenter;

    public ClauseDocumentSplitter() {
        this(new ContractSegmenter());
    }

    public ClauseDocumentSplitter(ContractSegmenter segmenter) {
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
    }

    @Override
    public List<TextSegment> split(Document document) {
        Objects.requireNonNull(document, "document");
        List<Clause> clauses = segmenter.segmentClauses(document.text());
        List<TextSegment> segments = new ArrayList<>(clauses.size());
        for (Clause clause : clauses) {
            Metadata metadata = document.metadata().copy();
            metadata.put(CLAUSE_ID, clause.clauseId());
            metadata.put(SECTION_ID, clause.sectionId());
            metadata.put(LOCAL_INDEX, clause.localIndex());
            clause.sectionHeading().ifPresent(heading -> metadata.put(SECTION_HEADING, heading));
            clause.label().ifPresent(label -> metadata.put(LABEL, label));
            segments.add(TextSegment.from(clause.text(), metadata));
        }
        return segments;
    }
}
