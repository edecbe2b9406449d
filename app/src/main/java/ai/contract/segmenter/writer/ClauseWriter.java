package ai.contract.segmenter.writer;

import ai.contract.segmenter.segment.Clause;
import java.util.List;

/**
 * Renders the clauses of one document into a serialized form.
 */
public interface ClauseWriter {

    String render(List<Clause> clauses);

    /**
     * File extension, without the dot, used for files produced by this writer.
     */
    String fileExtension();
}
