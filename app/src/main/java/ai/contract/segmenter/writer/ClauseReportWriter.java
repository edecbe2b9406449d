package ai.contract.segmenter.writer;

import ai.contract.segmenter.segment.Clause;
import java.util.List;

/**
 * Human-readable report: one block per clause, headed by its id, section heading and label.
 */
public class ClauseReportWriter implements ClauseWriter {

    static final String ABSENT = "None";
    static final String RULE = "-".repeat(50);

    @Override
    public String render(List<Clause> clauses) {
        StringBuilder builder = new StringBuilder();
        for (Clause clause : clauses) {
            builder.append("Clause ").append(clause.clauseId()).append('\n');
            builder.append("Section: ").append(clause.sectionHeading().orElse(ABSENT)).append('\n');
            builder.append("Label: ").append(clause.label().orElse(ABSENT)).append('\n');
            builder.append(RULE).append('\n');
            builder.append(clause.text()).append("\n\n");
        }
        return builder.toString();
    }

    @Override
    public String fileExtension() {
        return "txt";
    }
}
