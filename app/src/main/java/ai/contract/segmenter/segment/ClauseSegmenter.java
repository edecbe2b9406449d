package ai.contract.segmenter.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Splits each section body into clauses at subclause markers.
 *
 * <p>Text preceding the first marker of a section becomes an unlabeled clause; a section without markers yields one
 * unlabeled clause. Clause ids are provisional but dense over the whole document.
 */
public class ClauseSegmenter {

    private final SubclauseLabelParser labelParser;

    public ClauseSegmenter(SubclauseLabelParser labelParser) {
        this.labelParser = Objects.requireNonNull(labelParser, "labelParser");
    }

    public List<Clause> segment(List<Section> sections) {
        Objects.requireNonNull(sections, "sections");
        List<Clause> clauses = new ArrayList<>();
        IdSequence clauseIds = new IdSequence();

        for (Section section : sections) {
            ClauseAccumulator accumulator = new ClauseAccumulator(section, clauseIds);
            for (String line : section.text().split("\n", -1)) {
                Optional<String> label = labelParser.parseLabel(line);
                if (label.isPresent()) {
                    accumulator.flush().ifPresent(clauses::add);
                    accumulator.startClause(label.get(), labelParser.stripLabel(line));
                } else {
                    accumulator.collect(line);
                }
            }
            accumulator.flush().ifPresent(clauses::add);
        }
        return clauses;
    }

    /**
     * Per-section state: alternates between collecting lines and flushing them as a clause.
     */
    static final class ClauseAccumulator {

        private final Section section;
        private final IdSequence clauseIds;
        private final List<String> lines = new ArrayList<>();
        private int localIndex;
        private String label;

        ClauseAccumulator(Section section, IdSequence clauseIds) {
            this.section = section;
            this.clauseIds = clauseIds;
        }

        void collect(String line) {
            if (!UnicodeWhitespace.isBlank(line) || !lines.isEmpty()) {
                lines.add(line);
            }
        }

        void startClause(String newLabel, String strippedLine) {
            label = newLabel;
            if (!strippedLine.isEmpty()) {
                lines.add(strippedLine);
            }
        }

        /**
         * Emits the collected text as a clause when it is not blank. Buffer and label are reset either way.
         */
        Optional<Clause> flush() {
            String text = UnicodeWhitespace.strip(String.join("\n", lines));
            Optional<String> currentLabel = Optional.ofNullable(label);
            lines.clear();
            label = null;
            if (text.isEmpty()) {
                return Optional.empty();
            }
            localIndex++;
            return Optional.of(new Clause(clauseIds.next(), section.sectionId(), section.heading(),
                    localIndex, currentLabel, text));
        }
    }
}
