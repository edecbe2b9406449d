package ai.contract.segmenter.segment;

import java.util.List;
import java.util.Objects;

/**
 * Sections and final clauses produced for one document.
 */
public record SegmentationResult(List<Section> sections, List<Clause> clauses) {

    public SegmentationResult {
        sections = List.copyOf(Objects.requireNonNull(sections, "sections"));
        clauses = List.copyOf(Objects.requireNonNull(clauses, "clauses"));
    }

    public boolean isEmpty() {
        return clauses.isEmpty();
    }
}
