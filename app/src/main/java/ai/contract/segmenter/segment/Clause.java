package ai.contract.segmenter.segment;

import java.util.Objects;
import java.util.Optional;

/**
 * Finest segmentation unit: a labeled subclause or a whole unlabeled section body.
 *
 * <p>The owning section is referenced by id; {@code sectionHeading} is a copy taken when the clause was created.
 * {@code localIndex} is fixed at creation, while {@code clauseId} is reassigned by {@link ClauseMerger}.
 */
public record Clause(
        int clauseId,
        int sectionId,
        Optional<String> sectionHeading,
        int localIndex,
        Optional<String> label,
        String text
) {

    public Clause {
        sectionHeading = sectionHeading == null ? Optional.empty() : sectionHeading;
        label = label == null ? Optional.empty() : label;
        Objects.requireNonNull(text, "text");
    }

    public Clause withClauseId(int newClauseId) {
        return new Clause(newClauseId, sectionId, sectionHeading, localIndex, label, text);
    }

    public Clause withText(String newText) {
        return new Clause(clauseId, sectionId, sectionHeading, localIndex, label, newText);
    }
}
