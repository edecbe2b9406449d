package ai.contract.segmenter.segment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Folds short clauses into the preceding clause of the same section and renumbers the survivors.
 */
public class ClauseMerger {

    private final SegmenterConfig config;

    public ClauseMerger(SegmenterConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * A clause is absorbed when its trimmed text is shorter than the configured minimum and the previous surviving
     * clause belongs to the same section. The absorbing clause keeps its identity (section, local index, label);
     * only its text grows. Surviving clauses then get dense 1-based ids. With merging disabled the input is returned
     * untouched.
     */
    public List<Clause> merge(List<Clause> clauses) {
        Objects.requireNonNull(clauses, "clauses");
        if (!config.mergeShortClauses() || clauses.isEmpty()) {
            return clauses;
        }

        List<Clause> merged = new ArrayList<>(clauses.size());
        for (Clause candidate : clauses) {
            if (!merged.isEmpty() && isAbsorbable(candidate, merged.get(merged.size() - 1))) {
                Clause previous = merged.get(merged.size() - 1);
                String text = UnicodeWhitespace.stripTrailing(previous.text()) + "\n"
                        + UnicodeWhitespace.stripLeading(candidate.text());
                merged.set(merged.size() - 1, previous.withText(text));
            } else {
                merged.add(candidate);
            }
        }

        List<Clause> renumbered = new ArrayList<>(merged.size());
        for (int i = 0; i < merged.size(); i++) {
            renumbered.add(merged.get(i).withClauseId(i + 1));
        }
        return renumbered;
    }

    private boolean isAbsorbable(Clause candidate, Clause previous) {
        return UnicodeWhitespace.strip(candidate.text()).length() < config.minClauseLenChars()
                && candidate.sectionId() == previous.sectionId();
    }
}
