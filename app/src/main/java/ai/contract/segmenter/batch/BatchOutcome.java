package ai.contract.segmenter.batch;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Aggregate of segmentation results for a batch run, in input order.
 */
public record BatchOutcome(List<DocumentSegmentation> results,
                           List<DocumentFailure> failures) {

    public BatchOutcome {
        results = List.copyOf(Objects.requireNonNull(results, "results"));
        failures = List.copyOf(Objects.requireNonNull(failures, "failures"));
    }

    public int processedFiles() {
        return results.size();
    }

    public List<String> failedFiles() {
        if (failures.isEmpty()) {
            return List.of();
        }
        List<String> files = new ArrayList<>(failures.size());
        for (DocumentFailure failure : failures) {
            files.add(failure.source().toString());
        }
        return files;
    }
}
