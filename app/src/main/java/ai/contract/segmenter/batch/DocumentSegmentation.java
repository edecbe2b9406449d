package ai.contract.segmenter.batch;

import ai.contract.segmenter.segment.SegmentationResult;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Segmentation result for a single source document.
 */
public record DocumentSegmentation(Path source, SegmentationResult result) {

    public DocumentSegmentation {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(result, "result");
    }
}
