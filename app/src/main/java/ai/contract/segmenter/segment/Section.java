package ai.contract.segmenter.segment;

import java.util.Objects;
import java.util.Optional;

/**
 * Top-level contract division, starting at a detected heading line.
 */
public record Section(int sectionId, Optional<String> heading, String text) {

    public Section {
        if (sectionId < 1) {
            throw new IllegalArgumentException("sectionId must be 1 or greater");
        }
        heading = heading == null ? Optional.empty() : heading;
        Objects.requireNonNull(text, "text");
    }
}
