package ai.contract.segmenter.batch;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A document that could not be segmented, with the reason reported to the user.
 */
public record DocumentFailure(Path source, String message) {

    public DocumentFailure {
        Objects.requireNonNull(source, "source");
        message = message == null ? "" : message;
    }
}
