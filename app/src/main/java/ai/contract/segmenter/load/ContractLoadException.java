package ai.contract.segmenter.load;

import java.nio.file.Path;

/**
 * Runtime exception raised when a contract document cannot be read.
 */
public class ContractLoadException extends RuntimeException {

    private final Path source;

    public ContractLoadException(Path source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public Path source() {
        return source;
    }
}
