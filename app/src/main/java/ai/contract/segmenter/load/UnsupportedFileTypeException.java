package ai.contract.segmenter.load;

import java.nio.file.Path;

/**
 * Signals an input whose extension is neither {@code .txt} nor {@code .pdf}.
 */
public class UnsupportedFileTypeException extends ContractLoadException {

    private final String extension;

    public UnsupportedFileTypeException(Path source, String extension) {
        super(source, "Unsupported file type: " + (extension.isEmpty() ? "<none>" : extension) + ". Use .txt or .pdf",
                null);
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }
}
