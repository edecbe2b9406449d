package ai.contract.segmenter.load;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads contract text from {@code .txt} (UTF-8) or {@code .pdf} files.
 */
public class ContractLoader {

    private final PdfTextExtractor pdfTextExtractor;

    public ContractLoader() {
        this(new PdfTextExtractor());
    }

    public ContractLoader(PdfTextExtractor pdfTextExtractor) {
        this.pdfTextExtractor = Objects.requireNonNull(pdfTextExtractor, "pdfTextExtractor");
    }

    public String load(Path source) {
        Objects.requireNonNull(source, "source");
        String extension = extensionOf(source);
        try {
            return switch (extension) {
                case ".txt" -> Files.readString(source, StandardCharsets.UTF_8);
                case ".pdf" -> pdfTextExtractor.extract(source);
                default -> throw new UnsupportedFileTypeException(source, extension);
            };
        } catch (IOException ex) {
            throw new ContractLoadException(source, "Failed to read " + source + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Lower-cased extension including the dot, or an empty string when the file name has none.
     */
    static String extensionOf(Path source) {
        Path fileName = source.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }
}
