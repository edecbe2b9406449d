package ai.contract.segmenter.load;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts plain text from a PDF page by page with PDFBox.
 */
public class PdfTextExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfTextExtractor.class);

    static final String PAGE_SEPARATOR = "\n\n";

    /**
     * Returns the text of every page, in order, joined by a blank line. Pages without extractable text contribute
     * an empty string.
     */
    public String extract(Path pdf) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
            int totalPages = document.getNumberOfPages();
            LOGGER.debug("Extracting text from {} pages of {}", totalPages, pdf.getFileName());

            PDFTextStripper stripper = new PDFTextStripper();
            List<String> pages = new ArrayList<>(totalPages);
            for (int page = 1; page <= totalPages; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                pages.add(stripper.getText(document));
            }
            return String.join(PAGE_SEPARATOR, pages);
        }
    }
}
