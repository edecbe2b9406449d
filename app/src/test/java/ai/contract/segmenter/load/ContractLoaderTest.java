package ai.contract.segmenter.load;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ContractLoaderTest {

    @TempDir
    Path tempDir;

    private final ContractLoader loader = new ContractLoader();

    @Test
    void readsTextFilesAsUtf8() throws Exception {
        Path contract = tempDir.resolve("contract.txt");
        Files.writeString(contract, "SECTION 1. TERM\nLa durée est d’un an.", StandardCharsets.UTF_8);

        assertThat(loader.load(contract)).isEqualTo("SECTION 1. TERM\nLa durée est d’un an.");
    }

    @Test
    void extensionMatchIsCaseInsensitive() throws Exception {
        Path contract = tempDir.resolve("CONTRACT.TXT");
        Files.writeString(contract, "body", StandardCharsets.UTF_8);

        assertThat(loader.load(contract)).isEqualTo("body");
    }

    @Test
    void joinsPdfPagesWithBlankLine() throws Exception {
        Path pdf = tempDir.resolve("contract.pdf");
        writePdf(pdf, List.of("SECTION 1. TERM", "SECTION 2. PAYMENT"));

        String text = loader.load(pdf);

        assertThat(text).contains("SECTION 1. TERM", "SECTION 2. PAYMENT", PdfTextExtractor.PAGE_SEPARATOR);
        assertThat(text.indexOf("SECTION 1. TERM")).isLessThan(text.indexOf("SECTION 2. PAYMENT"));
    }

    @Test
    void rejectsUnsupportedExtension() throws Exception {
        Path contract = tempDir.resolve("contract.docx");
        Files.writeString(contract, "ignored", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> loader.load(contract))
                .isInstanceOf(UnsupportedFileTypeException.class)
                .hasMessage("Unsupported file type: .docx. Use .txt or .pdf")
                .satisfies(ex -> assertThat(((UnsupportedFileTypeException) ex).extension()).isEqualTo(".docx"));
    }

    @Test
    void rejectsFileWithoutExtension() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("README")))
                .isInstanceOf(UnsupportedFileTypeException.class)
                .hasMessageContaining("<none>");
    }

    @Test
    void wrapsIoFailuresWithCause() {
        Path missing = tempDir.resolve("missing.txt");

        assertThatThrownBy(() -> loader.load(missing))
                .isInstanceOf(ContractLoadException.class)
                .isNotInstanceOf(UnsupportedFileTypeException.class)
                .hasMessageContaining("missing.txt")
                .hasCauseInstanceOf(java.nio.file.NoSuchFileException.class);
    }

    @Test
    void extensionOfHandlesDotFiles() {
        assertThat(ContractLoader.extensionOf(Path.of("dir", ".txt"))).isEmpty();
        assertThat(ContractLoader.extensionOf(Path.of("a.b.PDF"))).isEqualTo(".pdf");
    }

    private static void writePdf(Path target, List<String> pageTexts) throws Exception {
        try (PDDocument document = new PDDocument()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (String pageText : pageTexts) {
                PDPage page = new PDPage();
                document.addPage(page);
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    content.beginText();
                    content.setFont(font, 12);
                    content.newLineAtOffset(72, 700);
                    content.showText(pageText);
                    content.endText();
                }
            }
            document.save(target.toFile());
        }
    }
}
