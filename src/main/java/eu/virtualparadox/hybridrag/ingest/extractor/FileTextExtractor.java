package eu.virtualparadox.hybridrag.ingest.extractor;

import eu.virtualparadox.hybridrag.ingest.model.EFileType;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts text from PDF, Markdown and plain-text files.
 * <ul>
 *   <li><b>PDF</b> (Apache PDFBox): each non-blank page becomes {@code "[Page N]\n<text>"},
 *       pages are joined by a blank line. The page markers are stripped again at chunking time.</li>
 *   <li><b>Markdown</b>: raw UTF-8 content, markup included.</li>
 *   <li><b>Text</b>: raw UTF-8 content.</li>
 * </ul>
 */
@Slf4j
@Service
public final class FileTextExtractor implements TextExtractor {

    static final String PAGE_SEPARATOR = "\n\n";

    @Override
    public String extractText(final Path path, final EFileType fileType) throws IOException {
        final String text = switch (fileType) {
            case PDF -> extractPdf(path);
            case MD, TXT -> Files.readString(path, StandardCharsets.UTF_8);
        };

        if (text.isBlank()) {
            throw new IllegalStateException("No text could be extracted from " + path.getFileName());
        }
        log.info("Extracted {} characters from {}", text.length(), path.getFileName());
        return text;
    }

    private String extractPdf(final Path path) throws IOException {
        try (PDDocument pdf = PDDocument.load(path.toFile())) {
            final int pageCount = pdf.getNumberOfPages();
            final PDFTextStripper stripper = new PDFTextStripper();

            final List<String> pages = new ArrayList<>(pageCount);
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);

                final String pageText = Normalizer.normalize(stripper.getText(pdf), Normalizer.Form.NFC).trim();
                if (!pageText.isEmpty()) {
                    pages.add("[Page " + page + "]\n" + pageText);
                }
            }

            log.debug("PDF {} has {} pages, {} with text", path.getFileName(), pageCount, pages.size());
            return String.join(PAGE_SEPARATOR, pages);
        }
    }
}
