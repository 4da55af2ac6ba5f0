package com.medimind.intake.parser;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts PDF text page by page. Failures become bracketed placeholders in the output
 * so that a broken page or file never aborts the pipeline.
 */
@Slf4j
@Component
public class PdfTextExtractor {

    static final String PAGE_SEPARATOR = "\n\n---\n\n";
    static final String NO_TEXT = "[PDF file contains no extractable text]";

    public String extract(byte[] bytes) {
        try (PDDocument document = Loader.loadPDF(bytes)) {
            PDFTextStripper stripper = new PDFTextStripper();
            int pageCount = document.getNumberOfPages();
            List<String> pages = new ArrayList<>();

            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                try {
                    String text = stripper.getText(document);
                    if (text != null && !text.isBlank()) {
                        pages.add("[Page " + page + "]\n" + text.strip());
                    }
                } catch (IOException | RuntimeException e) {
                    log.warn("Could not extract text from PDF page {}: {}", page, e.getMessage());
                    pages.add("[Page " + page + " - Could not extract text]");
                }
            }

            log.debug("Extracted {} of {} PDF pages", pages.size(), pageCount);
            return pages.isEmpty() ? NO_TEXT : String.join(PAGE_SEPARATOR, pages);
        } catch (IOException e) {
            log.warn("Unreadable PDF: {}", e.getMessage());
            return "[Error parsing PDF: " + e.getMessage() + "]";
        }
    }
}
