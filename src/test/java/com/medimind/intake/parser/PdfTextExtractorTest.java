package com.medimind.intake.parser;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class PdfTextExtractorTest {

    private final PdfTextExtractor extractor = new PdfTextExtractor();

    @Test
    void shouldLabelEachPageAndSeparateThem() throws IOException {
        byte[] pdf = buildPdf("Patient Name: Jane Doe", "Glucose 95 mg/dL 70-100");

        String text = extractor.extract(pdf);

        assertThat(text).startsWith("[Page 1]\nPatient Name: Jane Doe");
        assertThat(text).contains(PdfTextExtractor.PAGE_SEPARATOR + "[Page 2]\nGlucose 95 mg/dL 70-100");
    }

    @Test
    void shouldSkipBlankPages() throws IOException {
        byte[] pdf = buildPdf("First page", null, "Third page");

        String text = extractor.extract(pdf);

        assertThat(text).contains("[Page 1]", "[Page 3]").doesNotContain("[Page 2]");
    }

    @Test
    void shouldReportDocumentWithoutText() throws IOException {
        assertThat(extractor.extract(buildPdf((String) null))).isEqualTo(PdfTextExtractor.NO_TEXT);
    }

    @Test
    void shouldNotThrowOnCorruptFile() {
        String text = extractor.extract("definitely not a pdf".getBytes(StandardCharsets.US_ASCII));

        assertThat(text).startsWith("[Error parsing PDF:");
    }

    private static byte[] buildPdf(String... pageTexts) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            for (String text : pageTexts) {
                PDPage page = new PDPage();
                doc.addPage(page);
                if (text == null) {
                    continue;
                }
                try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                    cs.beginText();
                    cs.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                    cs.newLineAtOffset(50, 700);
                    cs.showText(text);
                    cs.endText();
                }
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            return out.toByteArray();
        }
    }
}
