package com.medimind.intake.service;

import com.medimind.intake.exception.DocumentParseException;
import com.medimind.intake.model.NormalizedDocument;
import com.medimind.intake.parser.DocumentFormat;
import com.medimind.intake.parser.Hl7Normalizer;
import com.medimind.intake.parser.JsonNormalizer;
import com.medimind.intake.parser.PdfTextExtractor;
import com.medimind.intake.parser.TextDecoder;
import com.medimind.intake.parser.XmlNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentParserServiceImpl implements DocumentParserService {

    private final TextDecoder textDecoder;
    private final PdfTextExtractor pdfTextExtractor;
    private final Hl7Normalizer hl7Normalizer;
    private final JsonNormalizer jsonNormalizer;
    private final XmlNormalizer xmlNormalizer;

    @Override
    public String parse(String filename, byte[] content) {
        Optional<DocumentFormat> format = DocumentFormat.fromFilename(filename);

        if (format.filter(DocumentFormat.PDF::equals).isPresent()) {
            return pdfTextExtractor.extract(content);
        }

        Optional<String> decoded = textDecoder.decode(content);
        if (decoded.isEmpty()) {
            log.warn("File {} looks binary, skipping", filename);
            return "[Binary file - cannot parse: " + filename + "]";
        }
        String text = decoded.get();

        return format
            .map(f -> parseAs(f, text))
            .orElseGet(() -> sniff(filename, text));
    }

    @Override
    public NormalizedDocument normalize(String filename, byte[] content) {
        return new NormalizedDocument(filename, parse(filename, content));
    }

    @Override
    public SortedMap<String, String> parseAll(Map<String, byte[]> files) {
        SortedMap<String, String> parsed = new TreeMap<>();
        files.forEach((filename, content) -> {
            if (filename == null || filename.startsWith(".") || content == null) {
                return;
            }
            NormalizedDocument document = normalize(filename, content);
            if (document.text().isBlank()) {
                log.debug("File {} has no text, skipping", filename);
                return;
            }
            parsed.put(document.sourceFilename(), document.text());
        });
        log.info("Parsed {} of {} files", parsed.size(), files.size());
        return parsed;
    }

    private String parseAs(DocumentFormat format, String text) {
        return switch (format) {
            case HL7 -> hl7Normalizer.normalize(text);
            case JSON -> looksLikeJson(text) ? normalizeJson(text) : text;
            case XML -> normalizeXml(text);
            case TEXT, PDF -> text;
        };
    }

    private String sniff(String filename, String text) {
        String trimmed = text.strip();
        if (trimmed.startsWith("MSH|")) {
            log.debug("File {} detected as HL7 by content", filename);
            return hl7Normalizer.normalize(text);
        }
        if (jsonNormalizer.accepts(trimmed)) {
            log.debug("File {} detected as JSON by content", filename);
            return normalizeJson(text);
        }
        if (trimmed.startsWith("<")) {
            log.debug("File {} detected as XML by content", filename);
            return normalizeXml(text);
        }
        return text;
    }

    private String normalizeJson(String text) {
        try {
            return jsonNormalizer.normalize(text);
        } catch (DocumentParseException e) {
            log.debug("Keeping raw text: {}", e.getMessage());
            return text;
        }
    }

    private String normalizeXml(String text) {
        try {
            return xmlNormalizer.normalize(text);
        } catch (DocumentParseException e) {
            log.debug("Falling back to tag stripping: {}", e.getMessage());
            return xmlNormalizer.stripTags(text);
        }
    }

    private static boolean looksLikeJson(String text) {
        String trimmed = text.strip();
        return trimmed.startsWith("{") || trimmed.startsWith("[");
    }
}
