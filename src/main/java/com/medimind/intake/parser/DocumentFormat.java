package com.medimind.intake.parser;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum DocumentFormat {
    PDF(Set.of(".pdf")),
    HL7(Set.of(".hl7", ".hl7v2", ".hl7v3")),
    JSON(Set.of(".json", ".ehr", ".fhir")),
    XML(Set.of(".xml", ".ccda", ".cda")),
    TEXT(Set.of(".txt", ".text"));

    private final Set<String> extensions;

    DocumentFormat(Set<String> extensions) {
        this.extensions = extensions;
    }

    /**
     * Resolves the format from the file extension. Empty when the extension is unknown
     * and the content has to be sniffed.
     */
    public static Optional<DocumentFormat> fromFilename(String filename) {
        if (filename == null) {
            return Optional.empty();
        }
        int dot = filename.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        String ext = filename.substring(dot).toLowerCase(Locale.ROOT);
        for (DocumentFormat format : values()) {
            if (format.extensions.contains(ext)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
