package com.medimind.intake.service;

import com.medimind.intake.model.NormalizedDocument;

import java.util.Map;
import java.util.SortedMap;

public interface DocumentParserService {

    /**
     * Detects the format of one file and renders it as plain text. Never throws:
     * unparseable content comes back raw or as a bracketed placeholder.
     */
    String parse(String filename, byte[] content);

    NormalizedDocument normalize(String filename, byte[] content);

    /**
     * Parses a whole corpus. Hidden files and files without any text are left out,
     * and the result is ordered by filename.
     */
    SortedMap<String, String> parseAll(Map<String, byte[]> files);
}
