package com.medimind.intake.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Positional access to pipe-delimited HL7 v2 segments.
 */
public final class Hl7Segments {

    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("\\r\\n|\\r|\\n");
    private static final Pattern FIELD_SEPARATOR = Pattern.compile("\\|");

    private Hl7Segments() {
    }

    public static List<String> lines(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        return List.of(SEGMENT_SEPARATOR.split(content));
    }

    /**
     * Splits every non-blank line on {@code |}, keeping trailing empty fields.
     */
    public static List<String[]> segments(String content) {
        List<String[]> segments = new ArrayList<>();
        for (String line : lines(content)) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty()) {
                segments.add(FIELD_SEPARATOR.split(trimmed, -1));
            }
        }
        return segments;
    }

    /**
     * Segments of the given type found anywhere in the text, including raw segments embedded in prose.
     */
    public static List<String[]> segmentsOfType(String content, String type) {
        String prefix = type + "|";
        List<String[]> matching = new ArrayList<>();
        for (String line : lines(content)) {
            String trimmed = line.strip();
            if (trimmed.startsWith(prefix)) {
                matching.add(FIELD_SEPARATOR.split(trimmed, -1));
            }
        }
        return matching;
    }

    public static String field(String[] fields, int index) {
        return index < fields.length ? fields[index].strip() : "";
    }

    /**
     * Display text of a coded element: {@code 2345-7^Glucose^LN} gives {@code Glucose},
     * a plain value is returned as is.
     */
    public static String codedText(String field) {
        if (field == null || field.isBlank()) {
            return "";
        }
        String[] components = field.split("\\^", -1);
        if (components.length > 1 && !components[1].isBlank()) {
            return components[1].strip();
        }
        return components[0].strip();
    }
}
