package com.medimind.intake.patient;

import java.util.List;
import java.util.Locale;

/**
 * A normalized document split once into the views the demographic strategies read.
 */
record DocumentText(String text, String lower, List<String> lines) {

    static DocumentText of(String text) {
        String content = text == null ? "" : text;
        return new DocumentText(content, content.toLowerCase(Locale.ROOT), List.of(content.split("\\R", -1)));
    }

    List<String> head(int lineCount) {
        return lines.subList(0, Math.min(lineCount, lines.size()));
    }

    /**
     * The full line around {@code index} in {@link #text}.
     */
    String lineAround(int index) {
        int start = text.lastIndexOf('\n', Math.max(0, index - 1)) + 1;
        int end = text.indexOf('\n', index);
        return text.substring(start, end < 0 ? text.length() : end);
    }
}
