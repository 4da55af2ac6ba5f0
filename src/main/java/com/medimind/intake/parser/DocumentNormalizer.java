package com.medimind.intake.parser;

/**
 * Renders one decoded text format as flat, labelled plain text.
 */
public interface DocumentNormalizer {

    /**
     * @throws com.medimind.intake.exception.DocumentParseException when the content is malformed
     */
    String normalize(String content);
}
