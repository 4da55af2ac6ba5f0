package com.medimind.intake.parser;

import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Decodes raw bytes as UTF-8, falling back to ISO-8859-1. Content dominated by
 * control characters is treated as binary.
 */
@Component
public class TextDecoder {

    private static final double MAX_CONTROL_RATIO = 0.3;

    public Optional<String> decode(byte[] bytes) {
        String text = decodeUtf8(bytes).orElseGet(() -> new String(bytes, StandardCharsets.ISO_8859_1));
        return isBinary(text) ? Optional.empty() : Optional.of(text);
    }

    private static Optional<String> decodeUtf8(byte[] bytes) {
        try {
            return Optional.of(StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString());
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }

    static boolean isBinary(String text) {
        if (text.isEmpty()) {
            return false;
        }
        long control = text.chars()
            .filter(c -> Character.isISOControl(c) && c != '\n' && c != '\r' && c != '\t' && c != '\f')
            .count();
        return control > text.length() * MAX_CONTROL_RATIO;
    }
}
