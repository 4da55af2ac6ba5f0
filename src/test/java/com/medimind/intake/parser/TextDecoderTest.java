package com.medimind.intake.parser;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class TextDecoderTest {

    private final TextDecoder decoder = new TextDecoder();

    @Test
    void shouldDecodeUtf8() {
        assertThat(decoder.decode("Größe: 180 cm".getBytes(StandardCharsets.UTF_8))).contains("Größe: 180 cm");
    }

    @Test
    void shouldFallBackToLatin1ForInvalidUtf8() {
        byte[] latin1 = "café au lait".getBytes(StandardCharsets.ISO_8859_1);

        assertThat(decoder.decode(latin1)).contains("café au lait");
    }

    @Test
    void shouldTreatControlHeavyContentAsBinary() {
        byte[] bytes = {0x00, 0x01, 0x02, 0x03, 'a', 0x04, 0x05, 0x06, 'b', 0x07};

        assertThat(decoder.decode(bytes)).isEmpty();
    }

    @Test
    void shouldNotCountLineBreaksAndTabsAsControl() {
        assertThat(decoder.decode("a\n\n\n\t\t\r\f".getBytes(StandardCharsets.UTF_8))).isPresent();
    }
}
