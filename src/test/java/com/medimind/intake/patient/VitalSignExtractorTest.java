package com.medimind.intake.patient;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class VitalSignExtractorTest {

    private final VitalSignExtractor extractor = new VitalSignExtractor();

    @Test
    void shouldReadAllLabelledVitals() {
        String text = """
            Vitals
            BP: 120/80
            Heart Rate: 72
            Temp: 98.6
            RR: 16
            SpO2: 98
            """;

        Map<String, String> vitals = extractor.extract(text);

        assertThat(vitals).containsExactly(
            Map.entry(VitalSignExtractor.BLOOD_PRESSURE, "120/80"),
            Map.entry(VitalSignExtractor.HEART_RATE, "72"),
            Map.entry(VitalSignExtractor.TEMPERATURE, "98.6"),
            Map.entry(VitalSignExtractor.RESPIRATORY_RATE, "16"),
            Map.entry(VitalSignExtractor.OXYGEN_SATURATION, "98"));
    }

    @Test
    void shouldSkipMatchesOnLabLines() {
        assertThat(extractor.extract("Pulse 72 (reference 60-100)")).isEmpty();
    }

    @Test
    void shouldDropImplausibleValues() {
        assertThat(extractor.extract("BP: 80/120\nHeart rate: 250\nTemperature: 45")).isEmpty();
    }

    @Test
    void shouldKeepFirstPlausibleReading() {
        assertThat(extractor.extract("HR: 300\nHR: 88")).containsEntry(VitalSignExtractor.HEART_RATE, "88");
    }
}
