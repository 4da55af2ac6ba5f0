package com.medimind.intake.patient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.medimind.intake.config.FallbackProperties;
import com.medimind.intake.exception.FallbackServiceException;
import com.medimind.intake.infra.CompletionClient;
import com.medimind.intake.model.Gender;
import com.medimind.intake.model.PatientRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DemographicsFallbackTest {

    @Mock
    private CompletionClient completionClient;

    private DemographicsFallback fallback;

    @BeforeEach
    void setUp() {
        fallback = new DemographicsFallback(Optional.of(completionClient), properties(true), new ObjectMapper());
    }

    @Nested
    @DisplayName("When the fallback is consulted")
    class Consulted {

        @Test
        @DisplayName("Should fill identity from a fenced JSON answer")
        void shouldFillIdentityFromFencedAnswer() {
            when(completionClient.complete(anyString())).thenReturn("""
                ```json
                {"name": "Jane Roe", "age": 40, "gender": "F", "date_of_birth": "1984-02-29"}
                ```
                """);

            PatientRecord record = fallback.fillMissing(PatientRecord.empty(), "scanned note", "scan.pdf");

            assertThat(record.name()).isEqualTo("Jane Roe");
            assertThat(record.age()).isEqualTo(40);
            assertThat(record.gender()).isEqualTo(Gender.FEMALE);
            assertThat(record.dateOfBirth()).isEqualTo("1984-02-29");
            verify(completionClient).complete(contains("scanned note"));
        }

        @Test
        @DisplayName("Should discard every field that fails validation")
        void shouldDiscardInvalidFields() {
            when(completionClient.complete(anyString())).thenReturn("""
                {"name": "J", "age": 200, "gender": "unknown", "date_of_birth": "1990-02-30",
                 "phone": "123", "email": "not-an-email", "patient_id": "null", "address": "1 Elm Street"}
                """);

            PatientRecord record = fallback.fillMissing(PatientRecord.empty(), "text", "note.txt");

            assertThat(record).isEqualTo(PatientRecord.builder().address("1 Elm Street").build());
        }

        @Test
        @DisplayName("Should never overwrite values found by the patterns")
        void shouldOnlyFillGaps() {
            PatientRecord found = PatientRecord.builder().patientId("P-1").build();
            when(completionClient.complete(anyString())).thenReturn("{\"name\": \"Jane Roe\", \"patient_id\": \"X-9\"}");

            PatientRecord record = fallback.fillMissing(found, "text", "note.txt");

            assertThat(record.name()).isEqualTo("Jane Roe");
            assertThat(record.patientId()).isEqualTo("P-1");
        }

        @Test
        @DisplayName("Should keep the record when the model fails")
        void shouldSurviveModelFailure() {
            when(completionClient.complete(anyString())).thenThrow(new FallbackServiceException("timed out", new TimeoutException()));

            assertThat(fallback.fillMissing(PatientRecord.empty(), "text", "note.txt")).isEqualTo(PatientRecord.empty());
        }

        @Test
        @DisplayName("Should keep the record when the answer is not JSON")
        void shouldIgnoreMalformedAnswer() {
            when(completionClient.complete(anyString())).thenReturn("I could not find a patient.");

            assertThat(fallback.fillMissing(PatientRecord.empty(), "text", "note.txt")).isEqualTo(PatientRecord.empty());
        }
    }

    @Nested
    @DisplayName("When the fallback is skipped")
    class Skipped {

        @Test
        void shouldNotCallModelWhenIdentityIsKnown() {
            PatientRecord found = PatientRecord.builder().age(45).build();

            assertThat(fallback.fillMissing(found, "Age: 45", "note.txt")).isSameAs(found);
            verifyNoInteractions(completionClient);
        }

        @Test
        void shouldNotCallModelWhenDisabled() {
            DemographicsFallback disabled = new DemographicsFallback(
                Optional.of(completionClient), properties(false), new ObjectMapper());

            disabled.fillMissing(PatientRecord.empty(), "text", "note.txt");

            verifyNoInteractions(completionClient);
        }

        @Test
        void shouldNotFailWithoutClient() {
            DemographicsFallback unconfigured = new DemographicsFallback(Optional.empty(), properties(true), new ObjectMapper());

            assertThat(unconfigured.fillMissing(PatientRecord.empty(), "text", "note.txt")).isEqualTo(PatientRecord.empty());
        }
    }

    @Test
    void shouldSampleHeadAndTailOfLongDocuments() {
        DemographicsFallback small = new DemographicsFallback(
            Optional.of(completionClient), new FallbackProperties(true, 100, 5, Duration.ofSeconds(1), 1), new ObjectMapper());
        String text = "H".repeat(100) + "M".repeat(50) + "TTTTT";

        assertThat(small.sample(text)).isEqualTo("H".repeat(100) + "\n...\nTTTTT");
        assertThat(small.sample("short")).isEqualTo("short");
    }

    private static FallbackProperties properties(boolean enabled) {
        return new FallbackProperties(enabled, 3000, 1000, Duration.ofSeconds(30), 12);
    }
}
