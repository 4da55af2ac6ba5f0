package com.medimind.intake.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.medimind.intake.config.ExtractionProperties;
import com.medimind.intake.config.FallbackProperties;
import com.medimind.intake.exception.FallbackServiceException;
import com.medimind.intake.infra.CompletionClient;
import com.medimind.intake.model.Gender;
import com.medimind.intake.model.PatientRecord;
import com.medimind.intake.patient.DemographicsFallback;
import com.medimind.intake.patient.PatientDemographicsExtractor;
import com.medimind.intake.patient.VitalSignExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PatientDataServiceTest {

    @Mock
    private CompletionClient completionClient;

    private PatientDataServiceImpl patientDataService;

    @BeforeEach
    void setUp() {
        PatientDemographicsExtractor extractor = new PatientDemographicsExtractor(
            ExtractionProperties.defaults(), new VitalSignExtractor());
        DemographicsFallback fallback = new DemographicsFallback(
            Optional.of(completionClient),
            new FallbackProperties(true, 3000, 1000, Duration.ofSeconds(5), 12),
            new ObjectMapper());
        patientDataService = new PatientDataServiceImpl(extractor, fallback, Runnable::run);
    }

    @Nested
    @DisplayName("Merging across files")
    class Merging {

        @Test
        void shouldPreferEarlierFilenameRegardlessOfInputOrder() {
            Map<String, String> files = new LinkedHashMap<>();
            files.put("B.txt", "Patient Name: John Roe\nSex: M");
            files.put("A.txt", "Patient Name: Jane Doe");

            PatientRecord record = patientDataService.extractPatientData(files);

            assertThat(record.name()).isEqualTo("Jane Doe");
            assertThat(record.gender()).isEqualTo(Gender.MALE);
        }

        @Test
        void shouldGiveSameResultForAnyMapOrder() {
            Map<String, String> forward = new LinkedHashMap<>();
            forward.put("A.txt", "Patient Name: Jane Doe\nBP: 120/80");
            forward.put("B.txt", "BP: 130/85\nHeart Rate: 72");
            Map<String, String> backward = new LinkedHashMap<>();
            backward.put("B.txt", forward.get("B.txt"));
            backward.put("A.txt", forward.get("A.txt"));

            PatientRecord first = patientDataService.extractPatientData(forward);
            PatientRecord second = patientDataService.extractPatientData(backward);

            assertThat(first).isEqualTo(second);
            assertThat(first.vitalSigns())
                .containsEntry("blood_pressure", "120/80")
                .containsEntry("heart_rate", "72");
        }

        @Test
        void shouldReturnEmptyRecordForNoFiles() {
            assertThat(patientDataService.extractPatientData(new HashMap<>())).isEqualTo(PatientRecord.empty());
        }
    }

    @Nested
    @DisplayName("Language model fallback")
    class Fallback {

        @Test
        void shouldNotConsultModelWhenPatternsFindIdentity() {
            patientDataService.extractPatientData(Map.of("note.txt", "Patient Name: Alice Smith\nAge: 45"));

            verifyNoInteractions(completionClient);
        }

        @Test
        void shouldConsultModelOnlyForFilesWithoutIdentity() {
            when(completionClient.complete(contains("Glucose 95 mg/dL")))
                .thenReturn("{\"name\": \"Jane Roe\", \"age\": 40, \"gender\": \"Female\"}");
            Map<String, String> files = new LinkedHashMap<>();
            files.put("a_labs.txt", "Glucose 95 mg/dL 70-100");
            files.put("b_note.txt", "Patient Name: Alice Smith\nAge: 45");

            PatientRecord record = patientDataService.extractPatientData(files);

            assertThat(record.name()).isEqualTo("Jane Roe");
            assertThat(record.age()).isEqualTo(40);
            verify(completionClient, never()).complete(contains("Alice Smith"));
        }

        @Test
        void shouldKeepGoingWhenModelFails() {
            when(completionClient.complete(anyString())).thenThrow(new FallbackServiceException("down", new IllegalStateException("quota")));

            PatientRecord record = patientDataService.extractPatientData(Map.of("scan.txt", "Illegible scan"));

            assertThat(record).isEqualTo(PatientRecord.empty());
        }
    }
}
