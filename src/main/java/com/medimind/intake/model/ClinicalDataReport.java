package com.medimind.intake.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record ClinicalDataReport(
    List<ClinicalEvent> events,

    List<LabResult> labs,

    List<Medication> medications,

    @JsonProperty("red_flags")
    List<RedFlag> redFlags,

    Map<String, Map<String, SectionStatus>> sections,

    ClinicalSummary summary,

    @JsonProperty("patient_data")
    PatientRecord patientData,

    @JsonProperty("vital_sign_references")
    Map<String, ReferenceRange> vitalSignReferences
) {

    public static ClinicalDataReport empty() {
        return new ClinicalDataReport(
            List.of(),
            List.of(),
            List.of(),
            List.of(),
            Map.of(),
            new ClinicalSummary(0, 0, 0, 0, 0),
            PatientRecord.empty(),
            Map.of()
        );
    }
}
