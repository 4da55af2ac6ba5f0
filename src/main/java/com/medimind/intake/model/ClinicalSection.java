package com.medimind.intake.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

public enum ClinicalSection {
    DEMOGRAPHICS(List.of("patient id", "patient name", "date of birth", "age", "sex", "gender", "pid")),
    CHIEF_COMPLAINT(List.of("chief complaint", "cc", "presenting complaint")),
    HISTORY_OF_PRESENT_ILLNESS(List.of("history of present illness", "hpi", "present illness")),
    PAST_MEDICAL_HISTORY(List.of("past medical history", "pmh", "medical history", "past history")),
    MEDICATIONS(List.of("medication", "medications", "drug", "rx", "prescription")),
    ALLERGIES(List.of("allergy", "allergies", "allergic", "adverse reaction")),
    VITAL_SIGNS(List.of("vital", "vitals", "blood pressure", "bp", "temperature", "temp", "heart rate", "hr")),
    PHYSICAL_EXAMINATION(List.of("physical exam", "physical examination", "pe", "examination")),
    LABORATORY_RESULTS(List.of("lab", "laboratory", "test results", "obx", "laboratory results")),
    ASSESSMENT(List.of("assessment", "diagnosis", "diagnoses", "impression")),
    PLAN(List.of("plan", "treatment plan", "management", "recommendations"));

    private final List<String> keywords;

    ClinicalSection(List<String> keywords) {
        this.keywords = keywords;
    }

    public List<String> keywords() {
        return keywords;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
