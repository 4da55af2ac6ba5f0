package com.medimind.intake.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Keyword lists behind the extraction heuristics. Anything left unset falls back
 * to the built-in list.
 */
@ConfigurationProperties(prefix = "app.extraction")
public record ExtractionProperties(
    List<String> labNameVocabulary,
    List<String> methodNames,
    List<String> medicationKeywords,
    List<String> redFlagKeywords,
    List<String> ageContextMarkers,
    List<String> nonPatientNameLabels,
    List<String> nameHeaderWords
) {

    public ExtractionProperties {
        labNameVocabulary = orDefault(labNameVocabulary, List.of(
            "haemoglobin", "hemoglobin", "hb", "wbc", "rbc", "platelet", "glucose", "creatinine",
            "cholesterol", "triglyceride", "bilirubin", "alt", "ast", "alkaline", "phosphatase",
            "sodium", "potassium", "calcium", "magnesium", "neutrophil", "lymphocyte", "monocyte",
            "eosinophil", "basophil", "mcv", "mch", "mchc", "rdw", "hct", "hematocrit", "esr",
            "sedimentation", "mpv", "pct", "p-lcr", "pdw", "absolute", "count", "differential",
            "morphology"));
        methodNames = orDefault(methodNames, List.of(
            "hexokinase", "uricase", "clia", "direct", "diazo", "ifcc", "kinetic", "pnpp-amp",
            "bromocresol", "bcg", "cynmeth", "calculated", "impedence", "microscopy", "sarcosine",
            "oxidase"));
        medicationKeywords = orDefault(medicationKeywords, List.of(
            "medication", "medications", "drug", "drugs", "prescription", "prescribed", "rx", "rxo",
            "rxa", "taking", "currently on", "on medication", "tablet", "capsule", "injection",
            "dose", "mg", "ml"));
        redFlagKeywords = orDefault(redFlagKeywords, List.of(
            "critical", "critical:", "urgent", "urgent:", "alert", "alert:", "warning", "warning:",
            "adverse", "adverse event", "adverse reaction", "allergy", "allergy:",
            "allergic reaction", "contraindication", "contraindicated"));
        ageContextMarkers = orDefault(ageContextMarkers, List.of(
            "g/dl", "mg/dl", "mmol", "u/l", "iu/l", "cells", "/ul", "%", "range", "reference",
            "normal", "test", "result", "value", "level", "count"));
        nonPatientNameLabels = orDefault(nonPatientNameLabels, List.of(
            "doctor", "dr.", "physician", "provider", "hospital", "clinic", "lab", "laboratory",
            "test", "facility", "referring", "consultant", "pathologist", "technician", "company",
            "insurance", "father", "mother", "spouse", "guardian", "contact"));
        nameHeaderWords = orDefault(nameHeaderWords, List.of(
            "report", "laboratory", "hospital", "clinic", "page", "date", "time", "medical",
            "center", "department", "result", "summary"));
    }

    public static ExtractionProperties defaults() {
        return new ExtractionProperties(null, null, null, null, null, null, null);
    }

    private static List<String> orDefault(List<String> configured, List<String> fallback) {
        return configured == null || configured.isEmpty() ? fallback : List.copyOf(configured);
    }
}
