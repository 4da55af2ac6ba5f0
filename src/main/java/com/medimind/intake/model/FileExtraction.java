package com.medimind.intake.model;

import java.util.List;
import java.util.Map;

/**
 * Everything the entity extractors found in one normalized file.
 */
public record FileExtraction(
    String sourceFile,
    List<ClinicalEvent> events,
    List<LabResult> labs,
    List<Medication> medications,
    List<RedFlag> redFlags,
    Map<String, SectionStatus> sections
) {}
