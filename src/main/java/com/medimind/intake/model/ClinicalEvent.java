package com.medimind.intake.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A dated mention of an admission, procedure, lab or visit.
 * {@code date} is either {@code YYYY-MM-DD} or {@link Sentinels#NOT_SPECIFIED}.
 */
public record ClinicalEvent(
    EventType type,
    String date,
    String description,

    @JsonProperty("source_file")
    String sourceFile,

    @JsonProperty("source_text")
    String sourceText
) {}
