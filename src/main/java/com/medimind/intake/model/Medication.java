package com.medimind.intake.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Medication(
    String name,

    @JsonProperty("start_date")
    String startDate,

    @JsonProperty("end_date")
    String endDate,

    @JsonProperty("source_file")
    String sourceFile,

    @JsonProperty("source_text")
    String sourceText
) {}
