package com.medimind.intake.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RedFlag(
    String type,
    String description,
    Severity severity,

    @JsonProperty("source_file")
    String sourceFile,

    @JsonProperty("source_text")
    String sourceText
) {}
