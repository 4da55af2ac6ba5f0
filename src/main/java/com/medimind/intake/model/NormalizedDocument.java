package com.medimind.intake.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NormalizedDocument(
    @JsonProperty("source_filename")
    String sourceFilename,

    String text
) {}
