package com.medimind.intake.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ClinicalSummary(
    @JsonProperty("total_events")
    int totalEvents,

    @JsonProperty("total_labs")
    int totalLabs,

    @JsonProperty("abnormal_labs")
    int abnormalLabs,

    @JsonProperty("total_medications")
    int totalMedications,

    @JsonProperty("total_red_flags")
    int totalRedFlags
) {}
