package com.medimind.intake.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record LabResult(
    @JsonProperty("test_name")
    String testName,

    String value,

    String units,

    @JsonProperty("reference_range")
    String referenceRange,

    @JsonProperty("is_abnormal")
    boolean abnormal,

    @JsonProperty("source_file")
    String sourceFile,

    @JsonProperty("source_text")
    String sourceText
) {

    public LabResult withTestName(String name) {
        return new LabResult(name, value, units, referenceRange, abnormal, sourceFile, sourceText);
    }

    public LabResult withReference(String range, String rangeUnits) {
        return new LabResult(testName, value, rangeUnits, range, abnormal, sourceFile, sourceText);
    }

    public boolean hasReferenceRange() {
        return referenceRange != null
            && !referenceRange.isBlank()
            && !Sentinels.NOT_SPECIFIED.equals(referenceRange);
    }
}
