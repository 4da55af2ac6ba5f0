package com.medimind.intake.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    HIGH,
    MEDIUM;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
