package com.medimind.intake.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EventType {
    ADMISSION,
    PROCEDURE,
    LAB,
    VISIT;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
