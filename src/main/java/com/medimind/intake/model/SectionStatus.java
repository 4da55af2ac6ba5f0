package com.medimind.intake.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SectionStatus {
    PRESENT,
    PARTIAL,
    NOT_MENTIONED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SectionStatus fromHitCount(int hits) {
        if (hits >= 2) {
            return PRESENT;
        }
        return hits == 1 ? PARTIAL : NOT_MENTIONED;
    }
}
