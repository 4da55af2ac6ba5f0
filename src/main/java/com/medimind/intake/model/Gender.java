package com.medimind.intake.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum Gender {
    MALE("Male"),
    FEMALE("Female");

    private final String label;

    Gender(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Accepts only M, F, Male and Female in any case; everything else is not a gender.
     */
    public static Optional<Gender> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "M", "MALE" -> Optional.of(MALE);
            case "F", "FEMALE" -> Optional.of(FEMALE);
            default -> Optional.empty();
        };
    }
}
