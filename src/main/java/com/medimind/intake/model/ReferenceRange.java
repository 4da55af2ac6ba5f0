package com.medimind.intake.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Normal interval for a lab test or vital sign, with optional sex-specific
 * and named variants (fasting, optimal, celsius...).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReferenceRange(
    String normal,
    String units,
    String male,
    String female,
    Map<String, String> variants
) {

    public ReferenceRange {
        variants = variants == null ? Map.of() : Map.copyOf(variants);
        units = units == null ? "" : units;
    }

    public static ReferenceRange notAvailable() {
        return new ReferenceRange(Sentinels.REFERENCE_RANGE_NOT_AVAILABLE, "", null, null, Map.of());
    }

    public boolean available() {
        return !Sentinels.REFERENCE_RANGE_NOT_AVAILABLE.equals(normal);
    }

    /**
     * Returns a copy whose {@code normal} interval is the variant for the given gender, when the table has one.
     */
    public ReferenceRange forGender(Gender gender) {
        if (gender == Gender.MALE && male != null) {
            return new ReferenceRange(male, units, male, female, variants);
        }
        if (gender == Gender.FEMALE && female != null) {
            return new ReferenceRange(female, units, male, female, variants);
        }
        return this;
    }
}
