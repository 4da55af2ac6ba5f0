package com.medimind.intake.model;

public final class Sentinels {

    /** Marks a value that is absent from the source document. */
    public static final String NOT_SPECIFIED = "Not specified";

    public static final String REFERENCE_RANGE_NOT_AVAILABLE = "Reference range not available";

    private Sentinels() {
    }
}
