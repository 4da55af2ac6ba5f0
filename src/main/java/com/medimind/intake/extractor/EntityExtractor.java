package com.medimind.intake.extractor;

import java.util.List;

/**
 * Pulls one kind of clinical entity out of a normalized document.
 * Implementations keep no state between calls.
 */
public interface EntityExtractor<T> {

    List<T> extract(String text, String sourceFile);
}
