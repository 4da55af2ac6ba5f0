package com.medimind.intake.patient;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * An ordered list of extraction strategies for one field. The first strategy that
 * returns a value wins and later ones never run.
 */
@Slf4j
final class FirstMatch<T> {

    private record Strategy<T>(String name, Function<DocumentText, Optional<T>> extractor) {}

    private final String field;
    private final List<Strategy<T>> strategies = new ArrayList<>();

    private FirstMatch(String field) {
        this.field = field;
    }

    static <T> FirstMatch<T> of(String field) {
        return new FirstMatch<>(field);
    }

    FirstMatch<T> then(String name, Function<DocumentText, Optional<T>> extractor) {
        strategies.add(new Strategy<>(name, extractor));
        return this;
    }

    Optional<T> apply(DocumentText document) {
        for (Strategy<T> strategy : strategies) {
            Optional<T> value = strategy.extractor().apply(document);
            if (value.isPresent()) {
                log.debug("{} found by '{}' strategy", field, strategy.name());
                return value;
            }
        }
        return Optional.empty();
    }
}
