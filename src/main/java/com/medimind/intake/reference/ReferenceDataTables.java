package com.medimind.intake.reference;

import com.medimind.intake.model.ReferenceRange;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lab and vital-sign reference tables. Keys and synonyms are lower case.
 */
public record ReferenceDataTables(
    Map<String, ReferenceRange> labs,
    Map<String, List<String>> labSynonyms,
    Map<String, ReferenceRange> vitals,
    Map<String, String> vitalAliases
) {

    public ReferenceDataTables {
        labs = Map.copyOf(labs);
        labSynonyms = Map.copyOf(labSynonyms);
        vitals = Map.copyOf(vitals);
        vitalAliases = Map.copyOf(vitalAliases);
    }

    public Optional<ReferenceRange> lab(String key) {
        return Optional.ofNullable(labs.get(key));
    }

    /**
     * Canonical lab key whose synonym list contains {@code name} exactly.
     */
    public Optional<String> labKeyForSynonym(String name) {
        return labSynonyms.entrySet().stream()
            .filter(e -> e.getValue().contains(name))
            .map(Map.Entry::getKey)
            .sorted()
            .findFirst();
    }

    public Optional<ReferenceRange> vital(String key) {
        return Optional.ofNullable(vitals.get(vitalAliases.getOrDefault(key, key)));
    }
}
