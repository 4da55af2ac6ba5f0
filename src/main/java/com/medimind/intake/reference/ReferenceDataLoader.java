package com.medimind.intake.reference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medimind.intake.model.ReferenceRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads the reference-range JSON document. Known range attributes become
 * {@link ReferenceRange} fields and any other string attribute becomes a named variant.
 */
@Slf4j
@RequiredArgsConstructor
public class ReferenceDataLoader {

    private static final Set<String> RANGE_FIELDS = Set.of("normal", "units", "male", "female", "variants", "synonyms");

    private final ObjectMapper objectMapper;

    public ReferenceDataTables load(Resource resource) {
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);

            Map<String, ReferenceRange> labs = new HashMap<>();
            Map<String, List<String>> synonyms = new HashMap<>();
            root.path("labs").fields().forEachRemaining(entry -> {
                String key = entry.getKey().toLowerCase(Locale.ROOT);
                labs.put(key, range(entry.getValue()));
                synonyms.put(key, synonyms(entry.getValue()));
            });

            Map<String, ReferenceRange> vitals = new HashMap<>();
            root.path("vitals").fields().forEachRemaining(entry ->
                vitals.put(entry.getKey().toLowerCase(Locale.ROOT), range(entry.getValue())));

            Map<String, String> aliases = new HashMap<>();
            root.path("vital_aliases").fields().forEachRemaining(entry ->
                aliases.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue().asText().toLowerCase(Locale.ROOT)));

            log.info("Loaded reference data: {} labs, {} vital signs, {} vital aliases",
                labs.size(), vitals.size(), aliases.size());
            return new ReferenceDataTables(labs, synonyms, vitals, aliases);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load reference data from " + resource.getDescription(), e);
        }
    }

    private static ReferenceRange range(JsonNode node) {
        Map<String, String> variants = new LinkedHashMap<>();
        node.path("variants").fields().forEachRemaining(v -> variants.put(v.getKey(), v.getValue().asText()));

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!RANGE_FIELDS.contains(field.getKey()) && field.getValue().isTextual()) {
                variants.put(field.getKey(), field.getValue().asText());
            }
        }

        return new ReferenceRange(
            node.path("normal").asText(),
            node.path("units").asText(""),
            textOrNull(node.get("male")),
            textOrNull(node.get("female")),
            variants
        );
    }

    private static List<String> synonyms(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.path("synonyms").forEach(s -> names.add(s.asText().toLowerCase(Locale.ROOT)));
        return List.copyOf(names);
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
