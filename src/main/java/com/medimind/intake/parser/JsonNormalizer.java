package com.medimind.intake.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medimind.intake.exception.DocumentParseException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Flattens FHIR or custom EHR JSON into indented {@code Key: value} lines.
 */
@Component
@RequiredArgsConstructor
public class JsonNormalizer implements DocumentNormalizer {

    private static final Set<String> METADATA_KEYS = Set.of("id", "meta", "extension", "text", "resourcetype");
    private static final String INDENT = "  ";

    private final ObjectMapper objectMapper;

    @Override
    public String normalize(String content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new DocumentParseException(DocumentFormat.JSON, e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode()) {
            throw new DocumentParseException(DocumentFormat.JSON, "empty document", null);
        }
        List<String> lines = new ArrayList<>();
        render(root, 0, lines);
        return String.join("\n", lines);
    }

    /**
     * True when the content looks like a JSON document and Jackson accepts it.
     */
    public boolean accepts(String content) {
        String trimmed = content.strip();
        if (!trimmed.startsWith("{") && !trimmed.startsWith("[")) {
            return false;
        }
        try {
            objectMapper.readTree(trimmed);
            return true;
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    private void render(JsonNode node, int depth, List<String> lines) {
        String indent = INDENT.repeat(depth);

        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String key = field.getKey();
                JsonNode value = field.getValue();
                if (METADATA_KEYS.contains(key.toLowerCase(Locale.ROOT)) || key.isBlank()) {
                    continue;
                }
                if (value.isContainerNode()) {
                    lines.add(indent + Labels.humanize(key) + ":");
                    render(value, depth + 1, lines);
                } else if (hasText(value)) {
                    lines.add(indent + Labels.humanize(key) + ": " + value.asText().strip());
                }
            }
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isContainerNode()) {
                    render(item, depth, lines);
                } else if (hasText(item)) {
                    lines.add(indent + "- " + item.asText().strip());
                }
            }
        } else if (hasText(node)) {
            lines.add(indent + node.asText().strip());
        }
    }

    private static boolean hasText(JsonNode value) {
        return !value.isNull() && !value.isMissingNode() && !value.asText().isBlank();
    }
}
