package com.medimind.intake.patient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.medimind.intake.config.FallbackProperties;
import com.medimind.intake.exception.FallbackServiceException;
import com.medimind.intake.infra.CompletionClient;
import com.medimind.intake.model.Gender;
import com.medimind.intake.model.PatientRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Asks the language model for demographics when the patterns found no identity at all.
 * Every field of the answer is validated on its own and only fills gaps.
 */
@Slf4j
@Component
public class DemographicsFallback {

    private static final Pattern CODE_FENCE = Pattern.compile("^```(?:json)?\\s*|\\s*```$");
    private static final Pattern ISO_DATE = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");
    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+\\-]+@[A-Za-z0-9.\\-]+\\.[A-Za-z]{2,}");
    private static final DateTimeFormatter STRICT_ISO = DateTimeFormatter.ofPattern("uuuu-MM-dd")
        .withResolverStyle(ResolverStyle.STRICT);
    private static final int MIN_PHONE_DIGITS = 7;

    private static final String EXTRACTION_PROMPT_TEMPLATE =
        """
            Role: Medical records clerk.
            Task: Extract the patient's demographics from the document excerpt below.
            Constraint: Use ONLY information explicitly written in the excerpt. Never guess or infer.
            If a field is not explicitly stated, its value MUST be null.

            Output: a single JSON object and nothing else, with exactly these keys:
            {"name": string|null, "age": integer|null, "gender": "Male"|"Female"|null,
             "date_of_birth": "YYYY-MM-DD"|null, "patient_id": string|null,
             "address": string|null, "phone": string|null, "email": string|null}

            Document excerpt:
            %s
            """;

    private final Optional<CompletionClient> completionClient;
    private final FallbackProperties properties;
    private final ObjectMapper objectMapper;

    public DemographicsFallback(
        Optional<CompletionClient> completionClient,
        FallbackProperties properties,
        ObjectMapper objectMapper
    ) {
        this.completionClient = completionClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Returns {@code record} untouched unless name, age and gender are all missing
     * and a completion client is configured.
     */
    public PatientRecord fillMissing(PatientRecord record, String text, String sourceFile) {
        if (!record.missingIdentity() || !properties.enabled() || completionClient.isEmpty()) {
            return record;
        }
        log.info("No patient identity found in {}, asking the language model", sourceFile);

        String answer;
        try {
            answer = completionClient.get().complete(String.format(EXTRACTION_PROMPT_TEMPLATE, sample(text)));
        } catch (FallbackServiceException e) {
            log.warn("Demographics fallback failed for {}: {}", sourceFile, e.getMessage());
            return record;
        }

        return parse(answer)
            .map(candidate -> record.mergeWith(validated(candidate)))
            .orElse(record);
    }

    String sample(String text) {
        int head = properties.headChars();
        int tail = properties.tailChars();
        if (text.length() <= head + tail) {
            return text;
        }
        return text.substring(0, head) + "\n...\n" + text.substring(text.length() - tail);
    }

    private Optional<JsonNode> parse(String answer) {
        if (answer == null || answer.isBlank()) {
            return Optional.empty();
        }
        String json = CODE_FENCE.matcher(answer.strip()).replaceAll("");
        try {
            JsonNode node = objectMapper.readTree(json);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("Demographics fallback returned malformed JSON: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    PatientRecord validated(JsonNode node) {
        return PatientRecord.builder()
            .name(text(node, "name").filter(PatientDemographicsExtractor::isValidName).orElse(null))
            .age(age(node).orElse(null))
            .gender(text(node, "gender").flatMap(Gender::parse).orElse(null))
            .dateOfBirth(text(node, "date_of_birth").filter(DemographicsFallback::isStrictDate).orElse(null))
            .patientId(text(node, "patient_id").orElse(null))
            .address(text(node, "address").orElse(null))
            .phone(text(node, "phone")
                .filter(p -> p.chars().filter(Character::isDigit).count() >= MIN_PHONE_DIGITS)
                .orElse(null))
            .email(text(node, "email").filter(e -> EMAIL.matcher(e).matches()).orElse(null))
            .build();
    }

    private static Optional<Integer> age(JsonNode node) {
        JsonNode value = node.path("age");
        Optional<Integer> age = Optional.empty();
        if (value.isInt()) {
            age = Optional.of(value.asInt());
        } else if (value.isTextual() && value.asText().strip().matches("\\d{1,3}")) {
            age = Optional.of(Integer.parseInt(value.asText().strip()));
        }
        Optional<Integer> valid = age.filter(a -> a >= 0 && a <= 150);
        if (age.isPresent() && valid.isEmpty()) {
            log.debug("Rejected fallback age {}", age.get());
        }
        return valid;
    }

    private static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isValueNode() || value.isNull()) {
            return Optional.empty();
        }
        String text = value.asText().strip();
        return text.isEmpty() || text.equalsIgnoreCase("null") ? Optional.empty() : Optional.of(text);
    }

    private static boolean isStrictDate(String value) {
        if (!ISO_DATE.matcher(value).matches()) {
            return false;
        }
        try {
            LocalDate.parse(value, STRICT_ISO);
            return true;
        } catch (DateTimeParseException e) {
            log.debug("Rejected fallback date of birth {}", value);
            return false;
        }
    }
}
