package com.medimind.intake.patient;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Vital signs written as labelled values. Matches sitting next to lab units or
 * reference ranges are skipped, and implausible values are dropped rather than clamped.
 */
@Slf4j
@Component
public class VitalSignExtractor {

    public static final String BLOOD_PRESSURE = "blood_pressure";
    public static final String HEART_RATE = "heart_rate";
    public static final String TEMPERATURE = "temperature";
    public static final String RESPIRATORY_RATE = "respiratory_rate";
    public static final String OXYGEN_SATURATION = "oxygen_saturation";

    private static final List<String> LAB_CONTEXT = List.of(
        "mg/dl", "g/dl", "mmol", "u/l", "iu/l", "/ul", "/hpf", "range", "reference");

    private record VitalPattern(String name, Pattern pattern, Predicate<Matcher> plausible) {}

    private static final List<VitalPattern> PATTERNS = List.of(
        new VitalPattern(BLOOD_PRESSURE,
            Pattern.compile("\\b(?:blood pressure|bp)\\b[:\\s]*(\\d{2,3})\\s*/\\s*(\\d{2,3})(?!\\d)", Pattern.CASE_INSENSITIVE),
            m -> {
                int systolic = Integer.parseInt(m.group(1));
                int diastolic = Integer.parseInt(m.group(2));
                return between(systolic, 60, 250) && between(diastolic, 30, 150) && systolic > diastolic;
            }),
        new VitalPattern(HEART_RATE,
            Pattern.compile("\\b(?:heart rate|hr|pulse)\\b[:\\s]*(\\d{2,3})(?![\\d.])", Pattern.CASE_INSENSITIVE),
            m -> between(Double.parseDouble(m.group(1)), 30, 200)),
        new VitalPattern(TEMPERATURE,
            Pattern.compile("\\b(?:temperature|temp)\\b[:\\s]*(\\d{2,3}(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE),
            m -> between(Double.parseDouble(m.group(1)), 90, 110)),
        new VitalPattern(RESPIRATORY_RATE,
            Pattern.compile("\\b(?:respiratory rate|resp rate|rr)\\b[:\\s]*(\\d{1,2})(?![\\d.])", Pattern.CASE_INSENSITIVE),
            m -> between(Double.parseDouble(m.group(1)), 5, 60)),
        new VitalPattern(OXYGEN_SATURATION,
            Pattern.compile("\\b(?:oxygen saturation|spo2|o2 sat|sao2|oxygen)\\b[:\\s]*(\\d{2,3}(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE),
            m -> between(Double.parseDouble(m.group(1)), 70, 100))
    );

    public Map<String, String> extract(String text) {
        Map<String, String> vitals = new LinkedHashMap<>();
        for (VitalPattern vital : PATTERNS) {
            find(vital, text).ifPresent(value -> vitals.put(vital.name(), value));
        }
        return vitals;
    }

    private static Optional<String> find(VitalPattern vital, String text) {
        Matcher matcher = vital.pattern().matcher(text);
        while (matcher.find()) {
            String line = lineOf(text, matcher.start()).toLowerCase(Locale.ROOT);
            if (LAB_CONTEXT.stream().anyMatch(line::contains)) {
                log.debug("Skipping {} candidate in lab context: {}", vital.name(), line.strip());
                continue;
            }
            if (!vital.plausible().test(matcher)) {
                log.debug("Discarding implausible {} '{}'", vital.name(), matcher.group());
                continue;
            }
            return Optional.of(matcher.groupCount() == 2
                ? matcher.group(1) + "/" + matcher.group(2)
                : matcher.group(1));
        }
        return Optional.empty();
    }

    private static String lineOf(String text, int index) {
        int start = text.lastIndexOf('\n', Math.max(0, index - 1)) + 1;
        int end = text.indexOf('\n', index);
        return text.substring(start, end < 0 ? text.length() : end);
    }

    private static boolean between(double value, double min, double max) {
        return value >= min && value <= max;
    }
}
