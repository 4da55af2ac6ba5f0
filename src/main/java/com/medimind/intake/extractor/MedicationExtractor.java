package com.medimind.intake.extractor;

import com.medimind.intake.config.ExtractionProperties;
import com.medimind.intake.model.Medication;
import com.medimind.intake.model.Sentinels;
import com.medimind.intake.parser.Hl7Segments;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Slf4j
@Component
public class MedicationExtractor implements EntityExtractor<Medication> {

    private static final Set<String> DOSE_UNITS = Set.of("mg", "ml", "mcg");
    private static final String DATE = ClinicalDates.DATE.pattern();

    private static final Pattern START_MARKER = Pattern.compile(
        "\\b(?:start(?:ed|ing)?(?:\\s+date)?|since)\\b[:\\s]*(?:on\\s+)?(" + DATE + ")", Pattern.CASE_INSENSITIVE);
    private static final Pattern END_MARKER = Pattern.compile(
        "\\b(?:until|stop(?:ped)?|discontinued|end\\s+date)\\b[:\\s]*(?:on\\s+)?(" + DATE + ")", Pattern.CASE_INSENSITIVE);
    private static final Pattern ADMINISTRATION_DATE = Pattern.compile("Administration Date:\\s*(\\d{8,14})");
    private static final Pattern LABEL_PREFIX = Pattern.compile(
        "^(?:medications?|drugs?|prescription|rx)[:\\s]*", Pattern.CASE_INSENSITIVE);
    private static final Pattern SEGMENT_HEADER = Pattern.compile("^\\[.*]$");

    private static final int LOOKAHEAD_LINES = 4;
    private static final int MAX_NAME_WORDS = 5;
    private static final int MAX_LINE_FOR_WORDS = 200;

    private final Pattern medicationKeywords;

    public MedicationExtractor(ExtractionProperties properties) {
        this.medicationKeywords = keywordPattern(properties.medicationKeywords());
    }

    @Override
    public List<Medication> extract(String text, String sourceFile) {
        List<Medication> medications = new ArrayList<>(administrations(text, sourceFile));
        medications.addAll(freeText(text.split("\\R"), sourceFile));

        Map<String, Medication> unique = new LinkedHashMap<>();
        for (Medication medication : medications) {
            unique.putIfAbsent(medication.name().toLowerCase(Locale.ROOT) + "\u0000" + medication.sourceFile(), medication);
        }
        log.debug("Found {} medications in {}", unique.size(), sourceFile);
        return new ArrayList<>(unique.values());
    }

    private List<Medication> administrations(String text, String sourceFile) {
        List<Medication> medications = new ArrayList<>();
        for (String[] fields : Hl7Segments.segmentsOfType(text, "RXA")) {
            String name = Hl7Segments.codedText(Hl7Segments.field(fields, 5));
            if (name.isEmpty()) {
                continue;
            }
            String startDate = ClinicalDates.orNotSpecified(ClinicalDates.parseHl7Timestamp(Hl7Segments.field(fields, 3)));
            medications.add(new Medication(name, startDate, Sentinels.NOT_SPECIFIED, sourceFile, String.join("|", fields)));
        }
        return medications;
    }

    private List<Medication> freeText(String[] lines, String sourceFile) {
        List<Medication> medications = new ArrayList<>();
        String currentDate = null;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            Optional<String> endDate = markedDate(END_MARKER, line);

            Optional<String> lineDate = ClinicalDates.firstDate(END_MARKER.matcher(line).replaceAll(" "));
            if (lineDate.isPresent()) {
                currentDate = lineDate.get();
            }

            if (line.startsWith("MSH|") || line.startsWith("RXA|") || SEGMENT_HEADER.matcher(line).matches()
                || !medicationKeywords.matcher(line).find()) {
                continue;
            }

            String name = LABEL_PREFIX.matcher(candidateName(line)).replaceFirst("").strip();
            if (name.length() <= 2) {
                continue;
            }

            String dateSoFar = currentDate;
            int index = i;
            String startDate = markedDate(START_MARKER, line)
                .or(() -> Optional.ofNullable(dateSoFar))
                .or(() -> nearbyDate(lines, index))
                .orElse(Sentinels.NOT_SPECIFIED);

            medications.add(new Medication(
                name,
                startDate,
                endDate.orElse(Sentinels.NOT_SPECIFIED),
                sourceFile,
                line));
        }
        return medications;
    }

    private static String candidateName(String line) {
        int colon = line.indexOf(':');
        if (colon >= 0) {
            return line.substring(colon + 1).strip();
        }
        if (line.length() < MAX_LINE_FOR_WORDS && line.chars().anyMatch(Character::isUpperCase)) {
            List<String> words = Arrays.stream(line.split("\\s+"))
                .filter(w -> !w.isEmpty() && (Character.isUpperCase(w.charAt(0)) || w.chars().allMatch(Character::isDigit)))
                .limit(MAX_NAME_WORDS)
                .collect(Collectors.toList());
            if (!words.isEmpty()) {
                return String.join(" ", words);
            }
        }
        return line;
    }

    private static Optional<String> markedDate(Pattern marker, String line) {
        Matcher matcher = marker.matcher(line);
        return matcher.find() ? ClinicalDates.parse(matcher.group(1)) : Optional.empty();
    }

    private static Optional<String> nearbyDate(String[] lines, int index) {
        for (int j = index + 1; j < Math.min(index + 1 + LOOKAHEAD_LINES, lines.length); j++) {
            Matcher administration = ADMINISTRATION_DATE.matcher(lines[j]);
            if (administration.find()) {
                Optional<String> timestamp = ClinicalDates.parseHl7Timestamp(administration.group(1));
                if (timestamp.isPresent()) {
                    return timestamp;
                }
            }
            Optional<String> date = ClinicalDates.firstDate(lines[j]);
            if (date.isPresent()) {
                return date;
            }
        }
        return Optional.empty();
    }

    // dose units only count standalone, so "mg/dL" in a lab line is not a medication
    private static Pattern keywordPattern(List<String> keywords) {
        String alternatives = keywords.stream()
            .map(kw -> DOSE_UNITS.contains(kw.toLowerCase(Locale.ROOT))
                ? Pattern.quote(kw) + "\\b(?!/)"
                : Pattern.quote(kw))
            .collect(Collectors.joining("|"));
        return Pattern.compile("\\b(?:" + alternatives + ")", Pattern.CASE_INSENSITIVE);
    }
}
