package com.medimind.intake.extractor;

import com.medimind.intake.config.ExtractionProperties;
import com.medimind.intake.model.LabResult;
import com.medimind.intake.model.Sentinels;
import com.medimind.intake.parser.Hl7Segments;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lab results from HL7 observations and from the common free-text layouts of lab
 * reports. All strategies run, then names are cleaned and duplicates dropped.
 */
@Slf4j
@Component
public class LabResultExtractor implements EntityExtractor<LabResult> {

    private static final String NUMBER = "\\d+(?:\\.\\d+)?";
    private static final String UNITS = "[A-Za-z/%^µ]+/?[A-Za-z0-9]*";
    private static final String RANGE = NUMBER + "\\s*[-–]\\s*" + NUMBER;

    private static final Pattern INLINE = Pattern.compile(
        "(?<![A-Za-z])([A-Za-z][A-Za-z \\t()\\-/,]*?)\\s+(" + NUMBER + ")\\s+(" + UNITS + ")\\s+(" + RANGE + ")");

    private static final Pattern VALUE_LINE = Pattern.compile(
        "^(" + NUMBER + ")\\s+(" + UNITS + ")\\s+(" + RANGE + ")");

    private static final Pattern COLON = Pattern.compile(
        "(?<![A-Za-z])([A-Za-z][A-Za-z \\t()\\-]*?):\\s*(" + NUMBER + ")(?![\\d.])\\s*(" + UNITS + ")?\\s*"
            + "(?:\\(([^)]*\\d[^)]*)\\)|(" + RANGE + "))");

    private static final Pattern OBSERVATION = Pattern.compile("^\\s*Observation:\\s*(.+)$");
    private static final Pattern OBSERVATION_VALUE = Pattern.compile("^\\s*Value:\\s*(\\S+)(?:\\s+(.+))?$");
    private static final Pattern OBSERVATION_RANGE = Pattern.compile("^\\s*Reference Range:\\s*(.+)$");

    private static final Pattern TWO_SIDED = Pattern.compile("(\\d[\\d,]*(?:\\.\\d+)?)\\s*[-–]\\s*(\\d[\\d,]*(?:\\.\\d+)?)");

    private static final Pattern METHOD_SUFFIX = Pattern.compile("\\s*\\(Method:.*?\\)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern METHOD_PARENTHETICAL = Pattern.compile(
        "\\s*\\([^)]*(?:method|assay|technique)[^)]*\\)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_PARENTHETICAL = Pattern.compile("\\s*\\(([^)]+)\\)\\s*$");

    private static final List<Pattern> NOISE = List.of(
        Pattern.compile("^\\(?method:", Pattern.CASE_INSENSITIVE),
        Pattern.compile("method\\)$", Pattern.CASE_INSENSITIVE),
        Pattern.compile("calculated\\)$", Pattern.CASE_INSENSITIVE),
        Pattern.compile("impedence\\)$", Pattern.CASE_INSENSITIVE),
        Pattern.compile("microscopy\\)$", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^page\\s+\\d+", Pattern.CASE_INSENSITIVE),
        Pattern.compile("^\\*\\*\\*"),
        Pattern.compile("^itdose", Pattern.CASE_INSENSITIVE)
    );

    private static final int MAX_NAME_LINE = 100;

    private final Pattern labVocabulary;
    private final List<String> methodNames;

    public LabResultExtractor(ExtractionProperties properties) {
        this.labVocabulary = KeywordPatterns.wordStart(properties.labNameVocabulary());
        this.methodNames = properties.methodNames();
    }

    @Override
    public List<LabResult> extract(String text, String sourceFile) {
        String[] lines = text.split("\\R");
        List<LabResult> candidates = new ArrayList<>();

        candidates.addAll(rawObservations(text, sourceFile));
        candidates.addAll(normalizedObservations(lines, sourceFile));
        candidates.addAll(inline(lines, sourceFile));
        candidates.addAll(threeLine(lines, sourceFile));
        candidates.addAll(colonSeparated(lines, sourceFile));

        List<LabResult> labs = cleanAndDeduplicate(candidates);
        log.debug("Found {} lab results ({} candidates) in {}", labs.size(), candidates.size(), sourceFile);
        return labs;
    }

    /**
     * True only when both the value and a two-sided numeric range parse and the value falls outside it.
     */
    public static boolean isAbnormal(String value, String range) {
        if (value == null || range == null) {
            return false;
        }
        Matcher matcher = TWO_SIDED.matcher(range);
        if (!matcher.find()) {
            return false;
        }
        try {
            double v = Double.parseDouble(value.replace(",", "").strip());
            double min = Double.parseDouble(matcher.group(1).replace(",", ""));
            double max = Double.parseDouble(matcher.group(2).replace(",", ""));
            return v < min || v > max;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * Drops method annotations and noise rows, then keeps the first result per
     * (name, value, file). Applying it to its own output changes nothing.
     */
    public List<LabResult> cleanAndDeduplicate(List<LabResult> labs) {
        Map<String, LabResult> unique = new LinkedHashMap<>();
        for (LabResult lab : labs) {
            String name = cleanName(lab.testName());
            if (name.length() < 2 || NOISE.stream().anyMatch(p -> p.matcher(name).find())) {
                continue;
            }
            String key = name.toLowerCase(Locale.ROOT) + "\u0000" + lab.value() + "\u0000" + lab.sourceFile();
            unique.putIfAbsent(key, lab.withTestName(name));
        }
        return new ArrayList<>(unique.values());
    }

    String cleanName(String raw) {
        String name = collapse(raw);
        String previous;
        do {
            previous = name;
            name = METHOD_PARENTHETICAL.matcher(name).replaceFirst("");
            Matcher trailing = TRAILING_PARENTHETICAL.matcher(name);
            if (trailing.find() && mentionsMethod(trailing.group(1))) {
                name = name.substring(0, trailing.start());
            }
            name = name.strip();
        } while (!name.equals(previous));
        return name;
    }

    private List<LabResult> rawObservations(String text, String sourceFile) {
        List<LabResult> labs = new ArrayList<>();
        for (String[] fields : Hl7Segments.segmentsOfType(text, "OBX")) {
            String name = Hl7Segments.codedText(Hl7Segments.field(fields, 3));
            String value = Hl7Segments.field(fields, 5);
            if (name.isEmpty() || value.isEmpty()) {
                continue;
            }
            String range = Hl7Segments.field(fields, 7);
            labs.add(lab(name, value, Hl7Segments.field(fields, 6), range, sourceFile, String.join("|", fields)));
        }
        return labs;
    }

    private List<LabResult> normalizedObservations(String[] lines, String sourceFile) {
        List<LabResult> labs = new ArrayList<>();
        for (int i = 0; i < lines.length; i++) {
            Matcher observation = OBSERVATION.matcher(lines[i]);
            if (!observation.matches()) {
                continue;
            }
            String name = observation.group(1).strip();
            String value = null;
            String units = "";
            String range = "";
            StringBuilder source = new StringBuilder(lines[i].strip());

            for (int j = i + 1; j < lines.length && !startsNewBlock(lines[j]); j++) {
                Matcher valueMatcher = OBSERVATION_VALUE.matcher(lines[j]);
                Matcher rangeMatcher = OBSERVATION_RANGE.matcher(lines[j]);
                if (valueMatcher.matches()) {
                    value = valueMatcher.group(1);
                    units = Optional.ofNullable(valueMatcher.group(2)).map(String::strip).orElse("");
                } else if (rangeMatcher.matches()) {
                    range = rangeMatcher.group(1).strip();
                } else {
                    continue;
                }
                source.append("\n").append(lines[j].strip());
            }
            if (value != null) {
                labs.add(lab(name, value, units, range, sourceFile, source.toString()));
            }
        }
        return labs;
    }

    private List<LabResult> inline(String[] lines, String sourceFile) {
        List<LabResult> labs = new ArrayList<>();
        for (String line : lines) {
            Matcher matcher = INLINE.matcher(line);
            while (matcher.find()) {
                String name = matcher.group(1);
                if (name.toLowerCase(Locale.ROOT).contains("method:")) {
                    continue;
                }
                name = collapse(METHOD_SUFFIX.matcher(name).replaceFirst(""));
                labs.add(lab(name, matcher.group(2), matcher.group(3), matcher.group(4).strip(), sourceFile,
                    matcher.group().strip()));
            }
        }
        return labs;
    }

    private List<LabResult> threeLine(String[] lines, String sourceFile) {
        List<LabResult> labs = new ArrayList<>();
        for (int i = 0; i + 1 < lines.length; i++) {
            String line = lines[i].strip();
            if (!isTestNameLine(line)) {
                continue;
            }
            String next = lines[i + 1].strip();
            String valueLine = isMethodLine(next) && i + 2 < lines.length ? lines[i + 2].strip() : next;

            Matcher matcher = VALUE_LINE.matcher(valueLine);
            if (matcher.find()) {
                labs.add(lab(collapse(line), matcher.group(1), matcher.group(2), matcher.group(3).strip(),
                    sourceFile, line + "\n" + valueLine));
            }
        }
        return labs;
    }

    private List<LabResult> colonSeparated(String[] lines, String sourceFile) {
        List<LabResult> labs = new ArrayList<>();
        for (String line : lines) {
            Matcher matcher = COLON.matcher(line);
            while (matcher.find()) {
                String range = matcher.group(4) != null ? matcher.group(4) : matcher.group(5);
                String units = matcher.group(3) != null ? matcher.group(3) : "";
                labs.add(lab(collapse(matcher.group(1)), matcher.group(2), units, range.strip(), sourceFile,
                    matcher.group().strip()));
            }
        }
        return labs;
    }

    private boolean isTestNameLine(String line) {
        if (line.isEmpty() || line.length() >= MAX_NAME_LINE || isMethodLine(line)) {
            return false;
        }
        String lower = line.toLowerCase(Locale.ROOT);
        if (lower.startsWith("page") || lower.startsWith("***")) {
            return false;
        }
        return labVocabulary.matcher(line).find();
    }

    private static boolean isMethodLine(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        return lower.startsWith("(method:") || lower.contains("method:");
    }

    private static boolean startsNewBlock(String line) {
        return line.strip().startsWith("[") || OBSERVATION.matcher(line).matches();
    }

    private boolean mentionsMethod(String parenthetical) {
        String lower = parenthetical.toLowerCase(Locale.ROOT);
        return methodNames.stream().anyMatch(lower::contains);
    }

    private static LabResult lab(String name, String value, String units, String range, String sourceFile,
                                 String sourceText) {
        String referenceRange = range == null || range.isBlank() ? Sentinels.NOT_SPECIFIED : range;
        return new LabResult(name, value, units, referenceRange, isAbnormal(value, referenceRange), sourceFile,
            sourceText);
    }

    private static String collapse(String value) {
        return value == null ? "" : value.strip().replaceAll("\\s+", " ");
    }
}
