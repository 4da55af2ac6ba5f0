package com.medimind.intake.extractor;

import com.medimind.intake.model.Sentinels;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date recognition shared by the extractors. Every date leaves here either as
 * ISO {@code YYYY-MM-DD} or not at all.
 */
public final class ClinicalDates {

    public static final Pattern DATE = Pattern.compile(
        "(?<!\\d)(?:\\d{4}(?<ysep>[-/.])\\d{1,2}\\k<ysep>\\d{1,2}|\\d{1,2}(?<dsep>[-/])\\d{1,2}\\k<dsep>\\d{4})(?!\\d)");

    private static final Pattern HL7_TIMESTAMP = Pattern.compile("^(\\d{8})(?:\\d{2,6})?(?:[.+\\-].*)?$");

    // first success wins, so month-first beats day-first for ambiguous slashes
    private static final List<DateTimeFormatter> FORMATS = List.of(
        strict("uuuu-M-d"),
        strict("M/d/uuuu"),
        strict("d/M/uuuu"),
        strict("uuuu/M/d"),
        strict("d-M-uuuu"),
        strict("uuuu.M.d")
    );

    private static final DateTimeFormatter BASIC = strict("uuuuMMdd");

    private ClinicalDates() {
    }

    public static Optional<String> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String candidate = raw.strip();
        for (DateTimeFormatter format : FORMATS) {
            try {
                return Optional.of(LocalDate.parse(candidate, format).toString());
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        return Optional.empty();
    }

    /**
     * First date on the line that actually parses.
     */
    public static Optional<String> firstDate(String line) {
        Matcher matcher = DATE.matcher(line);
        while (matcher.find()) {
            Optional<String> parsed = parse(matcher.group());
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    /**
     * HL7 {@code TS} values such as {@code 20240115} or {@code 202401151030}.
     */
    public static Optional<String> parseHl7Timestamp(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Matcher matcher = HL7_TIMESTAMP.matcher(raw.strip());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(matcher.group(1), BASIC).toString());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static String orNotSpecified(Optional<String> date) {
        return date.orElse(Sentinels.NOT_SPECIFIED);
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
