package com.medimind.intake.patient;

import com.medimind.intake.config.ExtractionProperties;
import com.medimind.intake.extractor.ClinicalDates;
import com.medimind.intake.model.Gender;
import com.medimind.intake.model.PatientRecord;
import com.medimind.intake.parser.Hl7Segments;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based patient demographics for a single normalized document. Every field
 * is an ordered list of strategies; a field no strategy can back up stays null.
 */
@Slf4j
@Component
public class PatientDemographicsExtractor {

    private static final int NAME_SCAN_LINES = 200;
    private static final int NAME_LABEL_HEAD_LINES = 20;
    private static final int PATIENT_MENTION_CHARS = 1000;
    private static final int BARE_NAME_LINES = 30;
    private static final int GENDER_SCAN_LINES = 50;
    private static final int SHORT_NAME_VALUE = 5;
    private static final int MIN_AGE = 2;
    private static final int MAX_AGE = 120;
    private static final int MAX_ADDRESS = 200;
    private static final int CONTEXT_BEFORE = 20;
    private static final int CONTEXT_AFTER = 15;

    private static final Set<String> NAME_STOP_WORDS = Set.of(
        "age", "sex", "gender", "dob", "date", "id", "mrn", "phone", "address", "email", "birth");

    private static final Pattern NAME_TOKEN = Pattern.compile("[A-Za-z][A-Za-z.'\\-]*,?");
    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z][A-Za-z.'\\-]*(?:\\s+[A-Za-z][A-Za-z.'\\-]*)+");
    private static final Pattern BARE_NAME = Pattern.compile("^[A-Z][a-z]+(?:\\s+[A-Z][a-z]+){1,3}$");
    private static final Pattern HL7_SEPARATORS = Pattern.compile("[|^\\r\\n]+");
    private static final List<Pattern> NAME_PATTERNS = List.of(
        Pattern.compile("\\[Patient Identification.*?Patient Name: ([A-Za-z \\t^]+)", Pattern.DOTALL),
        Pattern.compile("patient name[:\\s]+([A-Za-z \\t,.^]+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("\\bname[:\\s]+([A-Za-z]+[ \\t^.]+[A-Za-z]+)", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern AGE_SEX = Pattern.compile(
        "\\bage\\s*/\\s*sex[:\\s]+(\\d{1,3})\\s*(?:y(?:ears?|rs?)?)?\\s*/\\s*(male|female|m|f)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern AGE_LABEL = Pattern.compile("\\bage\\b[:\\s]+(\\d{1,3})(?!\\d)", Pattern.CASE_INSENSITIVE);
    private static final Pattern YEARS_OLD = Pattern.compile(
        "(?<![\\d.])(\\d{1,3})[\\s-]*(?:years?|yrs?)[\\s-]*old\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern AGED = Pattern.compile("\\baged\\s+(\\d{1,3})(?!\\d)", Pattern.CASE_INSENSITIVE);
    private static final Pattern YEARS = Pattern.compile("(?<![\\d.])(\\d{1,3})\\s*(?:yrs?|years?)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern PATIENT_CONTEXT = Pattern.compile("\\b(?:patient|pt|age|old|male|female)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER_CONTINUES = Pattern.compile("^(?:\\s*[/:\\-–]\\s*\\d|\\.\\d|\\s*%)");
    private static final Pattern NUMBER_PRECEDES = Pattern.compile("\\d\\s*[/:.\\-–]\\s*$");

    private static final Pattern DOB_LABEL = Pattern.compile(
        "\\b(?:date of birth|d\\.?o\\.?b\\.?|birth date)\\b[:\\s]+(\\d{8,14}(?!\\d)|[0-9][0-9/\\-.]{5,9})", Pattern.CASE_INSENSITIVE);
    private static final Pattern ALL_DIGITS = Pattern.compile("\\d+");
    private static final List<DateTimeFormatter> DOB_FORMATS = List.of(
        strict("uuuu-M-d"),
        strict("M/d/uuuu"),
        strict("d/M/uuuu"),
        strict("uuuuMMdd"),
        strict("uuuu/M/d")
    );

    private static final Pattern GENDER_LABEL = Pattern.compile(
        "\\b(?:gender|sex)\\b[:\\s]+(male|female|m|f)\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern PATIENT_ID = Pattern.compile(
        "\\b(?:patient\\s*id|mrn|medical record number)\\b[:#\\s]+([A-Za-z0-9][A-Za-z0-9\\-]*)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ADDRESS = Pattern.compile("\\baddress\\b[:\\s]+([^\\r\\n]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PHONE = Pattern.compile(
        "\\b(?:phone|telephone|tel)\\b[: \\t]+(\\+?[\\d(][\\d \\t\\-().]{5,}\\d)", Pattern.CASE_INSENSITIVE);
    private static final Pattern EMAIL = Pattern.compile(
        "\\be-?mail\\b[:\\s]+([A-Za-z0-9._%+\\-]+@[A-Za-z0-9.\\-]+\\.[A-Za-z]{2,})", Pattern.CASE_INSENSITIVE);

    private final ExtractionProperties properties;
    private final VitalSignExtractor vitalSignExtractor;
    private final Clock clock;

    private final FirstMatch<String> name = FirstMatch.<String>of("name")
        .then("labelled line", this::labelledName)
        .then("bare name line", this::bareNameLine)
        .then("document pattern", this::namePattern);

    private final FirstMatch<Integer> age = FirstMatch.<Integer>of("age")
        .then("age/sex", d -> ageFrom(AGE_SEX, d, AgeCheck.NONE))
        .then("age label", d -> ageFrom(AGE_LABEL, d, AgeCheck.NUMERIC))
        .then("years old", d -> ageFrom(YEARS_OLD, d, AgeCheck.CONTEXT))
        .then("aged", d -> ageFrom(AGED, d, AgeCheck.CONTEXT))
        .then("years with patient context", d -> ageFrom(YEARS, d, AgeCheck.PATIENT_CONTEXT));

    private final FirstMatch<String> dateOfBirth = FirstMatch.<String>of("date of birth")
        .then("dob label", this::labelledDateOfBirth)
        .then("hl7 pid", this::hl7DateOfBirth);

    private final FirstMatch<Gender> gender = FirstMatch.<Gender>of("gender")
        .then("gender label", d -> genderFrom(GENDER_LABEL, d))
        .then("age/sex", d -> genderFrom(AGE_SEX, d))
        .then("line scan", PatientDemographicsExtractor::genderLineScan);

    @Autowired
    public PatientDemographicsExtractor(ExtractionProperties properties, VitalSignExtractor vitalSignExtractor) {
        this(properties, vitalSignExtractor, Clock.systemDefaultZone());
    }

    PatientDemographicsExtractor(ExtractionProperties properties, VitalSignExtractor vitalSignExtractor, Clock clock) {
        this.properties = properties;
        this.vitalSignExtractor = vitalSignExtractor;
        this.clock = clock;
    }

    public PatientRecord extract(String text) {
        DocumentText document = DocumentText.of(text);

        return PatientRecord.builder()
            .name(name.apply(document).orElse(null))
            .age(age.apply(document).orElse(null))
            .dateOfBirth(dateOfBirth.apply(document).orElse(null))
            .gender(gender.apply(document).orElse(null))
            .patientId(firstGroup(PATIENT_ID, document.text()).orElse(null))
            .address(address(document).orElse(null))
            .phone(phone(document).orElse(null))
            .email(firstGroup(EMAIL, document.text()).orElse(null))
            .vitalSigns(vitalSignExtractor.extract(document.text()))
            .build();
    }

    /**
     * A name is accepted only when it is alphabetic, has at least two words and is longer than two characters.
     */
    public static boolean isValidName(String candidate) {
        return candidate != null && candidate.strip().length() > 2 && VALID_NAME.matcher(candidate.strip()).matches();
    }

    // name

    private Optional<String> labelledName(DocumentText document) {
        boolean mentionsPatient = document.lower()
            .substring(0, Math.min(PATIENT_MENTION_CHARS, document.lower().length()))
            .contains("patient");
        List<String> lines = document.head(NAME_SCAN_LINES);

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String lower = line.toLowerCase(Locale.ROOT);
            boolean labelled = lower.contains("patient name")
                || (lower.contains("name:") && (mentionsPatient || i < NAME_LABEL_HEAD_LINES));
            int colon = line.indexOf(':');
            if (!labelled || colon < 0 || isOtherPartyLabel(lower.substring(0, colon))) {
                continue;
            }

            String value = line.substring(colon + 1).strip();
            if (value.length() < SHORT_NAME_VALUE && i + 1 < document.lines().size()) {
                value = value + " " + document.lines().get(i + 1).strip();
            }
            Optional<String> candidate = nameFrom(value);
            if (candidate.isPresent()) {
                return candidate;
            }
        }
        return Optional.empty();
    }

    private Optional<String> bareNameLine(DocumentText document) {
        for (String line : document.head(BARE_NAME_LINES)) {
            String stripped = line.strip();
            if (!BARE_NAME.matcher(stripped).matches()) {
                continue;
            }
            String lower = stripped.toLowerCase(Locale.ROOT);
            if (properties.nameHeaderWords().stream().noneMatch(lower::contains)) {
                return Optional.of(stripped);
            }
        }
        return Optional.empty();
    }

    private Optional<String> namePattern(DocumentText document) {
        for (Pattern pattern : NAME_PATTERNS) {
            Matcher matcher = pattern.matcher(document.text());
            while (matcher.find()) {
                Optional<String> candidate = nameFrom(matcher.group(1));
                if (candidate.isPresent()) {
                    return candidate;
                }
            }
        }
        return Optional.empty();
    }

    private boolean isOtherPartyLabel(String label) {
        if (label.contains("patient")) {
            return false;
        }
        return properties.nonPatientNameLabels().stream().anyMatch(label::contains);
    }

    // takes name-like tokens up to the next label on the same line
    private static Optional<String> nameFrom(String raw) {
        String cleaned = HL7_SEPARATORS.matcher(raw).replaceAll(" ").strip();
        List<String> tokens = new ArrayList<>();
        for (String token : cleaned.split("\\s+")) {
            String bare = token.endsWith(":") ? token.substring(0, token.length() - 1) : token;
            if (token.endsWith(":") || NAME_STOP_WORDS.contains(bare.toLowerCase(Locale.ROOT))
                || !NAME_TOKEN.matcher(token).matches()) {
                break;
            }
            tokens.add(token.endsWith(",") ? token.substring(0, token.length() - 1) : token);
        }
        String candidate = String.join(" ", tokens);
        if (isValidName(candidate)) {
            return Optional.of(candidate);
        }
        if (!candidate.isEmpty()) {
            log.debug("Rejected name candidate '{}'", candidate);
        }
        return Optional.empty();
    }

    // age

    private Optional<Integer> ageFrom(Pattern pattern, DocumentText document, AgeCheck check) {
        Matcher matcher = pattern.matcher(document.text());
        while (matcher.find()) {
            int start = matcher.start(1);
            int end = matcher.end(1);
            String line = document.lineAround(start);

            if (check == AgeCheck.PATIENT_CONTEXT && !PATIENT_CONTEXT.matcher(line).find()) {
                continue;
            }
            if (isSuppressed(document.text(), start, end, check)) {
                log.debug("Suppressed age candidate '{}' in '{}'", matcher.group(1), line.strip());
                continue;
            }
            int value = Integer.parseInt(matcher.group(1));
            if (value >= MIN_AGE && value <= MAX_AGE) {
                return Optional.of(value);
            }
            log.debug("Rejected out-of-range age {}", value);
        }
        return Optional.empty();
    }

    private boolean isSuppressed(String text, int start, int end, AgeCheck check) {
        if (check == AgeCheck.NONE) {
            return false;
        }
        String after = text.substring(end, Math.min(text.length(), end + 4));
        String before = text.substring(Math.max(0, start - 3), start);
        if (NUMBER_CONTINUES.matcher(after).find() || NUMBER_PRECEDES.matcher(before).find()) {
            return true;
        }
        // a labelled age is trusted whatever the neighbouring fields say
        if (check == AgeCheck.NUMERIC) {
            return false;
        }
        int lineStart = text.lastIndexOf('\n', Math.max(0, start - 1)) + 1;
        int lineEnd = text.indexOf('\n', end);
        int from = Math.max(lineStart, start - CONTEXT_BEFORE);
        int to = Math.min(lineEnd < 0 ? text.length() : lineEnd, end + CONTEXT_AFTER);
        String context = text.substring(from, to).toLowerCase(Locale.ROOT);
        return properties.ageContextMarkers().stream().anyMatch(context::contains);
    }

    // date of birth

    private Optional<String> labelledDateOfBirth(DocumentText document) {
        Matcher matcher = DOB_LABEL.matcher(document.text());
        while (matcher.find()) {
            String raw = matcher.group(1);
            Optional<String> date = ALL_DIGITS.matcher(raw).matches()
                ? ClinicalDates.parseHl7Timestamp(raw).filter(this::notInFuture)
                : pastDate(raw);
            if (date.isPresent()) {
                return date;
            }
        }
        return Optional.empty();
    }

    private Optional<String> hl7DateOfBirth(DocumentText document) {
        for (String[] pid : Hl7Segments.segmentsOfType(document.text(), "PID")) {
            Optional<String> date = ClinicalDates.parseHl7Timestamp(Hl7Segments.field(pid, 7))
                .filter(this::notInFuture);
            if (date.isPresent()) {
                return date;
            }
        }
        return Optional.empty();
    }

    private boolean notInFuture(String isoDate) {
        return !LocalDate.parse(isoDate).isAfter(LocalDate.now(clock));
    }

    private Optional<String> pastDate(String raw) {
        for (DateTimeFormatter format : DOB_FORMATS) {
            try {
                LocalDate date = LocalDate.parse(raw.strip(), format);
                if (date.isAfter(LocalDate.now(clock))) {
                    log.debug("Rejected future date of birth {}", date);
                    return Optional.empty();
                }
                return Optional.of(date.toString());
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", raw, format);
            }
        }
        return Optional.empty();
    }

    // gender

    private static Optional<Gender> genderFrom(Pattern pattern, DocumentText document) {
        Matcher matcher = pattern.matcher(document.text());
        while (matcher.find()) {
            Optional<Gender> gender = Gender.parse(matcher.group(matcher.groupCount()));
            if (gender.isPresent()) {
                return gender;
            }
        }
        return Optional.empty();
    }

    private static Optional<Gender> genderLineScan(DocumentText document) {
        for (String line : document.head(GENDER_SCAN_LINES)) {
            String lower = line.toLowerCase(Locale.ROOT);
            int colon = line.indexOf(':');
            if (colon < 0 || !(lower.contains("gender") || lower.contains("sex"))) {
                continue;
            }
            Optional<Gender> gender = Gender.parse(line.substring(colon + 1));
            if (gender.isPresent()) {
                return gender;
            }
        }
        return Optional.empty();
    }

    // contact details

    private static Optional<String> address(DocumentText document) {
        return firstGroup(ADDRESS, document.text())
            .map(a -> a.replaceAll("\\^+", ", ").replaceAll("\\s+", " ").strip())
            .map(a -> a.length() > MAX_ADDRESS ? a.substring(0, MAX_ADDRESS) : a)
            .filter(a -> a.length() > SHORT_NAME_VALUE);
    }

    private static Optional<String> phone(DocumentText document) {
        return firstGroup(PHONE, document.text())
            .map(String::strip)
            .filter(p -> p.chars().filter(Character::isDigit).count() >= 7);
    }

    private static Optional<String> firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? Optional.of(matcher.group(1).strip()) : Optional.empty();
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }

    private enum AgeCheck {
        /** Accepted as found. */
        NONE,
        /** Rejected only when the number is part of a date, ratio or decimal. */
        NUMERIC,
        /** Also rejected near lab or report vocabulary. */
        CONTEXT,
        /** Like {@link #CONTEXT}, and the line must mention the patient. */
        PATIENT_CONTEXT
    }
}
