package com.medimind.intake.extractor;

import com.medimind.intake.model.ClinicalEvent;
import com.medimind.intake.model.EventType;
import com.medimind.intake.model.Sentinels;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import static com.medimind.intake.extractor.KeywordPatterns.wordStart;

/**
 * Finds admissions, procedures, labs and visits line by line. The most recent date
 * seen in the document is carried forward as the date of each event.
 */
@Slf4j
@Component
public class EventExtractor implements EntityExtractor<ClinicalEvent> {

    private static final Map<EventType, Pattern> KEYWORDS = new EnumMap<>(Map.of(
        EventType.ADMISSION, wordStart("admission", "admitted", "hospitalization", "admit", "discharge"),
        EventType.PROCEDURE, wordStart("procedure", "surgery", "operation", "surgical", "performed", "biopsy", "endoscopy"),
        EventType.LAB, wordStart("lab", "laboratory", "test", "result", "obx", "observation", "blood test", "cbc",
            "complete blood count"),
        EventType.VISIT, wordStart("visit", "appointment", "encounter", "consultation", "examination", "exam")
    ));

    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern LAB_PANEL = wordStart("cbc", "complete blood", "haemoglobin", "hemoglobin",
        "glucose", "creatinine");

    static final String LAB_REPORT_DESCRIPTION = "Laboratory test results";
    static final String LAB_REPORT_SOURCE = "Laboratory report";

    @Override
    public List<ClinicalEvent> extract(String text, String sourceFile) {
        List<ClinicalEvent> events = new ArrayList<>();
        String currentDate = null;

        for (String line : text.split("\\R")) {
            Optional<String> date = ClinicalDates.firstDate(line);
            if (date.isPresent()) {
                currentDate = date.get();
            }

            String stripped = line.strip();
            if (stripped.length() < 3) {
                continue;
            }
            String eventDate = currentDate != null ? currentDate : Sentinels.NOT_SPECIFIED;

            for (EventType type : EventType.values()) {
                if (!KEYWORDS.get(type).matcher(stripped).find()) {
                    continue;
                }
                if (type == EventType.LAB && !looksLikeLabLine(stripped)) {
                    continue;
                }
                events.add(new ClinicalEvent(type, eventDate, stripped, sourceFile, stripped));
            }
        }

        if (LAB_PANEL.matcher(text).find()) {
            String reportDate = currentDate != null ? currentDate : Sentinels.NOT_SPECIFIED;
            events.add(new ClinicalEvent(EventType.LAB, reportDate, LAB_REPORT_DESCRIPTION, sourceFile, LAB_REPORT_SOURCE));
        }

        log.debug("Found {} events in {}", events.size(), sourceFile);
        return events;
    }

    private static boolean looksLikeLabLine(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        return DIGIT.matcher(line).find() || lower.contains("result") || lower.contains("test");
    }
}
