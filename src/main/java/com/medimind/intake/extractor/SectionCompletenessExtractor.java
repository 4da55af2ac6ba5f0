package com.medimind.intake.extractor;

import com.medimind.intake.model.ClinicalSection;
import com.medimind.intake.model.SectionStatus;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Rates how completely each standard note section is covered by counting the
 * distinct section keywords that occur as whole words.
 */
@Component
public class SectionCompletenessExtractor {

    private static final Map<ClinicalSection, List<Pattern>> PATTERNS = new EnumMap<>(ClinicalSection.class);

    static {
        for (ClinicalSection section : ClinicalSection.values()) {
            PATTERNS.put(section, section.keywords().stream()
                .map(KeywordPatterns::wholeWord)
                .collect(Collectors.toList()));
        }
    }

    /**
     * Every section appears in the result, keyed by its snake_case name, in declaration order.
     */
    public Map<String, SectionStatus> extract(String text) {
        Map<String, SectionStatus> sections = new LinkedHashMap<>();
        for (ClinicalSection section : ClinicalSection.values()) {
            int hits = (int) PATTERNS.get(section).stream()
                .filter(p -> p.matcher(text).find())
                .count();
            sections.put(section.value(), SectionStatus.fromHitCount(hits));
        }
        return Collections.unmodifiableMap(sections);
    }
}
