package com.medimind.intake.service;

import com.medimind.intake.model.Gender;
import com.medimind.intake.model.LabResult;
import com.medimind.intake.model.ReferenceRange;
import com.medimind.intake.reference.ReferenceDataTables;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
@Slf4j
@RequiredArgsConstructor
public class ReferenceRangeServiceImpl implements ReferenceRangeService {

    private static final Pattern PARENTHETICAL = Pattern.compile("\\(([^)]*)\\)");

    private final ReferenceDataTables referenceData;

    @Override
    public ReferenceRange lookupLabRange(String testName, Gender gender) {
        if (testName == null || testName.isBlank()) {
            return ReferenceRange.notAvailable();
        }
        Set<String> candidates = candidates(testName);

        Optional<ReferenceRange> range = candidates.stream()
            .flatMap(c -> referenceData.lab(c).or(() -> referenceData.lab(c.replace(' ', '_'))).stream())
            .findFirst()
            .or(() -> candidates.stream()
                .flatMap(c -> referenceData.labKeyForSynonym(c).stream())
                .findFirst()
                .flatMap(referenceData::lab));

        return range
            .map(r -> r.forGender(gender))
            .orElseGet(ReferenceRange::notAvailable);
    }

    @Override
    public ReferenceRange lookupVitalRange(String vitalName) {
        if (vitalName == null || vitalName.isBlank()) {
            return ReferenceRange.notAvailable();
        }
        String key = vitalName.strip().toLowerCase(Locale.ROOT);
        return referenceData.vital(key)
            .or(() -> referenceData.vital(key.replace(' ', '_')))
            .or(() -> referenceData.vital(key.replace('_', ' ')))
            .orElseGet(ReferenceRange::notAvailable);
    }

    @Override
    public List<LabResult> enrichLabs(List<LabResult> labs, Gender gender) {
        List<LabResult> enriched = new ArrayList<>(labs.size());
        int filled = 0;
        for (LabResult lab : labs) {
            if (lab.hasReferenceRange()) {
                enriched.add(lab);
                continue;
            }
            ReferenceRange range = lookupLabRange(lab.testName(), gender);
            if (range.available()) {
                String units = range.units().isBlank() ? lab.units() : range.units();
                enriched.add(lab.withReference(range.normal(), units));
                filled++;
            } else {
                enriched.add(lab);
            }
        }
        log.debug("Filled reference ranges for {} of {} labs", filled, labs.size());
        return enriched;
    }

    // "Hemoglobin (Hb)" -> hemoglobin (hb), hemoglobin, hb
    private static Set<String> candidates(String testName) {
        String name = testName.strip().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(name);

        String outside = PARENTHETICAL.matcher(name).replaceAll(" ").replaceAll("\\s+", " ").strip();
        if (!outside.isEmpty()) {
            candidates.add(outside);
        }
        Matcher inner = PARENTHETICAL.matcher(name);
        while (inner.find()) {
            String content = inner.group(1).strip();
            if (!content.isEmpty()) {
                candidates.add(content);
            }
        }
        return candidates;
    }
}
