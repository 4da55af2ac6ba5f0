package com.medimind.intake.extractor;

import com.medimind.intake.config.ExtractionProperties;
import com.medimind.intake.model.RedFlag;
import com.medimind.intake.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * One flag per line that literally carries a warning keyword. The first keyword in
 * list order names the flag.
 */
@Slf4j
@Component
public class RedFlagExtractor implements EntityExtractor<RedFlag> {

    private final List<String> keywords;

    public RedFlagExtractor(ExtractionProperties properties) {
        this.keywords = properties.redFlagKeywords().stream()
            .map(k -> k.toLowerCase(Locale.ROOT))
            .collect(Collectors.toList());
    }

    @Override
    public List<RedFlag> extract(String text, String sourceFile) {
        List<RedFlag> flags = new ArrayList<>();
        for (String line : text.split("\\R")) {
            String lower = line.toLowerCase(Locale.ROOT);
            keywords.stream()
                .filter(lower::contains)
                .findFirst()
                .ifPresent(keyword -> {
                    String flagText = line.strip();
                    flags.add(new RedFlag(typeOf(keyword), flagText, severityOf(lower), sourceFile, flagText));
                });
        }
        log.debug("Found {} red flags in {}", flags.size(), sourceFile);
        return flags;
    }

    private static Severity severityOf(String lowerLine) {
        return lowerLine.contains("critical") || lowerLine.contains("urgent") ? Severity.HIGH : Severity.MEDIUM;
    }

    // "adverse event:" -> "Adverse Event"
    static String typeOf(String keyword) {
        String bare = keyword.split(":")[0].strip();
        return Arrays.stream(bare.split("\\s+"))
            .filter(w -> !w.isEmpty())
            .map(w -> Character.toUpperCase(w.charAt(0)) + w.substring(1).toLowerCase(Locale.ROOT))
            .collect(Collectors.joining(" "));
    }
}
