package com.medimind.intake.extractor;

import java.util.Arrays;
import java.util.Collection;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

final class KeywordPatterns {

    private KeywordPatterns() {
    }

    /**
     * Case-insensitive alternation anchored at a word start, so {@code lab} hits
     * {@code laboratory} but not {@code collaborate}.
     */
    static Pattern wordStart(Collection<String> keywords) {
        return Pattern.compile("\\b(?:" + alternation(keywords) + ")", Pattern.CASE_INSENSITIVE);
    }

    static Pattern wordStart(String... keywords) {
        return wordStart(Arrays.asList(keywords));
    }

    static Pattern wholeWord(String keyword) {
        return Pattern.compile("(?<![\\w])" + Pattern.quote(keyword) + "(?![\\w])", Pattern.CASE_INSENSITIVE);
    }

    private static String alternation(Collection<String> keywords) {
        return keywords.stream()
            .map(Pattern::quote)
            .collect(Collectors.joining("|"));
    }
}
