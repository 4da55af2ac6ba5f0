package com.medimind.intake.parser;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

final class Labels {

    private Labels() {
    }

    /**
     * {@code birth_date}, {@code birth-date} and {@code birthDate} all become {@code Birth Date}.
     */
    static String humanize(String key) {
        if (key == null) {
            return "";
        }
        String spaced = key
            .replaceAll("(?<=[a-z0-9])(?=[A-Z])", " ")
            .replace('_', ' ')
            .replace('-', ' ');
        return Arrays.stream(spaced.trim().split("\\s+"))
            .filter(word -> !word.isEmpty())
            .map(Labels::capitalize)
            .collect(Collectors.joining(" "));
    }

    private static String capitalize(String word) {
        return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
    }
}
