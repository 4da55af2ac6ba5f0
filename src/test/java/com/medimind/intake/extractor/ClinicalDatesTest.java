package com.medimind.intake.extractor;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ClinicalDatesTest {

    @ParameterizedTest
    @CsvSource({
        "2024-1-5, 2024-01-05",
        "03/15/2024, 2024-03-15",
        "15/03/2024, 2024-03-15",
        "2024/02/29, 2024-02-29",
        "05-06-2024, 2024-06-05",
        "2024.12.01, 2024-12-01"
    })
    void shouldNormalizeSupportedFormatsToIso(String raw, String expected) {
        assertThat(ClinicalDates.parse(raw)).contains(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"2024-02-30", "2023/02/29", "13/13/2024", "yesterday", ""})
    void shouldRejectImpossibleDates(String raw) {
        assertThat(ClinicalDates.parse(raw)).isEmpty();
    }

    @Test
    void shouldPreferMonthFirstForAmbiguousSlashDates() {
        assertThat(ClinicalDates.parse("04/05/2024")).contains("2024-04-05");
    }

    @Test
    void shouldSkipUnparsableMatchOnSameLine() {
        assertThat(ClinicalDates.firstDate("Seen 2024-02-30, again on 2024-03-01")).contains("2024-03-01");
    }

    @Test
    void shouldNotMatchDigitsOfLongerNumbers() {
        assertThat(ClinicalDates.firstDate("Accession 12024-01-0599")).isEmpty();
    }

    @Test
    void shouldReadHl7Timestamps() {
        assertThat(ClinicalDates.parseHl7Timestamp("20240115")).contains("2024-01-15");
        assertThat(ClinicalDates.parseHl7Timestamp("202401151030")).contains("2024-01-15");
        assertThat(ClinicalDates.parseHl7Timestamp("20241301")).isEmpty();
        assertThat(ClinicalDates.parseHl7Timestamp("2024")).isEmpty();
    }

    @Test
    void shouldFallBackToSentinel() {
        assertThat(ClinicalDates.orNotSpecified(Optional.empty())).isEqualTo("Not specified");
    }
}
