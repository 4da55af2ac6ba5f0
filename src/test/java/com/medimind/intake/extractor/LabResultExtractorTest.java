package com.medimind.intake.extractor;

import com.medimind.intake.config.ExtractionProperties;
import com.medimind.intake.model.LabResult;
import com.medimind.intake.parser.Hl7Normalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class LabResultExtractorTest {

    private static final String OBX = "OBX|1|NM|2345-7^Glucose^LN||95|mg/dL|70-100|N|||F";

    private final LabResultExtractor extractor = new LabResultExtractor(ExtractionProperties.defaults());

    @Nested
    @DisplayName("Free-text layouts")
    class FreeText {

        @Test
        void shouldReadInlineResult() {
            List<LabResult> labs = extractor.extract("Hemoglobin (Hb) 16.0 g/dL 13-17", "cbc.txt");

            assertThat(labs).singleElement().satisfies(lab -> {
                assertThat(lab.testName()).isEqualTo("Hemoglobin (Hb)");
                assertThat(lab.value()).isEqualTo("16.0");
                assertThat(lab.units()).isEqualTo("g/dL");
                assertThat(lab.referenceRange()).isEqualTo("13-17");
                assertThat(lab.abnormal()).isFalse();
                assertThat(lab.sourceFile()).isEqualTo("cbc.txt");
            });
        }

        @Test
        void shouldFlagValueOutsideRange() {
            List<LabResult> labs = extractor.extract("Hemoglobin (Hb) 18.5 g/dL 13-17", "cbc.txt");

            assertThat(labs).singleElement().satisfies(lab -> assertThat(lab.abnormal()).isTrue());
        }

        @Test
        void shouldReadNameLineFollowedByMethodAndValueLines() {
            String text = """
                Haemoglobin (Hb)
                (Method: Cynmeth Method)
                16.0 g/dL 13-17
                """;

            List<LabResult> labs = extractor.extract(text, "cbc.pdf");

            assertThat(labs).singleElement().satisfies(lab -> {
                assertThat(lab.testName()).isEqualTo("Haemoglobin (Hb)");
                assertThat(lab.value()).isEqualTo("16.0");
                assertThat(lab.referenceRange()).isEqualTo("13-17");
            });
        }

        @Test
        void shouldReadColonSeparatedResultWithParenthesisedRange() {
            List<LabResult> labs = extractor.extract("Potassium: 5.8 mEq/L (3.5-5.0)", "chem.txt");

            assertThat(labs).singleElement().satisfies(lab -> {
                assertThat(lab.testName()).isEqualTo("Potassium");
                assertThat(lab.units()).isEqualTo("mEq/L");
                assertThat(lab.referenceRange()).isEqualTo("3.5-5.0");
                assertThat(lab.abnormal()).isTrue();
            });
        }

        @ParameterizedTest
        @CsvSource({
            "'1. Hemoglobin 16.0 g/dL 13-17', Hemoglobin, 16.0, 13-17",
            "'* Glucose 95 mg/dL 70-100', Glucose, 95, 70-100",
            "'CBC: Hemoglobin: 13.5 g/dL (12-16)', Hemoglobin, 13.5, 12-16"
        })
        void shouldFindResultsThatDoNotStartTheLine(String line, String name, String value, String range) {
            List<LabResult> labs = extractor.extract(line, "cbc.txt");

            assertThat(labs)
                .extracting(LabResult::testName, LabResult::value, LabResult::referenceRange)
                .containsExactly(tuple(name, value, range));
        }

        @Test
        void shouldReadEveryResultOnARow() {
            List<LabResult> labs = extractor.extract("Sodium: 140 mmol/L (135-145)  Potassium: 4.1 mmol/L (3.5-5.0)", "chem.txt");

            assertThat(labs).extracting(LabResult::testName).containsExactly("Sodium", "Potassium");
        }

        @Test
        void shouldNotTreatRangeOrDateLinesAsResults() {
            String text = "Reference Range: 70-100\nReport Date: 2024-02-01\nPhone: 555-123-4567";

            assertThat(extractor.extract(text, "note.txt")).isEmpty();
        }

        @Test
        void shouldRemoveMethodFromName() {
            List<LabResult> labs = extractor.extract("Glucose Fasting (Hexokinase) 77 mg/dL 70-100", "chem.txt");

            assertThat(labs).extracting(LabResult::testName).containsExactly("Glucose Fasting");
        }

        @Test
        void shouldDropNoiseRows() {
            assertThat(extractor.extract("ITDOSE 5 mg/dL 1-10", "chem.txt")).isEmpty();
        }

        @Test
        void shouldKeepFirstOfDuplicateRows() {
            String text = "Sodium 140 mEq/L 136-145\nSodium 140 mEq/L 136-145";

            assertThat(extractor.extract(text, "chem.txt")).hasSize(1);
        }
    }

    @Nested
    @DisplayName("HL7 observations")
    class Observations {

        @Test
        void shouldReadRawObxSegment() {
            List<LabResult> labs = extractor.extract(OBX, "lab.hl7");

            assertThat(labs).singleElement().satisfies(lab -> {
                assertThat(lab.testName()).isEqualTo("Glucose");
                assertThat(lab.value()).isEqualTo("95");
                assertThat(lab.units()).isEqualTo("mg/dL");
                assertThat(lab.referenceRange()).isEqualTo("70-100");
            });
        }

        @Test
        void shouldReadNormalizedObservationOnce() {
            String normalized = new Hl7Normalizer().normalize(OBX + "\nOBX|2|NM|2160-0^Creatinine^LN||1.9|mg/dL|0.6-1.2|H|||F");

            List<LabResult> labs = extractor.extract(normalized, "lab.hl7");

            assertThat(labs).extracting(LabResult::testName, LabResult::value, LabResult::abnormal)
                .containsExactly(
                    tuple("Glucose", "95", false),
                    tuple("Creatinine", "1.9", true));
        }

        @Test
        void shouldMarkMissingRangeAsNotSpecified() {
            List<LabResult> labs = extractor.extract("OBX|1|NM|GLU^Glucose||150|mg/dL||H", "lab.hl7");

            assertThat(labs).singleElement().satisfies(lab -> {
                assertThat(lab.referenceRange()).isEqualTo("Not specified");
                assertThat(lab.abnormal()).isFalse();
            });
        }
    }

    @Nested
    @DisplayName("Cleaning")
    class Cleaning {

        @Test
        void shouldBeIdempotent() {
            String text = """
                Glucose Fasting (Hexokinase) 77 mg/dL 70-100
                Haemoglobin (Hb)
                (Method: Cynmeth Method)
                16.0 g/dL 13-17
                Potassium: 5.8 mEq/L (3.5-5.0)
                """;
            List<LabResult> once = extractor.extract(text, "mixed.txt");

            assertThat(extractor.cleanAndDeduplicate(once)).isEqualTo(once);
        }

        @Test
        void shouldStripMethodSuffixesRepeatedly() {
            assertThat(extractor.cleanName("Creatinine (Jaffe method) (Kinetic)")).isEqualTo("Creatinine");
        }
    }

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
        "18.2; 13-17; true",
        "16.0; 13-17; false",
        "12.9; 13.0 - 17.0; true",
        "12,000; 4,000-11,000; true",
        "4,500; 4,000-11,000; false",
        "5; <10; false",
        "abc; 1-2; false"
    })
    void shouldDecideAbnormalOnlyForTwoSidedRanges(String value, String range, boolean expected) {
        assertThat(LabResultExtractor.isAbnormal(value, range)).isEqualTo(expected);
    }
}
