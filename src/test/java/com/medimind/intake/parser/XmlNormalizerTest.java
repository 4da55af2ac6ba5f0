package com.medimind.intake.parser;

import com.medimind.intake.exception.DocumentParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class XmlNormalizerTest {

    private final XmlNormalizer normalizer = new XmlNormalizer();

    @Nested
    @DisplayName("Well-formed documents")
    class WellFormed {

        @Test
        void shouldRenderCdaAsIndentedOutline() {
            String xml = """
                <ClinicalDocument xmlns="urn:hl7-org:v3">
                  <recordTarget>
                    <patientRole>
                      <id extension="12345"/>
                      <patient>
                        <name><given>Jane</given><family>Doe</family></name>
                        <administrativeGenderCode code="F"/>
                      </patient>
                    </patientRole>
                  </recordTarget>
                </ClinicalDocument>
                """;

            assertThat(normalizer.normalize(xml)).isEqualTo(String.join("\n",
                "Clinical Document:",
                "  Record Target:",
                "    Patient Role:",
                "      Id (extension=12345):",
                "      Patient:",
                "        Name:",
                "          Given: Jane",
                "          Family: Doe",
                "        Administrative Gender Code (code=F):"));
        }

        @Test
        void shouldKeepTextThatFollowsChildElement() {
            String text = normalizer.normalize("<note>Start <b>bold</b> tail text</note>");

            assertThat(text).isEqualTo("Note: Start\n  B: bold\n  tail text");
        }

        @Test
        void shouldDropPrefixFromQualifiedNames() {
            String text = normalizer.normalize("<v3:entry xmlns:v3=\"urn:hl7-org:v3\"><v3:code>X1</v3:code></v3:entry>");

            assertThat(text).isEqualTo("Entry:\n  Code: X1");
        }
    }

    @Nested
    @DisplayName("Rejected documents")
    class Rejected {

        @Test
        void shouldThrowOnMalformedMarkup() {
            assertThatThrownBy(() -> normalizer.normalize("<a><b>text</a>"))
                .isInstanceOf(DocumentParseException.class);
        }

        @Test
        void shouldRefuseDoctypeDeclarations() {
            String xxe = "<!DOCTYPE foo [<!ENTITY xxe SYSTEM \"file:///etc/passwd\">]><foo>&xxe;</foo>";

            assertThatThrownBy(() -> normalizer.normalize(xxe))
                .isInstanceOf(DocumentParseException.class);
        }

        @Test
        void shouldStripTagsAsLastResort() {
            assertThat(normalizer.stripTags("<a><b>Glucose  95</b>\n mg/dL</a>")).isEqualTo("Glucose 95 mg/dL");
            assertThat(normalizer.stripTags("<only-tags/>")).isEqualTo("<only-tags/>");
        }
    }
}
