package com.medimind.intake.parser;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.medimind.intake.parser.Hl7Segments.codedText;
import static com.medimind.intake.parser.Hl7Segments.field;
import static java.util.Map.entry;

@Slf4j
@Component
public class Hl7Normalizer implements DocumentNormalizer {

    private static final int GENERIC_FIELD_COUNT = 5;

    private static final Map<String, String> SEGMENT_LABELS = Map.ofEntries(
        entry("MSH", "Message Header"),
        entry("PID", "Patient Identification"),
        entry("PV1", "Patient Visit"),
        entry("OBX", "Observation/Result"),
        entry("ORC", "Common Order"),
        entry("OBR", "Observation Request"),
        entry("NTE", "Notes and Comments"),
        entry("AL1", "Patient Allergy Information"),
        entry("DG1", "Diagnosis"),
        entry("PR1", "Procedures"),
        entry("RXA", "Pharmacy/Treatment Administration"),
        entry("RXR", "Pharmacy/Treatment Route"),
        entry("RXO", "Pharmacy/Treatment Order"),
        entry("SPM", "Specimen"),
        entry("NK1", "Next of Kin"),
        entry("IN1", "Insurance"),
        entry("ACC", "Accident"),
        entry("UB1", "UB82"),
        entry("UB2", "UB92 Data")
    );

    @Override
    public String normalize(String content) {
        List<String> out = new ArrayList<>();

        for (String[] fields : Hl7Segments.segments(content)) {
            if (fields.length < 2) {
                continue;
            }
            String type = fields[0];
            if (!out.isEmpty()) {
                out.add("");
            }
            out.add("[" + SEGMENT_LABELS.getOrDefault(type, type) + " (" + type + ")]");

            switch (type) {
                case "MSH" -> {
                    line(out, "Sending Application", field(fields, 2));
                    line(out, "Receiving Application", field(fields, 4));
                    line(out, "Message Type", field(fields, 8));
                    line(out, "Message Control ID", field(fields, 9));
                }
                case "PID" -> {
                    line(out, "Patient ID", field(fields, 3));
                    line(out, "Patient Name", field(fields, 5));
                    line(out, "Date of Birth", field(fields, 7));
                    line(out, "Sex", field(fields, 8));
                    line(out, "Address", field(fields, 11));
                    line(out, "Phone", field(fields, 13));
                }
                case "OBX" -> {
                    line(out, "Observation", codedText(field(fields, 3)));
                    line(out, "Value", (field(fields, 5) + " " + field(fields, 6)).strip());
                    line(out, "Reference Range", field(fields, 7));
                    line(out, "Abnormal Flag", field(fields, 8));
                    line(out, "Status", field(fields, 11));
                }
                case "DG1" -> {
                    line(out, "Diagnosis Code", field(fields, 3));
                    line(out, "Diagnosis Description", field(fields, 4));
                }
                case "NTE" -> line(out, "Note", field(fields, 3));
                case "AL1" -> {
                    line(out, "Allergy", codedText(field(fields, 3)));
                    line(out, "Reaction", field(fields, 5));
                }
                case "RXA" -> {
                    line(out, "Medication", codedText(field(fields, 5)));
                    line(out, "Administration Date", field(fields, 3));
                }
                default -> genericLine(out, fields);
            }
        }

        log.debug("Normalized HL7 message into {} lines", out.size());
        return out.isEmpty() ? content : String.join("\n", out);
    }

    private static void line(List<String> out, String label, String value) {
        if (value != null && !value.isBlank()) {
            out.add("  " + label + ": " + value);
        }
    }

    private static void genericLine(List<String> out, String[] fields) {
        List<String> keyFields = Arrays.asList(fields)
            .subList(1, Math.min(fields.length, GENERIC_FIELD_COUNT + 1));
        if (keyFields.stream().anyMatch(f -> !f.isBlank())) {
            out.add("  Data: " + keyFields.stream().map(String::strip).collect(Collectors.joining(" | ")));
        }
    }
}
