package com.medimind.intake.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.medimind.intake.model.ClinicalDataReport;
import com.medimind.intake.service.ClinicalDataService;
import com.medimind.intake.service.DocumentParserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * {@code --files=a.hl7,b.pdf}: parses the files, runs the extraction pipeline and
 * prints the clinical report as JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "files")
public class IntakeReportRunner implements ApplicationRunner {

    private final DocumentParserService documentParserService;
    private final ClinicalDataService clinicalDataService;
    private final ObjectMapper objectMapper;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        List<String> paths = args.getOptionValues("files");
        if (paths == null || paths.isEmpty()) {
            log.warn("--files given without any file");
            return;
        }
        print(report(readAll(paths)), System.out);
    }

    ClinicalDataReport report(Map<String, byte[]> files) {
        SortedMap<String, String> parsed = documentParserService.parseAll(files);
        return clinicalDataService.extractClinicalData(parsed);
    }

    void print(ClinicalDataReport report, PrintStream out) throws IOException {
        out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
    }

    private static Map<String, byte[]> readAll(List<String> paths) throws IOException {
        Map<String, byte[]> files = new LinkedHashMap<>();
        for (String option : paths) {
            for (String raw : option.split(",")) {
                if (raw.isBlank()) {
                    continue;
                }
                Path path = Path.of(raw.strip());
                files.put(path.getFileName().toString(), Files.readAllBytes(path));
                log.debug("Read {} ({} bytes)", path, files.get(path.getFileName().toString()).length);
            }
        }
        return files;
    }
}
