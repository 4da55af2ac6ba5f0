package com.medimind.intake.service;

import com.medimind.intake.model.PatientRecord;
import com.medimind.intake.patient.DemographicsFallback;
import com.medimind.intake.patient.PatientDemographicsExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

@Service
@Slf4j
public class PatientDataServiceImpl implements PatientDataService {

    private final PatientDemographicsExtractor demographicsExtractor;
    private final DemographicsFallback demographicsFallback;
    private final Executor extractionExecutor;

    public PatientDataServiceImpl(
        PatientDemographicsExtractor demographicsExtractor,
        DemographicsFallback demographicsFallback,
        @Qualifier("extractionTaskExecutor") Executor extractionExecutor
    ) {
        this.demographicsExtractor = demographicsExtractor;
        this.demographicsFallback = demographicsFallback;
        this.extractionExecutor = extractionExecutor;
    }

    @Override
    public PatientRecord extractPatientData(Map<String, String> files) {
        if (files == null || files.isEmpty()) {
            return PatientRecord.empty();
        }

        List<Map.Entry<String, CompletableFuture<PatientRecord>>> pending = new ArrayList<>();
        new TreeMap<>(files).forEach((filename, text) -> pending.add(Map.entry(filename,
            CompletableFuture.supplyAsync(() -> extractFromFile(filename, text), extractionExecutor))));

        PatientRecord merged = PatientRecord.empty();
        for (Map.Entry<String, CompletableFuture<PatientRecord>> file : pending) {
            try {
                merged = merged.mergeWith(file.getValue().join());
            } catch (CompletionException e) {
                log.error("Patient extraction failed for {}: {}", file.getKey(), e.getCause().getMessage(), e.getCause());
            }
        }

        log.info("Extracted patient data from {} files (name found: {})", files.size(), merged.name() != null);
        return merged;
    }

    private PatientRecord extractFromFile(String filename, String text) {
        PatientRecord record = demographicsExtractor.extract(text);
        log.debug("Demographics from {}: name={}, age={}, gender={}", filename,
            record.name() != null, record.age(), record.gender());
        return demographicsFallback.fillMissing(record, text, filename);
    }
}
