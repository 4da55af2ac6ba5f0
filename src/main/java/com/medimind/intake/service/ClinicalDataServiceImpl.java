package com.medimind.intake.service;

import com.medimind.intake.extractor.EventExtractor;
import com.medimind.intake.extractor.LabResultExtractor;
import com.medimind.intake.extractor.MedicationExtractor;
import com.medimind.intake.extractor.RedFlagExtractor;
import com.medimind.intake.extractor.SectionCompletenessExtractor;
import com.medimind.intake.model.ClinicalDataReport;
import com.medimind.intake.model.ClinicalEvent;
import com.medimind.intake.model.ClinicalSummary;
import com.medimind.intake.model.FileExtraction;
import com.medimind.intake.model.LabResult;
import com.medimind.intake.model.Medication;
import com.medimind.intake.model.PatientRecord;
import com.medimind.intake.model.RedFlag;
import com.medimind.intake.model.ReferenceRange;
import com.medimind.intake.model.SectionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

@Service
@Slf4j
public class ClinicalDataServiceImpl implements ClinicalDataService {

    private final EventExtractor eventExtractor;
    private final LabResultExtractor labResultExtractor;
    private final MedicationExtractor medicationExtractor;
    private final RedFlagExtractor redFlagExtractor;
    private final SectionCompletenessExtractor sectionExtractor;
    private final PatientDataService patientDataService;
    private final ReferenceRangeService referenceRangeService;
    private final Executor extractionExecutor;

    public ClinicalDataServiceImpl(
        EventExtractor eventExtractor,
        LabResultExtractor labResultExtractor,
        MedicationExtractor medicationExtractor,
        RedFlagExtractor redFlagExtractor,
        SectionCompletenessExtractor sectionExtractor,
        PatientDataService patientDataService,
        ReferenceRangeService referenceRangeService,
        @Qualifier("extractionTaskExecutor") Executor extractionExecutor
    ) {
        this.eventExtractor = eventExtractor;
        this.labResultExtractor = labResultExtractor;
        this.medicationExtractor = medicationExtractor;
        this.redFlagExtractor = redFlagExtractor;
        this.sectionExtractor = sectionExtractor;
        this.patientDataService = patientDataService;
        this.referenceRangeService = referenceRangeService;
        this.extractionExecutor = extractionExecutor;
    }

    @Override
    public ClinicalDataReport extractClinicalData(Map<String, String> files) {
        if (files == null || files.isEmpty()) {
            return ClinicalDataReport.empty();
        }
        log.info("Extracting clinical data from {} files", files.size());

        List<FileExtraction> extractions = extractAll(new TreeMap<>(files));

        List<ClinicalEvent> events = new ArrayList<>();
        List<LabResult> labs = new ArrayList<>();
        List<Medication> medications = new ArrayList<>();
        List<RedFlag> redFlags = new ArrayList<>();
        Map<String, Map<String, SectionStatus>> sections = new LinkedHashMap<>();
        for (FileExtraction extraction : extractions) {
            events.addAll(extraction.events());
            labs.addAll(extraction.labs());
            medications.addAll(extraction.medications());
            redFlags.addAll(extraction.redFlags());
            sections.put(extraction.sourceFile(), extraction.sections());
        }

        // List.sort is stable, so same-date entries keep file and line order
        events.sort(Comparator.comparing(ClinicalEvent::date));
        medications.sort(Comparator.comparing(Medication::startDate));

        PatientRecord patient = patientDataService.extractPatientData(files);
        List<LabResult> enrichedLabs = referenceRangeService.enrichLabs(labs, patient.gender());

        Map<String, ReferenceRange> vitalReferences = new LinkedHashMap<>();
        patient.vitalSigns().keySet()
            .forEach(vital -> vitalReferences.put(vital, referenceRangeService.lookupVitalRange(vital)));

        ClinicalSummary summary = new ClinicalSummary(
            events.size(),
            enrichedLabs.size(),
            (int) enrichedLabs.stream().filter(LabResult::abnormal).count(),
            medications.size(),
            redFlags.size()
        );
        log.info("Clinical data: {} events, {} labs ({} abnormal), {} medications, {} red flags",
            summary.totalEvents(), summary.totalLabs(), summary.abnormalLabs(),
            summary.totalMedications(), summary.totalRedFlags());

        return new ClinicalDataReport(
            List.copyOf(events),
            List.copyOf(enrichedLabs),
            List.copyOf(medications),
            List.copyOf(redFlags),
            sections,
            summary,
            patient,
            vitalReferences
        );
    }

    private List<FileExtraction> extractAll(TreeMap<String, String> files) {
        List<Map.Entry<String, CompletableFuture<FileExtraction>>> pending = new ArrayList<>();
        files.forEach((filename, text) -> pending.add(Map.entry(filename,
            CompletableFuture.supplyAsync(() -> extractFile(filename, text), extractionExecutor))));

        List<FileExtraction> extractions = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<FileExtraction>> file : pending) {
            try {
                extractions.add(file.getValue().join());
            } catch (CompletionException e) {
                log.error("Clinical extraction failed for {}: {}", file.getKey(), e.getCause().getMessage(), e.getCause());
            }
        }
        return extractions;
    }

    private FileExtraction extractFile(String filename, String text) {
        return new FileExtraction(
            filename,
            eventExtractor.extract(text, filename),
            labResultExtractor.extract(text, filename),
            medicationExtractor.extract(text, filename),
            redFlagExtractor.extract(text, filename),
            sectionExtractor.extract(text)
        );
    }
}
