package com.medimind.intake.service;

import com.medimind.intake.model.ClinicalDataReport;

import java.util.Map;

public interface ClinicalDataService {

    /**
     * Runs every entity extractor over each normalized file and aggregates the results,
     * with lab ranges filled from the reference tables.
     */
    ClinicalDataReport extractClinicalData(Map<String, String> files);
}
