package com.medimind.intake.service;

import com.medimind.intake.model.PatientRecord;

import java.util.Map;

public interface PatientDataService {

    /**
     * Extracts demographics from every file and merges them in filename order:
     * the first file that has a value for a field decides it.
     */
    PatientRecord extractPatientData(Map<String, String> files);
}
