package com.medimind.intake.service;

import com.medimind.intake.model.Gender;
import com.medimind.intake.model.LabResult;
import com.medimind.intake.model.ReferenceRange;

import java.util.List;

public interface ReferenceRangeService {

    /**
     * Standard range for a lab test, sex-specific when {@code gender} is known.
     * Unknown tests give {@link ReferenceRange#notAvailable()}.
     */
    ReferenceRange lookupLabRange(String testName, Gender gender);

    ReferenceRange lookupVitalRange(String vitalName);

    /**
     * Fills the range of every lab that has none in its document. Abnormal flags are left alone.
     */
    List<LabResult> enrichLabs(List<LabResult> labs, Gender gender);
}
