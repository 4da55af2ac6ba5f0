package com.medimind.intake.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Builder(toBuilder = true)
public record PatientRecord(
    String name,

    Integer age,

    @JsonProperty("date_of_birth")
    String dateOfBirth,

    Gender gender,

    @JsonProperty("patient_id")
    String patientId,

    String address,

    String phone,

    String email,

    @JsonProperty("vital_signs")
    Map<String, String> vitalSigns
) {

    public PatientRecord {
        vitalSigns = vitalSigns == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(vitalSigns));
    }

    public static PatientRecord empty() {
        return PatientRecord.builder().build();
    }

    /**
     * True when none of name, age and gender was found.
     */
    public boolean missingIdentity() {
        return name == null && age == null && gender == null;
    }

    /**
     * Keeps every value already present here and takes the rest from {@code other}.
     * Vital signs from {@code other} only fill keys that are absent here.
     */
    public PatientRecord mergeWith(PatientRecord other) {
        if (other == null) {
            return this;
        }
        Map<String, String> vitals = new LinkedHashMap<>(vitalSigns);
        other.vitalSigns().forEach(vitals::putIfAbsent);

        return new PatientRecord(
            name != null ? name : other.name(),
            age != null ? age : other.age(),
            dateOfBirth != null ? dateOfBirth : other.dateOfBirth(),
            gender != null ? gender : other.gender(),
            patientId != null ? patientId : other.patientId(),
            address != null ? address : other.address(),
            phone != null ? phone : other.phone(),
            email != null ? email : other.email(),
            vitals
        );
    }
}
