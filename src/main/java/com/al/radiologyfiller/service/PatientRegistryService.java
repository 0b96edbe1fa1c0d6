package com.al.radiologyfiller.service;

import com.al.radiologyfiller.exception.PatientNotFoundException;
import com.al.radiologyfiller.hl7.PatientDemographics;
import com.al.radiologyfiller.model.Patient;
import com.al.radiologyfiller.repository.PatientRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Resolves the patient an order refers to. Patients are never created here.
 * <p>
 * Lookup order: PID-3 against the registry identifier, then against the registry id, then the
 * PID-5 name with the PID-7 birth date. A name without a birth date only matches when exactly one
 * patient carries it. Ambiguous matches are treated as not found.
 */
@Slf4j
@Service
public class PatientRegistryService {

    private final PatientRepository patientRepository;

    public PatientRegistryService(PatientRepository patientRepository) {
        this.patientRepository = patientRepository;
    }

    public Patient resolve(PatientDemographics demographics) {
        if (demographics.hasIdentifier()) {
            Optional<Patient> byIdentifier = patientRepository.findFirstByPatientIdentifier(demographics.getIdentifier());
            if (byIdentifier.isPresent()) {
                return byIdentifier.get();
            }
            Optional<Patient> byId = patientRepository.findById(demographics.getIdentifier());
            if (byId.isPresent()) {
                return byId.get();
            }
            log.debug("No patient with identifier {}, trying name match", demographics.getIdentifier());
        }

        if (demographics.hasName()) {
            List<Patient> candidates = demographics.getDateOfBirth() != null
                    ? patientRepository.findByFirstNameIgnoreCaseAndLastNameIgnoreCaseAndDateOfBirth(
                            demographics.getFirstName(), demographics.getLastName(), demographics.getDateOfBirth())
                    : patientRepository.findByFirstNameIgnoreCaseAndLastNameIgnoreCase(
                            demographics.getFirstName(), demographics.getLastName());
            if (candidates.size() == 1) {
                return candidates.get(0);
            }
            if (candidates.size() > 1) {
                log.warn("{} patients match {}", candidates.size(), demographics.describe());
                throw new PatientNotFoundException(demographics.describe() + " (ambiguous, "
                        + candidates.size() + " matches)");
            }
        }
        throw new PatientNotFoundException(demographics.describe());
    }

    public Optional<Patient> findById(String patientId) {
        return patientRepository.findById(patientId);
    }
}
