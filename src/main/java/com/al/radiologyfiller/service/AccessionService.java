package com.al.radiologyfiller.service;

import com.al.radiologyfiller.exception.ConcurrencyConflictException;
import com.al.radiologyfiller.exception.InvalidStatusTransitionException;
import com.al.radiologyfiller.exception.ResourceNotFoundException;
import com.al.radiologyfiller.exception.StudyInstanceUidConflictException;
import com.al.radiologyfiller.model.Accession;
import com.al.radiologyfiller.model.enums.AccessionStatus;
import com.al.radiologyfiller.repository.AccessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reads accessions, applies workflow status changes and fills the DICOM Study Instance UID slot.
 */
@Slf4j
@Service
public class AccessionService {

    private final AccessionRepository accessionRepository;

    public AccessionService(AccessionRepository accessionRepository) {
        this.accessionRepository = accessionRepository;
    }

    public Accession getByAccessionNumber(String accessionNumber) {
        return accessionRepository.findByAccessionNumber(accessionNumber)
                .orElseThrow(() -> new ResourceNotFoundException("Accession", accessionNumber));
    }

    public Accession updateStatus(String accessionNumber, AccessionStatus next) {
        Accession accession = getByAccessionNumber(accessionNumber);
        AccessionStatus current = accession.getStatus();
        if (current == next) {
            return accession;
        }
        if (current == null || !current.canTransitionTo(next)) {
            throw new InvalidStatusTransitionException("Accession", accessionNumber, current, next);
        }
        if (!accessionRepository.compareAndSetStatus(accessionNumber, current, next)) {
            throw new ConcurrencyConflictException("Status of accession " + accessionNumber + " changed concurrently");
        }
        log.info("Accession {} moved from {} to {}", accessionNumber, current, next);
        return getByAccessionNumber(accessionNumber);
    }

    /**
     * Write-once assignment. The first UID wins; sending the same UID again is accepted, a different
     * one is rejected.
     *
     * @throws StudyInstanceUidConflictException if another UID is already assigned
     */
    public Accession assignStudyInstanceUid(String accessionNumber, String studyInstanceUid) {
        Accession accession = getByAccessionNumber(accessionNumber);
        if (accession.getStudyInstanceUid() == null
                && accessionRepository.assignStudyInstanceUid(accessionNumber, studyInstanceUid)) {
            log.info("Study Instance UID {} assigned to accession {}", studyInstanceUid, accessionNumber);
            return getByAccessionNumber(accessionNumber);
        }

        // already set, possibly by a concurrent writer
        Accession current = accession.getStudyInstanceUid() == null ? getByAccessionNumber(accessionNumber) : accession;
        if (studyInstanceUid.equals(current.getStudyInstanceUid())) {
            log.debug("Study Instance UID {} already recorded on accession {}", studyInstanceUid, accessionNumber);
            return current;
        }
        log.warn("Rejected Study Instance UID {} for accession {}: {} is already assigned, needs operator review",
                studyInstanceUid, accessionNumber, current.getStudyInstanceUid());
        throw new StudyInstanceUidConflictException(accessionNumber, current.getStudyInstanceUid(), studyInstanceUid);
    }
}
