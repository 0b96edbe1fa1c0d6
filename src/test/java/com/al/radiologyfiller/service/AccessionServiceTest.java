package com.al.radiologyfiller.service;

import com.al.radiologyfiller.exception.ConcurrencyConflictException;
import com.al.radiologyfiller.exception.InvalidStatusTransitionException;
import com.al.radiologyfiller.exception.ResourceNotFoundException;
import com.al.radiologyfiller.exception.StudyInstanceUidConflictException;
import com.al.radiologyfiller.model.Accession;
import com.al.radiologyfiller.model.enums.AccessionStatus;
import com.al.radiologyfiller.repository.AccessionRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class AccessionServiceTest {

    private static final String UID = "1.2.840.113619.2.55.3.604688119";

    @Mock
    private AccessionRepository accessionRepository;

    @InjectMocks
    private AccessionService accessionService;

    @Test
    public void testGetByAccessionNumber_NotFound() {
        when(accessionRepository.findByAccessionNumber("NOPE")).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> accessionService.getByAccessionNumber("NOPE"));
    }

    @Test
    public void testAssignStudyInstanceUid_FirstWriteWins() {
        when(accessionRepository.findByAccessionNumber("ACC1"))
                .thenReturn(Optional.of(accession(AccessionStatus.SCHEDULED, null)))
                .thenReturn(Optional.of(accession(AccessionStatus.SCHEDULED, UID)));
        when(accessionRepository.assignStudyInstanceUid("ACC1", UID)).thenReturn(true);

        Accession result = accessionService.assignStudyInstanceUid("ACC1", UID);

        assertEquals(UID, result.getStudyInstanceUid());
        verify(accessionRepository).assignStudyInstanceUid("ACC1", UID);
    }

    @Test
    public void testAssignStudyInstanceUid_SameUidIsNoOp() {
        when(accessionRepository.findByAccessionNumber("ACC1"))
                .thenReturn(Optional.of(accession(AccessionStatus.SCHEDULED, UID)));

        Accession result = accessionService.assignStudyInstanceUid("ACC1", UID);

        assertEquals(UID, result.getStudyInstanceUid());
        verify(accessionRepository, never()).assignStudyInstanceUid(anyString(), anyString());
    }

    @Test
    public void testAssignStudyInstanceUid_DifferentUidIsRejected() {
        when(accessionRepository.findByAccessionNumber("ACC1"))
                .thenReturn(Optional.of(accession(AccessionStatus.SCHEDULED, UID)));

        StudyInstanceUidConflictException e = assertThrows(StudyInstanceUidConflictException.class,
                () -> accessionService.assignStudyInstanceUid("ACC1", "1.2.3.4"));

        assertFalse(e.isRetryable());
        verify(accessionRepository, never()).assignStudyInstanceUid(anyString(), anyString());
    }

    @Test
    public void testAssignStudyInstanceUid_ConcurrentWriterWon() {
        when(accessionRepository.findByAccessionNumber("ACC1"))
                .thenReturn(Optional.of(accession(AccessionStatus.SCHEDULED, null)))
                .thenReturn(Optional.of(accession(AccessionStatus.SCHEDULED, UID)));
        when(accessionRepository.assignStudyInstanceUid("ACC1", "1.2.3.4")).thenReturn(false);

        assertThrows(StudyInstanceUidConflictException.class,
                () -> accessionService.assignStudyInstanceUid("ACC1", "1.2.3.4"));
    }

    @Test
    public void testUpdateStatus_AllowedTransition() {
        when(accessionRepository.findByAccessionNumber("ACC1"))
                .thenReturn(Optional.of(accession(AccessionStatus.SCHEDULED, null)))
                .thenReturn(Optional.of(accession(AccessionStatus.ARRIVED, null)));
        when(accessionRepository.compareAndSetStatus("ACC1", AccessionStatus.SCHEDULED, AccessionStatus.ARRIVED))
                .thenReturn(true);

        Accession result = accessionService.updateStatus("ACC1", AccessionStatus.ARRIVED);

        assertEquals(AccessionStatus.ARRIVED, result.getStatus());
    }

    @Test
    public void testUpdateStatus_TerminalStateCannotChange() {
        when(accessionRepository.findByAccessionNumber("ACC1"))
                .thenReturn(Optional.of(accession(AccessionStatus.COMPLETED, null)));

        assertThrows(InvalidStatusTransitionException.class,
                () -> accessionService.updateStatus("ACC1", AccessionStatus.IN_PROGRESS));
        verify(accessionRepository, never()).compareAndSetStatus(anyString(), any(), any());
    }

    @Test
    public void testUpdateStatus_LostRace() {
        when(accessionRepository.findByAccessionNumber("ACC1"))
                .thenReturn(Optional.of(accession(AccessionStatus.SCHEDULED, null)));
        when(accessionRepository.compareAndSetStatus("ACC1", AccessionStatus.SCHEDULED, AccessionStatus.CANCELLED))
                .thenReturn(false);

        assertThrows(ConcurrencyConflictException.class,
                () -> accessionService.updateStatus("ACC1", AccessionStatus.CANCELLED));
    }

    @Test
    public void testUpdateStatus_SameStatusIsNoOp() {
        when(accessionRepository.findByAccessionNumber("ACC1"))
                .thenReturn(Optional.of(accession(AccessionStatus.SCHEDULED, null)));

        accessionService.updateStatus("ACC1", AccessionStatus.SCHEDULED);

        verify(accessionRepository, never()).compareAndSetStatus(anyString(), any(), any());
    }

    private Accession accession(AccessionStatus status, String uid) {
        return Accession.builder()
                .accessionNumber("ACC1")
                .patientId("patient-1")
                .status(status)
                .studyInstanceUid(uid)
                .build();
    }
}
