package com.al.radiologyfiller.model.enums;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StatusLifecycleTest {

    @Test
    public void testAccessionStatus_ForwardOnly() {
        assertTrue(AccessionStatus.SCHEDULED.canTransitionTo(AccessionStatus.ARRIVED));
        assertTrue(AccessionStatus.ARRIVED.canTransitionTo(AccessionStatus.IN_PROGRESS));
        assertTrue(AccessionStatus.IN_PROGRESS.canTransitionTo(AccessionStatus.COMPLETED));
        assertFalse(AccessionStatus.IN_PROGRESS.canTransitionTo(AccessionStatus.ARRIVED));
        assertFalse(AccessionStatus.ARRIVED.canTransitionTo(AccessionStatus.SCHEDULED));
    }

    @Test
    public void testAccessionStatus_CancelFromAnyOpenState() {
        for (AccessionStatus status : AccessionStatus.values()) {
            assertEquals(!status.isTerminal(), status.canTransitionTo(AccessionStatus.CANCELLED), status.name());
        }
    }

    @Test
    public void testAccessionStatus_TerminalStatesAreFinal() {
        assertTrue(AccessionStatus.COMPLETED.allowedNext().isEmpty());
        assertTrue(AccessionStatus.CANCELLED.allowedNext().isEmpty());
    }

    @Test
    public void testProcedureRequestStatus_Lifecycle() {
        assertTrue(ProcedureRequestStatus.PENDING.canTransitionTo(ProcedureRequestStatus.SCHEDULED));
        assertTrue(ProcedureRequestStatus.SCHEDULED.canTransitionTo(ProcedureRequestStatus.COMPLETED));
        assertFalse(ProcedureRequestStatus.SCHEDULED.canTransitionTo(ProcedureRequestStatus.PENDING));
        assertFalse(ProcedureRequestStatus.CANCELLED.canTransitionTo(ProcedureRequestStatus.PENDING));
        assertFalse(ProcedureRequestStatus.COMPLETED.canTransitionTo(ProcedureRequestStatus.CANCELLED));
    }

    @Test
    public void testFromValue_AcceptsDisplayForms() {
        assertEquals(AccessionStatus.IN_PROGRESS, AccessionStatus.fromValue("InProgress"));
        assertEquals(AccessionStatus.IN_PROGRESS, AccessionStatus.fromValue("in progress"));
        assertEquals(AccessionStatus.ARRIVED, AccessionStatus.fromValue("ARRIVED"));
        assertEquals(ProcedureRequestStatus.CANCELLED, ProcedureRequestStatus.fromValue("cancelled"));
    }

    @Test
    public void testFromValue_RejectsUnknown() {
        assertThrows(IllegalArgumentException.class, () -> AccessionStatus.fromValue("Reported"));
        assertThrows(IllegalArgumentException.class, () -> ProcedureRequestStatus.fromValue(null));
    }
}
