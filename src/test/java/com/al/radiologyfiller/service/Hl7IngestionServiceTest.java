package com.al.radiologyfiller.service;

import ca.uhn.hl7v2.HapiContext;
import ca.uhn.hl7v2.model.Message;
import com.al.radiologyfiller.config.PerformanceConfig;
import com.al.radiologyfiller.config.RadiologyProperties;
import com.al.radiologyfiller.dto.IngestionResponse;
import com.al.radiologyfiller.exception.AccessionPatientConflictException;
import com.al.radiologyfiller.exception.ConcurrencyConflictException;
import com.al.radiologyfiller.exception.ErrorKind;
import com.al.radiologyfiller.exception.PatientNotFoundException;
import com.al.radiologyfiller.hl7.Hl7MessageParser;
import com.al.radiologyfiller.hl7.OrderIdentifierExtractor;
import com.al.radiologyfiller.hl7.PatientDemographics;
import com.al.radiologyfiller.model.Accession;
import com.al.radiologyfiller.model.Patient;
import com.al.radiologyfiller.model.ProcedureRequest;
import com.al.radiologyfiller.model.enums.IngestionChannel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static com.al.radiologyfiller.hl7.OrmMessageBuilder.orm;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class Hl7IngestionServiceTest {

    @Mock
    private PatientRegistryService patientRegistryService;

    @Mock
    private ReconciliationService reconciliationService;

    @Mock
    private AuditService auditService;

    private SimpleMeterRegistry meterRegistry;
    private Hl7IngestionService service;

    @Captor
    private ArgumentCaptor<List<ReconciliationCommand>> commands;

    private final Patient patient = Patient.builder().id("patient-1").patientIdentifier("PAT001").build();

    @BeforeEach
    public void setup() {
        meterRegistry = new SimpleMeterRegistry();
        Clock clock = Clock.fixed(Instant.parse("2025-11-10T08:30:00Z"), ZoneOffset.UTC);
        HapiContext hapiContext = new PerformanceConfig().hapiContext();
        AckMessageService ackMessageService = new AckMessageService(hapiContext, clock);
        service = new Hl7IngestionService(new Hl7MessageParser(hapiContext),
                new OrderIdentifierExtractor(new RadiologyProperties()),
                patientRegistryService, reconciliationService, auditService, ackMessageService, meterRegistry);
        lenient().when(auditService.recordReceived(anyString(), any(IngestionChannel.class))).thenReturn("log-1");
    }

    @Test
    public void testIngest_Success() {
        when(patientRegistryService.resolve(any(PatientDemographics.class))).thenReturn(patient);
        when(reconciliationService.reconcileAll(anyList()))
                .thenReturn(List.of(result("req-1", "RPID-1", "RAD-20251110-000001", true, false)));

        IngestionResponse response = service.ingest(singleLine(""), null, IngestionChannel.HTTP);

        assertTrue(response.isSuccess());
        assertEquals("HL7 message processed successfully", response.getMessage());
        assertEquals("patient-1", response.getPatient());
        assertEquals("req-1", response.getRequestId());
        assertEquals("RPID-1", response.getExternalRequestId());
        assertEquals("RAD-20251110-000001", response.getAccessionNumber());
        assertTrue(response.getAccessionGenerated());
        assertEquals("MSG0001", response.getMessageControlId());
        assertEquals(1, response.getOrders().size());
        assertNull(response.getError());
        assertTrue(response.getAck().contains("MSA|AA|MSG0001"));

        verify(reconciliationService).reconcileAll(commands.capture());
        ReconciliationCommand command = commands.getValue().get(0);
        assertEquals("RIS", command.getRequestScope());
        assertEquals("patient-1", command.getPatientId());
        assertEquals("RPID-1", command.getRequestedProcedureId());
        assertNull(command.getAccessionHint());

        verify(auditService).recordReceived(anyString(), eq(IngestionChannel.HTTP));
        verify(auditService).markProcessed(eq("log-1"), eq("MSG0001"), eq("ORM^O01"), eq("patient-1"), anyString());
        verify(auditService, never()).markFailed(any(), any(), any(), any(), any());
        assertEquals(1.0, meterRegistry.counter("radiology.hl7.messages", "channel", "HTTP", "outcome", "success")
                .count());
    }

    @Test
    public void testIngest_RedeliveryReportsExistingRequest() {
        when(patientRegistryService.resolve(any(PatientDemographics.class))).thenReturn(patient);
        when(reconciliationService.reconcileAll(anyList()))
                .thenReturn(List.of(result("req-1", "RPID-1", "ACC1", false, true)));

        IngestionResponse response = service.ingest(singleLine("ACC1"), null, IngestionChannel.MLLP);

        assertTrue(response.isSuccess());
        assertEquals("Order already received; returning the existing procedure request", response.getMessage());
        assertFalse(response.getAccessionGenerated());
        assertTrue(response.getOrders().get(0).isReplayed());
    }

    @Test
    public void testIngest_UnsupportedMessageType() {
        String adt = orm().messageType("ADT^A01").pid("PAT001", "Doe^John", "19800115").build();

        IngestionResponse response = service.ingest(adt, null, IngestionChannel.HTTP);

        assertFalse(response.isSuccess());
        assertEquals(IngestionResponse.ERROR, response.getStatus());
        assertEquals("UnsupportedMessageTypeError", response.getError());
        assertEquals(ErrorKind.UNSUPPORTED_MESSAGE_TYPE, response.getErrorKind());
        assertTrue(response.getAck().contains("MSA|AR|MSG0001"));
        verify(auditService).markFailed(eq("log-1"), eq("MSG0001"), eq("ADT^A01"),
                eq("UnsupportedMessageTypeError"), anyString());
        verifyNoInteractions(reconciliationService);
    }

    @Test
    public void testIngest_TypeHintOverridesHeader() {
        String raw = orm().messageType("ADT^A01").pid("PAT001", "Doe^John", "19800115")
                .obr("CT001", "RPID-1", "").build();
        when(patientRegistryService.resolve(any(PatientDemographics.class))).thenReturn(patient);
        when(reconciliationService.reconcileAll(anyList()))
                .thenReturn(List.of(result("req-1", "RPID-1", "ACC1", false, false)));

        IngestionResponse response = service.ingest(raw, "ORM^O01", IngestionChannel.HTTP);

        assertTrue(response.isSuccess());
    }

    @Test
    public void testIngest_ParseError() {
        IngestionResponse response = service.ingest("garbage", null, IngestionChannel.HTTP);

        assertEquals("ParseError", response.getError());
        assertFalse(response.getRetryable());
        assertNull(response.getMessageControlId());
        assertTrue(response.getAck().contains("MSA|AR|UNKNOWN"));
        verify(auditService).markFailed(eq("log-1"), isNull(), isNull(), eq("ParseError"), anyString());
        assertEquals(1.0, meterRegistry.counter("radiology.hl7.messages", "channel", "HTTP", "outcome", "ParseError")
                .count());
    }

    @Test
    public void testIngest_PatientNotFound() {
        when(patientRegistryService.resolve(any(PatientDemographics.class)))
                .thenThrow(new PatientNotFoundException("PID-3 'PAT001'"));

        IngestionResponse response = service.ingest(singleLine(""), null, IngestionChannel.HTTP);

        assertEquals("PatientNotFoundError", response.getError());
        assertTrue(response.getAck().contains("MSA|AE|MSG0001"));
        verifyNoInteractions(reconciliationService);
    }

    @Test
    public void testIngest_ConcurrencyConflictIsRetryable() {
        when(patientRegistryService.resolve(any(PatientDemographics.class))).thenReturn(patient);
        when(reconciliationService.reconcileAll(anyList()))
                .thenThrow(new ConcurrencyConflictException("Timed out waiting for accession:ACC1"));

        IngestionResponse response = service.ingest(singleLine("ACC1"), null, IngestionChannel.AMQP);

        assertEquals("ConcurrencyConflictError", response.getError());
        assertTrue(response.getRetryable());
        assertNull(response.getOrders());
        assertTrue(response.getAck().contains("^^^206&"));
    }

    @Test
    public void testIngest_AllLinesReconciledAsOneUnit() {
        String raw = orm().pid("PAT001", "Doe^John", "19800115")
                .orc("PLC1", "")
                .obr("CT001", "RPID-1", "ACC1")
                .orc("PLC2", "")
                .obr("CT002", "RPID-2", "ACC2")
                .build();
        when(patientRegistryService.resolve(any(PatientDemographics.class))).thenReturn(patient);
        when(reconciliationService.reconcileAll(anyList())).thenReturn(List.of(
                result("req-1", "RPID-1", "ACC1", false, false),
                result("req-2", "RPID-2", "ACC2", false, false)));

        IngestionResponse response = service.ingest(raw, null, IngestionChannel.HTTP);

        assertTrue(response.isSuccess());
        assertEquals("HL7 message processed successfully (2 order lines)", response.getMessage());
        assertEquals(2, response.getOrders().size());
        assertEquals(2, response.getOrders().get(1).getSequence());
        verify(reconciliationService).reconcileAll(commands.capture());
        assertEquals(List.of("RPID-1", "RPID-2"), commands.getValue().stream()
                .map(ReconciliationCommand::getRequestedProcedureId).collect(Collectors.toList()));
        verify(reconciliationService, never()).reconcile(any());
    }

    @Test
    public void testIngest_LaterLineConflictReportsNothingStored() {
        String raw = orm().pid("PAT002", "Roe^Jane", "19900101")
                .orc("PLC1", "")
                .obr("CT001", "RPID-B1", "ACC-NEW")
                .orc("PLC2", "")
                .obr("CT002", "RPID-B2", "ACC1")
                .build();
        when(patientRegistryService.resolve(any(PatientDemographics.class))).thenReturn(patient);
        when(reconciliationService.reconcileAll(anyList()))
                .thenThrow(new AccessionPatientConflictException("ACC1", "patient-9", "patient-1"));

        IngestionResponse response = service.ingest(raw, null, IngestionChannel.HTTP);

        assertEquals("AccessionPatientConflictError", response.getError());
        assertNull(response.getOrders());
        assertFalse(response.getMessage().contains("stored"));
        assertTrue(response.getAck().contains("MSA|AE|MSG0001"));
        verify(auditService).markFailed(eq("log-1"), eq("MSG0001"), eq("ORM^O01"),
                eq("AccessionPatientConflictError"), anyString());
    }

    @Test
    public void testIngest_UnknownVersionIsAuditedAsParseError() {
        String raw = "MSH|^~\\&|RIS|HOSP|RADFILLER|RAD|20251110083000||ORM^O01|MSG0099|P|9.9\r"
                + "PID|1||PAT001^^^HOSP^MR||Doe^John||19800115|M\r"
                + "OBR|1|||CT001^CT Head|||||||||||||||RPID-1";

        IngestionResponse response = service.ingest(raw, null, IngestionChannel.MLLP);

        assertEquals("ParseError", response.getError());
        assertTrue(response.getAck().contains("MSA|AR|"));
        verify(auditService).recordReceived(raw, IngestionChannel.MLLP);
        verify(auditService).markFailed(eq("log-1"), any(), isNull(), eq("ParseError"), anyString());
        verifyNoInteractions(patientRegistryService, reconciliationService);
    }

    @Test
    public void testIngestParsed_UsesHapiMessageWithoutReparsing() throws Exception {
        String raw = singleLine("");
        Message message = new PerformanceConfig().hapiContext().getPipeParser().parse(raw);
        when(patientRegistryService.resolve(any(PatientDemographics.class))).thenReturn(patient);
        when(reconciliationService.reconcileAll(anyList()))
                .thenReturn(List.of(result("req-1", "RPID-1", "ACC1", false, false)));

        IngestionResponse response = service.ingestParsed("raw text as received", message, IngestionChannel.MLLP);

        assertTrue(response.isSuccess());
        assertEquals("MSG0001", response.getMessageControlId());
        verify(auditService).recordReceived("raw text as received", IngestionChannel.MLLP);
    }

    @Test
    public void testIngest_UnexpectedFailureIsInternalError() {
        when(patientRegistryService.resolve(any(PatientDemographics.class))).thenReturn(patient);
        when(reconciliationService.reconcileAll(anyList()))
                .thenThrow(new IllegalStateException("disk full"));

        IngestionResponse response = service.ingest(singleLine(""), null, IngestionChannel.HTTP);

        assertEquals("InternalError", response.getError());
        assertEquals(ErrorKind.INTERNAL_ERROR, response.getErrorKind());
        verify(auditService).markFailed(eq("log-1"), eq("MSG0001"), eq("ORM^O01"), eq("InternalError"), anyString());
    }

    private String singleLine(String accessionNumber) {
        return orm().pid("PAT001", "Doe^John", "19800115")
                .orc("PLC1001", "")
                .obr("CT001^CT Head", "RPID-1", accessionNumber)
                .build();
    }

    private ReconciliationResult result(String requestId, String rpid, String accessionNumber, boolean generated,
            boolean replayed) {
        ProcedureRequest request = ProcedureRequest.builder()
                .id(requestId)
                .externalRequestId(rpid)
                .accessionNumber(accessionNumber)
                .patientId("patient-1")
                .build();
        Accession accession = Accession.builder().accessionNumber(accessionNumber).patientId("patient-1").build();
        return ReconciliationResult.builder()
                .request(request)
                .accession(accession)
                .generated(generated)
                .replayed(replayed)
                .accessionCreated(!replayed)
                .build();
    }
}
