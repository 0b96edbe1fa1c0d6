package com.al.radiologyfiller.service;

import ca.uhn.hl7v2.HapiContext;
import com.al.radiologyfiller.config.PerformanceConfig;
import com.al.radiologyfiller.exception.ErrorKind;
import com.al.radiologyfiller.hl7.Hl7MessageParser;
import com.al.radiologyfiller.hl7.MessageHeader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.al.radiologyfiller.hl7.OrmMessageBuilder.orm;
import static org.junit.jupiter.api.Assertions.*;

public class AckMessageServiceTest {

    private AckMessageService ackMessageService;
    private MessageHeader original;

    @BeforeEach
    public void setup() {
        Clock clock = Clock.fixed(Instant.parse("2025-11-10T08:30:00Z"), ZoneOffset.UTC);
        HapiContext hapiContext = new PerformanceConfig().hapiContext();
        ackMessageService = new AckMessageService(hapiContext, clock);
        Hl7MessageParser parser = new Hl7MessageParser(hapiContext);
        original = parser.header(parser.parse(orm()
                .pid("PAT001", "Doe^John", "19800115")
                .orc("PLAC-1", "")
                .obr("71020", "RPID-1", "")
                .build()));
    }

    @Test
    public void testAccept_EchoesControlIdAndSwapsEndpoints() throws Exception {
        String ack = ackMessageService.generateAckAccept(original);

        assertTrue(ack.startsWith("MSH|^~\\&|RADFILLER|RAD|RIS|HOSP|20251110083000"));
        assertTrue(ack.contains("ACK^O01^ACK"));
        assertTrue(ack.contains("MSA|AA|MSG0001"));
        assertFalse(ack.contains("ERR|"));
    }

    @Test
    public void testApplicationError_CarriesErrorSegment() throws Exception {
        String ack = ackMessageService.generateAckFor(original, ErrorKind.PATIENT_NOT_FOUND, "Patient not found");

        assertTrue(ack.contains("MSA|AE|MSG0001|Patient not found"));
        assertTrue(ack.contains("ERR|OBR^^^204&Patient not found"));
    }

    @Test
    public void testReject_UnparsableMessage() throws Exception {
        String ack = ackMessageService.generateAckFor(null, ErrorKind.PARSE_ERROR, "Missing MSH segment");

        assertTrue(ack.contains("MSH|^~\\&|RADIOLOGY-FILLER|RADIOLOGY"));
        assertTrue(ack.contains("MSA|AR|UNKNOWN"));
        assertTrue(ack.contains("ERR|MSH^^^100&"));
    }

    @Test
    public void testReject_EchoesControlIdRecoveredFromUnparsableMessage() throws Exception {
        Hl7MessageParser parser = new Hl7MessageParser(new PerformanceConfig().hapiContext());
        MessageHeader recovered = parser.criticalHeader(
                "MSH|^~\\&|RIS|HOSP|RADFILLER|RAD|20251110083000|||MSG0042|P|2.5\rPID|1||PAT001");

        String ack = ackMessageService.generateAckFor(recovered, ErrorKind.PARSE_ERROR, "Missing message type");

        assertTrue(ack.contains("MSA|AR|MSG0042"));
    }

    @Test
    public void testReject_UnsupportedMessageType() throws Exception {
        String ack = ackMessageService.generateAckFor(original, ErrorKind.UNSUPPORTED_MESSAGE_TYPE, "ADT not handled");

        assertTrue(ack.contains("MSA|AR|MSG0001"));
    }

    @Test
    public void testLongErrorTextIsTruncated() throws Exception {
        String ack = ackMessageService.generateAckFor(original, ErrorKind.MAPPING_ERROR, "x".repeat(150));

        String msa = ack.split("\r")[1];
        assertTrue(msa.endsWith("..."));
        assertEquals("MSA|AE|MSG0001|".length() + 80, msa.length());
    }

    @Test
    public void testErrorCodes() {
        assertEquals("100", AckMessageService.hl7ErrorCode(ErrorKind.PARSE_ERROR));
        assertEquals("101", AckMessageService.hl7ErrorCode(ErrorKind.MISSING_IDENTIFIER));
        assertEquals("101", AckMessageService.hl7ErrorCode(ErrorKind.ACCESSION_REQUIRED));
        assertEquals("200", AckMessageService.hl7ErrorCode(ErrorKind.UNSUPPORTED_MESSAGE_TYPE));
        assertEquals("204", AckMessageService.hl7ErrorCode(ErrorKind.PATIENT_NOT_FOUND));
        assertEquals("206", AckMessageService.hl7ErrorCode(ErrorKind.CONCURRENCY_CONFLICT));
        assertEquals("207", AckMessageService.hl7ErrorCode(ErrorKind.ACCESSION_PATIENT_CONFLICT));
        assertEquals("207", AckMessageService.hl7ErrorCode(null));
    }
}
