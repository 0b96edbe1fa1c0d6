package com.al.radiologyfiller.hl7;

import ca.uhn.hl7v2.model.Message;
import ca.uhn.hl7v2.model.v25.message.ORM_O01;
import ca.uhn.hl7v2.util.Terser;
import com.al.radiologyfiller.config.PerformanceConfig;
import com.al.radiologyfiller.exception.ErrorKind;
import com.al.radiologyfiller.exception.Hl7ParseException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class Hl7MessageParserTest {

    private static final String ORM = "MSH|^~\\&|RIS|HOSP|RADFILLER|RAD|20251110083000||ORM^O01|MSG0001|P|2.5\r"
            + "PID|1||PAT001^^^HOSP^MR||Doe^John||19800115|M\r"
            + "ORC|NW|PLC1001|FIL2001\r"
            + "OBR|1|PLC1001|FIL2001|CT001^CT Head";

    private final Hl7MessageParser parser = new Hl7MessageParser(new PerformanceConfig().hapiContext());

    @Test
    public void testParse_ReadsHeaderFields() {
        MessageHeader header = parser.header(parser.parse(ORM));

        assertEquals("ORM^O01", header.getMessageType());
        assertEquals("MSG0001", header.getMessageControlId());
        assertEquals("RIS", header.getSendingApplication());
        assertEquals("HOSP", header.getSendingFacility());
        assertEquals("RADFILLER", header.getReceivingApplication());
        assertEquals("P", header.getProcessingId());
        assertEquals("2.5", header.getVersionId());
    }

    @Test
    public void testParse_ProducesOrmStructure() throws Exception {
        Message message = parser.parse(ORM);

        assertTrue(message instanceof ORM_O01);
        Terser terser = new Terser(message);
        assertEquals("CT001", terser.get("/.OBR-4-1"));
        assertEquals("CT Head", terser.get("/.OBR-4-2"));
        assertNull(terser.get("/.OBR-20"));
    }

    @Test
    public void testParse_AcceptsLineFeedsAndMllpFraming() throws Exception {
        String framed = "\u000b" + ORM.replace("\r", "\r\n") + "\r\n\u001c\r";

        Message message = parser.parse(framed);

        assertEquals("PAT001", new Terser(message).get("/.PID-3-1"));
    }

    @Test
    public void testParse_OlderVersionReadWithSameStructures() throws Exception {
        Message message = parser.parse(ORM.replace("|P|2.5", "|P|2.3"));

        assertTrue(message instanceof ORM_O01);
        assertEquals("2.3", parser.header(message).getVersionId());
    }

    @Test
    public void testParse_UsesDeclaredDelimiters() {
        String custom = "MSH#$~\\&#RIS#HOSP#RADFILLER#RAD#20251110083000##ORM$O01#MSG0002#P#2.5\r"
                + "PID#1##PAT002$$$HOSP";

        MessageHeader header = parser.header(parser.parse(custom));

        assertEquals("ORM^O01", header.getMessageType());
        assertEquals("MSG0002", header.getMessageControlId());
    }

    @Test
    public void testParse_UnknownVersionIsParseError() {
        Hl7ParseException e = assertThrows(Hl7ParseException.class,
                () -> parser.parse(ORM.replace("|P|2.5", "|P|9.9")));

        assertEquals(ErrorKind.PARSE_ERROR, e.getKind());
        assertNotNull(e.getSegmentText());
    }

    @Test
    public void testParse_EmptyMessage() {
        Hl7ParseException e = assertThrows(Hl7ParseException.class, () -> parser.parse("  \r\n "));
        assertEquals(ErrorKind.PARSE_ERROR, e.getKind());
    }

    @Test
    public void testParse_MissingMsh() {
        assertThrows(Hl7ParseException.class, () -> parser.parse("PID|1||PAT001"));
    }

    @Test
    public void testParse_MissingMessageType() {
        assertThrows(Hl7ParseException.class,
                () -> parser.parse("MSH|^~\\&|RIS|HOSP|RADFILLER|RAD|20251110083000|||MSG0003|P|2.5"));
    }

    @Test
    public void testParse_GarbageSegment() {
        Hl7ParseException e = assertThrows(Hl7ParseException.class,
                () -> parser.parse(ORM + "\rthis is not a segment"));
        assertTrue(e.getMessage().contains("this is not a segment"));
    }

    @Test
    public void testParse_RejectsBatchWithSecondMsh() {
        assertThrows(Hl7ParseException.class, () -> parser.parse(ORM + "\r" + ORM));
    }

    @Test
    public void testCriticalHeader_RecoversControlIdOfRejectedMessage() {
        MessageHeader header = parser.criticalHeader(
                "MSH|^~\\&|RIS|HOSP|RADFILLER|RAD|20251110083000|||MSG0004|P|2.5");

        assertNotNull(header);
        assertEquals("MSG0004", header.getMessageControlId());
        assertNull(parser.criticalHeader("garbage"));
    }
}
