package com.al.radiologyfiller.mllp;

import ca.uhn.hl7v2.DefaultHapiContext;
import ca.uhn.hl7v2.HL7Exception;
import ca.uhn.hl7v2.model.Message;
import ca.uhn.hl7v2.model.v25.message.ACK;
import com.al.radiologyfiller.dto.IngestionResponse;
import com.al.radiologyfiller.model.enums.IngestionChannel;
import com.al.radiologyfiller.service.Hl7IngestionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class MllpOrderReceiverTest {

    private static final String HL7 = "MSH|^~\\&|RIS|HOSP|RADFILLER|RAD|20251110083000||ORM^O01|MSG0001|P|2.5";
    private static final String ACK_TEXT = "MSH|^~\\&|RADFILLER|RAD|RIS|HOSP|20251110083000||ACK^O01^ACK|ACK-1|P|2.5\r"
            + "MSA|AE|MSG0001|Patient not found";

    @Mock
    private Hl7IngestionService ingestionService;

    @Mock
    private Message inbound;

    private MllpOrderReceiver receiver;

    @BeforeEach
    public void setup() {
        receiver = new MllpOrderReceiver(ingestionService, new DefaultHapiContext());
    }

    @Test
    public void testProcessMessage_AnswersWithIngestionAck() throws Exception {
        when(ingestionService.ingestParsed(HL7, inbound, IngestionChannel.MLLP))
                .thenReturn(IngestionResponse.builder().status(IngestionResponse.ERROR).ack(ACK_TEXT).build());

        Message reply = receiver.processMessage(inbound, metadata(HL7));

        assertTrue(reply instanceof ACK);
        ACK ack = (ACK) reply;
        assertEquals("AE", ack.getMSA().getAcknowledgmentCode().getValue());
        assertEquals("MSG0001", ack.getMSA().getMessageControlID().getValue());
        verify(inbound, never()).encode();
        verify(ingestionService, never()).ingest(anyString(), any(), any());
    }

    @Test
    public void testProcessMessage_FallsBackToEncodedMessage() throws Exception {
        when(inbound.encode()).thenReturn(HL7);
        when(ingestionService.ingestParsed(HL7, inbound, IngestionChannel.MLLP))
                .thenReturn(IngestionResponse.builder().status(IngestionResponse.SUCCESS).ack(ACK_TEXT).build());

        receiver.processMessage(inbound, new HashMap<>());

        verify(ingestionService).ingestParsed(HL7, inbound, IngestionChannel.MLLP);
    }

    @Test
    public void testProcessMessage_NoAck() {
        when(ingestionService.ingestParsed(HL7, inbound, IngestionChannel.MLLP))
                .thenReturn(IngestionResponse.builder().status(IngestionResponse.ERROR).message("boom").build());

        assertThrows(HL7Exception.class,
                () -> receiver.processMessage(inbound, metadata(HL7)));
    }

    @Test
    public void testProcessMessage_MarksMessageAsIngested() throws Exception {
        when(ingestionService.ingestParsed(HL7, inbound, IngestionChannel.MLLP))
                .thenReturn(IngestionResponse.builder().status(IngestionResponse.SUCCESS).ack(ACK_TEXT).build());
        Map<String, Object> metadata = metadata(HL7);

        receiver.processMessage(inbound, metadata);

        assertEquals(Boolean.TRUE, metadata.get(MllpOrderReceiver.INGESTED_KEY));
    }

    private static Map<String, Object> metadata(String raw) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(MllpOrderReceiver.RAW_MESSAGE_KEY, raw);
        return metadata;
    }
}
