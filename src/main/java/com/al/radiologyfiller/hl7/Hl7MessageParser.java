package com.al.radiologyfiller.hl7;

import ca.uhn.hl7v2.HL7Exception;
import ca.uhn.hl7v2.HapiContext;
import ca.uhn.hl7v2.Location;
import ca.uhn.hl7v2.model.Message;
import ca.uhn.hl7v2.model.Segment;
import ca.uhn.hl7v2.parser.Parser;
import com.al.radiologyfiller.exception.Hl7ParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses pipe-delimited (ER7) HL7 v2 text with HAPI.
 * <p>
 * Segments may be separated by CR, LF or CRLF and MLLP framing bytes left around the payload are
 * stripped before the text reaches the pipe parser. The shared {@link HapiContext} reads every version
 * with the 2.5 structures and without validation rules, so Z-segments and older versions are accepted.
 */
@Slf4j
@Component
public class Hl7MessageParser {

    private static final Pattern SEGMENT_SEPARATOR = Pattern.compile("\\r\\n|\\r|\\n");
    private static final Pattern SEGMENT_NAME = Pattern.compile("[A-Z][A-Z0-9]{2}");

    private final HapiContext hapiContext;

    public Hl7MessageParser(HapiContext hapiContext) {
        this.hapiContext = hapiContext;
    }

    public Message parse(String rawMessage) {
        List<String> lines = segmentLines(rawMessage);
        String text = String.join("\r", lines);
        try {
            Message message = hapiContext.getPipeParser().parse(text);
            log.debug("Parsed HL7 {} message with {} segments", message.getName(), lines.size());
            return message;
        } catch (HL7Exception e) {
            throw new Hl7ParseException(e.getMessage(), offendingSegment(e, lines));
        }
    }

    /**
     * MSH header of a parsed message.
     */
    public MessageHeader header(Message message) {
        try {
            return MessageHeader.from((Segment) message.get("MSH"));
        } catch (HL7Exception e) {
            throw new Hl7ParseException("MSH segment cannot be read: " + e.getMessage(), null);
        }
    }

    /**
     * Best-effort header of a message that failed to parse: the fields HAPI can still recover
     * (control id, processing id, version), or null when not even those can be read.
     */
    public MessageHeader criticalHeader(String rawMessage) {
        if (rawMessage == null || rawMessage.isBlank()) {
            return null;
        }
        try {
            Parser parser = hapiContext.getPipeParser();
            return MessageHeader.from(parser.getCriticalResponseData(normalize(rawMessage)));
        } catch (HL7Exception | RuntimeException e) {
            log.debug("No MSH could be recovered from the rejected message: {}", e.getMessage());
            return null;
        }
    }

    private List<String> segmentLines(String rawMessage) {
        if (rawMessage == null || rawMessage.isBlank()) {
            throw new Hl7ParseException("HL7 message is empty", null);
        }
        List<String> lines = new ArrayList<>();
        for (String line : SEGMENT_SEPARATOR.split(stripFraming(rawMessage))) {
            String trimmed = line.strip();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        if (lines.isEmpty()) {
            throw new Hl7ParseException("HL7 message is empty", null);
        }

        String msh = lines.get(0);
        if (!msh.startsWith("MSH") || msh.length() < 8 || Character.isLetterOrDigit(msh.charAt(3))) {
            throw new Hl7ParseException("Message does not start with an MSH segment", msh);
        }
        char fieldSeparator = msh.charAt(3);
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            int end = line.indexOf(fieldSeparator);
            String name = end < 0 ? line : line.substring(0, end);
            if (!SEGMENT_NAME.matcher(name).matches()) {
                throw new Hl7ParseException("Unparsable segment at position " + (i + 1), line);
            }
            if ("MSH".equals(name)) {
                throw new Hl7ParseException("Batched messages with more than one MSH are not supported", line);
            }
        }
        return lines;
    }

    private String normalize(String rawMessage) {
        return String.join("\r", SEGMENT_SEPARATOR.split(stripFraming(rawMessage).strip()));
    }

    private String offendingSegment(HL7Exception e, List<String> lines) {
        Location location = e.getLocation();
        String name = location == null ? null : location.getSegmentName();
        if (name != null) {
            for (String line : lines) {
                if (line.startsWith(name)) {
                    return line;
                }
            }
        }
        return lines.get(0);
    }

    private String stripFraming(String raw) {
        String payload = raw;
        int start = payload.indexOf('\u000b');
        if (start >= 0) {
            payload = payload.substring(start + 1);
        }
        int end = payload.indexOf('\u001c');
        if (end >= 0) {
            payload = payload.substring(0, end);
        }
        return payload;
    }
}
