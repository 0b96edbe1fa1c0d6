package com.al.radiologyfiller.hl7;

import ca.uhn.hl7v2.HL7Exception;
import ca.uhn.hl7v2.model.Group;
import ca.uhn.hl7v2.model.Message;
import ca.uhn.hl7v2.model.Segment;
import ca.uhn.hl7v2.model.Structure;
import ca.uhn.hl7v2.util.Terser;
import com.al.radiologyfiller.config.RadiologyProperties;
import com.al.radiologyfiller.exception.Hl7ParseException;
import com.al.radiologyfiller.exception.MissingIdentifierException;
import com.al.radiologyfiller.exception.PatientNotFoundException;
import com.al.radiologyfiller.model.enums.ProcedurePriority;
import com.al.radiologyfiller.util.DateTimeUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives Requested Procedure IDs, accession numbers and order details from a parsed ORM message.
 * <p>
 * Field usage:
 * <ul>
 * <li>RPID: OBR-20, else derived from the OBR-4 procedure code</li>
 * <li>Accession number: OBR-18</li>
 * <li>Placer / filler order number: ORC-2 / ORC-3, else OBR-2 / OBR-3</li>
 * <li>Procedure: OBR-4 (code^text), priority OBR-5 (else OBR-27.6), requested at OBR-7</li>
 * <li>Ordering provider: OBR-16, else ORC-12</li>
 * <li>Modality: OBR-24, scheduled at OBR-36</li>
 * </ul>
 * Each OBR is paired with the closest ORC before it. Every line is checked before anything is returned,
 * so a bad line rejects the whole message.
 */
@Slf4j
@Component
public class OrderIdentifierExtractor {

    private final RadiologyProperties properties;

    public OrderIdentifierExtractor(RadiologyProperties properties) {
        this.properties = properties;
    }

    public ExtractedOrder extract(Message message) {
        try {
            return extractOrder(message);
        } catch (HL7Exception e) {
            throw new Hl7ParseException("Order fields cannot be read: " + e.getMessage(), null);
        }
    }

    private ExtractedOrder extractOrder(Message message) throws HL7Exception {
        MessageHeader header = MessageHeader.from((Segment) message.get("MSH"));
        List<Segment> segments = new ArrayList<>();
        collectSegments(message, segments);

        Segment pid = null;
        List<OrderLine> lines = new ArrayList<>();
        Segment currentOrc = null;
        Segment currentObr = null;
        List<String> notes = new ArrayList<>();
        for (Segment segment : segments) {
            switch (segment.getName()) {
                case "PID":
                    if (pid == null) {
                        pid = segment;
                    }
                    break;
                case "ORC":
                    flush(lines, currentOrc, currentObr, notes);
                    currentObr = null;
                    currentOrc = segment;
                    break;
                case "OBR":
                    flush(lines, currentOrc, currentObr, notes);
                    currentObr = segment;
                    break;
                case "NTE":
                    String note = value(segment, 3);
                    if (currentObr != null && note != null) {
                        notes.add(note);
                    }
                    break;
                default:
                    break;
            }
        }
        flush(lines, currentOrc, currentObr, notes);

        if (pid == null) {
            throw new PatientNotFoundException("a message without a PID segment");
        }
        if (lines.isEmpty()) {
            throw new MissingIdentifierException("Order message " + header.getMessageControlId()
                    + " has no OBR segment");
        }

        String sourceSystem = blankToNull(header.getSendingApplication());
        ExtractedOrder order = ExtractedOrder.builder()
                .messageControlId(header.getMessageControlId())
                .messageType(header.getMessageType())
                .sourceSystem(sourceSystem)
                .requestScope(properties.requestScopeFor(sourceSystem))
                .patient(demographics(pid))
                .lines(lines)
                .build();
        log.debug("Extracted {} order line(s) from message {} (scope {})", lines.size(),
                order.getMessageControlId(), order.getRequestScope());
        return order;
    }

    /**
     * Every non-empty segment of the message in document order, including the ones HAPI could not place
     * in the ORM structure.
     */
    private void collectSegments(Group group, List<Segment> out) throws HL7Exception {
        for (String name : group.getNames()) {
            for (Structure structure : group.getAll(name)) {
                if (structure instanceof Group) {
                    collectSegments((Group) structure, out);
                } else if (!structure.isEmpty()) {
                    out.add((Segment) structure);
                }
            }
        }
    }

    private void flush(List<OrderLine> lines, Segment orc, Segment obr, List<String> notes) throws HL7Exception {
        if (obr == null) {
            return;
        }
        lines.add(toLine(lines.size() + 1, orc, obr, notes));
        notes.clear();
    }

    private OrderLine toLine(int sequence, Segment orc, Segment obr, List<String> notes) throws HL7Exception {
        String placer = firstNonBlank(orc == null ? null : component(orc, 2, 1), component(obr, 2, 1));
        String filler = firstNonBlank(orc == null ? null : component(orc, 3, 1), component(obr, 3, 1));
        String serviceCode = component(obr, 4, 1);
        String serviceName = firstNonBlank(component(obr, 4, 2), serviceCode);

        String rpid = component(obr, 20, 1);
        if (rpid == null && serviceCode != null) {
            rpid = placer != null ? placer + "_" + serviceCode : serviceCode;
        }
        if (rpid == null) {
            throw new MissingIdentifierException("OBR #" + sequence
                    + " has neither a Requested Procedure ID (OBR-20) nor a procedure code (OBR-4)");
        }

        String priorityCode = firstNonBlank(component(obr, 5, 1), component(obr, 27, 6));
        String rawScheduled = value(obr, 36);
        LocalDateTime scheduled = parseDateTime(rawScheduled, "OBR-36", sequence);

        return OrderLine.builder()
                .sequence(sequence)
                .requestedProcedureId(rpid)
                .accessionNumber(component(obr, 18, 1))
                .placerOrderNumber(placer)
                .fillerOrderNumber(filler)
                .serviceCode(serviceCode)
                .serviceName(serviceName)
                .orderingProvider(firstNonBlank(provider(obr, 16), orc == null ? null : provider(orc, 12)))
                .requestedDateTime(parseDateTime(value(obr, 7), "OBR-7", sequence))
                .priority(ProcedurePriority.fromHl7Code(priorityCode))
                .modality(component(obr, 24, 1))
                .scheduledDate(scheduled == null ? null : scheduled.toLocalDate())
                .scheduledTime(scheduled == null || rawScheduled.length() <= 8 ? null : scheduled.toLocalTime())
                .notes(notes.isEmpty() ? null : String.join("\n", notes))
                .build();
    }

    private PatientDemographics demographics(Segment pid) throws HL7Exception {
        LocalDate dob = null;
        String rawDob = value(pid, 7);
        if (rawDob != null) {
            try {
                dob = DateTimeUtil.parseHl7Date(rawDob);
            } catch (DateTimeException e) {
                log.warn("Ignoring unparsable PID-7 '{}'", rawDob);
            }
        }
        return PatientDemographics.builder()
                .identifier(component(pid, 3, 1))
                .lastName(component(pid, 5, 1))
                .firstName(component(pid, 5, 2))
                .dateOfBirth(dob)
                .gender(value(pid, 8))
                .build();
    }

    /**
     * XCN as "Given Family", or the id number when no name is sent.
     */
    private String provider(Segment segment, int field) throws HL7Exception {
        String family = component(segment, field, 2);
        String given = component(segment, field, 3);
        String name = ((given == null ? "" : given) + " " + (family == null ? "" : family)).strip();
        return firstNonBlank(name, component(segment, field, 1));
    }

    /**
     * First subcomponent of a component of the first repetition, stripped, or null when empty.
     */
    private static String component(Segment segment, int field, int component) throws HL7Exception {
        return blankToNull(Terser.get(segment, field, 0, component, 1));
    }

    private static String value(Segment segment, int field) throws HL7Exception {
        return component(segment, field, 1);
    }

    private LocalDateTime parseDateTime(String value, String field, int sequence) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return DateTimeUtil.parseHl7DateTime(value);
        } catch (DateTimeException e) {
            log.warn("Ignoring unparsable {} '{}' on OBR #{}", field, value, sequence);
            return null;
        }
    }

    private static String firstNonBlank(String first, String second) {
        if (first != null && !first.isBlank()) {
            return first.strip();
        }
        return blankToNull(second);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
