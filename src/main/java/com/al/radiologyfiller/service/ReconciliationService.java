package com.al.radiologyfiller.service;

import com.al.radiologyfiller.config.RadiologyProperties;
import com.al.radiologyfiller.exception.AccessionPatientConflictException;
import com.al.radiologyfiller.exception.AccessionRequiredException;
import com.al.radiologyfiller.exception.ConcurrencyConflictException;
import com.al.radiologyfiller.hl7.OrderLine;
import com.al.radiologyfiller.model.Accession;
import com.al.radiologyfiller.model.AccessionRequestLink;
import com.al.radiologyfiller.model.ProcedureRequest;
import com.al.radiologyfiller.model.enums.AccessionStatus;
import com.al.radiologyfiller.model.enums.ProcedureRequestStatus;
import com.al.radiologyfiller.repository.AccessionRepository;
import com.al.radiologyfiller.repository.ProcedureRequestRepository;
import com.al.radiologyfiller.service.accession.AccessionNumberGenerator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Links requested procedures (RPIDs) to accessions.
 * <p>
 * For one order line:
 * <ol>
 * <li>A known RPID is a redelivery: the stored request and accession are returned untouched.</li>
 * <li>With an accession number from the placer, the request joins that accession, or a new accession
 * is created under that number. An accession of another patient rejects the order.</li>
 * <li>Without one, a number is generated (unless generation is disabled) and a new accession is
 * created.</li>
 * </ol>
 * All order lines of one message form a single unit of work. Their RPIDs and supplied accession
 * numbers are locked up front (RPIDs first, each group in sorted order) and every line is checked before
 * the first write. If a write still fails, the lines already written for the message are undone, so a
 * failed message leaves no request behind. With MongoDB transactions enabled the unit additionally runs
 * in a transaction.
 */
@Slf4j
@Service
public class ReconciliationService {

    private final ProcedureRequestRepository procedureRequestRepository;
    private final AccessionRepository accessionRepository;
    private final AccessionNumberGenerator accessionNumberGenerator;
    private final KeyedLockManager lockManager;
    private final TransactionOperations reconciliationTransactions;
    private final RadiologyProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public ReconciliationService(ProcedureRequestRepository procedureRequestRepository,
            AccessionRepository accessionRepository,
            AccessionNumberGenerator accessionNumberGenerator,
            KeyedLockManager lockManager,
            TransactionOperations reconciliationTransactions,
            RadiologyProperties properties,
            MeterRegistry meterRegistry,
            Clock clock) {
        this.procedureRequestRepository = procedureRequestRepository;
        this.accessionRepository = accessionRepository;
        this.accessionNumberGenerator = accessionNumberGenerator;
        this.lockManager = lockManager;
        this.reconciliationTransactions = reconciliationTransactions;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public ReconciliationResult reconcile(ReconciliationCommand command) {
        return reconcileAll(List.of(command)).get(0);
    }

    /**
     * Reconciles the order lines of one message, in order, all or nothing.
     */
    public List<ReconciliationResult> reconcileAll(List<ReconciliationCommand> commands) {
        return lockManager.withLocks(lockKeys(commands),
                () -> translated(() -> reconciliationTransactions.execute(status -> reconcileLocked(commands))));
    }

    private List<String> lockKeys(List<ReconciliationCommand> commands) {
        SortedSet<String> rpids = new TreeSet<>();
        SortedSet<String> accessionNumbers = new TreeSet<>();
        for (ReconciliationCommand command : commands) {
            rpids.add("rpid:" + command.getRequestScope() + ":" + command.getRequestedProcedureId());
            if (command.getAccessionHint() != null) {
                accessionNumbers.add("accession:" + command.getAccessionHint());
            }
        }
        List<String> keys = new ArrayList<>(rpids);
        keys.addAll(accessionNumbers);
        return keys;
    }

    private List<ReconciliationResult> reconcileLocked(List<ReconciliationCommand> commands) {
        for (ReconciliationCommand command : commands) {
            verify(command);
        }
        List<ReconciliationResult> results = new ArrayList<>(commands.size());
        try {
            for (ReconciliationCommand command : commands) {
                results.add(reconcileLine(command));
            }
        } catch (RuntimeException e) {
            undo(results, e);
            throw e;
        }
        return results;
    }

    /**
     * Rejects a line that would fail once writing has started. Only reads.
     */
    private void verify(ReconciliationCommand command) {
        Optional<ProcedureRequest> existing = procedureRequestRepository
                .findByRequestScopeAndExternalRequestId(command.getRequestScope(), command.getRequestedProcedureId());
        if (existing.isPresent()) {
            checkSamePatient(command, existing.get());
            return;
        }
        String hint = command.getAccessionHint();
        if (hint != null) {
            accessionRepository.findByAccessionNumber(hint).ifPresent(accession -> checkSamePatient(command, accession));
        } else if (!properties.isAutoGenerateAccession()) {
            throw new AccessionRequiredException(command.getRequestedProcedureId());
        }
    }

    private ReconciliationResult reconcileLine(ReconciliationCommand command) {
        Optional<ProcedureRequest> existing = procedureRequestRepository
                .findByRequestScopeAndExternalRequestId(command.getRequestScope(), command.getRequestedProcedureId());
        if (existing.isPresent()) {
            return replay(command, existing.get());
        }

        String hint = command.getAccessionHint();
        if (hint != null) {
            Optional<Accession> accession = accessionRepository.findByAccessionNumber(hint);
            return accession.isPresent()
                    ? attach(command, accession.get())
                    : createWithAccession(command, hint, false);
        }

        if (!properties.isAutoGenerateAccession()) {
            throw new AccessionRequiredException(command.getRequestedProcedureId());
        }
        return createWithAccession(command, nextFreeAccessionNumber(), true);
    }

    private ReconciliationResult replay(ReconciliationCommand command, ProcedureRequest request) {
        checkSamePatient(command, request);
        Accession accession = accessionRepository.findByAccessionNumber(request.getAccessionNumber())
                .orElseThrow(() -> new ConcurrencyConflictException("Request " + request.getExternalRequestId()
                        + " is being written by another node"));
        log.info("RPID {} already reconciled to accession {}, treating message {} as a redelivery",
                request.getExternalRequestId(), accession.getAccessionNumber(), command.getMessageControlId());
        return ReconciliationResult.builder()
                .request(request)
                .accession(accession)
                .generated(false)
                .replayed(true)
                .accessionCreated(false)
                .build();
    }

    private void checkSamePatient(ReconciliationCommand command, ProcedureRequest request) {
        if (!Objects.equals(request.getPatientId(), command.getPatientId())) {
            log.warn("Rejecting RPID {}: already stored for patient {} under accession {}, order is for patient {}",
                    request.getExternalRequestId(), request.getPatientId(), request.getAccessionNumber(),
                    command.getPatientId());
            throw new AccessionPatientConflictException(request.getAccessionNumber(), request.getPatientId(),
                    command.getPatientId());
        }
    }

    private void checkSamePatient(ReconciliationCommand command, Accession accession) {
        if (!Objects.equals(accession.getPatientId(), command.getPatientId())) {
            log.warn("Rejecting RPID {}: accession {} belongs to patient {}, order is for patient {}",
                    command.getRequestedProcedureId(), accession.getAccessionNumber(), accession.getPatientId(),
                    command.getPatientId());
            throw new AccessionPatientConflictException(accession.getAccessionNumber(), accession.getPatientId(),
                    command.getPatientId());
        }
    }

    /**
     * Removes what earlier lines of a failed message wrote, newest first. A compensation that fails itself
     * is logged with the ids to clean up and attached to the original failure.
     */
    private void undo(List<ReconciliationResult> results, RuntimeException cause) {
        for (int i = results.size() - 1; i >= 0; i--) {
            ReconciliationResult result = results.get(i);
            if (result.isReplayed()) {
                continue;
            }
            ProcedureRequest request = result.getRequest();
            String accessionNumber = result.getAccession().getAccessionNumber();
            try {
                if (result.isAccessionCreated()) {
                    accessionRepository.delete(result.getAccession());
                } else {
                    accessionRepository.removeRequest(accessionNumber, request.getId());
                }
                procedureRequestRepository.delete(request);
                log.info("Undid RPID {} on accession {} after a later order line failed",
                        request.getExternalRequestId(), accessionNumber);
            } catch (RuntimeException e) {
                log.error("Could not undo RPID {} (request {}) on accession {}; manual cleanup required",
                        request.getExternalRequestId(), request.getId(), accessionNumber, e);
                cause.addSuppressed(e);
            }
        }
    }

    private ReconciliationResult attach(ReconciliationCommand command, Accession accession) {
        checkSamePatient(command, accession);

        ProcedureRequest request = procedureRequestRepository.insert(newRequest(command, accession.getAccessionNumber()));
        AccessionRequestLink link = linkFor(request);
        boolean appended;
        try {
            appended = accessionRepository.appendRequest(accession.getAccessionNumber(), link);
        } catch (RuntimeException e) {
            procedureRequestRepository.delete(request);
            throw e;
        }
        if (!appended) {
            procedureRequestRepository.delete(request);
            throw new ConcurrencyConflictException("Accession " + accession.getAccessionNumber()
                    + " changed while request " + request.getExternalRequestId() + " was being linked");
        }
        accession.getRequests().add(link);

        log.info("Linked RPID {} to existing accession {} ({} request(s))", request.getExternalRequestId(),
                accession.getAccessionNumber(), accession.getRequests().size());
        return ReconciliationResult.builder()
                .request(request)
                .accession(accession)
                .generated(false)
                .replayed(false)
                .accessionCreated(false)
                .build();
    }

    private ReconciliationResult createWithAccession(ReconciliationCommand command, String accessionNumber,
            boolean generated) {
        ProcedureRequest request = newRequest(command, accessionNumber);
        request.setId(new ObjectId().toHexString());

        // request first: a reader that finds it before its accession gets a retryable conflict
        request = procedureRequestRepository.insert(request);
        Accession accession;
        try {
            accession = accessionRepository.insert(newAccession(command, accessionNumber, generated, linkFor(request)));
        } catch (DuplicateKeyException e) {
            procedureRequestRepository.delete(request);
            throw new ConcurrencyConflictException("Accession " + accessionNumber
                    + " was created concurrently by another writer", e);
        } catch (RuntimeException e) {
            procedureRequestRepository.delete(request);
            throw e;
        }

        if (generated) {
            meterRegistry.counter("radiology.accessions.generated").increment();
        }
        log.info("Created accession {} ({}) for RPID {}", accessionNumber, generated ? "generated" : "placer supplied",
                request.getExternalRequestId());
        return ReconciliationResult.builder()
                .request(request)
                .accession(accession)
                .generated(generated)
                .replayed(false)
                .accessionCreated(true)
                .build();
    }

    /**
     * Skips sequence values whose number is already taken (e.g. entered by hand or issued under a
     * previous pattern).
     */
    private String nextFreeAccessionNumber() {
        LocalDate today = LocalDate.now(clock);
        int attempts = Math.max(1, properties.getMaxGenerationAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            String candidate = accessionNumberGenerator.generate(today);
            if (!accessionRepository.existsByAccessionNumber(candidate)) {
                return candidate;
            }
            log.warn("Generated accession number {} is already in use (attempt {}/{})", candidate, attempt, attempts);
        }
        throw new IllegalStateException("No free accession number after " + attempts + " attempts with pattern "
                + properties.getAccessionPattern());
    }

    private ProcedureRequest newRequest(ReconciliationCommand command, String accessionNumber) {
        OrderLine line = command.getLine();
        LocalDateTime now = LocalDateTime.now(clock);
        return ProcedureRequest.builder()
                .externalRequestId(line.getRequestedProcedureId())
                .requestScope(command.getRequestScope())
                .sourceSystem(command.getSourceSystem())
                .placerOrderNumber(line.getPlacerOrderNumber())
                .fillerOrderNumber(line.getFillerOrderNumber())
                .serviceCode(line.getServiceCode())
                .serviceName(line.getServiceName())
                .orderingProvider(line.getOrderingProvider())
                .requestedDateTime(line.getRequestedDateTime() != null ? line.getRequestedDateTime() : now)
                .priority(line.getPriority())
                .notes(line.getNotes())
                .patientId(command.getPatientId())
                .accessionNumber(accessionNumber)
                .status(ProcedureRequestStatus.PENDING)
                .messageControlId(command.getMessageControlId())
                .createdAt(now)
                .statusUpdatedAt(now)
                .build();
    }

    private Accession newAccession(ReconciliationCommand command, String accessionNumber, boolean generated,
            AccessionRequestLink firstLink) {
        OrderLine line = command.getLine();
        LocalDateTime now = LocalDateTime.now(clock);
        Accession accession = Accession.builder()
                .accessionNumber(accessionNumber)
                .patientId(command.getPatientId())
                .studyDate(line.getScheduledDate() != null ? line.getScheduledDate() : now.toLocalDate())
                .studyTime(line.getScheduledTime() != null ? line.getScheduledTime()
                        : LocalTime.from(now).truncatedTo(ChronoUnit.SECONDS))
                .modality(line.getModality())
                .performingFacility(properties.getFacilityCode())
                .status(AccessionStatus.SCHEDULED)
                .generated(generated)
                .createdAt(now)
                .statusUpdatedAt(now)
                .build();
        accession.getRequests().add(firstLink);
        return accession;
    }

    private AccessionRequestLink linkFor(ProcedureRequest request) {
        return AccessionRequestLink.builder()
                .requestId(request.getId())
                .externalRequestId(request.getExternalRequestId())
                .serviceName(request.getServiceName())
                .linkedAt(request.getCreatedAt())
                .build();
    }

    private <T> T translated(Supplier<T> work) {
        try {
            return work.get();
        } catch (DuplicateKeyException e) {
            throw new ConcurrencyConflictException("A concurrent writer stored the same identifier", e);
        } catch (TransientDataAccessException e) {
            throw new ConcurrencyConflictException("Storage is temporarily unavailable", e);
        }
    }
}
