package com.al.radiologyfiller.service.accession;

import com.al.radiologyfiller.config.RadiologyProperties;
import com.al.radiologyfiller.exception.ConcurrencyConflictException;
import com.al.radiologyfiller.repository.SequenceCounterRepository;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Produces accession numbers from a pattern and a persisted per-date-key sequence.
 * <p>
 * The read-increment-persist step is a single atomic {@code findAndModify} on the counter document
 * for the pattern's date key, so concurrent callers (in this JVM or on other nodes) never receive the
 * same value. A new date key starts a fresh document at zero, which is the daily reset.
 */
@Slf4j
@Service
public class AccessionNumberGenerator {

    static final String COUNTER_KEY_PREFIX = "accession:";

    private final SequenceCounterRepository sequenceCounterRepository;
    private final RadiologyProperties properties;
    private final Map<String, AccessionPattern> compiledPatterns = new ConcurrentHashMap<>();

    public AccessionNumberGenerator(SequenceCounterRepository sequenceCounterRepository,
            RadiologyProperties properties) {
        this.sequenceCounterRepository = sequenceCounterRepository;
        this.properties = properties;
    }

    /**
     * Fails startup when the configured pattern is invalid.
     */
    @PostConstruct
    void validateConfiguredPattern() {
        AccessionPattern pattern = compile(properties.getAccessionPattern());
        log.info("Accession pattern '{}' (sequence width {}, facility {})", pattern.getSource(),
                pattern.getSequenceWidth(), properties.getFacilityCode());
    }

    public String generate(String facilityCode, String pattern, LocalDate today) {
        AccessionPattern compiled = compile(pattern);
        long sequence = nextSequence(compiled.dateKey(today));
        String accessionNumber = compiled.format(facilityCode, today, sequence);
        log.debug("Generated accession number {} (sequence {})", accessionNumber, sequence);
        return accessionNumber;
    }

    /**
     * Generates with the configured facility code and pattern.
     */
    public String generate(LocalDate today) {
        return generate(properties.getFacilityCode(), properties.getAccessionPattern(), today);
    }

    public AccessionPattern compile(String pattern) {
        AccessionPattern compiled = compiledPatterns.get(pattern);
        if (compiled == null) {
            compiled = AccessionPattern.compile(pattern);
            compiledPatterns.putIfAbsent(pattern, compiled);
        }
        return compiled;
    }

    private long nextSequence(String dateKey) {
        String counterKey = COUNTER_KEY_PREFIX + dateKey;
        try {
            return sequenceCounterRepository.incrementAndGet(counterKey, dateKey);
        } catch (DuplicateKeyException e) {
            // two first-of-the-day upserts raced; the document exists now
            log.debug("Concurrent creation of sequence counter {}, retrying", counterKey);
            return retryIncrement(counterKey, dateKey, e);
        } catch (TransientDataAccessException e) {
            throw new ConcurrencyConflictException("Sequence counter " + counterKey + " is busy", e);
        }
    }

    private long retryIncrement(String counterKey, String dateKey, RuntimeException first) {
        try {
            return sequenceCounterRepository.incrementAndGet(counterKey, dateKey);
        } catch (DuplicateKeyException | TransientDataAccessException e) {
            e.addSuppressed(first);
            throw new ConcurrencyConflictException("Sequence counter " + counterKey + " is busy", e);
        }
    }
}
