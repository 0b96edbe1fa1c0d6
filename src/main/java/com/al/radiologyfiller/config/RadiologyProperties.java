package com.al.radiologyfiller.config;

import com.al.radiologyfiller.model.ProcedureRequest;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Order filler settings. Underscore keys from the site configuration
 * ({@code radiology.auto_generate_accession}) bind here as well as kebab-case ones.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "radiology")
public class RadiologyProperties {

    /**
     * Generate an accession number when the order carries none (OBR-18 empty).
     */
    private boolean autoGenerateAccession = true;

    /**
     * Value substituted for {facility_code} in the accession pattern.
     */
    private String facilityCode = "RAD";

    /**
     * Accession number template. Must contain a {seq:0Nd} placeholder.
     */
    private String accessionPattern = "{facility_code}-{YYYYMMDD}-{seq:06d}";

    /**
     * Uniqueness scope of Requested Procedure IDs.
     */
    private RpidScope rpidScope = RpidScope.SOURCE_SYSTEM;

    /**
     * Longest wait for a contended accession or RPID before the message is answered with a retryable
     * conflict.
     */
    private Duration lockTimeout = Duration.ofSeconds(5);

    /**
     * How many sequence values the generator may skip when a generated number is already taken.
     */
    private int maxGenerationAttempts = 100;

    /**
     * Run each reconciliation in a MongoDB transaction. Needs a replica set.
     */
    private boolean transactionsEnabled = false;

    private Mllp mllp = new Mllp();

    private Amqp amqp = new Amqp();

    /**
     * Namespace in which RPIDs from the given sending application are unique.
     */
    public String requestScopeFor(String sourceSystem) {
        if (rpidScope == RpidScope.GLOBAL || sourceSystem == null || sourceSystem.isBlank()) {
            return ProcedureRequest.GLOBAL_SCOPE;
        }
        return sourceSystem.trim();
    }

    @Data
    public static class Mllp {
        private boolean enabled = false;
        private int port = 2575;
        private boolean tls = false;
    }

    @Data
    public static class Amqp {
        /**
         * Consume orders from the inbound RabbitMQ queue.
         */
        private boolean enabled = true;
    }

    public enum RpidScope {
        /**
         * RPIDs are unique per sending application (MSH-3) when the message names one.
         */
        SOURCE_SYSTEM,

        /**
         * RPIDs are unique across every sender.
         */
        GLOBAL
    }
}
