package com.al.radiologyfiller.mllp;

import ca.uhn.hl7v2.HapiContext;
import ca.uhn.hl7v2.app.HL7Service;
import com.al.radiologyfiller.config.RadiologyProperties;
import com.al.radiologyfiller.service.Hl7IngestionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Runs the MLLP listener for the lifetime of the application context.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "radiology.mllp.enabled", havingValue = "true")
public class MllpServerLifecycle implements SmartLifecycle {

    private final HapiContext hapiContext;
    private final Hl7IngestionService ingestionService;
    private final RadiologyProperties properties;

    private HL7Service server;

    public MllpServerLifecycle(HapiContext hapiContext, Hl7IngestionService ingestionService,
            RadiologyProperties properties) {
        this.hapiContext = hapiContext;
        this.ingestionService = ingestionService;
        this.properties = properties;
    }

    @Override
    public synchronized void start() {
        if (server != null) {
            return;
        }
        RadiologyProperties.Mllp mllp = properties.getMllp();
        HL7Service service = hapiContext.newServer(mllp.getPort(), mllp.isTls());
        service.registerApplication("*", "*", new MllpOrderReceiver(ingestionService, hapiContext));
        service.setExceptionHandler(new MllpParseFailureHandler(ingestionService));
        try {
            service.startAndWait();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while starting MLLP listener on port " + mllp.getPort(), e);
        }
        server = service;
        log.info("MLLP listener started on port {} (tls: {})", mllp.getPort(), mllp.isTls());
    }

    @Override
    public synchronized void stop() {
        if (server == null) {
            return;
        }
        server.stopAndWait();
        server = null;
        log.info("MLLP listener stopped");
    }

    @Override
    public synchronized boolean isRunning() {
        return server != null && server.isRunning();
    }
}
