package com.al.radiologyfiller.listener;

import com.al.radiologyfiller.config.RabbitMQConfig;
import com.al.radiologyfiller.dto.IngestionResponse;
import com.al.radiologyfiller.model.enums.IngestionChannel;
import com.al.radiologyfiller.service.Hl7IngestionService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.stereotype.Component;

/**
 * Consumes HL7 orders from RabbitMQ. Only retryable outcomes (concurrent updates) go back through the
 * retry queues; every other error needs a corrected message and is final. Each outcome is published
 * as JSON to the output queue.
 */
@Component
@ConditionalOnProperty(name = "radiology.amqp.enabled", havingValue = "true", matchIfMissing = true)
public class Hl7OrderQueueListener {

    private static final Logger log = LoggerFactory.getLogger(Hl7OrderQueueListener.class);

    static final String RETRY_COUNT_HEADER = "x-retry-count";
    static final String MESSAGE_TYPE_HEADER = "message_type";

    private final Hl7IngestionService ingestionService;
    private final RabbitTemplate rabbitTemplate;
    private final ObjectMapper objectMapper;

    @Value("${app.rabbitmq.exchange}")
    private String exchange;

    @Value("${app.rabbitmq.output-queue}")
    private String outputQueue;

    @Value("${app.rabbitmq.dlx}")
    private String deadLetterExchange;

    @Value("${app.rabbitmq.dl-routingkey}")
    private String deadLetterRoutingKey;

    public Hl7OrderQueueListener(Hl7IngestionService ingestionService,
            RabbitTemplate rabbitTemplate,
            ObjectMapper objectMapper) {
        this.ingestionService = ingestionService;
        this.rabbitTemplate = rabbitTemplate;
        this.objectMapper = objectMapper;
    }

    @RabbitListener(queues = "${app.rabbitmq.queue}")
    public void receiveMessage(
            String hl7Message,
            @Header(value = MESSAGE_TYPE_HEADER, required = false) String messageType,
            @Header(value = RETRY_COUNT_HEADER, required = false, defaultValue = "0") Integer retryCount) {
        log.info("Processing queued HL7 message (retry attempt: {})", retryCount);

        IngestionResponse response = ingestionService.ingest(hl7Message, messageType, IngestionChannel.AMQP);

        if (!response.isSuccess() && Boolean.TRUE.equals(response.getRetryable())) {
            if (retryCount < RabbitMQConfig.MAX_RETRIES) {
                int nextRetry = retryCount + 1;
                String retryRoutingKey = RabbitMQConfig.RETRY_ROUTING_KEY_PREFIX + nextRetry;
                rabbitTemplate.convertAndSend(exchange, retryRoutingKey, hl7Message, message -> {
                    message.getMessageProperties().setHeader(RETRY_COUNT_HEADER, nextRetry);
                    if (messageType != null) {
                        message.getMessageProperties().setHeader(MESSAGE_TYPE_HEADER, messageType);
                    }
                    message.getMessageProperties().setHeader("x-first-failure-reason", response.getError());
                    return message;
                });
                log.info("Message {} routed to retry queue '{}' (attempt {} of {})", response.getMessageControlId(),
                        retryRoutingKey, nextRetry, RabbitMQConfig.MAX_RETRIES);
                return;
            }
            log.error("Max retries exhausted for message {}, sending to dead letter queue",
                    response.getMessageControlId());
            rabbitTemplate.convertAndSend(deadLetterExchange, deadLetterRoutingKey, hl7Message, message -> {
                message.getMessageProperties().setHeader(RETRY_COUNT_HEADER, retryCount);
                message.getMessageProperties().setHeader("x-failure-reason", response.getError());
                return message;
            });
        }

        publishOutcome(response);
    }

    private void publishOutcome(IngestionResponse response) {
        try {
            rabbitTemplate.convertAndSend(outputQueue, objectMapper.writeValueAsString(response));
            log.info("Outcome of message {} ({}) published to {}", response.getMessageControlId(),
                    response.getStatus(), outputQueue);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize ingestion outcome", e);
        }
    }
}
