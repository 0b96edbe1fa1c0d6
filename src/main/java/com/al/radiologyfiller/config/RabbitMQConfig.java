package com.al.radiologyfiller.config;

import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Exchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Queue topology for order intake. Messages that hit a retryable conflict are parked in TTL queues
 * and dead-lettered back onto the order exchange. A message still failing after the last retry is
 * published to the DLQ by the listener.
 */
@Configuration
@ConditionalOnProperty(name = "radiology.amqp.enabled", havingValue = "true", matchIfMissing = true)
public class RabbitMQConfig {

    public static final String RETRY_ROUTING_KEY_PREFIX = "hl7.retry.";

    public static final int MAX_RETRIES = 3;

    @Value("${app.rabbitmq.queue}")
    private String queueName;

    @Value("${app.rabbitmq.output-queue}")
    private String outputQueueName;

    @Value("${app.rabbitmq.dlq}")
    private String dlqName;

    @Value("${app.rabbitmq.dlx}")
    private String dlxName;

    @Value("${app.rabbitmq.dl-routingkey}")
    private String dlRoutingKey;

    @Value("${app.rabbitmq.exchange}")
    private String exchangeName;

    @Value("${app.rabbitmq.routingkey}")
    private String routingKey;

    @Bean
    Queue orderQueue() {
        return QueueBuilder.durable(queueName)
                .withArgument("x-dead-letter-exchange", dlxName)
                .withArgument("x-dead-letter-routing-key", dlRoutingKey)
                .build();
    }

    @Bean
    Queue outcomeQueue() {
        return QueueBuilder.durable(outputQueueName).build();
    }

    @Bean
    Queue deadLetterQueue() {
        return QueueBuilder.durable(dlqName).build();
    }

    @Bean
    Exchange deadLetterExchange() {
        return ExchangeBuilder.directExchange(dlxName).durable(true).build();
    }

    @Bean
    Binding deadLetterBinding() {
        return BindingBuilder.bind(deadLetterQueue())
                .to(deadLetterExchange())
                .with(dlRoutingKey)
                .noargs();
    }

    @Bean
    Exchange orderExchange() {
        return ExchangeBuilder.topicExchange(exchangeName).durable(true).build();
    }

    @Bean
    Binding orderBinding() {
        return BindingBuilder.bind(orderQueue())
                .to(orderExchange())
                .with(routingKey)
                .noargs();
    }

    // Retry backoff: 5s, 15s, 45s

    @Bean
    Queue orderRetryQueue1() {
        return retryQueue(queueName + "-retry-1", 5000, exchangeName, routingKey);
    }

    @Bean
    Binding orderRetryBinding1() {
        return BindingBuilder.bind(orderRetryQueue1()).to(orderExchange()).with(RETRY_ROUTING_KEY_PREFIX + 1).noargs();
    }

    @Bean
    Queue orderRetryQueue2() {
        return retryQueue(queueName + "-retry-2", 15000, exchangeName, routingKey);
    }

    @Bean
    Binding orderRetryBinding2() {
        return BindingBuilder.bind(orderRetryQueue2()).to(orderExchange()).with(RETRY_ROUTING_KEY_PREFIX + 2).noargs();
    }

    @Bean
    Queue orderRetryQueue3() {
        return retryQueue(queueName + "-retry-3", 45000, exchangeName, routingKey);
    }

    @Bean
    Binding orderRetryBinding3() {
        return BindingBuilder.bind(orderRetryQueue3()).to(orderExchange()).with(RETRY_ROUTING_KEY_PREFIX + 3).noargs();
    }

    private Queue retryQueue(String name, int ttlMillis, String deadLetterExchange, String deadLetterRoutingKey) {
        return QueueBuilder.durable(name)
                .withArgument("x-message-ttl", ttlMillis)
                .withArgument("x-dead-letter-exchange", deadLetterExchange)
                .withArgument("x-dead-letter-routing-key", deadLetterRoutingKey)
                .build();
    }
}
