package com.flairbit.calls.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.rabbit.annotation.EnableRabbit;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;

@Configuration
@EnableRabbit
@Slf4j
public class RabbitConfig {

    /** Lifecycle events, routed by event type (e.g. {@code call.ended}). */
    public static final String EVENTS_EXCHANGE = "calls.events";

    /** Inbound call requests from the booking and emergency subsystems. */
    public static final String CALL_REQUEST_QUEUE = "calls.request.queue";
    public static final String CALL_REQUEST_EXCHANGE = "calls.requests";
    public static final String CALL_REQUEST_ROUTING_KEY = "calls.request.create";

    @Bean
    public TopicExchange callEventsExchange() {
        return new TopicExchange(EVENTS_EXCHANGE, true, false);
    }

    @Bean
    public Queue callRequestQueue() {
        return QueueBuilder.durable(CALL_REQUEST_QUEUE).build();
    }

    @Bean
    public TopicExchange callRequestExchange() {
        return new TopicExchange(CALL_REQUEST_EXCHANGE, true, false);
    }

    @Bean
    public Binding callRequestBinding(@Qualifier("callRequestQueue") Queue queue,
                                      @Qualifier("callRequestExchange") TopicExchange exchange) {
        return BindingBuilder.bind(queue).to(exchange).with(CALL_REQUEST_ROUTING_KEY);
    }

    @Bean
    public SimpleRabbitListenerContainerFactory rabbitListenerContainerFactory(
            ConnectionFactory connectionFactory,
            Jackson2JsonMessageConverter jackson2JsonMessageConverter) {

        SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();
        factory.setConnectionFactory(connectionFactory);
        factory.setMessageConverter(jackson2JsonMessageConverter);

        factory.setConcurrentConsumers(2);
        factory.setMaxConcurrentConsumers(8);

        factory.setPrefetchCount(10);
        // rejected call requests are answered by the requester timing out, not by redelivery loops
        factory.setDefaultRequeueRejected(false);
        factory.setAcknowledgeMode(AcknowledgeMode.AUTO);

        factory.setErrorHandler(t -> log.error("RabbitMQ Listener Error: {}", t.getMessage(), t));

        return factory;
    }

    @Bean
    public Jackson2JsonMessageConverter jackson2JsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory,
                                         Jackson2JsonMessageConverter converter) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMessageConverter(converter);

        template.setMandatory(true);
        template.setConfirmCallback((correlationData, ack, cause) -> {
            if (!ack) {
                log.error("Event publish not confirmed: {}", cause);
            }
        });
        template.setReturnsCallback(returned -> log.error("Returned event: {}",
                new String(returned.getMessage().getBody(), StandardCharsets.UTF_8)));

        return template;
    }
}
