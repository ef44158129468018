package com.vantage.kafka;

import com.vantage.domain.SecurityEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

/**
 * Forwards ingested security events to the Kafka event bus.
 *
 * Sends are fire-and-forget: a failure is logged and counted but never fails
 * the mutation that produced the event, which has already been stored.
 * Events are keyed by tenant so one tenant's events stay ordered within a partition.
 */
@Service
public class SecurityEventForwarder {

    private static final Logger log = LoggerFactory.getLogger(SecurityEventForwarder.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final String topic;
    private final Counter sendSuccessCounter;
    private final Counter sendFailureCounter;
    private final Timer sendLatencyTimer;

    public SecurityEventForwarder(KafkaTemplate<String, Object> kafkaTemplate,
                                  MeterRegistry meterRegistry,
                                  @Value("${vantage.kafka.security-events-topic:security-events}") String topic) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = topic;
        this.sendSuccessCounter = Counter.builder("vantage.kafka.forward.success")
                .description("Security events forwarded to Kafka")
                .tag("topic", topic)
                .register(meterRegistry);
        this.sendFailureCounter = Counter.builder("vantage.kafka.forward.failure")
                .description("Security events that could not be forwarded")
                .tag("topic", topic)
                .register(meterRegistry);
        this.sendLatencyTimer = Timer.builder("vantage.kafka.forward.latency")
                .description("Latency of Kafka sends")
                .tag("topic", topic)
                .register(meterRegistry);
    }

    public void forward(SecurityEvent event) {
        Timer.Sample sample = Timer.start();
        try {
            kafkaTemplate.send(topic, event.getTenantId(), event).whenComplete((result, ex) -> {
                sample.stop(sendLatencyTimer);
                if (ex != null) {
                    sendFailureCounter.increment();
                    log.error("Failed to forward event {} to topic {}: {}", event.getId(), topic, ex.getMessage(), ex);
                } else {
                    sendSuccessCounter.increment();
                    log.debug("Forwarded event {} to topic {} partition {} offset {}",
                            event.getId(), topic,
                            result.getRecordMetadata().partition(),
                            result.getRecordMetadata().offset());
                }
            });
        } catch (RuntimeException e) {
            sendFailureCounter.increment();
            log.error("Failed to hand event {} to the Kafka producer", event.getId(), e);
        }
    }

    public String getTopic() {
        return topic;
    }
}
