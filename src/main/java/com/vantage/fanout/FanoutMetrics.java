package com.vantage.fanout;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Counters for the subscription fan-out engine, tagged by channel.
 */
public class FanoutMetrics {

    private final MeterRegistry meterRegistry;

    public FanoutMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void published(String channel) {
        counter("vantage.fanout.published", "Messages published", channel).increment();
    }

    public void delivered(String channel) {
        counter("vantage.fanout.delivered", "Messages accepted into a subscriber buffer", channel).increment();
    }

    public void filterError(String channel) {
        counter("vantage.fanout.filter.errors", "Subscription filters that threw", channel).increment();
    }

    public void dropped(String channel) {
        counter("vantage.fanout.dropped", "Messages dropped from full subscriber buffers", channel).increment();
    }

    public void deliveryError(String channel) {
        counter("vantage.fanout.delivery.errors", "Deliveries that failed inside the engine", channel).increment();
    }

    private Counter counter(String name, String description, String channel) {
        return Counter.builder(name)
                .description(description)
                .tag("channel", channel)
                .register(meterRegistry);
    }
}
