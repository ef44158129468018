package com.vantage.loader;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Micrometer instrumentation for batch loaders, tagged by loader name.
 *
 * Metrics:
 * - vantage.loader.batches: downstream calls issued
 * - vantage.loader.batch.keys: distinct keys per downstream call
 * - vantage.loader.batch.latency: time spent in the downstream call
 * - vantage.loader.batch.failures: downstream calls that failed as a whole
 * - vantage.loader.batch.timeouts: downstream calls that exceeded their deadline
 * - vantage.loader.key.failures: keys failed inside otherwise successful batches
 */
public class LoaderMetrics {

    private final MeterRegistry meterRegistry;

    public LoaderMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordBatch(String loader, int keyCount) {
        Counter.builder("vantage.loader.batches")
                .description("Number of downstream batch calls")
                .tag("loader", loader)
                .register(meterRegistry)
                .increment();
        DistributionSummary.builder("vantage.loader.batch.keys")
                .description("Distinct keys per downstream batch call")
                .tag("loader", loader)
                .register(meterRegistry)
                .record(keyCount);
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopTimer(Timer.Sample sample, String loader) {
        sample.stop(Timer.builder("vantage.loader.batch.latency")
                .description("Latency of downstream batch calls")
                .tag("loader", loader)
                .register(meterRegistry));
    }

    public void recordBatchFailure(String loader) {
        Counter.builder("vantage.loader.batch.failures")
                .description("Downstream batch calls that failed entirely")
                .tag("loader", loader)
                .register(meterRegistry)
                .increment();
    }

    public void recordBatchTimeout(String loader) {
        Counter.builder("vantage.loader.batch.timeouts")
                .description("Downstream batch calls that exceeded their deadline")
                .tag("loader", loader)
                .register(meterRegistry)
                .increment();
    }

    public void recordKeyFailures(String loader, int count) {
        Counter.builder("vantage.loader.key.failures")
                .description("Keys that failed inside a partially successful batch")
                .tag("loader", loader)
                .register(meterRegistry)
                .increment(count);
    }
}
