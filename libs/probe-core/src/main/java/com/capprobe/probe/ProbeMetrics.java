package com.capprobe.probe;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for probe evaluation.
 * <p>
 * Every meter carries the probe {@code kind} and {@code check} tags; evaluations are additionally
 * tagged with their {@code outcome} ({@code present} / {@code absent}).
 */
public final class ProbeMetrics {

    public static final String EVALUATIONS = "capprobe.probe.evaluations";
    public static final String CACHE_HITS = "capprobe.probe.cache.hits";
    public static final String DURATION = "capprobe.probe.duration";

    public static final String TAG_KIND = "kind";
    public static final String TAG_CHECK = "check";
    public static final String TAG_OUTCOME = "outcome";

    private final MeterRegistry registry;

    public ProbeMetrics(MeterRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
    }

    /** Metrics kept in a private in-memory registry. */
    public static ProbeMetrics inMemory() {
        return new ProbeMetrics(new SimpleMeterRegistry());
    }

    /**
     * Records one uncached evaluation and how long it took.
     */
    public void recordEvaluation(Probe probe, CheckType check, ProbeResult result, long elapsedNanos) {
        Tags tags = baseTags(probe, check);
        Counter.builder(EVALUATIONS)
                .description("Uncached probe evaluations")
                .tags(tags.and(TAG_OUTCOME, result.present() ? "present" : "absent"))
                .register(registry)
                .increment();
        Timer.builder(DURATION)
                .description("Time spent evaluating probes, external invocations included")
                .tags(tags)
                .register(registry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordCacheHit(Probe probe, CheckType check) {
        Counter.builder(CACHE_HITS)
                .description("Probe queries answered from the cache")
                .tags(baseTags(probe, check))
                .register(registry)
                .increment();
    }

    public MeterRegistry registry() {
        return registry;
    }

    private static Tags baseTags(Probe probe, CheckType check) {
        return Tags.of(TAG_KIND, probe.kind().name().toLowerCase(), TAG_CHECK, check.name().toLowerCase());
    }
}
