package com.capprobe.probe;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ProbeCache")
class ProbeCacheTest {

    private ProbeCache cache;

    @BeforeEach
    void setUp() {
        cache = new ProbeCache();
    }

    @Test
    @DisplayName("computes once and returns the stored instance afterwards")
    void computesOnce() {
        var key = ProbeCache.Key.of(ExecutableProbe.of("latex"), CheckType.PRESENCE);
        var calls = new AtomicInteger();

        ProbeResult first = cache.getOrCompute(key, () -> {
            calls.incrementAndGet();
            return ProbeResult.present("latex");
        });
        ProbeResult second = cache.getOrCompute(key, () -> {
            calls.incrementAndGet();
            return ProbeResult.absent("latex", "never stored");
        });

        assertThat(second).isSameAs(first);
        assertThat(calls).hasValue(1);
        assertThat(cache.find(key)).containsSame(first);
    }

    @Test
    @DisplayName("keys distinguish kind, name and check type")
    void keysAreDistinct() {
        var exe = ExecutableProbe.of("graphics");
        var composite = CompositeProbe.of("graphics", exe);

        cache.getOrCompute(ProbeCache.Key.of(exe, CheckType.PRESENCE), () -> ProbeResult.present("graphics"));
        cache.getOrCompute(ProbeCache.Key.of(exe, CheckType.FUNCTIONAL), () -> ProbeResult.present("graphics"));
        cache.getOrCompute(ProbeCache.Key.of(composite, CheckType.PRESENCE), () -> ProbeResult.present("graphics"));

        assertThat(cache.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("allows the computation to consult the cache")
    void allowsReentrantComputation() {
        var inner = ProbeCache.Key.of(ExecutableProbe.of("a"), CheckType.PRESENCE);
        var outer = ProbeCache.Key.of(CompositeProbe.of("c", ExecutableProbe.of("a")), CheckType.PRESENCE);

        ProbeResult result = cache.getOrCompute(outer, () -> {
            ProbeResult member = cache.getOrCompute(inner, () -> ProbeResult.present("a"));
            return member.present() ? ProbeResult.present("c") : ProbeResult.absent("c", "member");
        });

        assertThat(result.present()).isTrue();
        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("rejects a computation without result")
    void rejectsNullResult() {
        var key = ProbeCache.Key.of(ExecutableProbe.of("latex"), CheckType.PRESENCE);

        assertThatThrownBy(() -> cache.getOrCompute(key, () -> null))
                .isInstanceOf(IllegalStateException.class);
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("returns but does not store a result computed on an interrupted thread")
    void skipsStoringWhenInterrupted() {
        var key = ProbeCache.Key.of(ExecutableProbe.of("latex"), CheckType.PRESENCE);

        ProbeResult interrupted;
        try {
            interrupted = cache.getOrCompute(key, () -> {
                Thread.currentThread().interrupt();
                return ProbeResult.absent("latex", "interrupted");
            });
        } finally {
            Thread.interrupted();
        }
        ProbeResult recomputed = cache.getOrCompute(key, () -> ProbeResult.present("latex"));

        assertThat(interrupted.present()).isFalse();
        assertThat(recomputed.present()).isTrue();
        assertThat(cache.find(key)).containsSame(recomputed);
    }

    @Test
    @DisplayName("clear forgets verdicts and locations")
    void clearForgetsEverything() {
        var key = ProbeCache.Key.of(ExecutableProbe.of("latex"), CheckType.PRESENCE);
        cache.getOrCompute(key, () -> ProbeResult.present("latex"));
        cache.recordLocation(key, Path.of("/tmp/x"));

        cache.clear();

        assertThat(cache.size()).isZero();
        assertThat(cache.find(key)).isEmpty();
        assertThat(cache.location(key)).isEmpty();
    }
}
