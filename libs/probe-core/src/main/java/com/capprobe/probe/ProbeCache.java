package com.capprobe.probe;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Process-scoped memo of probe verdicts.
 * <p>
 * A cache is created together with its {@link Prober} and lives as long as the prober does;
 * nothing is persisted across runs. Entries never expire: capability availability is assumed
 * stable for the lifetime of the process.
 * <p>
 * The table is safe for concurrent use. Concurrent first-time evaluations of the same probe may
 * both run their computation; the first result stored wins and is returned to every later caller.
 */
public final class ProbeCache {

    /**
     * Cache key: probe identity plus the verdict kind.
     */
    public record Key(ProbeKind kind, String name, CheckType check) {

        public static Key of(Probe probe, CheckType check) {
            return new Key(probe.kind(), probe.name(), check);
        }
    }

    private final Map<Key, ProbeResult> results = new ConcurrentHashMap<>();
    private final Map<Key, Path> locations = new ConcurrentHashMap<>();

    /**
     * Returns the cached result for {@code key}, computing and storing it on a miss.
     * <p>
     * The computation runs outside of any lock and may itself consult this cache (composite
     * members, static-file dependencies). A result computed while the calling thread is
     * interrupted is returned but not stored, since a cancelled external invocation says nothing
     * about the capability.
     */
    public ProbeResult getOrCompute(Key key, Supplier<ProbeResult> computation) {
        ProbeResult cached = results.get(key);
        if (cached != null) {
            return cached;
        }
        ProbeResult computed = computation.get();
        if (computed == null) {
            throw new IllegalStateException("computation returned no result for " + key);
        }
        if (Thread.currentThread().isInterrupted()) {
            return computed;
        }
        ProbeResult raced = results.putIfAbsent(key, computed);
        return raced != null ? raced : computed;
    }

    public Optional<ProbeResult> find(Key key) {
        return Optional.ofNullable(results.get(key));
    }

    /** Remembers where a present static file was resolved to. */
    void recordLocation(Key key, Path location) {
        locations.putIfAbsent(key, location);
    }

    Optional<Path> location(Key key) {
        return Optional.ofNullable(locations.get(key));
    }

    public int size() {
        return results.size();
    }

    /**
     * Forgets every verdict. Only meant for tests and explicit re-scans.
     */
    public void clear() {
        results.clear();
        locations.clear();
    }
}
