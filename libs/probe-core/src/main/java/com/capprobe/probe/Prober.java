package com.capprobe.probe;

import com.capprobe.probe.process.ProcessRunner;
import com.capprobe.probe.process.SystemProcessRunner;
import com.capprobe.probe.resolve.CommandFileResolver;
import com.capprobe.probe.resolve.ExecutableLocator;
import com.capprobe.probe.resolve.FileResolver;
import com.capprobe.probe.resolve.Resolution;
import com.capprobe.probe.resolve.SearchPathLocator;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Evaluates {@link Probe}s and memoizes their verdicts.
 * <p>
 * This is the caller-facing query surface: {@link #isPresent(Probe)}, {@link #isFunctional(Probe)}
 * and {@link #absolutePath(StaticFileProbe)}. Every operation dispatches on {@link Probe#kind()}.
 * Presence and functional queries never throw for an absent capability; the path query and
 * {@link #require(Probe)} convert absence into {@link ProbeNotPresentException}.
 * <p>
 * External state is reached only through the three adapters ({@link ExecutableLocator},
 * {@link FileResolver}, {@link ProcessRunner}), so tests can run without spawning processes.
 * Instances are safe for concurrent use; see {@link ProbeCache} for the caching guarantees.
 */
public final class Prober {

    private static final Logger log = LoggerFactory.getLogger(Prober.class);

    private final ExecutableLocator locator;
    private final FileResolver fileResolver;
    private final ProcessRunner processRunner;
    private final ProbeCache cache;
    private final ProbeMetrics metrics;

    public Prober(
            ExecutableLocator locator,
            FileResolver fileResolver,
            ProcessRunner processRunner,
            ProbeCache cache,
            ProbeMetrics metrics) {
        if (locator == null) {
            throw new IllegalArgumentException("locator must not be null");
        }
        if (fileResolver == null) {
            throw new IllegalArgumentException("fileResolver must not be null");
        }
        if (processRunner == null) {
            throw new IllegalArgumentException("processRunner must not be null");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.locator = locator;
        this.fileResolver = fileResolver;
        this.processRunner = processRunner;
        this.cache = cache;
        this.metrics = metrics;
    }

    /**
     * Prober over the real environment with default settings and in-memory metrics.
     */
    public static Prober create() {
        return create(ProbeSettings.defaults());
    }

    public static Prober create(ProbeSettings settings) {
        return create(settings, ProbeMetrics.inMemory().registry());
    }

    /**
     * Prober over the real environment: {@code PATH} lookup, {@link SystemProcessRunner} and
     * {@link CommandFileResolver}, with a fresh cache.
     */
    public static Prober create(ProbeSettings settings, MeterRegistry meterRegistry) {
        ProcessRunner runner = new SystemProcessRunner(settings.processTimeout());
        ExecutableLocator locator = settings.searchPath().isEmpty()
                ? new SearchPathLocator()
                : new SearchPathLocator(settings.searchPath());
        return new Prober(locator, new CommandFileResolver(runner), runner, new ProbeCache(),
                new ProbeMetrics(meterRegistry));
    }

    /**
     * Cheap existence check, answered from the cache when possible.
     */
    public ProbeResult isPresent(Probe probe) {
        requireProbe(probe);
        return evaluate(probe, CheckType.PRESENCE, () -> switch (probe.kind()) {
            case EXECUTABLE -> checkExecutable((ExecutableProbe) probe);
            case STATIC_FILE -> checkStaticFile((StaticFileProbe) probe);
            case COMPOSITE -> checkComposite((CompositeProbe) probe);
        });
    }

    /**
     * Existence plus functional check. Only executable probes with a {@link FunctionalCheck} run
     * anything beyond {@link #isPresent(Probe)}; a functional failure is reported as absent with
     * the check's own reason.
     */
    public ProbeResult isFunctional(Probe probe) {
        requireProbe(probe);
        ProbeResult presence = isPresent(probe);
        if (!presence.present() || probe.kind() != ProbeKind.EXECUTABLE) {
            return presence;
        }
        ExecutableProbe executable = (ExecutableProbe) probe;
        if (!executable.hasFunctionalCheck()) {
            return presence;
        }
        return evaluate(probe, CheckType.FUNCTIONAL, () -> checkFunctional(executable));
    }

    /**
     * Absolute path the resolver reported for the file.
     *
     * @throws ProbeNotPresentException carrying the same reason as {@link #isPresent(Probe)} when
     *                                  the file (or one of its dependencies) is absent
     */
    public Path absolutePath(StaticFileProbe probe) {
        ProbeResult result = isPresent(probe);
        if (!result.present()) {
            throw new ProbeNotPresentException(result);
        }
        ProbeCache.Key key = ProbeCache.Key.of(probe, CheckType.PRESENCE);
        Optional<Path> known = cache.location(key);
        if (known.isPresent()) {
            return known.get();
        }
        // present verdict stored by a racing evaluation whose location was not kept
        Resolution resolution = fileResolver.resolve(probe.resolver(), probe.filename());
        if (!resolution.isFound()) {
            throw new ProbeNotPresentException(ProbeResult.absent(probe, resolution.reason()));
        }
        cache.recordLocation(key, resolution.path());
        return resolution.path();
    }

    /**
     * Asserts presence.
     *
     * @return the positive result
     * @throws ProbeNotPresentException if the capability is absent
     */
    public ProbeResult require(Probe probe) {
        ProbeResult result = isPresent(probe);
        if (!result.present()) {
            throw new ProbeNotPresentException(result);
        }
        return result;
    }

    /**
     * Evaluates every probe of the catalogue in order, warming the cache.
     */
    public ProbeReport scan(ProbeCatalog catalog) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog must not be null");
        }
        List<ProbeResult> results = new ArrayList<>();
        for (Probe probe : catalog.allKnownProbes()) {
            results.add(isPresent(probe));
        }
        ProbeReport report = new ProbeReport(catalog.name(), results, Instant.now());
        log.info("Scanned {} probes of catalog '{}': {} present", results.size(), catalog.name(),
                report.presentCount());
        return report;
    }

    public ProbeCache cache() {
        return cache;
    }

    public ProbeMetrics metrics() {
        return metrics;
    }

    private ProbeResult evaluate(Probe probe, CheckType check, Supplier<ProbeResult> computation) {
        ProbeCache.Key key = ProbeCache.Key.of(probe, check);
        Optional<ProbeResult> cached = cache.find(key);
        if (cached.isPresent()) {
            metrics.recordCacheHit(probe, check);
            return cached.get();
        }
        return cache.getOrCompute(key, () -> {
            long start = System.nanoTime();
            ProbeResult result = computation.get();
            metrics.recordEvaluation(probe, check, result, System.nanoTime() - start);
            if (result.present()) {
                log.debug("{} check of '{}': present", check, probe.name());
            } else {
                log.debug("{} check of '{}': absent ({})", check, probe.name(), result.reason());
            }
            return result;
        });
    }

    private ProbeResult checkExecutable(ExecutableProbe probe) {
        if (locator.locate(probe.command()).isPresent()) {
            return ProbeResult.present(probe.name());
        }
        return ProbeResult.absent(probe, notOnPathReason(probe.command()));
    }

    private ProbeResult checkStaticFile(StaticFileProbe probe) {
        Optional<ProbeResult> blocked = firstAbsent(probe.dependencies());
        if (blocked.isPresent()) {
            return ProbeResult.absentBecauseOf(probe, blocked.get());
        }
        Resolution resolution = fileResolver.resolve(probe.resolver(), probe.filename());
        if (!resolution.isFound()) {
            return ProbeResult.absent(probe, resolution.reason());
        }
        cache.recordLocation(ProbeCache.Key.of(probe, CheckType.PRESENCE), resolution.path());
        return ProbeResult.present(probe.name());
    }

    private ProbeResult checkComposite(CompositeProbe probe) {
        return firstAbsent(probe.members())
                .map(cause -> ProbeResult.absentBecauseOf(probe, cause))
                .orElseGet(() -> ProbeResult.present(probe.name()));
    }

    private ProbeResult checkFunctional(ExecutableProbe probe) {
        Optional<Path> executable = locator.locate(probe.command());
        if (executable.isEmpty()) {
            return ProbeResult.absent(probe, notOnPathReason(probe.command()));
        }
        ProbeResult verdict;
        try {
            verdict = probe.functionalCheck().verify(probe, executable.get(), processRunner);
        } catch (RuntimeException e) {
            log.warn("Functional check of '{}' failed unexpectedly", probe.name(), e);
            return ProbeResult.absent(probe, "Functional check of %s failed: %s".formatted(probe.name(), e));
        }
        if (verdict == null || !verdict.subjectName().equals(probe.name())) {
            throw new IllegalStateException("functional check of '%s' returned %s".formatted(probe.name(), verdict));
        }
        return verdict;
    }

    /** Evaluates in order, stopping at the first absent probe. */
    private Optional<ProbeResult> firstAbsent(List<Probe> probes) {
        for (Probe member : probes) {
            ProbeResult result = isPresent(member);
            if (!result.present()) {
                return Optional.of(result);
            }
        }
        return Optional.empty();
    }

    /** The reason reported for a command that is not on the search path. */
    public static String notOnPathReason(String command) {
        return "Executable '%s' not found on PATH".formatted(command);
    }

    private static void requireProbe(Probe probe) {
        if (probe == null) {
            throw new IllegalArgumentException("probe must not be null");
        }
    }
}
