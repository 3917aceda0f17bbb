package com.capprobe.probeservice.config;

import com.capprobe.latex.LatexCatalog;
import com.capprobe.probe.ProbeCache;
import com.capprobe.probe.ProbeCatalog;
import com.capprobe.probe.ProbeMetrics;
import com.capprobe.probe.ProbeSettings;
import com.capprobe.probe.Prober;
import com.capprobe.probe.process.ProcessRunner;
import com.capprobe.probe.process.SystemProcessRunner;
import com.capprobe.probe.resolve.CommandFileResolver;
import com.capprobe.probe.resolve.ExecutableLocator;
import com.capprobe.probe.resolve.FileResolver;
import com.capprobe.probe.resolve.SearchPathLocator;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

/**
 * Wires one process-wide {@link Prober} and its cache. The cache lives as long as the
 * application context.
 */
@Configuration
public class ProbeConfig {

    private static final Logger log = LoggerFactory.getLogger(ProbeConfig.class);

    @Bean
    public ProbeSettings probeSettings(ProbeServiceProperties properties) {
        ProbeSettings settings = properties.toSettings();
        log.info("Probe settings: timeout={}, searchPath={}",
                settings.processTimeout() == null ? "unbounded" : settings.processTimeout(),
                settings.searchPath().isEmpty() ? "PATH" : settings.searchPath());
        return settings;
    }

    @Bean
    public ProcessRunner processRunner(ProbeSettings settings) {
        return new SystemProcessRunner(settings.processTimeout());
    }

    @Bean
    public ExecutableLocator executableLocator(ProbeSettings settings) {
        return settings.searchPath().isEmpty()
                ? new SearchPathLocator()
                : new SearchPathLocator(settings.searchPath());
    }

    @Bean
    public FileResolver fileResolver(ProcessRunner processRunner) {
        return new CommandFileResolver(processRunner);
    }

    @Bean
    public ProbeCache probeCache() {
        return new ProbeCache();
    }

    @Bean
    public ProbeMetrics probeMetrics(MeterRegistry meterRegistry) {
        return new ProbeMetrics(meterRegistry);
    }

    @Bean
    public Prober prober(
            ExecutableLocator executableLocator,
            FileResolver fileResolver,
            ProcessRunner processRunner,
            ProbeCache probeCache,
            ProbeMetrics probeMetrics) {
        return new Prober(executableLocator, fileResolver, processRunner, probeCache, probeMetrics);
    }

    @Bean
    public ProbeCatalog probeCatalog() {
        return new LatexCatalog();
    }

    /**
     * Warms the cache once the application is ready, when {@code capprobe.probe.warm-up} is set.
     */
    @Bean
    public CatalogWarmUp catalogWarmUp(Prober prober, ProbeCatalog catalog, ProbeServiceProperties properties) {
        return new CatalogWarmUp(prober, catalog, properties.warmUp());
    }

    /** Scans the catalogue on {@link ApplicationReadyEvent}. */
    public static class CatalogWarmUp {

        private final Prober prober;
        private final ProbeCatalog catalog;
        private final boolean enabled;

        public CatalogWarmUp(Prober prober, ProbeCatalog catalog, boolean enabled) {
            this.prober = prober;
            this.catalog = catalog;
            this.enabled = enabled;
        }

        @EventListener(ApplicationReadyEvent.class)
        public void warmUp() {
            if (!enabled) {
                return;
            }
            log.info("Warming probe cache for catalog '{}'", catalog.name());
            prober.scan(catalog);
        }
    }
}
