package com.capprobe.probeservice.config;

import com.capprobe.probe.ProbeSettings;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration of the probing subsystem, bound from the {@code capprobe.probe.*}
 * prefix:
 *
 * <pre>
 * capprobe:
 *   probe:
 *     process-timeout: 30s
 *     search-path:
 *       - /usr/local/texlive/2024/bin/x86_64-linux
 *     warm-up: true
 * </pre>
 *
 * @param processTimeout bound on every external invocation; unset waits without bound
 * @param searchPath     directories searched for executables; empty uses {@code PATH}
 * @param warmUp         whether to scan the catalogue once at startup
 */
@ConfigurationProperties(prefix = "capprobe.probe")
@Validated
public record ProbeServiceProperties(Duration processTimeout, @NotNull List<String> searchPath, boolean warmUp) {

    /**
     * Compact constructor: applies defaults for optional fields before Bean Validation runs.
     */
    public ProbeServiceProperties {
        if (searchPath == null) {
            searchPath = List.of();
        }
        if (processTimeout != null && (processTimeout.isNegative() || processTimeout.isZero())) {
            processTimeout = null;
        }
    }

    /** Settings for the probing library. */
    public ProbeSettings toSettings() {
        return new ProbeSettings(processTimeout, searchDirectories());
    }

    /** The configured search path as directories. */
    public List<Path> searchDirectories() {
        return searchPath.stream().filter(s -> !s.isBlank()).map(Path::of).toList();
    }
}
