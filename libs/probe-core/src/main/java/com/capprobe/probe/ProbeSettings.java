package com.capprobe.probe;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Settings for the default adapters built by {@link Prober#create(ProbeSettings)}.
 *
 * @param processTimeout bound on every external invocation; {@code null} waits without bound
 * @param searchPath     directories searched for executables; empty means the {@code PATH}
 *                       environment variable
 */
public record ProbeSettings(Duration processTimeout, List<Path> searchPath) {

    public ProbeSettings {
        if (processTimeout != null && (processTimeout.isNegative() || processTimeout.isZero())) {
            throw new IllegalArgumentException("processTimeout must be positive");
        }
        searchPath = searchPath == null ? List.of() : List.copyOf(searchPath);
    }

    /** No timeout, environment search path. */
    public static ProbeSettings defaults() {
        return new ProbeSettings(null, List.of());
    }
}
