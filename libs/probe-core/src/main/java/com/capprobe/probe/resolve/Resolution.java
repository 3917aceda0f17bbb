package com.capprobe.probe.resolve;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Answer of a {@link FileResolver}: either the resolved absolute path or the reason it was not
 * found.
 */
public record Resolution(Path path, String reason) {

    public Resolution {
        if ((path == null) == (reason == null || reason.isBlank())) {
            throw new IllegalArgumentException("exactly one of path or reason must be given");
        }
    }

    public static Resolution found(Path path) {
        return new Resolution(path, null);
    }

    public static Resolution notFound(String reason) {
        return new Resolution(null, reason);
    }

    public boolean isFound() {
        return path != null;
    }

    public Optional<Path> location() {
        return Optional.ofNullable(path);
    }
}
