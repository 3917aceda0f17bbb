package com.capprobe.probe;

import java.util.List;

/**
 * Probe for a file located through an external resolver tool rather than a direct filesystem
 * search.
 * <p>
 * The {@code dependencies} are evaluated first, in order, with the same short-circuit rule as a
 * {@link CompositeProbe}; the resolver is only invoked once all of them are present. Listing the
 * resolver's own {@link ExecutableProbe} among them keeps a missing resolver from ever being
 * spawned.
 *
 * @param name         probe identity
 * @param filename     logical file name handed to the resolver (e.g. {@code "article.cls"})
 * @param resolver     command name of the resolver tool (e.g. {@code "kpsewhich"})
 * @param dependencies probes that gate resolution, in evaluation order
 * @param installHint  optional installation hint (nullable)
 */
public record StaticFileProbe(
        String name,
        String filename,
        String resolver,
        List<Probe> dependencies,
        InstallHint installHint
) implements Probe {

    public StaticFileProbe {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("filename must not be null or blank");
        }
        if (resolver == null || resolver.isBlank()) {
            throw new IllegalArgumentException("resolver must not be null or blank");
        }
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    @Override
    public ProbeKind kind() {
        return ProbeKind.STATIC_FILE;
    }
}
