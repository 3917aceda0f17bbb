package com.capprobe.probe;

import java.util.List;
import java.util.Optional;

/**
 * Enumerable catalogue of the probes one external subsystem cares about. Used to pre-warm the
 * cache and to report on every capability of the subsystem.
 */
public interface ProbeCatalog {

    /** Short name of the subsystem, e.g. {@code "latex"}. */
    String name();

    /** All known probes, in a fixed order. */
    List<Probe> allKnownProbes();

    /** Looks up a catalogue probe by its name. */
    default Optional<Probe> find(String probeName) {
        return allKnownProbes().stream()
                .filter(p -> p.name().equals(probeName))
                .findFirst();
    }
}
