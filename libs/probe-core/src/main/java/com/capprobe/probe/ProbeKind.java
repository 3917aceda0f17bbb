package com.capprobe.probe;

/**
 * The closed set of probe variants. {@link Prober} dispatches every operation on this tag.
 */
public enum ProbeKind {

    /** A program resolvable on the search path, optionally verified by a functional check. */
    EXECUTABLE,

    /** A file located by an external resolver tool. */
    STATIC_FILE,

    /** The conjunction of several member probes. */
    COMPOSITE
}
