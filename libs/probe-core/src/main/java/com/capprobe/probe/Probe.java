package com.capprobe.probe;

/**
 * A named, evaluable capability check.
 * <p>
 * The variants are {@link ExecutableProbe}, {@link StaticFileProbe} and {@link CompositeProbe};
 * {@link Prober} relies on {@link #kind()} matching the implementing record, so no other
 * implementations are supported. All variants are value types: two probes of the same kind built
 * from the same fields are {@code equals} and interchangeable.
 */
public interface Probe {

    /**
     * Unique, process-stable identity of the capability. Used as cache key and in messages.
     */
    String name();

    /** The variant tag. */
    ProbeKind kind();

    /**
     * Installation hint carried into negative results, or {@code null}.
     */
    InstallHint installHint();
}
