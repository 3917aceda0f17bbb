/**
 * Capability probing: ask at runtime whether optional external functionality (an executable, a
 * resolver-located file, or a combination of both) is available and working, without failing
 * when it is absent.
 *
 * <p>Probes are immutable value types ({@link com.capprobe.probe.ExecutableProbe},
 * {@link com.capprobe.probe.StaticFileProbe}, {@link com.capprobe.probe.CompositeProbe}).
 * {@link com.capprobe.probe.Prober} evaluates them through narrow adapters in
 * {@code com.capprobe.probe.resolve} and {@code com.capprobe.probe.process} and memoizes the
 * verdicts in a {@link com.capprobe.probe.ProbeCache}.
 *
 * @see com.capprobe.probe.testing
 */
package com.capprobe.probe;
