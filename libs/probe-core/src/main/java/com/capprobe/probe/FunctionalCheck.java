package com.capprobe.probe;

import com.capprobe.probe.process.ProcessRunner;
import java.nio.file.Path;

/**
 * Verifies that a located executable actually works, typically by running it against a minimal
 * input and inspecting its exit status.
 * <p>
 * Implementations must report failures as a negative {@link ProbeResult} whose reason differs
 * from the not-found reason. They should be value types (records) so that equal probes stay
 * interchangeable.
 */
@FunctionalInterface
public interface FunctionalCheck {

    /**
     * Runs the check.
     *
     * @param probe      the probe being verified
     * @param executable absolute path of the located executable
     * @param runner     runner for any external invocation
     * @return the functional verdict for {@code probe}
     */
    ProbeResult verify(ExecutableProbe probe, Path executable, ProcessRunner runner);
}
