package com.capprobe.probe.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs an external program to completion. The only way probes reach external processes, so
 * tests can substitute a scripted runner.
 */
@FunctionalInterface
public interface ProcessRunner {

    /**
     * Starts {@code command} and waits for it to exit.
     *
     * @param command          program followed by its arguments
     * @param workingDirectory directory to run in; {@code null} for the current directory
     * @return exit status and captured output
     * @throws ProcessTimeoutException       if the configured bound elapsed first (the process is killed)
     * @throws java.io.InterruptedIOException if the waiting thread was interrupted
     * @throws IOException                   if the program could not be started
     */
    ProcessOutcome run(List<String> command, Path workingDirectory) throws IOException;
}
