package com.capprobe.probe.process;

/**
 * Exit status and captured output of a finished process.
 */
public record ProcessOutcome(int exitCode, String stdout, String stderr) {

    public ProcessOutcome {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
    }

    public boolean succeeded() {
        return exitCode == 0;
    }
}
