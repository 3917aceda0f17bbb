package com.capprobe.probe.process;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Thrown when an external invocation exceeds the configured timeout.
 */
public class ProcessTimeoutException extends IOException {

    private final transient List<String> command;
    private final Duration timeout;

    public ProcessTimeoutException(List<String> command, Duration timeout) {
        super("'%s' did not finish within %d ms".formatted(String.join(" ", command), timeout.toMillis()));
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    public List<String> command() {
        return command;
    }

    public Duration timeout() {
        return timeout;
    }
}
