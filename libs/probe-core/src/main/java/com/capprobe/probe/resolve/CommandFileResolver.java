package com.capprobe.probe.resolve;

import com.capprobe.probe.process.ProcessOutcome;
import com.capprobe.probe.process.ProcessRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link FileResolver} that runs {@code <resolver> <filename>} and trusts its exit status: zero
 * means found, with the absolute path on standard output; anything else means not found.
 * Standard error is never interpreted.
 */
public final class CommandFileResolver implements FileResolver {

    private static final Logger log = LoggerFactory.getLogger(CommandFileResolver.class);

    private final ProcessRunner runner;

    public CommandFileResolver(ProcessRunner runner) {
        if (runner == null) {
            throw new IllegalArgumentException("runner must not be null");
        }
        this.runner = runner;
    }

    @Override
    public Resolution resolve(String resolver, String filename) {
        ProcessOutcome outcome;
        try {
            outcome = runner.run(List.of(resolver, filename), null);
        } catch (InterruptedIOException e) {
            log.debug("Resolver {} interrupted while resolving '{}'", resolver, filename);
            return Resolution.notFound("%s was interrupted while resolving '%s'".formatted(resolver, filename));
        } catch (IOException e) {
            log.warn("Resolver {} failed for '{}': {}", resolver, filename, e.getMessage());
            return Resolution.notFound("%s failed while resolving '%s': %s".formatted(resolver, filename, e.getMessage()));
        }

        if (!outcome.succeeded()) {
            log.debug("Resolver {} exited with status {} for '{}'", resolver, outcome.exitCode(), filename);
            return Resolution.notFound(notFoundReason(resolver, filename));
        }
        String output = outcome.stdout().strip();
        if (output.isEmpty()) {
            return Resolution.notFound("%s reported '%s' without a path".formatted(resolver, filename));
        }
        try {
            return Resolution.found(Path.of(output));
        } catch (InvalidPathException e) {
            log.warn("Resolver {} printed an unusable path for '{}': {}", resolver, filename, output);
            return Resolution.notFound("%s printed an unusable path for '%s'".formatted(resolver, filename));
        }
    }

    /** The reason reported when the resolver exits with a non-zero status. */
    public static String notFoundReason(String resolver, String filename) {
        return "'%s' not found by %s".formatted(filename, resolver);
    }
}
