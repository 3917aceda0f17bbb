package com.capprobe.probe.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}.
 * <p>
 * Standard output and error are drained concurrently so chatty programs cannot block on a full
 * pipe. Drains run on daemon threads owned by the runner; the pool never queues, so every running
 * process has both of its streams read no matter how many callers run processes at once.
 * Standard input is closed immediately. With a timeout configured, a process still running when
 * it elapses is destroyed forcibly and {@link ProcessTimeoutException} is thrown.
 * <p>
 * {@link #close()} stops the drain threads; a closed runner rejects further invocations.
 */
public final class SystemProcessRunner implements ProcessRunner, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SystemProcessRunner.class);
    private static final AtomicInteger RUNNER_IDS = new AtomicInteger();

    private final Duration timeout;
    private final ExecutorService drains;

    /** Runner that waits for processes without bound. */
    public SystemProcessRunner() {
        this(null);
    }

    /**
     * @param timeout bound on each invocation; {@code null} waits without bound
     */
    public SystemProcessRunner(Duration timeout) {
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.timeout = timeout;
        this.drains = newDrainPool(RUNNER_IDS.incrementAndGet());
    }

    @Override
    public ProcessOutcome run(List<String> command, Path workingDirectory) throws IOException {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be null or empty");
        }
        if (drains.isShutdown()) {
            throw new IllegalStateException("runner is closed");
        }
        ProcessBuilder builder = new ProcessBuilder(command);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }

        log.debug("Running {} in {}", command, workingDirectory == null ? "current directory" : workingDirectory);
        Process process = builder.start();
        try {
            process.getOutputStream().close();
            CompletableFuture<String> stdout = drain(process.getInputStream());
            CompletableFuture<String> stderr = drain(process.getErrorStream());

            if (timeout == null) {
                process.waitFor();
            } else if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ProcessTimeoutException(command, timeout);
            }

            int exitCode = process.exitValue();
            log.debug("{} exited with status {}", command.get(0), exitCode);
            return new ProcessOutcome(exitCode, join(stdout), join(stderr));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new InterruptedIOException("Interrupted while waiting for " + command.get(0));
        } finally {
            if (process.isAlive()) {
                process.destroy();
            }
        }
    }

    /** The configured timeout, or {@code null} when unbounded. */
    public Duration timeout() {
        return timeout;
    }

    /** Stops the drain threads. Output of invocations still in flight is still read to the end. */
    @Override
    public void close() {
        drains.shutdown();
    }

    private static ExecutorService newDrainPool(int runnerId) {
        AtomicInteger threadIds = new AtomicInteger();
        return new ThreadPoolExecutor(0, Integer.MAX_VALUE, 60L, TimeUnit.SECONDS, new SynchronousQueue<>(), r -> {
            Thread t = new Thread(r);
            t.setName("capprobe-process-drain-" + runnerId + "-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (stream) {
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, drains);
    }

    private static String join(CompletableFuture<String> output) throws IOException {
        try {
            return output.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof UncheckedIOException unchecked) {
                throw unchecked.getCause();
            }
            throw e;
        }
    }
}
