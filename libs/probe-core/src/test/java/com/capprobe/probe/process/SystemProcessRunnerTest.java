package com.capprobe.probe.process;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("SystemProcessRunner")
@DisabledOnOs(OS.WINDOWS)
class SystemProcessRunnerTest {

    @TempDir
    Path workingDirectory;

    @Test
    @DisplayName("captures exit status and both output streams")
    void capturesOutput() throws IOException {
        var runner = new SystemProcessRunner();

        ProcessOutcome outcome = runner.run(List.of("sh", "-c", "echo out; echo err >&2; exit 3"), null);

        assertThat(outcome.exitCode()).isEqualTo(3);
        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.stdout()).isEqualTo("out\n");
        assertThat(outcome.stderr()).isEqualTo("err\n");
    }

    @Test
    @DisplayName("runs in the given working directory")
    void runsInWorkingDirectory() throws IOException {
        var runner = new SystemProcessRunner(Duration.ofSeconds(30));

        ProcessOutcome outcome = runner.run(List.of("sh", "-c", "pwd -P"), workingDirectory);

        assertThat(Path.of(outcome.stdout().strip())).isEqualTo(workingDirectory.toRealPath());
    }

    @Test
    @DisplayName("kills a process that exceeds the timeout")
    void enforcesTimeout() {
        var runner = new SystemProcessRunner(Duration.ofMillis(200));

        assertThatThrownBy(() -> runner.run(List.of("sleep", "10"), null))
                .isInstanceOf(ProcessTimeoutException.class)
                .hasMessageContaining("did not finish within 200 ms");
    }

    @Test
    @DisplayName("reports a program that cannot be started")
    void reportsMissingProgram() {
        var runner = new SystemProcessRunner();

        assertThatThrownBy(() -> runner.run(List.of("capprobe-no-such-program-xyz"), null))
                .isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("completes concurrent invocations that fill the error pipe")
    void drainsConcurrentChattyProcesses() throws Exception {
        int callers = 3 * Runtime.getRuntime().availableProcessors() + 2;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try (var runner = new SystemProcessRunner()) {
            List<Future<ProcessOutcome>> outcomes = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                outcomes.add(pool.submit(() -> runner.run(
                        List.of("sh", "-c", "head -c 300000 /dev/zero >&2; echo ok"), null)));
            }
            for (Future<ProcessOutcome> outcome : outcomes) {
                ProcessOutcome finished = outcome.get(30, TimeUnit.SECONDS);
                assertThat(finished.stdout()).isEqualTo("ok\n");
                assertThat(finished.stderr()).hasSize(300000);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("rejects invocations once closed")
    void rejectsAfterClose() {
        var runner = new SystemProcessRunner();
        runner.close();

        assertThatThrownBy(() -> runner.run(List.of("true"), null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("closed");
    }

    @Test
    @DisplayName("rejects invalid arguments")
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> new SystemProcessRunner(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SystemProcessRunner().run(List.of(), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
