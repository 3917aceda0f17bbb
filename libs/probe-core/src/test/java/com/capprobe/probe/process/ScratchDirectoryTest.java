package com.capprobe.probe.process;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ScratchDirectory")
class ScratchDirectoryTest {

    @Test
    @DisplayName("removes the directory and its contents on close")
    void removesOnClose() throws IOException {
        Path directory;
        Path file;
        try (ScratchDirectory scratch = ScratchDirectory.create("capprobe-test-")) {
            directory = scratch.path();
            file = scratch.write("sample.tex", "\\documentclass{article}");
            Files.createDirectory(directory.resolve("nested"));
            Files.writeString(directory.resolve("nested").resolve("sample.log"), "log");

            assertThat(file).exists().hasContent("\\documentclass{article}");
        }

        assertThat(file).doesNotExist();
        assertThat(directory).doesNotExist();
    }

    @Test
    @DisplayName("removes the directory when the body fails")
    void removesOnFailure() throws IOException {
        Path[] directory = new Path[1];

        assertThatThrownBy(() -> {
            try (ScratchDirectory scratch = ScratchDirectory.create("capprobe-test-")) {
                directory[0] = scratch.path();
                throw new IllegalStateException("check failed");
            }
        }).isInstanceOf(IllegalStateException.class);

        assertThat(directory[0]).doesNotExist();
    }

    @Test
    @DisplayName("refuses file names that leave the directory")
    void refusesEscapingNames() throws IOException {
        try (ScratchDirectory scratch = ScratchDirectory.create("capprobe-test-")) {
            assertThatThrownBy(() -> scratch.write("../escape.tex", "x"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("closing twice is harmless")
    void closeIsIdempotent() throws IOException {
        ScratchDirectory scratch = ScratchDirectory.create("capprobe-test-");
        scratch.close();
        scratch.close();

        assertThat(scratch.path()).doesNotExist();
    }
}
