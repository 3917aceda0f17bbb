package com.capprobe.probe.resolve;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("SearchPathLocator")
@DisabledOnOs(OS.WINDOWS)
class SearchPathLocatorTest {

    @TempDir
    Path first;

    @TempDir
    Path second;

    private static Path executable(Path directory, String name) throws IOException {
        Path file = Files.writeString(directory.resolve(name), "#!/bin/sh\nexit 0\n");
        assertThat(file.toFile().setExecutable(true)).isTrue();
        return file;
    }

    @Test
    @DisplayName("finds an executable in the first matching directory")
    void findsInOrder() throws IOException {
        Path expected = executable(first, "pdflatex");
        executable(second, "pdflatex");

        var locator = new SearchPathLocator(List.of(first, second));

        assertThat(locator.locate("pdflatex")).contains(expected.toAbsolutePath());
    }

    @Test
    @DisplayName("ignores files that are not executable and directories")
    void ignoresNonExecutables() throws IOException {
        Files.writeString(first.resolve("latex"), "not a program");
        Files.createDirectory(second.resolve("latex"));

        var locator = new SearchPathLocator(List.of(first, second));

        assertThat(locator.locate("latex")).isEmpty();
    }

    @Test
    @DisplayName("returns empty for unknown and blank commands")
    void returnsEmptyForUnknown() {
        var locator = new SearchPathLocator(List.of(first));

        assertThat(locator.locate("xelatex")).isEmpty();
        assertThat(locator.locate(" ")).isEmpty();
        assertThat(locator.locate(null)).isEmpty();
    }

    @Test
    @DisplayName("accepts a command given as a path")
    void acceptsPathCommand() throws IOException {
        Path program = executable(first, "kpsewhich");

        var locator = new SearchPathLocator(List.of());

        assertThat(locator.locate(program.toString())).contains(program.toAbsolutePath());
    }

    @Test
    @DisplayName("splits a PATH value and skips empty entries")
    void splitsPathValue() {
        String value = first + File.pathSeparator + File.pathSeparator + second;

        assertThat(SearchPathLocator.fromEnvironment(value)).containsExactly(first, second);
        assertThat(SearchPathLocator.fromEnvironment(null)).isEmpty();
    }
}
