package com.capprobe.probe.resolve;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves a command name the way the process's program search would. Never starts a process.
 */
@FunctionalInterface
public interface ExecutableLocator {

    /**
     * @param command program name, e.g. {@code "pdflatex"}
     * @return absolute path of the executable, or empty if it cannot be found
     */
    Optional<Path> locate(String command);
}
