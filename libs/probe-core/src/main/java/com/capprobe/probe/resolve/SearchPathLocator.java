package com.capprobe.probe.resolve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * {@link ExecutableLocator} that scans a list of directories, by default the {@code PATH}
 * environment variable. On Windows every {@code PATHEXT} extension is tried as well.
 */
public final class SearchPathLocator implements ExecutableLocator {

    private static final Logger log = LoggerFactory.getLogger(SearchPathLocator.class);

    private final List<Path> directories;
    private final List<String> extensions;

    /** Locator over the current {@code PATH}. */
    public SearchPathLocator() {
        this(fromEnvironment(System.getenv("PATH")));
    }

    public SearchPathLocator(List<Path> directories) {
        this(directories, isWindows() ? windowsExtensions(System.getenv("PATHEXT")) : List.of(""));
    }

    SearchPathLocator(List<Path> directories, List<String> extensions) {
        this.directories = List.copyOf(directories);
        this.extensions = List.copyOf(extensions);
    }

    @Override
    public Optional<Path> locate(String command) {
        if (command == null || command.isBlank()) {
            return Optional.empty();
        }
        if (command.indexOf('/') >= 0 || command.indexOf(File.separatorChar) >= 0) {
            return candidate(Path.of(command));
        }
        for (Path directory : directories) {
            for (String extension : extensions) {
                Optional<Path> found = candidate(directory.resolve(command + extension));
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    public List<Path> directories() {
        return directories;
    }

    /**
     * Splits a {@code PATH}-style value into directories, skipping empty and malformed entries.
     */
    public static List<Path> fromEnvironment(String pathValue) {
        List<Path> result = new ArrayList<>();
        if (pathValue == null) {
            return result;
        }
        for (String part : pathValue.split(File.pathSeparator)) {
            if (part.isBlank()) {
                continue;
            }
            try {
                result.add(Path.of(part));
            } catch (InvalidPathException e) {
                log.debug("Skipping search path entry '{}': {}", part, e.getMessage());
            }
        }
        return result;
    }

    private static Optional<Path> candidate(Path path) {
        if (Files.isRegularFile(path) && Files.isExecutable(path)) {
            return Optional.of(path.toAbsolutePath());
        }
        return Optional.empty();
    }

    private static List<String> windowsExtensions(String pathExt) {
        List<String> result = new ArrayList<>();
        result.add("");
        String value = pathExt == null ? ".COM;.EXE;.BAT;.CMD" : pathExt;
        for (String ext : value.split(";")) {
            if (!ext.isBlank()) {
                result.add(ext.toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }

    private static boolean isWindows() {
        return System.getProperty("os.name").toLowerCase(Locale.ROOT).contains("win");
    }
}
