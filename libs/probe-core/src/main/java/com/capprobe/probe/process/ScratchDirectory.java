package com.capprobe.probe.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * A freshly created temporary directory owned by one check invocation. Closing it deletes the
 * directory and everything written into it.
 * <pre>{@code
 * try (ScratchDirectory scratch = ScratchDirectory.create("capprobe-latex-")) {
 *     Path input = scratch.write("sample.tex", content);
 *     ...
 * }
 * }</pre>
 */
public final class ScratchDirectory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScratchDirectory.class);

    private final Path path;

    private ScratchDirectory(Path path) {
        this.path = path;
    }

    /**
     * Creates a new directory under the system temporary directory.
     *
     * @param prefix directory name prefix
     */
    public static ScratchDirectory create(String prefix) throws IOException {
        return new ScratchDirectory(Files.createTempDirectory(prefix));
    }

    public Path path() {
        return path;
    }

    /**
     * Writes a UTF-8 text file into the directory.
     *
     * @return the absolute path of the written file
     */
    public Path write(String fileName, String content) throws IOException {
        Path file = path.resolve(fileName);
        if (!file.getParent().equals(path)) {
            throw new IllegalArgumentException("fileName must not leave the scratch directory: " + fileName);
        }
        return Files.writeString(file, content);
    }

    /**
     * Deletes the directory tree. Failures are logged; closing never throws.
     */
    @Override
    public void close() {
        if (!Files.exists(path)) {
            return;
        }
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(path)) {
            entries = walk.sorted(Comparator.reverseOrder()).toList();
        } catch (IOException e) {
            log.warn("Could not list scratch directory {} for cleanup: {}", path, e.getMessage());
            return;
        }
        for (Path entry : entries) {
            try {
                Files.deleteIfExists(entry);
            } catch (IOException e) {
                log.warn("Could not delete scratch entry {}: {}", entry, e.getMessage());
            }
        }
    }
}
