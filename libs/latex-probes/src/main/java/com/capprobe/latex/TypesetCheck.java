package com.capprobe.latex;

import com.capprobe.probe.ExecutableProbe;
import com.capprobe.probe.FunctionalCheck;
import com.capprobe.probe.ProbeResult;
import com.capprobe.probe.process.ProcessOutcome;
import com.capprobe.probe.process.ProcessRunner;
import com.capprobe.probe.process.ScratchDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Functional check for a typesetting program: compiles a minimal document in a fresh scratch
 * directory with {@code -interaction=nonstopmode} and trusts the exit status alone. Output and
 * log files are never parsed. The scratch directory is removed whatever the outcome.
 *
 * @param documentLines the sample document, one entry per line
 */
public record TypesetCheck(List<String> documentLines) implements FunctionalCheck {

    private static final Logger log = LoggerFactory.getLogger(TypesetCheck.class);

    /** A one-formula article. */
    public static final List<String> SAMPLE_DOCUMENT = List.of(
            "\\documentclass{article}",
            "\\begin{document}",
            "$\\alpha+2$",
            "\\end{document}");

    static final String SAMPLE_FILE_NAME = "capprobe-sample.tex";
    static final String NON_INTERACTIVE = "-interaction=nonstopmode";

    public TypesetCheck {
        if (documentLines == null || documentLines.isEmpty()) {
            throw new IllegalArgumentException("documentLines must not be null or empty");
        }
        documentLines = List.copyOf(documentLines);
    }

    /** Check compiling {@link #SAMPLE_DOCUMENT}. */
    public static TypesetCheck sampleDocument() {
        return new TypesetCheck(SAMPLE_DOCUMENT);
    }

    @Override
    public ProbeResult verify(ExecutableProbe probe, Path executable, ProcessRunner runner) {
        try (ScratchDirectory scratch = ScratchDirectory.create("capprobe-" + probe.command() + "-")) {
            Path document = scratch.write(SAMPLE_FILE_NAME, String.join("\n", documentLines));
            ProcessOutcome outcome = runner.run(
                    List.of(executable.toString(), NON_INTERACTIVE, document.getFileName().toString()),
                    scratch.path());
            if (outcome.succeeded()) {
                return ProbeResult.present(probe.name());
            }
            return ProbeResult.absent(probe, "Running %s on a sample file returned non-zero exit status %d"
                    .formatted(probe.name(), outcome.exitCode()));
        } catch (IOException e) {
            log.warn("Could not run {} on a sample file: {}", probe.name(), e.getMessage());
            return ProbeResult.absent(probe, "Running %s on a sample file failed: %s"
                    .formatted(probe.name(), e.getMessage()));
        }
    }
}
