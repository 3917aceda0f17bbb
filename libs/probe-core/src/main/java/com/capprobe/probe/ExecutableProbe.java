package com.capprobe.probe;

/**
 * Probe for a program on the search path.
 * <p>
 * Presence only requires the command to be resolvable; no process is started. A
 * {@link FunctionalCheck}, when given, is run by {@link Prober#isFunctional(Probe)} against the
 * located executable.
 *
 * @param name            probe identity
 * @param command         program name to locate (e.g. {@code "pdflatex"})
 * @param functionalCheck optional check of correct operation (nullable)
 * @param installHint     optional installation hint (nullable)
 */
public record ExecutableProbe(
        String name,
        String command,
        FunctionalCheck functionalCheck,
        InstallHint installHint
) implements Probe {

    public ExecutableProbe {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("command must not be null or blank");
        }
    }

    /** Probe named after the command itself, without functional check or hint. */
    public static ExecutableProbe of(String command) {
        return new ExecutableProbe(command, command, null, null);
    }

    @Override
    public ProbeKind kind() {
        return ProbeKind.EXECUTABLE;
    }

    public boolean hasFunctionalCheck() {
        return functionalCheck != null;
    }
}
