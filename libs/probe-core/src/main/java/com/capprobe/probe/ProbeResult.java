package com.capprobe.probe;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of evaluating a {@link Probe}.
 * <p>
 * Absence is a normal outcome: a negative result always carries a non-blank {@code reason} that
 * can be shown to a user as-is. Two results are equal when they describe the same subject with
 * the same verdict; reason and resolution texts do not take part in equality.
 *
 * @param subjectName name of the evaluated probe
 * @param present     the verdict
 * @param reason      why the capability is unavailable; {@code null} when present
 * @param resolution  how the capability could be made available; {@code null} when present or unknown
 */
public record ProbeResult(String subjectName, boolean present, String reason, String resolution) {

    public ProbeResult {
        if (subjectName == null || subjectName.isBlank()) {
            throw new IllegalArgumentException("subjectName must not be null or blank");
        }
        if (present) {
            reason = null;
            resolution = null;
        } else if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason must be given for an absent capability");
        }
    }

    /** Creates a positive result. */
    public static ProbeResult present(String subjectName) {
        return new ProbeResult(subjectName, true, null, null);
    }

    /** Creates a negative result without resolution hint. */
    public static ProbeResult absent(String subjectName, String reason) {
        return new ProbeResult(subjectName, false, reason, null);
    }

    /**
     * Creates a negative result for the probe, taking the resolution text from its install hint.
     */
    public static ProbeResult absent(Probe probe, String reason) {
        InstallHint hint = probe.installHint();
        return new ProbeResult(probe.name(), false, reason, hint == null ? null : hint.describe());
    }

    /**
     * Re-attributes a negative result of a member or dependency to the given probe, keeping the
     * member's reason unmodified.
     */
    public static ProbeResult absentBecauseOf(Probe probe, ProbeResult cause) {
        if (cause.present()) {
            throw new IllegalArgumentException("cause must be a negative result");
        }
        String resolution = cause.resolution();
        if (resolution == null && probe.installHint() != null) {
            resolution = probe.installHint().describe();
        }
        return new ProbeResult(probe.name(), false, cause.reason(), resolution);
    }

    /** The reason as an optional, empty for positive results. */
    public Optional<String> reasonText() {
        return Optional.ofNullable(reason);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ProbeResult that)) {
            return false;
        }
        return present == that.present && subjectName.equals(that.subjectName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subjectName, present);
    }

    @Override
    public String toString() {
        return present
                ? "ProbeResult('%s', true)".formatted(subjectName)
                : "ProbeResult('%s', false, reason='%s')".formatted(subjectName, reason);
    }
}
