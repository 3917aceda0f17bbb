package com.capprobe.probe;

import java.util.List;

/**
 * A capability that is present iff all of its members are present.
 * <p>
 * Members are evaluated in declaration order. Evaluation stops at the first absent member, whose
 * reason becomes the composite's reason unmodified.
 *
 * @param name        probe identity
 * @param members     sub-probes, in evaluation order (never empty)
 * @param installHint optional installation hint (nullable)
 */
public record CompositeProbe(String name, List<Probe> members, InstallHint installHint) implements Probe {

    public CompositeProbe {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("members must not be null or empty");
        }
        members = List.copyOf(members);
    }

    /** Composite without installation hint. */
    public static CompositeProbe of(String name, Probe... members) {
        return new CompositeProbe(name, List.of(members), null);
    }

    @Override
    public ProbeKind kind() {
        return ProbeKind.COMPOSITE;
    }
}
