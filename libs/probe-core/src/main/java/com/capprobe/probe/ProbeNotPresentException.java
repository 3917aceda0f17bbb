package com.capprobe.probe;

/**
 * Thrown by queries that promise a value (a resolved path, a required capability) when the
 * capability is absent. Presence queries never throw it; they return the negative
 * {@link ProbeResult} instead.
 */
public class ProbeNotPresentException extends RuntimeException {

    private final transient ProbeResult result;

    public ProbeNotPresentException(ProbeResult result) {
        super(message(result));
        this.result = result;
    }

    private static String message(ProbeResult result) {
        if (result == null || result.present()) {
            throw new IllegalArgumentException("result must be a negative result");
        }
        String text = "%s is not available.%n%s".formatted(result.subjectName(), result.reason());
        if (result.resolution() != null) {
            text += System.lineSeparator() + result.resolution();
        }
        return text;
    }

    public String probeName() {
        return result.subjectName();
    }

    /** The same reason text the corresponding {@link ProbeResult} carries. */
    public String reason() {
        return result.reason();
    }

    public ProbeResult result() {
        return result;
    }
}
