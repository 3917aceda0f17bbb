package com.capprobe.probeservice.api;

/**
 * Thrown when a request names a probe that is not in the served catalogue.
 */
public class UnknownProbeException extends RuntimeException {

    private final String probeName;
    private final String catalog;

    public UnknownProbeException(String probeName, String catalog) {
        super("Unknown probe '%s' in catalog '%s'".formatted(probeName, catalog));
        this.probeName = probeName;
        this.catalog = catalog;
    }

    public String probeName() {
        return probeName;
    }

    public String catalog() {
        return catalog;
    }
}
