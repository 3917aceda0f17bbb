package com.capprobe.probe.resolve;

/**
 * Maps a logical file name to an absolute path through an external tool that knows a search
 * convention this library does not implement (e.g. {@code kpsewhich} for TeX files).
 */
@FunctionalInterface
public interface FileResolver {

    /**
     * Resolves a file. Must not throw for absent files or failing tools; both are reported as
     * {@link Resolution#notFound(String)}.
     *
     * @param resolver command name of the resolver tool
     * @param filename logical file name
     */
    Resolution resolve(String resolver, String filename);
}
