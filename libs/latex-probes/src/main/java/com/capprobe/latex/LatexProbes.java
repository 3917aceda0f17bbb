package com.capprobe.latex;

import com.capprobe.probe.ExecutableProbe;
import com.capprobe.probe.InstallHint;
import com.capprobe.probe.Probe;
import com.capprobe.probe.StaticFileProbe;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Probes for a LaTeX installation: the typesetting programs, the {@code kpsewhich} file resolver,
 * and files or packages located through it.
 * <p>
 * Every factory method returns equal probes for equal arguments, so verdicts cached for one
 * instance apply to all of them.
 */
public final class LatexProbes {

    public static final String LATEX_URL = "https://www.latex-project.org/";
    public static final String LATEX_PACKAGE = "texlive";
    public static final String RESOLVER = "kpsewhich";

    /** Attached to every LaTeX probe. */
    public static final InstallHint INSTALL_HINT = new InstallHint(LATEX_PACKAGE, LATEX_URL);

    private static final String PACKAGE_PREFIX = "latex_package_";

    private static final Map<String, StaticFileProbe> PACKAGES = new ConcurrentHashMap<>();

    private LatexProbes() {
        // utility class
    }

    public static ExecutableProbe latex() {
        return typesetter("latex");
    }

    public static ExecutableProbe pdflatex() {
        return typesetter("pdflatex");
    }

    public static ExecutableProbe xelatex() {
        return typesetter("xelatex");
    }

    public static ExecutableProbe lualatex() {
        return typesetter("lualatex");
    }

    /**
     * A typesetting program, checked functionally by compiling {@link TypesetCheck#SAMPLE_DOCUMENT}.
     */
    public static ExecutableProbe typesetter(String program) {
        return new ExecutableProbe(program, program, TypesetCheck.sampleDocument(), INSTALL_HINT);
    }

    /** The resolver tool itself; presence only. */
    public static ExecutableProbe kpsewhich() {
        return new ExecutableProbe(RESOLVER, RESOLVER, null, INSTALL_HINT);
    }

    /**
     * A TeX file located by {@code kpsewhich}. Resolution is only attempted once {@code pdflatex}
     * and {@code kpsewhich} are both present.
     *
     * @param name     probe identity, e.g. {@code "latex_class_article"}
     * @param filename file to look up, e.g. {@code "article.cls"}
     */
    public static StaticFileProbe texFile(String name, String filename) {
        List<Probe> dependencies = List.of(pdflatex(), kpsewhich());
        return new StaticFileProbe(name, filename, RESOLVER, dependencies, INSTALL_HINT);
    }

    /**
     * A LaTeX package, present when its {@code .sty} file resolves. Construct-or-reuse: the same
     * package identifier always yields the same instance.
     *
     * @param packageId package identifier, e.g. {@code "tkz-graph"}
     */
    public static StaticFileProbe latexPackage(String packageId) {
        String name = packageProbeName(packageId);
        return PACKAGES.computeIfAbsent(name, n -> texFile(n, packageId + ".sty"));
    }

    /**
     * Derives the probe name of a package: {@code latex_package_} followed by the identifier with
     * every {@code -} replaced by {@code _}.
     */
    public static String packageProbeName(String packageId) {
        if (packageId == null || packageId.isBlank()) {
            throw new IllegalArgumentException("packageId must not be null or blank");
        }
        return (PACKAGE_PREFIX + packageId).replace('-', '_');
    }
}
