package com.capprobe.latex;

import com.capprobe.probe.Probe;
import com.capprobe.probe.ProbeCatalog;

import java.util.List;

/**
 * Every LaTeX capability callers may want to pre-warm or report on: the four typesetting
 * programs and the {@code tkz-graph} package.
 */
public final class LatexCatalog implements ProbeCatalog {

    public static final String NAME = "latex";

    private final List<Probe> probes = List.of(
            LatexProbes.latex(),
            LatexProbes.pdflatex(),
            LatexProbes.xelatex(),
            LatexProbes.lualatex(),
            LatexProbes.latexPackage("tkz-graph"));

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Probe> allKnownProbes() {
        return probes;
    }
}
