package com.capprobe.latex;

import static org.assertj.core.api.Assertions.assertThat;

import com.capprobe.probe.Probe;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LatexCatalog")
class LatexCatalogTest {

    private final LatexCatalog catalog = new LatexCatalog();

    @Test
    @DisplayName("lists the four typesetters and the tkz-graph package in order")
    void listsKnownProbes() {
        assertThat(catalog.name()).isEqualTo("latex");
        assertThat(catalog.allKnownProbes())
                .extracting(Probe::name)
                .containsExactly("latex", "pdflatex", "xelatex", "lualatex", "latex_package_tkz_graph");
    }

    @Test
    @DisplayName("finds probes by name")
    void findsByName() {
        assertThat(catalog.find("xelatex")).contains(LatexProbes.xelatex());
        assertThat(catalog.find("latex_package_tkz_graph")).contains(LatexProbes.latexPackage("tkz-graph"));
        assertThat(catalog.find("context")).isEmpty();
    }
}
