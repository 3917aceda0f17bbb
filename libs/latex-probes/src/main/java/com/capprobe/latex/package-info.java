/**
 * Capability probes for a LaTeX toolchain.
 *
 * <p>{@link com.capprobe.latex.LatexProbes} builds the probes, {@link com.capprobe.latex.TypesetCheck}
 * verifies that a typesetting program really compiles a document, and
 * {@link com.capprobe.latex.LatexCatalog} lists the probes as one catalogue.
 */
package com.capprobe.latex;
