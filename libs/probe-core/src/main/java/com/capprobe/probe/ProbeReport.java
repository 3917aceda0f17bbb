package com.capprobe.probe;

import java.time.Instant;
import java.util.List;

/**
 * Verdicts for every probe of a {@link ProbeCatalog}, in catalogue order.
 *
 * @param catalog     catalogue name
 * @param results     one result per probe
 * @param generatedAt when the scan finished
 */
public record ProbeReport(String catalog, List<ProbeResult> results, Instant generatedAt) {

    public ProbeReport {
        results = List.copyOf(results);
    }

    /** Number of capabilities reported present. */
    public long presentCount() {
        return results.stream().filter(ProbeResult::present).count();
    }

    /** The negative results only. */
    public List<ProbeResult> missing() {
        return results.stream().filter(r -> !r.present()).toList();
    }
}
