package com.capprobe.probeservice.api;

import com.capprobe.probe.Probe;
import com.capprobe.probe.ProbeCatalog;
import com.capprobe.probe.ProbeKind;
import com.capprobe.probe.ProbeReport;
import com.capprobe.probe.ProbeResult;
import com.capprobe.probe.Prober;
import com.capprobe.probe.StaticFileProbe;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Caller-facing query surface over HTTP. Absence is a normal 200 response carrying the negative
 * verdict; only the path query turns absence into an error response.
 */
@RestController
@RequestMapping("/api/v1/probes")
public class ProbeController {

    private final Prober prober;
    private final ProbeCatalog catalog;

    public ProbeController(Prober prober, ProbeCatalog catalog) {
        this.prober = prober;
        this.catalog = catalog;
    }

    @GetMapping
    public ProbeReport report() {
        return prober.scan(catalog);
    }

    @GetMapping("/{name}")
    public ProbeResult presence(@PathVariable String name) {
        return prober.isPresent(lookup(name));
    }

    @GetMapping("/{name}/functional")
    public ProbeResult functional(@PathVariable String name) {
        return prober.isFunctional(lookup(name));
    }

    @GetMapping("/{name}/path")
    public Map<String, String> path(@PathVariable String name) {
        Probe probe = lookup(name);
        if (probe.kind() != ProbeKind.STATIC_FILE) {
            throw new IllegalArgumentException("Probe '%s' is not a file probe".formatted(name));
        }
        return Map.of(
                "name", name,
                "path", prober.absolutePath((StaticFileProbe) probe).toString());
    }

    private Probe lookup(String name) {
        return catalog.find(name).orElseThrow(() -> new UnknownProbeException(name, catalog.name()));
    }
}
