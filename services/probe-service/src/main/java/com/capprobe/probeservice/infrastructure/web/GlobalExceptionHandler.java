package com.capprobe.probeservice.infrastructure.web;

import com.capprobe.probe.ProbeNotPresentException;
import com.capprobe.probeservice.api.UnknownProbeException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses:
 *
 * <pre>
 * {
 *   "type": "https://capprobe.dev/errors/not-present",
 *   "title": "Capability Not Present",
 *   "status": 404,
 *   "detail": "'tkz-graph.sty' not found by kpsewhich",
 *   "probe": "latex_package_tkz_graph",
 *   "timestamp": "2026-10-19T08:30:00Z"
 * }
 * </pre>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ProbeNotPresentException.class)
    public ProblemDetail handleNotPresent(ProbeNotPresentException ex) {
        log.debug("Capability not present: {}", ex.probeName());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.reason());
        problem.setTitle("Capability Not Present");
        problem.setType(URI.create("https://capprobe.dev/errors/not-present"));
        problem.setProperty("probe", ex.probeName());
        if (ex.result().resolution() != null) {
            problem.setProperty("resolution", ex.result().resolution());
        }
        return withTimestamp(problem);
    }

    @ExceptionHandler(UnknownProbeException.class)
    public ProblemDetail handleUnknownProbe(UnknownProbeException ex) {
        log.warn("Unknown probe requested: {}", ex.probeName());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
        problem.setTitle("Unknown Probe");
        problem.setType(URI.create("https://capprobe.dev/errors/unknown-probe"));
        problem.setProperty("catalog", ex.catalog());
        return withTimestamp(problem);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setType(URI.create("https://capprobe.dev/errors/bad-request"));
        return withTimestamp(problem);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create("https://capprobe.dev/errors/internal"));
        return withTimestamp(problem);
    }

    private static ProblemDetail withTimestamp(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        return problem;
    }
}
