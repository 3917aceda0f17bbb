package com.capprobe.probeservice.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ProbeServiceProperties")
class ProbeServicePropertiesTest {

    @Test
    @DisplayName("accepts valid properties")
    void acceptsValidProperties() {
        var props = new ProbeServiceProperties(Duration.ofSeconds(30), List.of("/opt/texlive/bin"), true);

        assertThat(props.processTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(props.searchDirectories()).containsExactly(Path.of("/opt/texlive/bin"));
        assertThat(props.warmUp()).isTrue();
    }

    @Test
    @DisplayName("defaults search path to empty when null")
    void defaultsSearchPath() {
        var props = new ProbeServiceProperties(null, null, false);

        assertThat(props.searchPath()).isEmpty();
        assertThat(props.toSettings().searchPath()).isEmpty();
    }

    @Test
    @DisplayName("treats a zero or negative timeout as unbounded")
    void treatsNonPositiveTimeoutAsUnbounded() {
        assertThat(new ProbeServiceProperties(Duration.ZERO, List.of(), false).processTimeout()).isNull();
        assertThat(new ProbeServiceProperties(Duration.ofSeconds(-1), List.of(), false).toSettings().processTimeout())
                .isNull();
    }

    @Test
    @DisplayName("skips blank search path entries")
    void skipsBlankEntries() {
        var props = new ProbeServiceProperties(null, List.of(" ", "/usr/bin"), false);

        assertThat(props.toSettings().searchPath()).containsExactly(Path.of("/usr/bin"));
    }
}
