package io.abapscan4j.spring;

import static org.assertj.core.api.Assertions.assertThat;

import io.abapscan4j.core.api.model.Finding;
import io.abapscan4j.core.api.model.Severity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class MicrometerReporterTest {

    private static Finding finding(String rule, int line) {
        return new Finding("P", "I", "FORM", "f", line, line, rule, Severity.ERROR, "m", "s", "BREAK-POINT.");
    }

    @Test
    void countsFindingsPerRule() {
        var registry = new SimpleMeterRegistry();
        var reporter = new MicrometerReporter(registry, 50);

        reporter.report(List.of(finding("Rule304_BreakPointUsage", 1), finding("Rule304_BreakPointUsage", 2)));
        reporter.report(List.of(finding("Rule303_SetExtendedCheck", 3)));

        assertThat(registry.counter(MicrometerReporter.COUNTER, "rule", "Rule304_BreakPointUsage").count())
                .isEqualTo(2.0);
        assertThat(registry.counter(MicrometerReporter.COUNTER, "rule", "Rule303_SetExtendedCheck").count())
                .isEqualTo(1.0);
    }

    @Test
    void ringBufferKeepsMostRecentFindings() {
        var reporter = new MicrometerReporter(new SimpleMeterRegistry(), 1);
        assertThat(reporter.capacity()).isEqualTo(10);

        List<Finding> batch = new ArrayList<>();
        for (int i = 1; i <= 15; i++) batch.add(finding("Rule304_BreakPointUsage", i));
        reporter.report(batch);

        assertThat(reporter.recentFindings()).hasSize(10);
        assertThat(reporter.recentFindings().get(0).startingLine()).isEqualTo(6);
    }

    @Test
    void ignoresEmptyReports() {
        var reporter = new MicrometerReporter(new SimpleMeterRegistry(), 10);
        reporter.report(List.of());
        reporter.report(null);
        assertThat(reporter.recentFindings()).isEmpty();
    }
}
