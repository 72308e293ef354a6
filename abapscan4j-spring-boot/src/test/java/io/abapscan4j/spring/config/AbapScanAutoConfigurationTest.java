package io.abapscan4j.spring.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.abapscan4j.core.api.UnitScanner;
import io.abapscan4j.core.api.model.RuleType;
import io.abapscan4j.core.api.model.Unit;
import io.abapscan4j.core.report.NoopReporter;
import io.abapscan4j.core.report.Reporter;
import io.abapscan4j.spring.AbapScanEndpoint;
import io.abapscan4j.spring.MicrometerReporter;
import io.abapscan4j.spring.web.ScanController;
import io.abapscan4j.spring.web.UnitJsonModule;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;

class AbapScanAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(AbapScanAutoConfiguration.class));

    @Test
    void registersScannerWithAllRulesByDefault() {
        runner.run(ctx -> {
            assertThat(ctx).hasSingleBean(UnitScanner.class);
            assertThat(ctx.getBean(UnitScanner.class).activeRules())
                    .containsExactly(RuleType.SET_EXTENDED_CHECK, RuleType.BREAK_POINT);
            assertThat(ctx.getBean(Reporter.class)).isInstanceOf(NoopReporter.class);
            assertThat(ctx).doesNotHaveBean(ScanController.class);
        });
    }

    @Test
    void rulesCanBeRestrictedFromProperties() {
        runner.withPropertyValues("abapscan4j.rules=BREAK_POINT").run(ctx -> assertThat(
                        ctx.getBean(UnitScanner.class).activeRules())
                .containsExactly(RuleType.BREAK_POINT));
    }

    @Test
    void backsOffWhenDisabled() {
        runner.withPropertyValues("abapscan4j.enabled=false")
                .run(ctx -> assertThat(ctx).doesNotHaveBean(UnitScanner.class));
    }

    @Test
    void usesMicrometerWhenRegistryPresent() {
        runner.withBean(MeterRegistry.class, SimpleMeterRegistry::new).run(ctx -> {
            assertThat(ctx.getBean(Reporter.class)).isInstanceOf(MicrometerReporter.class);

            ctx.getBean(UnitScanner.class).scanOne(Unit.of("P", "I", "FORM", "f", 0, 1, "BREAK-POINT."));

            MeterRegistry registry = ctx.getBean(MeterRegistry.class);
            assertThat(registry.counter("abapscan4j_findings_total", "rule", "Rule304_BreakPointUsage").count())
                    .isEqualTo(1.0);
        });
    }

    @Test
    void servletApplicationGetsControllerAndEndpoint() {
        new WebApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(AbapScanAutoConfiguration.class))
                .withPropertyValues("management.endpoints.web.exposure.include=abapscan", "abapscan4j.version=3.1")
                .run(ctx -> {
                    assertThat(ctx).hasSingleBean(ScanController.class);
                    assertThat(ctx).hasSingleBean(UnitJsonModule.class);
                    assertThat(ctx).hasSingleBean(AbapScanEndpoint.class);

                    Map<String, Object> info = ctx.getBean(AbapScanEndpoint.class).info();
                    assertThat(info).containsEntry("status", "OK").containsEntry("version", "3.1");
                    assertThat(info.get("recentFindings")).isEqualTo(List.of());
                });
    }
}
