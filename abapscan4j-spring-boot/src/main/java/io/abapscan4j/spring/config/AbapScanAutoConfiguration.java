/*
 * Copyright (c) 2025 Abapscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.abapscan4j.spring.config;

import io.abapscan4j.core.api.UnitScanner;
import io.abapscan4j.core.preset.RuleRegistry;
import io.abapscan4j.core.report.NoopReporter;
import io.abapscan4j.core.report.Reporter;
import io.abapscan4j.spring.AbapScanEndpoint;
import io.abapscan4j.spring.AbapScanProperties;
import io.abapscan4j.spring.MicrometerReporter;
import io.abapscan4j.spring.web.ScanController;
import io.abapscan4j.spring.web.ScanExceptionHandler;
import io.abapscan4j.spring.web.UnitJsonModule;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.autoconfigure.endpoint.condition.ConditionalOnAvailableEndpoint;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.*;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Builds the {@link UnitScanner} from YAML, a {@link Reporter} (Micrometer or no-op) and, in a
 * servlet application, the scan controller.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(AbapScanProperties.class)
@ConditionalOnProperty(prefix = "abapscan4j", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AbapScanAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(Reporter.class)
    public Reporter abapScanReporter(ObjectProvider<MeterRegistry> registry, AbapScanProperties props) {
        MeterRegistry r = registry.getIfAvailable();
        return (r != null) ? new MicrometerReporter(r, props.getRecentFindingsCapacity()) : new NoopReporter();
    }

    @Bean
    @ConditionalOnMissingBean
    public UnitScanner unitScanner(AbapScanProperties props, Reporter reporter) {
        var rules = new RuleRegistry().build(props.getRules());
        var scanner = new UnitScanner(rules, reporter);
        log.info("abapscan4j active rules: {}", scanner.activeRules());
        return scanner;
    }

    @Bean
    @ConditionalOnAvailableEndpoint(endpoint = AbapScanEndpoint.class)
    public AbapScanEndpoint abapScanEndpoint(UnitScanner scanner, Reporter reporter, AbapScanProperties props) {
        return new AbapScanEndpoint(scanner, reporter, props.getVersion());
    }

    @Bean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnMissingBean
    public ScanController scanController(UnitScanner scanner, AbapScanProperties props) {
        return new ScanController(scanner, props.getVersion());
    }

    @Bean
    @ConditionalOnMissingBean
    public UnitJsonModule unitJsonModule() {
        return new UnitJsonModule();
    }

    @Bean
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    public ScanExceptionHandler scanExceptionHandler() {
        return new ScanExceptionHandler();
    }
}
