/*
 * Copyright (c) 2025 Abapscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.abapscan4j.spring;

import io.abapscan4j.core.api.UnitScanner;
import io.abapscan4j.core.report.Reporter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;

@Endpoint(id = "abapscan")
public class AbapScanEndpoint {

    private final UnitScanner scanner;
    private final Reporter reporter;
    private final String version;

    public AbapScanEndpoint(UnitScanner scanner, Reporter reporter, String version) {
        this.scanner = scanner;
        this.reporter = reporter;
        this.version = version;
    }

    @ReadOperation
    public Map<String, Object> info() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("status", "OK");
        m.put("version", version);
        m.put("rules", scanner.activeRules());
        m.put("recentFindings",
                (reporter instanceof MicrometerReporter mic) ? mic.recentFindings() : List.of());
        return m;
    }
}
