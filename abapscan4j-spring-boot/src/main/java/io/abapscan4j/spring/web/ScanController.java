/*
 * Copyright (c) 2025 Abapscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.abapscan4j.spring.web;

import io.abapscan4j.core.api.UnitScanner;
import io.abapscan4j.core.api.model.RuleType;
import io.abapscan4j.core.api.model.Unit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

/**
 * HTTP surface of the scanner. {@code /remediate} returns the scanned unit as is,
 * {@code /remediate-array} drops units without findings.
 */
@Slf4j
@RestController
public class ScanController {

    private final UnitScanner scanner;
    private final String version;

    public ScanController(UnitScanner scanner, String version) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.version = version;
    }

    @PostMapping("/remediate")
    public Unit scanSingle(@RequestBody Unit unit) {
        validate(Collections.singletonList(unit), false);
        return scanner.scanOne(unit);
    }

    @PostMapping("/remediate-array")
    public List<Unit> scanArray(@RequestBody List<Unit> units) {
        validate(units, true);
        List<Unit> out = new ArrayList<>();
        for (Unit scanned : scanner.scanMany(units)) {
            if (scanned.hasFindings()) out.add(scanned);
        }
        log.debug("Scanned {} unit(s), {} with findings", units.size(), out.size());
        return out;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("ok", true);
        m.put("rules", scanner.activeRules().stream().map(RuleType::number).toList());
        m.put("version", version);
        return m;
    }

    /** Identity fields must be present; empty strings are accepted and scanned. */
    private void validate(List<Unit> units, boolean indexed) {
        List<String> problems = new ArrayList<>();
        for (int i = 0; i < units.size(); i++) {
            Unit u = units.get(i);
            String prefix = indexed ? "[" + i + "]." : "";
            if (u == null) {
                problems.add((indexed ? "[" + i + "]" : "body") + ": must not be null");
                continue;
            }
            if (u.pgmName() == null) problems.add(prefix + "pgm_name: must not be null");
            if (u.incName() == null) problems.add(prefix + "inc_name: must not be null");
            if (u.type() == null) problems.add(prefix + "type: must not be null");
        }
        if (!problems.isEmpty()) {
            throw new InvalidUnitException(problems);
        }
    }
}
