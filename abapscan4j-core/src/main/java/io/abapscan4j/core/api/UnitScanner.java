/*
 * Copyright (c) 2025 Abapscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.abapscan4j.core.api;

import io.abapscan4j.core.api.model.Finding;
import io.abapscan4j.core.api.model.MatchResult;
import io.abapscan4j.core.api.model.RuleType;
import io.abapscan4j.core.api.model.Unit;
import io.abapscan4j.core.report.NoopReporter;
import io.abapscan4j.core.report.Reporter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composite scanner that runs all rules over a unit and returns a copy carrying the findings.
 * Findings are ordered by rule registration first, then by position in the source.
 */
public final class UnitScanner {
    private static final Logger log = LoggerFactory.getLogger(UnitScanner.class);

    private final List<Rule> rules;
    private final Reporter reporter;

    public UnitScanner(List<Rule> rules) {
        this(rules, new NoopReporter());
    }

    public UnitScanner(List<Rule> rules, Reporter reporter) {
        this.rules = List.copyOf(rules);
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    public Unit scanOne(Unit unit) {
        Objects.requireNonNull(unit, "unit");
        String src = unit.source();
        List<Finding> findings = new ArrayList<>();
        for (Rule rule : rules) {
            MatchResult r = rule.match(src);
            if (!r.found()) continue;
            for (MatchResult.Span s : r.spans()) {
                findings.add(FindingBuilder.build(unit, rule, s));
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Scanned {}/{} {} '{}': {} finding(s)",
                    unit.pgmName(), unit.incName(), unit.type(), unit.name(), findings.size());
        }
        if (!findings.isEmpty()) reporter.report(List.copyOf(findings));
        return unit.withFindings(findings);
    }

    /** Scans every unit in input order; units without findings are kept. */
    public List<Unit> scanMany(List<Unit> units) {
        List<Unit> out = new ArrayList<>(units.size());
        for (Unit u : units) out.add(scanOne(u));
        return List.copyOf(out);
    }

    public List<RuleType> activeRules() {
        return rules.stream().map(Rule::type).toList();
    }
}
