/*
 * Copyright (c) 2025 Abapscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.abapscan4j.spring;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.abapscan4j.core.api.model.Finding;
import io.abapscan4j.core.report.Reporter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/** Counts findings per rule and keeps the most recent ones for the actuator endpoint. */
public final class MicrometerReporter implements Reporter {
    static final String COUNTER = "abapscan4j_findings_total";

    private final MeterRegistry registry;
    private final Deque<Finding> ring = new ArrayDeque<>();
    private final int capacity;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "MeterRegistry is a framework-managed, thread-safe component; "
                    + "keeping a reference is required for metrics reporting and it is not exposed via accessors.")
    public MicrometerReporter(MeterRegistry registry, int capacity) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.capacity = Math.max(10, capacity);
    }

    @Override
    public synchronized void report(List<Finding> findings) {
        if (findings == null || findings.isEmpty()) return;
        for (Finding f : findings) {
            registry.counter(COUNTER, "rule", f.issuesType()).increment();
            if (ring.size() >= capacity) ring.removeFirst();
            ring.addLast(f);
        }
    }

    /** Returns an unmodifiable snapshot of the recent findings ring buffer. */
    public synchronized List<Finding> recentFindings() {
        return List.copyOf(ring);
    }

    public int capacity() {
        return capacity;
    }
}
