/*
 * Copyright (c) 2025 Abapscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.abapscan4j.core.report;

import io.abapscan4j.core.api.model.Finding;
import java.util.List;

/** Receives the findings of every scan that produced at least one. */
public interface Reporter {
    void report(List<Finding> findings);
}
