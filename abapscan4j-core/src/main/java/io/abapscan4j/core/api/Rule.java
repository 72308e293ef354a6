/*
 * Copyright (c) 2025 Abapscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.abapscan4j.core.api;

import io.abapscan4j.core.api.model.MatchResult;
import io.abapscan4j.core.api.model.RuleType;

/** Stateless rule that returns the spans (start..end) of every statement it forbids. */
public interface Rule {
    RuleType type();

    /** Issue type reported on findings, e.g. {@code Rule303_SetExtendedCheck}. */
    default String id() {
        return type().issueType();
    }

    String message();

    String suggestion();

    MatchResult match(String source);
}
