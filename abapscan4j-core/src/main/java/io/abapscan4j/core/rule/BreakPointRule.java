/*
 * Copyright (c) 2025 Abapscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.abapscan4j.core.rule;

import io.abapscan4j.core.api.model.RuleType;

/**
 * Rule 304: {@code BREAK-POINT} in any of its forms ({@code BREAK-POINT.}, {@code BREAK-POINT ID grp},
 * {@code BREAK-POINT lv_user}). One trailing word is consumed with the keyword.
 */
public final class BreakPointRule extends RegexRule {
    static final String REGEX = "\\bBREAK-POINT\\b(?:\\s+\\w+)?";

    public BreakPointRule() {
        super(
                RuleType.BREAK_POINT,
                REGEX,
                "BREAK-POINT is not allowed in ABAP Cloud / Key User scenarios.",
                "Remove or comment out the BREAK-POINT statement.");
    }
}
