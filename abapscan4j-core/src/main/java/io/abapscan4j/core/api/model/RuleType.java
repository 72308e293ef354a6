/*
 * Copyright (c) 2025 Abapscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.abapscan4j.core.api.model;

/** Logical rule types users configure in YAML. */
public enum RuleType {
    SET_EXTENDED_CHECK(303, "Rule303_SetExtendedCheck"), // obsolete statement
    BREAK_POINT(304, "Rule304_BreakPointUsage"); // forbidden in ABAP Cloud / Key User

    private final int number;
    private final String issueType;

    RuleType(int number, String issueType) {
        this.number = number;
        this.issueType = issueType;
    }

    public int number() {
        return number;
    }

    public String issueType() {
        return issueType;
    }
}
