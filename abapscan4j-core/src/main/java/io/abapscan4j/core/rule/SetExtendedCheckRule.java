/*
 * Copyright (c) 2025 Abapscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.abapscan4j.core.rule;

import io.abapscan4j.core.api.model.RuleType;

/** Rule 303: obsolete {@code SET EXTENDED CHECK} statement, any whitespace between the keywords. */
public final class SetExtendedCheckRule extends RegexRule {
    static final String REGEX = "\\bSET\\s+EXTENDED\\s+CHECK\\b";

    public SetExtendedCheckRule() {
        super(
                RuleType.SET_EXTENDED_CHECK,
                REGEX,
                "Obsolete SET EXTENDED CHECK statement detected.",
                "Remove the SET EXTENDED CHECK statement entirely.");
    }
}
