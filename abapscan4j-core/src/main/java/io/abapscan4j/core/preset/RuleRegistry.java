/*
 * Copyright (c) 2025 Abapscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.abapscan4j.core.preset;

import io.abapscan4j.core.api.Rule;
import io.abapscan4j.core.api.model.RuleType;
import io.abapscan4j.core.rule.BreakPointRule;
import io.abapscan4j.core.rule.SetExtendedCheckRule;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Builds the list of {@link Rule} instances for the enabled {@link RuleType}s.
 *
 * <p>Rules are always returned in rule-number order (303, then 304) regardless of the order
 * they were configured in, so findings of a unit come out in a stable order.</p>
 */
public final class RuleRegistry {

    /** Default enabled rules (user may override in YAML). */
    public static EnumSet<RuleType> defaultTypes() {
        return EnumSet.allOf(RuleType.class);
    }

    /**
     * Build rules in a deterministic order.
     *
     * @param types the logical types enabled in config (may be null/empty)
     * @return immutable list of active rules
     */
    public List<Rule> build(List<RuleType> types) {
        EnumSet<RuleType> enabled =
                (types == null || types.isEmpty()) ? defaultTypes() : EnumSet.copyOf(types);

        List<Rule> out = new ArrayList<>();
        if (enabled.contains(RuleType.SET_EXTENDED_CHECK)) out.add(new SetExtendedCheckRule());
        if (enabled.contains(RuleType.BREAK_POINT)) out.add(new BreakPointRule());
        return List.copyOf(out);
    }
}
