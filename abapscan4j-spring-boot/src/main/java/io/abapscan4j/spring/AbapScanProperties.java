/*
 * Copyright (c) 2025 Abapscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.abapscan4j.spring;

import io.abapscan4j.core.api.model.RuleType;
import java.util.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "abapscan4j")
public class AbapScanProperties {

    private boolean enabled = true;

    /** Version reported by the health probe. */
    private String version = "2.0";

    private int recentFindingsCapacity = 200;

    @Setter(AccessLevel.NONE)
    @Getter(AccessLevel.NONE)
    private List<RuleType> rules = new ArrayList<>(); // empty = all rules

    public List<RuleType> getRules() {
        return Collections.unmodifiableList(rules);
    }

    public void setRules(List<RuleType> rules) {
        this.rules = new ArrayList<>(Objects.requireNonNullElse(rules, List.of()));
    }
}
