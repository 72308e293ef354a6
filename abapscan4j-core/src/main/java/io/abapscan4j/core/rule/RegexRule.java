/*
 * Copyright (c) 2025 Abapscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.abapscan4j.core.rule;

import io.abapscan4j.core.api.Rule;
import io.abapscan4j.core.api.model.MatchResult;
import io.abapscan4j.core.api.model.RuleType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule backed by a case-insensitive {@link Pattern}; matches are leftmost and non-overlapping.
 * Word characters and boundaries are Unicode-aware, so {@code \b} and {@code \w} treat umlauts
 * in ABAP identifiers as letters on every JDK.
 */
public class RegexRule implements Rule {
    private final RuleType type;
    private final Pattern pattern;
    private final String message;
    private final String suggestion;

    public RegexRule(RuleType type, String regex, String message, String suggestion) {
        this.type = Objects.requireNonNull(type, "type");
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);
        this.message = message;
        this.suggestion = suggestion;
    }

    @Override
    public RuleType type() {
        return type;
    }

    @Override
    public String message() {
        return message;
    }

    @Override
    public String suggestion() {
        return suggestion;
    }

    @Override
    public MatchResult match(String source) {
        if (source == null || source.isEmpty()) return MatchResult.empty();
        Matcher m = pattern.matcher(source);
        List<MatchResult.Span> spans = new ArrayList<>();
        while (m.find()) {
            spans.add(new MatchResult.Span(m.start(), m.end(), m.group()));
        }
        return spans.isEmpty() ? MatchResult.empty() : new MatchResult(true, spans);
    }

    @Override
    public String toString() {
        return type.issueType() + "[" + pattern.pattern() + "]";
    }
}
