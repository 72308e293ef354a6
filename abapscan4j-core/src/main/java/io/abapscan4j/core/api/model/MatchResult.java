/*
 * Copyright (c) 2025 Abapscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.abapscan4j.core.api.model;

import java.util.List;

public record MatchResult(boolean found, List<Span> spans) {
    public MatchResult {
        spans = List.copyOf(spans);
    }

    public static MatchResult empty() {
        return new MatchResult(false, List.of());
    }

    /** Span indices [start,end) into the scanned source, with the matched text. */
    public record Span(int start, int end, String text) {}
}
