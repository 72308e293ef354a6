/*
 * Copyright (c) 2025 Abapscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.abapscan4j.core.api;

import io.abapscan4j.core.api.model.Finding;
import io.abapscan4j.core.api.model.MatchResult;
import io.abapscan4j.core.api.model.Severity;
import io.abapscan4j.core.api.model.Unit;

/**
 * Turns a span local to a unit's source into a {@link Finding} located in the original file.
 *
 * <p>The absolute line is {@code unit.startLine + lineInBlock}, where {@code lineInBlock} is the
 * 1-based line of the match inside the unit. Downstream consumers rely on this exact arithmetic.</p>
 */
public final class FindingBuilder {
    private FindingBuilder() {}

    public static Finding build(Unit unit, Rule rule, MatchResult.Span span) {
        String src = unit.source();
        int start = span.start();
        if (start < 0 || start > src.length()) {
            throw new IllegalArgumentException("span start " + start + " outside source of length " + src.length());
        }
        int line = absoluteLine(unit.startLine(), src, start);
        return new Finding(
                unit.pgmName(),
                unit.incName(),
                unit.type(),
                unit.name(),
                line,
                line, // single-statement rules never span lines
                rule.id(),
                Severity.ERROR,
                rule.message(),
                rule.suggestion(),
                escape(lineAt(src, start)));
    }

    static int absoluteLine(int startLine, String src, int pos) {
        return startLine + lineInBlock(src, pos);
    }

    /** 1-based line number of {@code pos} within {@code src}. */
    static int lineInBlock(String src, int pos) {
        int breaks = 0;
        for (int i = 0; i < pos; i++) {
            if (src.charAt(i) == '\n') breaks++;
        }
        return breaks + 1;
    }

    /** The physical line holding {@code pos}, without its terminating line break. */
    static String lineAt(String src, int pos) {
        int from = src.lastIndexOf('\n', pos - 1) + 1;
        int to = src.indexOf('\n', pos);
        if (to == -1) to = src.length();
        return src.substring(from, to);
    }

    static String escape(String snippet) {
        return snippet.replace("\n", "\\n");
    }
}
