/*
 * Copyright (c) 2025 Abapscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.abapscan4j.core.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * A contiguous block of ABAP source (program, include, class, method, ...) as produced by
 * the upstream unit splitter. {@code startLine} is the absolute position of the block in
 * its containing file.
 *
 * <p>Instances are never mutated; {@link #withFindings(List)} returns a copy. Identity fields
 * ({@code pgmName}, {@code incName}, {@code type}) are checked at the request boundary, not here.</p>
 */
public record Unit(
        @JsonProperty("pgm_name") String pgmName,
        @JsonProperty("inc_name") String incName,
        @JsonProperty("type") String type,
        @JsonProperty("name") String name,
        @JsonProperty("class_implementation") String classImplementation,
        @JsonProperty("start_line") int startLine,
        @JsonProperty("end_line") int endLine,
        @JsonProperty("code") String code,
        @JsonProperty("findings") List<Finding> findings) {

    public Unit {
        findings = (findings == null) ? null : List.copyOf(findings);
    }

    public static Unit of(String pgmName, String incName, String type, String name, int startLine, int endLine,
            String code) {
        return new Unit(pgmName, incName, type, name, null, startLine, endLine, code, null);
    }

    /** Source text of the unit; an absent {@code code} reads as empty text. */
    public String source() {
        return (code == null) ? "" : code;
    }

    /** Copy of this unit carrying {@code findings}; an empty list is stored as {@code null}. */
    public Unit withFindings(List<Finding> findings) {
        List<Finding> f = (findings == null || findings.isEmpty()) ? null : findings;
        return new Unit(pgmName, incName, type, name, classImplementation, startLine, endLine, code, f);
    }

    public boolean hasFindings() {
        return findings != null && !findings.isEmpty();
    }
}
