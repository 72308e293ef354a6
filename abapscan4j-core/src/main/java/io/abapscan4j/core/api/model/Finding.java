/*
 * Copyright (c) 2025 Abapscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.abapscan4j.core.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single rule violation located in the original source file.
 *
 * <p>Context fields are copied from the owning {@link Unit}; {@code startingLine} and
 * {@code endingLine} are absolute line numbers and the {@code snippet} is the physical
 * line holding the match, with line breaks escaped.</p>
 */
public record Finding(
        @JsonProperty("prog_name") String progName,
        @JsonProperty("incl_name") String inclName,
        @JsonProperty("types") String types,
        @JsonProperty("blockname") String blockname,
        @JsonProperty("starting_line") int startingLine,
        @JsonProperty("ending_line") int endingLine,
        @JsonProperty("issues_type") String issuesType,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("message") String message,
        @JsonProperty("suggestion") String suggestion,
        @JsonProperty("snippet") String snippet) {}
