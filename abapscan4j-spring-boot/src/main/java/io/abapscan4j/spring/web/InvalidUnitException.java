/*
 * Copyright (c) 2025 Abapscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.abapscan4j.spring.web;

import java.util.List;

/** A request body that breaks the unit contract (missing program, include or type). */
public class InvalidUnitException extends RuntimeException {
    private final List<String> problems;

    public InvalidUnitException(List<String> problems) {
        super("Invalid unit: " + String.join(", ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
