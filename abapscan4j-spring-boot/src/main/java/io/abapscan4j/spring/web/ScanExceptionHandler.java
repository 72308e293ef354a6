/*
 * Copyright (c) 2025 Abapscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.abapscan4j.spring.web;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps request-boundary failures to JSON error bodies; the scan itself never fails. */
@Slf4j
@RestControllerAdvice(assignableTypes = ScanController.class)
public class ScanExceptionHandler {

    @ExceptionHandler(InvalidUnitException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> invalidUnit(InvalidUnitException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return body("validation_failed", e.problems());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> unreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return body("malformed_request", List.of(e.getMostSpecificCause().getMessage()));
    }

    private static Map<String, Object> body(String error, List<String> details) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("error", error);
        m.put("details", details);
        return m;
    }
}
