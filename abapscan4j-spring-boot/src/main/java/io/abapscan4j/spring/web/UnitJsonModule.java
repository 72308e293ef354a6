/*
 * Copyright (c) 2025 Abapscan4J Contributors
 * Licensed under the Apache License 2.0
 */
package io.abapscan4j.spring.web;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.fasterxml.jackson.databind.module.SimpleModule;
import io.abapscan4j.core.api.model.Finding;
import io.abapscan4j.core.api.model.Unit;
import java.util.List;

/**
 * Reads request units through a builder so defaults apply only to absent fields:
 * a missing {@code name} or {@code code} becomes {@code ""}, an explicit {@code null} stays null.
 */
public class UnitJsonModule extends SimpleModule {

    public UnitJsonModule() {
        super("abapscan4j-unit");
        setMixInAnnotation(Unit.class, UnitMixin.class);
    }

    @JsonDeserialize(builder = UnitJsonBuilder.class)
    abstract static class UnitMixin {}

    @JsonPOJOBuilder(withPrefix = "")
    public static final class UnitJsonBuilder {
        private String pgmName;
        private String incName;
        private String type;
        private String name = "";
        private String classImplementation;
        private int startLine;
        private int endLine;
        private String code = "";
        private List<Finding> findings;

        @JsonProperty("pgm_name")
        public UnitJsonBuilder pgmName(String v) {
            this.pgmName = v;
            return this;
        }

        @JsonProperty("inc_name")
        public UnitJsonBuilder incName(String v) {
            this.incName = v;
            return this;
        }

        @JsonProperty("type")
        public UnitJsonBuilder type(String v) {
            this.type = v;
            return this;
        }

        @JsonProperty("name")
        public UnitJsonBuilder name(String v) {
            this.name = v;
            return this;
        }

        @JsonProperty("class_implementation")
        public UnitJsonBuilder classImplementation(String v) {
            this.classImplementation = v;
            return this;
        }

        @JsonProperty("start_line")
        public UnitJsonBuilder startLine(int v) {
            this.startLine = v;
            return this;
        }

        @JsonProperty("end_line")
        public UnitJsonBuilder endLine(int v) {
            this.endLine = v;
            return this;
        }

        @JsonProperty("code")
        public UnitJsonBuilder code(String v) {
            this.code = v;
            return this;
        }

        @JsonProperty("findings")
        public UnitJsonBuilder findings(List<Finding> v) {
            this.findings = v;
            return this;
        }

        public Unit build() {
            return new Unit(pgmName, incName, type, name, classImplementation, startLine, endLine, code, findings);
        }
    }
}
