package com.whereq.contextforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;

/**
 * LLM providers an item can be optimized for
 */
public enum TargetModel {
    OPENAI("openai"),
    ANTHROPIC("anthropic"),
    GEMINI("gemini");

    private final String id;

    TargetModel(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /**
     * Default target set when the caller does not choose one
     */
    public static List<TargetModel> defaults() {
        return List.of(OPENAI, ANTHROPIC, GEMINI);
    }

    @JsonCreator
    public static TargetModel fromId(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Target model must not be null");
        }
        return Arrays.stream(values())
            .filter(model -> model.id.equalsIgnoreCase(value.trim()))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unsupported target model: " + value + " (expected one of openai, anthropic, gemini)"));
    }
}
