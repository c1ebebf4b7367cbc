package com.finplan.plananalysis.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Optional;

/**
 * Semantic classification of a budget line.
 *
 * <p>The short code is what gets persisted with corrections and exchanged with clients
 * (B, R, S, IN, D). {@link #UNKNOWN} uses the empty code.
 */
@Getter
public enum ItemTag {

    BUDGET("B", "Budget expense"),
    RECURRING("R", "Recurring expense"),
    SAVINGS("S", "Savings goal"),
    INCOME("IN", "Income source"),
    DEBT("D", "Debt payment"),
    UNKNOWN("", "Unclassified");

    private final String code;
    private final String description;

    ItemTag(String code, String description) {
        this.code = code;
        this.description = description;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Resolves a tag from its code or its enum name, case-insensitively.
     */
    public static Optional<ItemTag> fromCode(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (ItemTag tag : values()) {
            if (tag.code.equalsIgnoreCase(trimmed) || tag.name().equalsIgnoreCase(trimmed)) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static ItemTag fromJson(String value) {
        return fromCode(value)
            .orElseThrow(() -> new IllegalArgumentException("Unknown item tag: " + value));
    }
}
