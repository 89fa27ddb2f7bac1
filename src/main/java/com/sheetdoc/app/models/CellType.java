package com.sheetdoc.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Enumerates the kinds of value a cell can hold:
 * EMPTY, NUMBER, STRING, BOOLEAN.
 * The wire name ("empty", "number", ...) is what SheetDoc and JSON carry.
 */
public enum CellType {
    EMPTY("empty"),
    NUMBER("number"),
    STRING("string"),
    BOOLEAN("boolean");

    private final String wireName;

    CellType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Allows case-insensitive input.
     * For example, "number" -> NUMBER, "Boolean" -> BOOLEAN, etc.
     */
    @JsonCreator
    public static CellType fromValue(String value) {
        return CellType.valueOf(value.trim().toUpperCase());
    }
}
