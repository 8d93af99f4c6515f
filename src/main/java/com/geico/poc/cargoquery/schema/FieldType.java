package com.geico.poc.cargoquery.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Semantic type of a stored field. The display name is the one used in schema
 * documents ("Coordinates part", "Date precision", ...).
 */
public enum FieldType {
    INTEGER("Integer"),
    FLOAT("Float"),
    BOOLEAN("Boolean"),
    STRING("String"),
    TEXT("Text"),
    WIKITEXT("Wikitext"),
    SEARCHTEXT("Searchtext"),
    PAGE("Page"),
    FILE("File"),
    URL("URL"),
    EMAIL("Email"),
    DATE("Date"),
    DATETIME("Datetime"),
    COORDINATES("Coordinates"),
    COORDINATES_PART("Coordinates part"),
    DATE_PRECISION("Date precision");

    private final String displayName;

    FieldType(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    public boolean isDate() {
        return this == DATE || this == DATETIME;
    }

    @JsonCreator
    public static FieldType fromName(String name) {
        if (name == null) {
            return null;
        }
        for (FieldType type : values()) {
            if (type.displayName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown field type: " + name);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
