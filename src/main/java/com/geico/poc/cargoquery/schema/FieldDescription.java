package com.geico.poc.cargoquery.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Type information for one field. A null type means "untyped": a literal, a computed
 * expression or a page property whose value is passed through as a string.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldDescription {

    private static final FieldDescription UNTYPED = new FieldDescription(null, false, null);

    private final FieldType type;
    private final boolean list;
    private final String delimiter;

    @JsonCreator
    public FieldDescription(
            @JsonProperty("type") FieldType type,
            @JsonProperty("isList") boolean list,
            @JsonProperty("delimiter") String delimiter) {
        this.type = type;
        this.list = list;
        this.delimiter = delimiter;
    }

    public static FieldDescription of(FieldType type) {
        return new FieldDescription(type, false, null);
    }

    public static FieldDescription listOf(FieldType type, String delimiter) {
        return new FieldDescription(type, true, delimiter);
    }

    public static FieldDescription untyped() {
        return UNTYPED;
    }

    @JsonProperty("type")
    public FieldType getType() {
        return type;
    }

    /**
     * Whether the field holds several values per row, stored in an auxiliary
     * {@code <table>__<field>} table.
     */
    @JsonProperty("isList")
    public boolean isList() {
        return list;
    }

    @JsonProperty("delimiter")
    public String getDelimiter() {
        return delimiter;
    }

    @JsonIgnore
    public boolean isTyped() {
        return type != null;
    }

    public boolean hasType(FieldType expected) {
        return type == expected;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FieldDescription that = (FieldDescription) o;
        return list == that.list && type == that.type && Objects.equals(delimiter, that.delimiter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, list, delimiter);
    }

    @Override
    public String toString() {
        String name = type == null ? "untyped" : type.getDisplayName();
        return list ? "List (" + delimiter + ") of " + name : name;
    }
}
