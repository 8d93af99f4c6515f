package com.geico.poc.cargoquery.compiler;

import java.util.Objects;

/**
 * What a selected field expression actually refers to in storage. Resolved once from the
 * field expression and carried through the rewrite stages, which switch on {@link Kind}
 * instead of re-reading name suffixes.
 */
public final class FieldRef {

    public enum Kind {
        /** A column of a declared table */
        DIRECT,
        /** The {@code _value} column of a list field's auxiliary table */
        LIST_VALUE,
        /** The {@code <field>__full} column holding a list or coordinates field's raw value */
        LIST_FULL,
        /** {@code <field>__lat} or {@code <field>__lon} */
        COORDINATE_PART,
        /** {@code <field>__precision} */
        DATE_PRECISION,
        /** Built-in page columns: _pageName, _pageTitle, _pageID, _ID, _rowID */
        PAGE_PROPERTY,
        LITERAL,
        /** Function call or other computed expression */
        EXPRESSION
    }

    private final Kind kind;
    private final String table;
    private final String field;

    private FieldRef(Kind kind, String table, String field) {
        this.kind = kind;
        this.table = table;
        this.field = field;
    }

    public static FieldRef direct(String table, String field) {
        return new FieldRef(Kind.DIRECT, table, field);
    }

    public static FieldRef listValue(String ownerTable, String field) {
        return new FieldRef(Kind.LIST_VALUE, ownerTable, field);
    }

    public static FieldRef listFull(String ownerTable, String field) {
        return new FieldRef(Kind.LIST_FULL, ownerTable, field);
    }

    public static FieldRef coordinatePart(String table, String field) {
        return new FieldRef(Kind.COORDINATE_PART, table, field);
    }

    public static FieldRef datePrecision(String table, String field) {
        return new FieldRef(Kind.DATE_PRECISION, table, field);
    }

    public static FieldRef pageProperty(String table, String field) {
        return new FieldRef(Kind.PAGE_PROPERTY, table, field);
    }

    public static FieldRef literal() {
        return new FieldRef(Kind.LITERAL, null, null);
    }

    public static FieldRef expression() {
        return new FieldRef(Kind.EXPRESSION, null, null);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Owning table, null when unknown
     */
    public String getTable() {
        return table;
    }

    /**
     * Base field name (no suffix); null for literals and expressions
     */
    public String getField() {
        return field;
    }

    public boolean is(Kind other) {
        return kind == other;
    }

    public boolean refersTo(String tableName, String fieldName) {
        return Objects.equals(table, tableName) && Objects.equals(field, fieldName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldRef)) return false;
        FieldRef that = (FieldRef) o;
        return kind == that.kind && Objects.equals(table, that.table) && Objects.equals(field, that.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, table, field);
    }

    @Override
    public String toString() {
        if (field == null) {
            return kind.name();
        }
        return kind + "(" + (table == null ? "" : table + ".") + field + ")";
    }
}
