package com.geico.poc.cargoquery.compiler;

import com.geico.poc.cargoquery.schema.FieldDescription;

/**
 * Type information for one selected alias.
 */
public class ResolvedField {

    private final FieldDescription description;
    private final String table;
    private final FieldRef ref;

    public ResolvedField(FieldDescription description, String table, FieldRef ref) {
        this.description = description;
        this.table = table;
        this.ref = ref;
    }

    public FieldDescription getDescription() {
        return description;
    }

    /**
     * Owning table, or null for literals, expressions and synthetic columns
     */
    public String getTable() {
        return table;
    }

    public FieldRef getRef() {
        return ref;
    }

    public ResolvedField withRef(FieldRef newRef) {
        return new ResolvedField(description, table, newRef);
    }

    @Override
    public String toString() {
        return "ResolvedField{" + description + ", table=" + table + ", ref=" + ref + "}";
    }
}
