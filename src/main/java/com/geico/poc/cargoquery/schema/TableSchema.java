package com.geico.poc.cargoquery.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field descriptions of one main table, in declaration order.
 *
 * Stored as a JSON document per table: {"fields": {"Title": {"type": "String"}, ...}}
 */
public class TableSchema {

    private final String tableName;
    private final Map<String, FieldDescription> fieldDescriptions;

    @JsonCreator
    public TableSchema(
            @JsonProperty("tableName") String tableName,
            @JsonProperty("fields") Map<String, FieldDescription> fieldDescriptions) {
        this.tableName = tableName;
        this.fieldDescriptions = fieldDescriptions != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(fieldDescriptions))
                : Collections.emptyMap();
    }

    public static Builder builder(String tableName) {
        return new Builder(tableName);
    }

    public String getTableName() {
        return tableName;
    }

    @JsonProperty("fields")
    public Map<String, FieldDescription> getFieldDescriptions() {
        return fieldDescriptions;
    }

    @JsonIgnore
    public boolean hasField(String fieldName) {
        return fieldDescriptions.containsKey(fieldName);
    }

    public FieldDescription getField(String fieldName) {
        return fieldDescriptions.get(fieldName);
    }

    /**
     * Same schema under another table name; used when a document was stored without one.
     */
    public TableSchema withTableName(String name) {
        return new TableSchema(name, fieldDescriptions);
    }

    @Override
    public String toString() {
        return tableName + fieldDescriptions;
    }

    public static class Builder {
        private final String tableName;
        private final Map<String, FieldDescription> fields = new LinkedHashMap<>();

        private Builder(String tableName) {
            this.tableName = tableName;
        }

        public Builder field(String name, FieldType type) {
            fields.put(name, FieldDescription.of(type));
            return this;
        }

        public Builder listField(String name, FieldType type) {
            fields.put(name, FieldDescription.listOf(type, ","));
            return this;
        }

        public TableSchema build() {
            return new TableSchema(tableName, fields);
        }
    }
}
