package com.geico.poc.cargoquery.schema;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Schema provider backed by a map; used for embedded setups and tests.
 */
public class InMemorySchemaProvider implements SchemaProvider {

    private final Map<String, TableSchema> schemas = new ConcurrentHashMap<>();

    public InMemorySchemaProvider register(TableSchema schema) {
        schemas.put(schema.getTableName(), schema);
        return this;
    }

    @Override
    public Map<String, TableSchema> getTableSchemas(List<String> tableNames) {
        Map<String, TableSchema> result = new LinkedHashMap<>();
        for (String tableName : tableNames) {
            TableSchema schema = schemas.get(tableName);
            if (schema != null) {
                result.put(tableName, schema);
            }
        }
        return result;
    }
}
