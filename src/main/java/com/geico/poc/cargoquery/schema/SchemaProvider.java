package com.geico.poc.cargoquery.schema;

import java.util.List;
import java.util.Map;

/**
 * Source of table schemas. Implementations are read-only from the compiler's point of view.
 */
public interface SchemaProvider {

    /**
     * Schemas for the given main table names, keyed by table name in request order.
     * Tables the provider does not know are absent from the result.
     */
    Map<String, TableSchema> getTableSchemas(List<String> tableNames);
}
