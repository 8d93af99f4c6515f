package com.geico.poc.cargoquery.storage;

import java.util.List;
import java.util.Map;

/**
 * Relational store the compiled queries run against.
 * Implementations decide the physical table prefix and identifier quoting.
 */
public interface QueryEngine {

    /**
     * Check if a logical table exists in the store
     */
    boolean tableExists(String tableName);

    /**
     * Quote a column name or alias as an identifier
     */
    String addIdentifierQuotes(String name);

    /**
     * Check if the name is already wrapped in identifier quotes
     */
    boolean isQuotedIdentifier(String name);

    /**
     * Physical, prefixed and quoted name for a logical table
     */
    String tableName(String logicalName);

    /**
     * Run a SELECT. Join clauses are keyed by the table they join in.
     */
    RowCursor select(List<String> tables, Map<String, String> aliasedFields, String where,
                     SelectOptions options, Map<String, JoinClause> joinClauses);
}
