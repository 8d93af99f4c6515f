package com.geico.poc.cargoquery.storage;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory engine for compiler and executor tests. Table names and identifiers are
 * passed through unchanged so that rewritten clauses can be compared as plain text.
 */
public class FakeQueryEngine implements QueryEngine {

    private final Set<String> existingTables = new HashSet<>();
    private final List<Map<String, Object>> rows = new ArrayList<>();
    private String lastSql;
    private boolean cursorClosed;

    public FakeQueryEngine withTables(String... tableNames) {
        for (String tableName : tableNames) {
            existingTables.add(tableName);
        }
        return this;
    }

    public FakeQueryEngine withRow(Map<String, Object> row) {
        rows.add(row);
        return this;
    }

    public String getLastSql() {
        return lastSql;
    }

    public boolean isCursorClosed() {
        return cursorClosed;
    }

    @Override
    public boolean tableExists(String tableName) {
        return existingTables.contains(tableName);
    }

    @Override
    public String addIdentifierQuotes(String name) {
        return name;
    }

    @Override
    public boolean isQuotedIdentifier(String name) {
        return false;
    }

    @Override
    public String tableName(String logicalName) {
        return logicalName;
    }

    @Override
    public RowCursor select(List<String> tables, Map<String, String> aliasedFields, String where,
                            SelectOptions options, Map<String, JoinClause> joinClauses) {
        lastSql = new SelectStatementBuilder(this).build(tables, aliasedFields, where, options, joinClauses);
        cursorClosed = false;
        Iterator<Map<String, Object>> iterator = new ArrayList<>(rows).iterator();
        return new RowCursor() {
            @Override
            public Map<String, Object> fetchRow() {
                return iterator.hasNext() ? iterator.next() : null;
            }

            @Override
            public void close() {
                cursorClosed = true;
            }
        };
    }
}
