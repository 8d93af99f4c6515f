package com.geico.poc.cargoquery.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geico.poc.cargoquery.compiler.SchemaResolutionException;
import com.geico.poc.cargoquery.storage.QueryExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads table schemas from the schema registry table, one JSON document per main table:
 *
 *   CREATE TABLE cargo_tables (main_table VARCHAR(200) PRIMARY KEY, table_schema CLOB)
 */
public class JdbcSchemaProvider implements SchemaProvider {

    private static final Logger log = LoggerFactory.getLogger(JdbcSchemaProvider.class);

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final String schemaTable;

    public JdbcSchemaProvider(DataSource dataSource, ObjectMapper objectMapper, String schemaTable) {
        if (!schemaTable.matches("[A-Za-z0-9_]+")) {
            throw new IllegalArgumentException("Invalid schema table name: " + schemaTable);
        }
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
        this.schemaTable = schemaTable;
    }

    @Override
    public Map<String, TableSchema> getTableSchemas(List<String> tableNames) {
        if (tableNames.isEmpty()) {
            return Collections.emptyMap();
        }

        StringBuilder sql = new StringBuilder("SELECT main_table, table_schema FROM ")
                .append(schemaTable)
                .append(" WHERE main_table IN (");
        for (int i = 0; i < tableNames.size(); i++) {
            sql.append(i > 0 ? ", ?" : "?");
        }
        sql.append(")");

        Map<String, String> documents = new HashMap<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql.toString())) {
            for (int i = 0; i < tableNames.size(); i++) {
                ps.setString(i + 1, tableNames.get(i));
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    documents.put(rs.getString(1), rs.getString(2));
                }
            }
        } catch (SQLException e) {
            throw new QueryExecutionException("Failed to read table schemas: " + e.getMessage(), e);
        }

        // Keep request order
        Map<String, TableSchema> schemas = new LinkedHashMap<>();
        for (String tableName : tableNames) {
            String document = documents.get(tableName);
            if (document != null) {
                schemas.put(tableName, parse(tableName, document));
            }
        }
        log.debug("Loaded {} of {} table schemas from {}", schemas.size(), tableNames.size(), schemaTable);
        return schemas;
    }

    private TableSchema parse(String tableName, String document) {
        try {
            return objectMapper.readValue(document, TableSchema.class).withTableName(tableName);
        } catch (JsonProcessingException e) {
            throw new SchemaResolutionException("Error: the schema for table \"" + tableName
                    + "\" could not be read: " + e.getOriginalMessage());
        }
    }
}
