package com.geico.poc.cargoquery.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geico.poc.cargoquery.compiler.SchemaResolutionException;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JdbcSchemaProviderTest {

    private Connection keepAlive;
    private JdbcSchemaProvider provider;

    @BeforeEach
    public void setup() throws SQLException {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:schema_test");
        keepAlive = dataSource.getConnection();
        try (Statement stmt = keepAlive.createStatement()) {
            stmt.execute("CREATE TABLE cargo_tables (main_table VARCHAR(200) PRIMARY KEY, table_schema VARCHAR(4000))");
            stmt.execute("INSERT INTO cargo_tables VALUES "
                    + "('Films', '{\"fields\": {\"Title\": {\"type\": \"String\"}}}'), "
                    + "('People', '{\"fields\": {\"Born\": {\"type\": \"Integer\"}}}'), "
                    + "('Broken', '{\"fields\": ')");
        }
        provider = new JdbcSchemaProvider(dataSource, new ObjectMapper(), "cargo_tables");
    }

    @AfterEach
    public void tearDown() throws SQLException {
        try (Statement stmt = keepAlive.createStatement()) {
            stmt.execute("DROP ALL OBJECTS");
        }
        keepAlive.close();
    }

    @Test
    public void testSchemasInRequestOrder() {
        Map<String, TableSchema> schemas = provider.getTableSchemas(Arrays.asList("People", "Films", "Crew"));

        assertEquals(Arrays.asList("People", "Films"), new ArrayList<>(schemas.keySet()));
        assertEquals("Films", schemas.get("Films").getTableName());
        assertEquals(FieldType.INTEGER, schemas.get("People").getField("Born").getType());
    }

    @Test
    public void testEmptyRequest() {
        assertTrue(provider.getTableSchemas(Collections.emptyList()).isEmpty());
    }

    @Test
    public void testUnreadableDocument() {
        assertThrows(SchemaResolutionException.class,
                () -> provider.getTableSchemas(Collections.singletonList("Broken")));
    }

    @Test
    public void testSchemaTableNameIsChecked() {
        assertThrows(IllegalArgumentException.class,
                () -> new JdbcSchemaProvider(null, new ObjectMapper(), "cargo_tables; DROP"));
    }
}
