package com.geico.poc.cargoquery.storage;

import org.apache.calcite.sql.SqlDialect;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JdbcQueryEngineTest {

    private JdbcDataSource dataSource;
    private Connection keepAlive;
    private JdbcQueryEngine engine;

    @BeforeEach
    public void setup() throws SQLException {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:engine_test;MODE=MySQL");
        keepAlive = dataSource.getConnection();
        try (Statement stmt = keepAlive.createStatement()) {
            stmt.execute("CREATE TABLE `cargo__Films` (`_ID` INT, `Title` VARCHAR(100), `Runtime` INT)");
            stmt.execute("INSERT INTO `cargo__Films` VALUES (1, 'Jaws', 124), (2, 'Duel', 90), (3, 'Fargo', NULL)");
        }
        engine = new JdbcQueryEngine(dataSource, SqlDialect.DatabaseProduct.MYSQL.getDialect(), "cargo__");
    }

    @AfterEach
    public void tearDown() throws SQLException {
        try (Statement stmt = keepAlive.createStatement()) {
            stmt.execute("DROP ALL OBJECTS");
        }
        keepAlive.close();
    }

    @Test
    public void testQuotingFollowsDialect() {
        assertEquals("`Title`", engine.addIdentifierQuotes("Title"));
        assertTrue(engine.isQuotedIdentifier("`Title`"));
        assertFalse(engine.isQuotedIdentifier("Title"));
        assertEquals("`cargo__Films`", engine.tableName("Films"));
    }

    @Test
    public void testTableExists() {
        assertTrue(engine.tableExists("Films"));
        assertFalse(engine.tableExists("People"));
    }

    @Test
    public void testSelectReturnsRowsByLabel() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("`Title`", "`cargo__Films`.`Title`");
        fields.put("`Length`", "`cargo__Films`.`Runtime`");

        try (RowCursor cursor = engine.select(Arrays.asList("Films"), fields, "`cargo__Films`.`_ID` < 3",
                new SelectOptions(null, null, "`Title`", 10), Collections.emptyMap())) {
            Map<String, Object> first = cursor.fetchRow();
            assertEquals("Duel", first.get("Title"));
            assertEquals(90, ((Number) first.get("length")).intValue(), "Labels are case-insensitive");
            assertEquals("Jaws", cursor.fetchRow().get("Title"));
            assertNull(cursor.fetchRow());
        }
    }

    @Test
    public void testLimitCapsRows() {
        try (RowCursor cursor = engine.select(Arrays.asList("Films"), Collections.singletonMap("`Title`", "`Title`"),
                "", new SelectOptions(null, null, null, 1), Collections.emptyMap())) {
            assertNotNull(cursor.fetchRow());
            assertNull(cursor.fetchRow());
        }
    }

    @Test
    public void testBadSqlIsWrapped() {
        assertThrows(QueryExecutionException.class, () -> engine.select(Arrays.asList("Films"),
                Collections.singletonMap("`Title`", "`NoSuchColumn`"), "", new SelectOptions(null, null, null, 1),
                Collections.emptyMap()));
    }
}
