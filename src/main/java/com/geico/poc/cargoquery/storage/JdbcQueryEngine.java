package com.geico.poc.cargoquery.storage;

import org.apache.calcite.sql.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.LinkedCaseInsensitiveMap;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Map;

/**
 * {@link QueryEngine} over a JDBC {@link DataSource}. Logical table names are mapped to
 * physical ones by prepending the table prefix; identifiers are quoted the way the
 * configured Calcite dialect quotes them.
 */
public class JdbcQueryEngine implements QueryEngine {

    private static final Logger log = LoggerFactory.getLogger(JdbcQueryEngine.class);

    private final DataSource dataSource;
    private final SqlDialect dialect;
    private final String tablePrefix;
    private final SelectStatementBuilder statementBuilder;
    private final String quoteStart;
    private final String quoteEnd;

    public JdbcQueryEngine(DataSource dataSource, SqlDialect dialect, String tablePrefix) {
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.tablePrefix = tablePrefix == null ? "" : tablePrefix;
        this.statementBuilder = new SelectStatementBuilder(this);

        // Quoting an empty name leaves just the two quote strings
        String empty = dialect.quoteIdentifier("");
        this.quoteStart = empty.isEmpty() ? "" : empty.substring(0, empty.length() / 2);
        this.quoteEnd = empty.isEmpty() ? "" : empty.substring(empty.length() / 2);
    }

    @Override
    public boolean tableExists(String tableName) {
        String physicalName = tablePrefix + tableName;
        try (Connection conn = dataSource.getConnection()) {
            DatabaseMetaData metaData = conn.getMetaData();
            try (ResultSet rs = metaData.getTables(conn.getCatalog(), null, null, null)) {
                while (rs.next()) {
                    if (physicalName.equalsIgnoreCase(rs.getString("TABLE_NAME"))) {
                        return true;
                    }
                }
            }
            return false;
        } catch (SQLException e) {
            throw new QueryExecutionException("Failed to check table " + physicalName + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String addIdentifierQuotes(String name) {
        return dialect.quoteIdentifier(name);
    }

    @Override
    public boolean isQuotedIdentifier(String name) {
        if (quoteStart.isEmpty() || name == null) {
            return false;
        }
        return name.length() >= quoteStart.length() + quoteEnd.length()
                && name.startsWith(quoteStart)
                && name.endsWith(quoteEnd);
    }

    @Override
    public String tableName(String logicalName) {
        return dialect.quoteIdentifier(tablePrefix + logicalName);
    }

    @Override
    public RowCursor select(List<String> tables, Map<String, String> aliasedFields, String where,
                            SelectOptions options, Map<String, JoinClause> joinClauses) {
        String sql = statementBuilder.build(tables, aliasedFields, where, options, joinClauses);
        log.debug("Executing: {}", sql);

        Connection conn = null;
        Statement stmt = null;
        try {
            conn = dataSource.getConnection();
            stmt = conn.createStatement();
            stmt.setMaxRows(options.getLimit());
            ResultSet rs = stmt.executeQuery(sql);
            return new JdbcRowCursor(conn, stmt, rs);
        } catch (SQLException e) {
            closeQuietly(stmt, conn, e);
            throw new QueryExecutionException("Query failed: " + e.getMessage(), e);
        }
    }

    private static void closeQuietly(Statement stmt, Connection conn, SQLException failure) {
        try {
            if (stmt != null) {
                stmt.close();
            }
            if (conn != null) {
                conn.close();
            }
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }

    /**
     * Cursor that owns its connection until closed.
     */
    private static class JdbcRowCursor implements RowCursor {

        private final Connection conn;
        private final Statement stmt;
        private final ResultSet rs;
        private final String[] labels;

        JdbcRowCursor(Connection conn, Statement stmt, ResultSet rs) throws SQLException {
            this.conn = conn;
            this.stmt = stmt;
            this.rs = rs;
            ResultSetMetaData metaData = rs.getMetaData();
            this.labels = new String[metaData.getColumnCount()];
            for (int i = 0; i < labels.length; i++) {
                labels[i] = metaData.getColumnLabel(i + 1);
            }
        }

        @Override
        public Map<String, Object> fetchRow() {
            try {
                if (!rs.next()) {
                    return null;
                }
                Map<String, Object> row = new LinkedCaseInsensitiveMap<>(labels.length);
                for (int i = 0; i < labels.length; i++) {
                    row.put(labels[i], rs.getObject(i + 1));
                }
                return row;
            } catch (SQLException e) {
                throw new QueryExecutionException("Failed to read row: " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            try {
                rs.close();
                stmt.close();
                conn.close();
            } catch (SQLException e) {
                throw new QueryExecutionException("Failed to close cursor: " + e.getMessage(), e);
            }
        }
    }
}
