package com.geico.poc.cargoquery.config;

import org.apache.calcite.sql.SqlDialect;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration for the query service
 */
@Configuration
@ConfigurationProperties(prefix = "cargo-query")
public class CargoQueryConfig {

    public static final List<String> DEFAULT_ALLOWED_SQL_FUNCTIONS = Arrays.asList(
            // Control flow
            "CASE", "IF", "IFNULL", "NULLIF", "COALESCE",
            // String
            "CHAR_LENGTH", "CHARACTER_LENGTH", "CONCAT", "CONCAT_WS", "LCASE", "LEFT", "LENGTH", "LOCATE",
            "LOWER", "LPAD", "LTRIM", "REPEAT", "REPLACE", "REVERSE", "RIGHT", "RPAD", "RTRIM", "SUBSTR",
            "SUBSTRING", "SUBSTRING_INDEX", "TRIM", "UCASE", "UPPER",
            // Numeric
            "ABS", "CEIL", "CEILING", "COS", "EXP", "FLOOR", "LN", "LOG", "LOG10", "MOD", "PI", "POW",
            "POWER", "RAND", "ROUND", "SIGN", "SIN", "SQRT", "TAN", "TRUNCATE",
            // Date
            "CURDATE", "CURRENT_DATE", "DATE", "DATE_ADD", "DATE_DIFF", "DATE_FORMAT", "DATE_SUB", "DAY",
            "DAYOFMONTH", "DAYOFWEEK", "DAYOFYEAR", "MONTH", "NOW", "WEEK", "YEAR",
            // Aggregate
            "AVG", "COUNT", "GROUP_CONCAT", "MAX", "MIN", "SUM",
            // Operators written like calls
            "IN", "NEAR");

    private int defaultQueryLimit = 100;
    private int maxQueryLimit = 5000;
    private List<String> allowedSqlFunctions = new ArrayList<>(DEFAULT_ALLOWED_SQL_FUNCTIONS);
    private String tablePrefix = "cargo__";
    private Dialect dialect = Dialect.MYSQL;
    private String schemaTable = "cargo_tables";

    public enum Dialect {
        MYSQL(SqlDialect.DatabaseProduct.MYSQL),
        POSTGRESQL(SqlDialect.DatabaseProduct.POSTGRESQL),
        H2(SqlDialect.DatabaseProduct.H2);

        private final SqlDialect.DatabaseProduct product;

        Dialect(SqlDialect.DatabaseProduct product) {
            this.product = product;
        }

        public SqlDialect toSqlDialect() {
            return product.getDialect();
        }
    }

    public int getDefaultQueryLimit() {
        return defaultQueryLimit;
    }

    public void setDefaultQueryLimit(int defaultQueryLimit) {
        this.defaultQueryLimit = defaultQueryLimit;
    }

    public int getMaxQueryLimit() {
        return maxQueryLimit;
    }

    public void setMaxQueryLimit(int maxQueryLimit) {
        this.maxQueryLimit = maxQueryLimit;
    }

    public List<String> getAllowedSqlFunctions() {
        return allowedSqlFunctions;
    }

    public void setAllowedSqlFunctions(List<String> allowedSqlFunctions) {
        this.allowedSqlFunctions = allowedSqlFunctions;
    }

    public String getTablePrefix() {
        return tablePrefix;
    }

    public void setTablePrefix(String tablePrefix) {
        this.tablePrefix = tablePrefix;
    }

    public Dialect getDialect() {
        return dialect;
    }

    public void setDialect(Dialect dialect) {
        this.dialect = dialect;
    }

    public String getSchemaTable() {
        return schemaTable;
    }

    public void setSchemaTable(String schemaTable) {
        this.schemaTable = schemaTable;
    }
}
