package com.geico.poc.cargoquery;

import com.geico.poc.cargoquery.compiler.CompiledQuery;
import com.geico.poc.cargoquery.compiler.SchemaResolutionException;
import com.geico.poc.cargoquery.storage.QueryEngine;
import com.geico.poc.cargoquery.storage.RowCursor;
import com.geico.poc.cargoquery.storage.SelectOptions;
import com.geico.poc.cargoquery.storage.SelectStatementBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.HtmlUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Runs compiled queries against the engine and turns the rows into alias -> escaped text.
 */
public class CargoQueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(CargoQueryExecutor.class);

    private static final Pattern BARE_IDENTIFIER = Pattern.compile("[\\w$]*[A-Za-z_$][\\w$]*");

    private final QueryEngine engine;
    private final SelectStatementBuilder statementBuilder;

    public CargoQueryExecutor(QueryEngine engine) {
        this.engine = engine;
        this.statementBuilder = new SelectStatementBuilder(engine);
    }

    /**
     * Execute the query. Every value is HTML-escaped; SQL NULL becomes an empty string.
     *
     * @throws SchemaResolutionException if a declared table does not exist
     */
    public List<Map<String, String>> run(CompiledQuery query) {
        checkTablesExist(query);

        long start = System.currentTimeMillis();
        List<Map<String, String>> results = new ArrayList<>();
        try (RowCursor cursor = engine.select(query.getTables(), realAliasedFields(query), query.getWhere(),
                selectOptions(query), query.getJoinClauses())) {
            Map<String, Object> row;
            while ((row = cursor.fetchRow()) != null) {
                Map<String, String> resultRow = new LinkedHashMap<>();
                for (String alias : query.getAliasedFields().keySet()) {
                    Object value = row.get(alias);
                    resultRow.put(alias, value == null ? "" : HtmlUtils.htmlEscape(String.valueOf(value), "UTF-8"));
                }
                results.add(resultRow);
            }
        }

        log.info("Query on {} returned {} rows in {} ms", query.getTables(), results.size(),
                System.currentTimeMillis() - start);
        return results;
    }

    /**
     * The SELECT statement {@link #run} would execute
     */
    public String toSql(CompiledQuery query) {
        return statementBuilder.build(query.getTables(), realAliasedFields(query), query.getWhere(),
                selectOptions(query), query.getJoinClauses());
    }

    void checkTablesExist(CompiledQuery query) {
        for (String tableName : query.getTables()) {
            if (!engine.tableExists(tableName)) {
                throw new SchemaResolutionException("Error: no database table exists named \"" + tableName + "\".");
            }
        }
    }

    SelectOptions selectOptions(CompiledQuery query) {
        String orderBy = query.getOrderBy();
        if (query.isDefaultOrderBy() && isUnquotedIdentifier(orderBy)) {
            orderBy = engine.addIdentifierQuotes(orderBy);
        }
        return new SelectOptions(query.getGroupBy(), query.getHaving(), orderBy, query.getLimit());
    }

    /**
     * Aliases quoted; plain column names quoted too, since some engines fold unquoted
     * names to lower case.
     */
    Map<String, String> realAliasedFields(CompiledQuery query) {
        Map<String, String> realAliasedFields = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : query.getAliasedFields().entrySet()) {
            String fieldName = entry.getValue();
            if (isUnquotedIdentifier(fieldName)) {
                fieldName = engine.addIdentifierQuotes(fieldName);
            }
            realAliasedFields.put(engine.addIdentifierQuotes(entry.getKey()), fieldName);
        }
        return realAliasedFields;
    }

    private boolean isUnquotedIdentifier(String expression) {
        return BARE_IDENTIFIER.matcher(expression).matches() && !engine.isQuotedIdentifier(expression);
    }
}
