package com.geico.poc.cargoquery.storage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders the SELECT statement for a compiled query.
 *
 * Tables without a join clause are listed first, comma separated; every table that has one
 * follows as an explicit join, in table-list order:
 *
 *   SELECT `cargo__Films`.`Title` AS `Title` FROM `cargo__Films`
 *     LEFT OUTER JOIN `cargo__Films__Director` ON (...) WHERE ... LIMIT 100
 */
public class SelectStatementBuilder {

    private final QueryEngine engine;

    public SelectStatementBuilder(QueryEngine engine) {
        this.engine = engine;
    }

    public String build(List<String> tables, Map<String, String> aliasedFields, String where,
                        SelectOptions options, Map<String, JoinClause> joinClauses) {
        StringBuilder sql = new StringBuilder("SELECT ");

        boolean first = true;
        for (Map.Entry<String, String> entry : aliasedFields.entrySet()) {
            if (!first) {
                sql.append(", ");
            }
            first = false;
            sql.append(entry.getValue()).append(" AS ").append(entry.getKey());
        }

        sql.append(" FROM ").append(fromClause(tables, joinClauses));

        if (where != null && !where.trim().isEmpty()) {
            sql.append(" WHERE ").append(where.trim());
        }
        if (options.getGroupBy() != null) {
            sql.append(" GROUP BY ").append(options.getGroupBy());
        }
        if (options.getHaving() != null) {
            sql.append(" HAVING ").append(options.getHaving());
        }
        if (options.getOrderBy() != null) {
            sql.append(" ORDER BY ").append(options.getOrderBy());
        }
        sql.append(" LIMIT ").append(options.getLimit());
        return sql.toString();
    }

    String fromClause(List<String> tables, Map<String, JoinClause> joinClauses) {
        List<String> implicitJoins = new ArrayList<>();
        List<String> explicitJoins = new ArrayList<>();
        for (String table : tables) {
            JoinClause join = joinClauses.get(table);
            if (join == null) {
                implicitJoins.add(engine.tableName(table));
            } else {
                explicitJoins.add(join.getJoinType() + " " + engine.tableName(table)
                        + " ON (" + join.getCondition() + ")");
            }
        }
        String from = String.join(",", implicitJoins);
        if (!explicitJoins.isEmpty()) {
            from = from + " " + String.join(" ", explicitJoins);
        }
        return from;
    }
}
