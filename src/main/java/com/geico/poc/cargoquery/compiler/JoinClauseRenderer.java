package com.geico.poc.cargoquery.compiler;

import com.geico.poc.cargoquery.storage.JoinClause;
import com.geico.poc.cargoquery.storage.QueryEngine;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders join conditions into the engine's join clauses, keyed by the table each one
 * joins in. A later condition for the same table replaces an earlier one.
 */
public class JoinClauseRenderer {

    private final QueryEngine engine;

    public JoinClauseRenderer(QueryEngine engine) {
        this.engine = engine;
    }

    public Map<String, JoinClause> render(List<JoinCondition> joinConditions) {
        Map<String, JoinClause> joinClauses = new LinkedHashMap<>();
        for (JoinCondition joinCondition : joinConditions) {
            String condition = column(joinCondition.getTable1(), joinCondition.getField1())
                    + " = "
                    + column(joinCondition.getTable2(), joinCondition.getField2());
            joinClauses.put(joinCondition.getTable2(), new JoinClause(joinCondition.getJoinType(), condition));
        }
        return joinClauses;
    }

    private String column(String tableName, String fieldName) {
        String quotedField = engine.isQuotedIdentifier(fieldName) ? fieldName : engine.addIdentifierQuotes(fieldName);
        return engine.tableName(tableName) + "." + quotedField;
    }
}
