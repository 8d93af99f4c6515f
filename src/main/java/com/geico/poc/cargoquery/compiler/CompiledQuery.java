package com.geico.poc.cargoquery.compiler;

import com.geico.poc.cargoquery.storage.JoinClause;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A fully rewritten query, ready for the engine. Field expressions and clauses hold
 * physical, quoted names; the table list and join conditions hold logical names.
 */
public class CompiledQuery {

    private final QueryIr ir;
    private final Map<String, JoinClause> joinClauses;
    private final int limit;

    public CompiledQuery(QueryIr ir, Map<String, JoinClause> joinClauses, int limit) {
        this.ir = ir;
        this.joinClauses = Collections.unmodifiableMap(new LinkedHashMap<>(joinClauses));
        this.limit = limit;
    }

    public List<String> getTables() {
        return ir.getTables();
    }

    public Map<String, String> getAliasedFields() {
        return ir.getAliasedFields();
    }

    public Map<String, ResolvedField> getResolvedFields() {
        return ir.getResolvedFields();
    }

    public List<JoinCondition> getJoinConditions() {
        return ir.getJoinConditions();
    }

    public Map<String, JoinClause> getJoinClauses() {
        return joinClauses;
    }

    /**
     * The join on parameter as supplied, for re-running the query later
     */
    public String getJoinOn() {
        return ir.getJoinOn();
    }

    public String getWhere() {
        return ir.getWhere();
    }

    public String getGroupBy() {
        return ir.getGroupBy();
    }

    public String getHaving() {
        return ir.getHaving();
    }

    public String getOrderBy() {
        return ir.getOrderBy();
    }

    public boolean isDefaultOrderBy() {
        return ir.isDefaultOrderBy();
    }

    public int getLimit() {
        return limit;
    }

    public Map<String, List<String>> getSearchTerms() {
        return ir.getSearchTerms();
    }

    public String getAliasForFieldString(String fieldString) {
        return ir.getFieldStringAliases().get(fieldString);
    }

    @Override
    public String toString() {
        return "CompiledQuery{tables=" + getTables() + ", fields=" + getAliasedFields()
                + ", joins=" + joinClauses + ", where='" + getWhere() + "', groupBy='" + getGroupBy()
                + "', having='" + getHaving() + "', orderBy='" + getOrderBy() + "', limit=" + limit + "}";
    }
}
