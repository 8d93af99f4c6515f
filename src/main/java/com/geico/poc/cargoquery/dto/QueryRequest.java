package com.geico.poc.cargoquery.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.geico.poc.cargoquery.compiler.QuerySpec;

/**
 * Query parameters as posted; the multi-word ones also accept their spaced names
 * ("join on", "group by", "order by").
 */
public class QueryRequest {
    private String tables;
    private String fields;
    private String where;
    @JsonAlias("join on")
    private String joinOn;
    @JsonAlias("group by")
    private String groupBy;
    private String having;
    @JsonAlias("order by")
    private String orderBy;
    private String limit;

    public QueryRequest() {
    }

    public QuerySpec toSpec() {
        return QuerySpec.builder()
                .tables(tables)
                .fields(fields)
                .where(where)
                .joinOn(joinOn)
                .groupBy(groupBy)
                .having(having)
                .orderBy(orderBy)
                .limit(limit)
                .build();
    }

    public String getTables() {
        return tables;
    }

    public void setTables(String tables) {
        this.tables = tables;
    }

    public String getFields() {
        return fields;
    }

    public void setFields(String fields) {
        this.fields = fields;
    }

    public String getWhere() {
        return where;
    }

    public void setWhere(String where) {
        this.where = where;
    }

    public String getJoinOn() {
        return joinOn;
    }

    public void setJoinOn(String joinOn) {
        this.joinOn = joinOn;
    }

    public String getGroupBy() {
        return groupBy;
    }

    public void setGroupBy(String groupBy) {
        this.groupBy = groupBy;
    }

    public String getHaving() {
        return having;
    }

    public void setHaving(String having) {
        this.having = having;
    }

    public String getOrderBy() {
        return orderBy;
    }

    public void setOrderBy(String orderBy) {
        this.orderBy = orderBy;
    }

    public String getLimit() {
        return limit;
    }

    public void setLimit(String limit) {
        this.limit = limit;
    }
}
