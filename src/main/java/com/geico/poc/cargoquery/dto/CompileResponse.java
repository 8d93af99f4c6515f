package com.geico.poc.cargoquery.dto;

import com.geico.poc.cargoquery.compiler.ErrorKind;

import java.util.List;
import java.util.Map;

/**
 * What a query compiles to, without running it
 */
public class CompileResponse {
    private String sql;
    private List<String> tables;
    private Map<String, String> fields;
    private Map<String, String> joinClauses;
    private Map<String, List<String>> searchTerms;
    private int limit;
    private String error;
    private ErrorKind errorKind;

    public static CompileResponse error(String message, ErrorKind kind) {
        CompileResponse response = new CompileResponse();
        response.error = message;
        response.errorKind = kind;
        return response;
    }

    public String getSql() {
        return sql;
    }

    public void setSql(String sql) {
        this.sql = sql;
    }

    public List<String> getTables() {
        return tables;
    }

    public void setTables(List<String> tables) {
        this.tables = tables;
    }

    public Map<String, String> getFields() {
        return fields;
    }

    public void setFields(Map<String, String> fields) {
        this.fields = fields;
    }

    public Map<String, String> getJoinClauses() {
        return joinClauses;
    }

    public void setJoinClauses(Map<String, String> joinClauses) {
        this.joinClauses = joinClauses;
    }

    public Map<String, List<String>> getSearchTerms() {
        return searchTerms;
    }

    public void setSearchTerms(Map<String, List<String>> searchTerms) {
        this.searchTerms = searchTerms;
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = limit;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public void setErrorKind(ErrorKind errorKind) {
        this.errorKind = errorKind;
    }
}
