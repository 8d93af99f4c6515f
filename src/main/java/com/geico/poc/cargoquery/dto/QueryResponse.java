package com.geico.poc.cargoquery.dto;

import com.geico.poc.cargoquery.compiler.ErrorKind;

import java.util.List;
import java.util.Map;

public class QueryResponse {
    private List<Map<String, String>> rows;
    private int rowCount;
    private List<String> columns;
    private Map<String, List<String>> searchTerms;
    private String error;
    private ErrorKind errorKind;

    public QueryResponse() {
    }

    public QueryResponse(List<Map<String, String>> rows, List<String> columns) {
        this.rows = rows;
        this.columns = columns;
        this.rowCount = rows != null ? rows.size() : 0;
    }

    public static QueryResponse error(String message, ErrorKind kind) {
        QueryResponse response = new QueryResponse();
        response.error = message;
        response.errorKind = kind;
        response.rowCount = 0;
        return response;
    }

    public static QueryResponse error(String message) {
        return error(message, null);
    }

    // Getters and setters
    public List<Map<String, String>> getRows() {
        return rows;
    }

    public void setRows(List<Map<String, String>> rows) {
        this.rows = rows;
        this.rowCount = rows != null ? rows.size() : 0;
    }

    public int getRowCount() {
        return rowCount;
    }

    public void setRowCount(int rowCount) {
        this.rowCount = rowCount;
    }

    public List<String> getColumns() {
        return columns;
    }

    public void setColumns(List<String> columns) {
        this.columns = columns;
    }

    public Map<String, List<String>> getSearchTerms() {
        return searchTerms;
    }

    public void setSearchTerms(Map<String, List<String>> searchTerms) {
        this.searchTerms = searchTerms;
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
