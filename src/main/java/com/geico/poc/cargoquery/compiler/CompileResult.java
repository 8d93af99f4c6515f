package com.geico.poc.cargoquery.compiler;

/**
 * Either a compiled query or the error that stopped compilation, never both.
 */
public final class CompileResult {

    private final CompiledQuery query;
    private final QueryError error;

    private CompileResult(CompiledQuery query, QueryError error) {
        this.query = query;
        this.error = error;
    }

    public static CompileResult success(CompiledQuery query) {
        return new CompileResult(query, null);
    }

    public static CompileResult failure(QueryError error) {
        return new CompileResult(null, error);
    }

    public boolean isSuccess() {
        return query != null;
    }

    public CompiledQuery getQuery() {
        if (query == null) {
            throw new IllegalStateException("Compilation failed: " + error);
        }
        return query;
    }

    public QueryError getError() {
        if (error == null) {
            throw new IllegalStateException("Compilation succeeded");
        }
        return error;
    }

    /**
     * The compiled query, or the error rethrown as its exception type
     */
    public CompiledQuery orElseThrow() {
        if (query == null) {
            throw error.toException();
        }
        return query;
    }

    @Override
    public String toString() {
        return isSuccess() ? "CompileResult{" + query + "}" : "CompileResult{" + error + "}";
    }
}
