package com.geico.poc.cargoquery.compiler;

/**
 * Why a query could not be compiled.
 */
public class QueryError {

    private final ErrorKind kind;
    private final String message;

    public QueryError(ErrorKind kind, String message) {
        this.kind = kind;
        this.message = message;
    }

    public static QueryError from(CargoQueryException e) {
        return new QueryError(e.getKind(), e.getMessage());
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    /**
     * The exception a caller that prefers throwing would have seen
     */
    public CargoQueryException toException() {
        switch (kind) {
            case SECURITY:
                return new SecurityViolationException(message);
            case SYNTAX:
                return new QuerySyntaxException(message);
            case SCHEMA:
                return new SchemaResolutionException(message);
            case JOIN_GRAPH:
                return new JoinGraphException(message);
            default:
                return new CargoQueryException(kind, message);
        }
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
