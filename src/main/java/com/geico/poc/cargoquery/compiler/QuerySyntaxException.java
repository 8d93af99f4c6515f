package com.geico.poc.cargoquery.compiler;

/**
 * Thrown when a clause does not follow the query grammar
 */
public class QuerySyntaxException extends CargoQueryException {

    public QuerySyntaxException(String message) {
        super(ErrorKind.SYNTAX, message);
    }
}
