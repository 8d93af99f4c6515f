package com.geico.poc.cargoquery.compiler;

/**
 * Thrown when the join conditions do not connect every declared table
 */
public class JoinGraphException extends CargoQueryException {

    public JoinGraphException(String message) {
        super(ErrorKind.JOIN_GRAPH, message);
    }
}
