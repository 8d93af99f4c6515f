package com.geico.poc.cargoquery.storage;

/**
 * Exception thrown when the underlying store fails while reading schemas or rows
 */
public class QueryExecutionException extends RuntimeException {

    public QueryExecutionException(String message) {
        super(message);
    }

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
