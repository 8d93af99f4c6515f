package com.geico.poc.cargoquery.compiler;

/**
 * Base exception for every fatal condition raised while compiling a query.
 */
public class CargoQueryException extends RuntimeException {

    private final ErrorKind kind;

    public CargoQueryException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CargoQueryException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
