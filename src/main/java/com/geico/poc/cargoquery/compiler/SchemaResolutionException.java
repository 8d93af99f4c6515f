package com.geico.poc.cargoquery.compiler;

/**
 * Thrown when a table or field cannot be found in the declared schemas
 */
public class SchemaResolutionException extends CargoQueryException {

    public SchemaResolutionException(String message) {
        super(ErrorKind.SCHEMA, message);
    }
}
