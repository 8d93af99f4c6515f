package com.geico.poc.cargoquery.compiler;

/**
 * Thrown when a clause contains a blacklisted token or calls a function outside the whitelist
 */
public class SecurityViolationException extends CargoQueryException {

    public SecurityViolationException(String message) {
        super(ErrorKind.SECURITY, message);
    }
}
