package com.geico.poc.cargoquery.compiler;

/**
 * Category of a fatal compile error. Every kind aborts compilation; none is retried.
 */
public enum ErrorKind {
    /** Blacklisted token or disallowed SQL function */
    SECURITY,
    /** Malformed join clause, NEAR/MATCHES argument, DISTINCT misuse */
    SYNTAX,
    /** Unknown table or field */
    SCHEMA,
    /** Disconnected table or join against an undeclared table */
    JOIN_GRAPH
}
