package com.geico.poc.cargoquery.compiler;

/**
 * One step of the clause rewriting pipeline: a snapshot in, a new snapshot out.
 */
public interface RewriteStage {

    QueryIr apply(QueryIr ir);
}
