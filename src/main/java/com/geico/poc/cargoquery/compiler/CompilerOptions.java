package com.geico.poc.cargoquery.compiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Settings the compiler needs, passed in explicitly.
 */
public class CompilerOptions {

    private final int defaultQueryLimit;
    private final int maxQueryLimit;
    private final List<String> allowedSqlFunctions;

    public CompilerOptions(int defaultQueryLimit, int maxQueryLimit, List<String> allowedSqlFunctions) {
        if (defaultQueryLimit < 0 || maxQueryLimit < 0) {
            throw new IllegalArgumentException("Query limits must not be negative");
        }
        this.defaultQueryLimit = defaultQueryLimit;
        this.maxQueryLimit = maxQueryLimit;
        this.allowedSqlFunctions = Collections.unmodifiableList(new ArrayList<>(allowedSqlFunctions));
    }

    public int getDefaultQueryLimit() {
        return defaultQueryLimit;
    }

    public int getMaxQueryLimit() {
        return maxQueryLimit;
    }

    public List<String> getAllowedSqlFunctions() {
        return allowedSqlFunctions;
    }
}
