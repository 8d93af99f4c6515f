package com.geico.poc.cargoquery.storage;

import java.util.Map;

/**
 * Forward-only view over the rows of an executed SELECT.
 */
public interface RowCursor extends AutoCloseable {

    /**
     * Next row keyed by column label, or null when the rows are exhausted
     */
    Map<String, Object> fetchRow();

    @Override
    void close();
}
