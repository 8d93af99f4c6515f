package com.geico.poc.cargoquery.search;

import java.util.List;

/**
 * Extracts the terms a full-text search string looks for, in order, for highlighting.
 */
public interface SearchTermExtractor {

    List<String> getSearchTerms(String searchString);
}
