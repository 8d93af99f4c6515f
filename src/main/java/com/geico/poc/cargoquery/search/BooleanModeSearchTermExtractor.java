package com.geico.poc.cargoquery.search;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Terms of a MySQL boolean-mode search string:
 *
 *   +apple -banana "green pear" ~cherry pine*
 *     -> [apple, green pear, cherry, pine]
 *
 * Excluded ({@code -}) terms are dropped; the {@code +}, {@code ~}, {@code <} and
 * {@code >} modifiers and the trailing {@code *} wildcard are stripped. Grouping
 * parentheses are ignored.
 */
public class BooleanModeSearchTermExtractor implements SearchTermExtractor {

    private static final Pattern TERM = Pattern.compile("([-+<>~]?)(?:\"([^\"]*)\"|([\\p{L}\\p{N}_']+)(\\*?))");

    @Override
    public List<String> getSearchTerms(String searchString) {
        List<String> terms = new ArrayList<>();
        if (searchString == null || searchString.trim().isEmpty()) {
            return terms;
        }

        Matcher matcher = TERM.matcher(searchString);
        while (matcher.find()) {
            if ("-".equals(matcher.group(1))) {
                continue;
            }
            String term = matcher.group(2) != null ? matcher.group(2).trim() : matcher.group(3);
            if (!term.isEmpty() && !terms.contains(term)) {
                terms.add(term);
            }
        }
        return terms;
    }
}
