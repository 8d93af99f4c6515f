package com.geico.poc.cargoquery.compiler.token;

import java.util.List;

/**
 * Single left-to-right pass over the tokens of a clause. A {@link Rule} gets a chance at
 * every token position; when it matches it writes its replacement and reports how many
 * tokens it consumed, otherwise the token is copied unchanged.
 */
public final class ClauseScanner {

    /**
     * A rewrite rule tried at each token position.
     */
    public interface Rule {
        /**
         * @return the number of tokens consumed from {@code index}, 0 when the rule does not apply
         */
        int apply(List<SqlToken> tokens, int index, StringBuilder out);
    }

    /**
     * Predicate tried at each token position.
     */
    public interface Probe {
        boolean matches(List<SqlToken> tokens, int index);
    }

    private ClauseScanner() {
    }

    public static String rewrite(String clause, Rule rule) {
        if (clause == null || clause.isEmpty()) {
            return clause;
        }
        List<SqlToken> tokens = SqlTokenizer.tokenize(clause);
        StringBuilder out = new StringBuilder(clause.length());
        int i = 0;
        while (i < tokens.size()) {
            int consumed = rule.apply(tokens, i, out);
            if (consumed > 0) {
                i += consumed;
            } else {
                out.append(tokens.get(i).getText());
                i++;
            }
        }
        return out.toString();
    }

    public static boolean anyMatch(String clause, Probe probe) {
        if (clause == null || clause.isEmpty()) {
            return false;
        }
        List<SqlToken> tokens = SqlTokenizer.tokenize(clause);
        for (int i = 0; i < tokens.size(); i++) {
            if (probe.matches(tokens, i)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Match a field reference at {@code index}. With a table this is {@code table.field};
     * without one it is a bare {@code field} that is neither part of a dotted name nor a
     * function name.
     *
     * @return the index just past the reference, or -1
     */
    public static int matchReference(List<SqlToken> tokens, int index, String table, String field) {
        if (index > 0 && tokens.get(index - 1).isSymbol('.')) {
            return -1;
        }
        int end;
        if (table != null) {
            if (index + 2 >= tokens.size()
                    || !tokens.get(index).isWord(table)
                    || !tokens.get(index + 1).isSymbol('.')
                    || !tokens.get(index + 2).isWord(field)) {
                return -1;
            }
            end = index + 3;
        } else {
            if (!tokens.get(index).isWord(field)) {
                return -1;
            }
            end = index + 1;
            int next = skipWhitespace(tokens, end);
            if (next < tokens.size() && tokens.get(next).isSymbol('(')) {
                return -1;
            }
        }
        if (end < tokens.size() && tokens.get(end).isSymbol('.')) {
            return -1;
        }
        return end;
    }

    public static boolean isReference(List<SqlToken> tokens, int index, String table, String field) {
        return matchReference(tokens, index, table, field) >= 0;
    }

    public static int skipWhitespace(List<SqlToken> tokens, int index) {
        int i = index;
        while (i < tokens.size() && tokens.get(i).isWhitespace()) {
            i++;
        }
        return i;
    }

    /**
     * Match a whitespace-separated keyword sequence starting at {@code index}; leading
     * whitespace is not skipped.
     *
     * @return the index just past the last keyword, or -1
     */
    public static int matchKeywords(List<SqlToken> tokens, int index, String... keywords) {
        int i = index;
        for (int k = 0; k < keywords.length; k++) {
            if (k > 0) {
                if (i >= tokens.size() || !tokens.get(i).isWhitespace()) {
                    return -1;
                }
                i++;
            }
            if (i >= tokens.size() || !tokens.get(i).isWord(keywords[k])) {
                return -1;
            }
            i++;
        }
        return i;
    }

    /**
     * Index of the parenthesis closing the one at {@code openIndex}, or -1.
     */
    public static int findClosingParenthesis(List<SqlToken> tokens, int openIndex) {
        int depth = 0;
        for (int i = openIndex; i < tokens.size(); i++) {
            SqlToken token = tokens.get(i);
            if (token.isSymbol('(')) {
                depth++;
            } else if (token.isSymbol(')')) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    public static String render(List<SqlToken> tokens, int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            sb.append(tokens.get(i).getText());
        }
        return sb.toString();
    }
}
