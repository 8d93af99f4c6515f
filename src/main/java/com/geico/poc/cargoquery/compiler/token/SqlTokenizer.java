package com.geico.poc.cargoquery.compiler.token;

import com.geico.poc.cargoquery.compiler.QuerySyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a SQL clause fragment into tokens, keeping string literals and quoted
 * identifiers intact so that rewrites never reach inside them.
 */
public final class SqlTokenizer {

    private SqlTokenizer() {
    }

    public static List<SqlToken> tokenize(String sql) {
        List<SqlToken> tokens = new ArrayList<>();
        if (sql == null || sql.isEmpty()) {
            return tokens;
        }

        int i = 0;
        int length = sql.length();
        while (i < length) {
            char c = sql.charAt(i);

            if (Character.isWhitespace(c)) {
                int end = i;
                while (end < length && Character.isWhitespace(sql.charAt(end))) {
                    end++;
                }
                tokens.add(new SqlToken(SqlToken.Type.WHITESPACE, sql.substring(i, end)));
                i = end;
            } else if (c == '\'' || c == '"') {
                int end = findQuotedStringEnd(sql, c, i + 1);
                if (end < 0) {
                    throw new QuerySyntaxException("Error: unclosed string literal in \"" + sql + "\".");
                }
                tokens.add(new SqlToken(SqlToken.Type.STRING, sql.substring(i, end + 1)));
                i = end + 1;
            } else if (c == '`') {
                int end = sql.indexOf('`', i + 1);
                if (end < 0) {
                    throw new QuerySyntaxException("Error: unclosed quoted identifier in \"" + sql + "\".");
                }
                tokens.add(new SqlToken(SqlToken.Type.QUOTED_IDENTIFIER, sql.substring(i, end + 1)));
                i = end + 1;
            } else if (Character.isDigit(c)) {
                int end = i;
                boolean seenDot = false;
                while (end < length) {
                    char d = sql.charAt(end);
                    if (Character.isDigit(d)) {
                        end++;
                    } else if (d == '.' && !seenDot && end + 1 < length && Character.isDigit(sql.charAt(end + 1))) {
                        seenDot = true;
                        end++;
                    } else {
                        break;
                    }
                }
                if (end < length && isWordChar(sql.charAt(end))) {
                    // Identifier starting with a digit, e.g. "2nd_value"
                    end = consumeWord(sql, i);
                    tokens.add(new SqlToken(SqlToken.Type.WORD, sql.substring(i, end)));
                } else {
                    tokens.add(new SqlToken(SqlToken.Type.NUMBER, sql.substring(i, end)));
                }
                i = end;
            } else if (isWordChar(c)) {
                int end = consumeWord(sql, i);
                tokens.add(new SqlToken(SqlToken.Type.WORD, sql.substring(i, end)));
                i = end;
            } else {
                tokens.add(new SqlToken(SqlToken.Type.SYMBOL, String.valueOf(c)));
                i++;
            }
        }
        return tokens;
    }

    /**
     * Position of the closing quote for a literal opened just before {@code start},
     * honouring backslash escapes and doubled quotes; -1 when unclosed.
     */
    public static int findQuotedStringEnd(String sql, char quote, int start) {
        int i = start;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        return -1;
    }

    /**
     * Drops every quoted string literal from the text, leaving everything else in place.
     */
    public static String removeQuotedStrings(String sql) {
        if (sql == null || sql.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                int end = findQuotedStringEnd(sql, c, i + 1);
                if (end < 0) {
                    // An unbalanced quote is kept so that the rest is still scanned
                    out.append(c);
                    i++;
                    continue;
                }
                i = end + 1;
                continue;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    public static String render(List<SqlToken> tokens) {
        StringBuilder sb = new StringBuilder();
        for (SqlToken token : tokens) {
            sb.append(token.getText());
        }
        return sb.toString();
    }

    static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static int consumeWord(String sql, int start) {
        int end = start;
        while (end < sql.length() && isWordChar(sql.charAt(end))) {
            end++;
        }
        return end;
    }
}
