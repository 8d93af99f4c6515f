package com.geico.poc.cargoquery.compiler.token;

import com.geico.poc.cargoquery.compiler.QuerySyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a clause on a delimiter character, handling:
 * - String literals containing the delimiter
 * - Parenthesised sub-expressions (function arguments)
 * - Backslash-escaped characters
 */
public class SmartSplitter {

    /**
     * Split on top-level occurrences of the delimiter, dropping blank pieces.
     */
    public static List<String> split(char delimiter, String str) {
        return split(delimiter, str, false);
    }

    /**
     * Split on top-level occurrences of the delimiter. Each piece is trimmed.
     */
    public static List<String> split(char delimiter, String str, boolean includeBlankValues) {
        List<String> values = new ArrayList<>();
        if (str == null || str.isEmpty()) {
            return values;
        }

        StringBuilder current = new StringBuilder();
        int openParentheses = 0;
        boolean ignoreNextChar = false;

        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            boolean escaped = ignoreNextChar;

            if (ignoreNextChar) {
                ignoreNextChar = false;
            } else if (c == '(') {
                openParentheses++;
            } else if (c == ')') {
                openParentheses--;
            } else if (c == '\'' || c == '"') {
                int end = SqlTokenizer.findQuotedStringEnd(str, c, i + 1);
                if (end < 0) {
                    throw new QuerySyntaxException("Error: unclosed string literal.");
                }
                // Copy the whole literal, delimiters inside it are not split points
                current.append(str, i, end + 1);
                i = end;
                continue;
            } else if (c == '\\') {
                ignoreNextChar = true;
            }

            if (c == delimiter && openParentheses == 0 && !escaped) {
                values.add(current.toString().trim());
                current = new StringBuilder();
            } else {
                current.append(c);
            }
        }
        values.add(current.toString().trim());

        if (includeBlankValues) {
            return values;
        }
        List<String> nonBlank = new ArrayList<>();
        for (String value : values) {
            if (!value.isEmpty()) {
                nonBlank.add(value);
            }
        }
        return nonBlank;
    }
}
