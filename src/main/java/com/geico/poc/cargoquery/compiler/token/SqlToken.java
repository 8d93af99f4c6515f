package com.geico.poc.cargoquery.compiler.token;

/**
 * A lexical token of a SQL clause fragment. Concatenating the text of every token
 * reproduces the original fragment exactly.
 */
public final class SqlToken {

    public enum Type {
        /** Identifier or keyword: letters, digits, underscore and dollar sign */
        WORD,
        NUMBER,
        /** Single- or double-quoted string literal, quotes included */
        STRING,
        /** Backtick-quoted identifier, backticks included */
        QUOTED_IDENTIFIER,
        WHITESPACE,
        /** Any other single character: parentheses, dot, comma, operators */
        SYMBOL
    }

    private final Type type;
    private final String text;

    public SqlToken(Type type, String text) {
        this.type = type;
        this.text = text;
    }

    public Type getType() {
        return type;
    }

    public String getText() {
        return text;
    }

    public boolean isWord() {
        return type == Type.WORD;
    }

    /**
     * Case-insensitive keyword/identifier comparison.
     */
    public boolean isWord(String word) {
        return type == Type.WORD && text.equalsIgnoreCase(word);
    }

    public boolean isSymbol(char c) {
        return type == Type.SYMBOL && text.charAt(0) == c;
    }

    public boolean isWhitespace() {
        return type == Type.WHITESPACE;
    }

    public boolean isString() {
        return type == Type.STRING;
    }

    /**
     * Content of a string literal without its surrounding quotes.
     */
    public String unquotedText() {
        if (type != Type.STRING && type != Type.QUOTED_IDENTIFIER) {
            return text;
        }
        if (text.length() < 2) {
            return "";
        }
        return text.substring(1, text.length() - 1);
    }

    @Override
    public String toString() {
        return type + "(" + text + ")";
    }
}
