package com.geico.poc.cargoquery.compiler;

import com.geico.poc.cargoquery.compiler.token.SmartSplitter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses the fields parameter into an ordered alias -> expression map.
 *
 *   "Films.Title, Release_date, COUNT(*) = Count"
 *     -> {Title=Films.Title, Release date=Release_date, Count=COUNT(*)}
 */
public class FieldAliasResolver {

    public static final String DEFAULT_FIELD = "_pageName";

    private static final String BLANK_ALIAS = "Blank value ";

    public static class Result {
        private final Map<String, String> aliasedFields;
        private final Map<String, String> fieldStringAliases;

        Result(Map<String, String> aliasedFields, Map<String, String> fieldStringAliases) {
            this.aliasedFields = Collections.unmodifiableMap(aliasedFields);
            this.fieldStringAliases = Collections.unmodifiableMap(fieldStringAliases);
        }

        public Map<String, String> getAliasedFields() {
            return aliasedFields;
        }

        public Map<String, String> getFieldStringAliases() {
            return fieldStringAliases;
        }

        public String getAliasForFieldString(String fieldString) {
            return fieldStringAliases.get(fieldString);
        }
    }

    public Result resolve(String fieldsStr) {
        List<String> fieldStrings = SmartSplitter.split(',', fieldsStr);
        if (fieldStrings.isEmpty()) {
            fieldStrings = Collections.singletonList(DEFAULT_FIELD);
        }

        for (String fieldString : fieldStrings) {
            if (fieldString.toLowerCase(Locale.ROOT).startsWith("distinct ")) {
                throw new QuerySyntaxException("Error: the DISTINCT keyword is not allowed; "
                        + "please use \"group by\" instead.");
            }
        }

        // Aliases are map keys, so every blank alias gets a distinct placeholder
        int blankAliasCount = 0;
        Map<String, String> aliasedFields = new LinkedHashMap<>();
        Map<String, String> fieldStringAliases = new LinkedHashMap<>();
        for (String fieldString : fieldStrings) {
            List<String> parts = SmartSplitter.split('=', fieldString, true);
            String expression;
            String alias;
            if (parts.size() == 2) {
                expression = parts.get(0);
                alias = parts.get(1);
            } else {
                expression = fieldString;
                alias = defaultAlias(fieldString);
            }
            if (alias.isEmpty()) {
                blankAliasCount++;
                alias = BLANK_ALIAS + blankAliasCount;
            }
            aliasedFields.put(alias, expression);
            fieldStringAliases.put(fieldString, alias);
        }
        return new Result(aliasedFields, fieldStringAliases);
    }

    /**
     * Field name without its table; underscores become spaces except for built-in
     * fields, which start with one.
     */
    static String defaultAlias(String fieldName) {
        int dot = fieldName.indexOf('.');
        String realFieldName = dot >= 0 ? fieldName.substring(dot + 1) : fieldName;
        if (realFieldName.startsWith("_")) {
            return realFieldName;
        }
        return realFieldName.replace('_', ' ');
    }
}
