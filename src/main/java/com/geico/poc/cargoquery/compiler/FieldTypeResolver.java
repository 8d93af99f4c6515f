package com.geico.poc.cargoquery.compiler;

import com.geico.poc.cargoquery.compiler.token.SqlTokenizer;
import com.geico.poc.cargoquery.schema.FieldDescription;
import com.geico.poc.cargoquery.schema.FieldType;
import com.geico.poc.cargoquery.schema.SchemaProvider;
import com.geico.poc.cargoquery.schema.TableSchema;
import com.geico.poc.cargoquery.validation.QueryTokenGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Works out the type and owning table of every selected field, using the table schemas
 * and the naming conventions for built-in and helper columns.
 */
public class FieldTypeResolver {

    private static final Logger log = LoggerFactory.getLogger(FieldTypeResolver.class);

    // field or table.field
    private static final Pattern FIELD_PATTERN = Pattern.compile("^([-\\w$]+)([.]([-\\w$]+))?$");
    private static final Pattern FUNCTION_CALL_PATTERN = Pattern.compile("\\w\\s*\\(");

    private static final Set<String> INTEGER_FUNCTIONS = Set.of("COUNT", "FLOOR", "CEIL", "ROUND");
    private static final Set<String> FLOAT_FUNCTIONS = Set.of("MAX", "MIN", "AVG", "SUM", "POWER", "LN", "LOG");
    private static final Set<String> DATE_FUNCTIONS = Set.of("DATE", "DATE_ADD", "DATE_SUB", "DATE_DIFF");

    private static final Set<String> INTEGER_PAGE_FIELDS = Set.of("_ID", "_rowID", "_pageID");

    static final String VALUE_FIELD = "_value";
    static final String FULL_SUFFIX = "__full";
    static final String LAT_SUFFIX = "__lat";
    static final String LON_SUFFIX = "__lon";
    static final String PRECISION_SUFFIX = "__precision";

    private final SchemaProvider schemaProvider;
    private final QueryTokenGuard tokenGuard;

    public FieldTypeResolver(SchemaProvider schemaProvider, QueryTokenGuard tokenGuard) {
        this.schemaProvider = schemaProvider;
        this.tokenGuard = tokenGuard;
    }

    /**
     * Schemas for the declared tables. An auxiliary table {@code Owner__field} is covered
     * by its owner's schema.
     */
    public Map<String, TableSchema> loadSchemas(List<String> tableNames) {
        List<String> mainTables = new ArrayList<>();
        for (String tableName : tableNames) {
            String mainTable = mainTableName(tableName);
            if (!mainTables.contains(mainTable)) {
                mainTables.add(mainTable);
            }
        }

        Map<String, TableSchema> found = schemaProvider.getTableSchemas(mainTables);
        Map<String, TableSchema> schemas = new LinkedHashMap<>();
        for (String mainTable : mainTables) {
            TableSchema schema = found.get(mainTable);
            if (schema == null) {
                throw new SchemaResolutionException("Error: no database table exists named \"" + mainTable + "\".");
            }
            schemas.put(mainTable, schema);
        }
        return schemas;
    }

    static String mainTableName(String tableName) {
        int separator = tableName.indexOf("__");
        return separator > 0 ? tableName.substring(0, separator) : tableName;
    }

    public Map<String, ResolvedField> resolve(Map<String, String> aliasedFields, List<String> tableNames,
                                              Map<String, TableSchema> schemas) {
        Map<String, ResolvedField> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : aliasedFields.entrySet()) {
            ResolvedField field = resolveExpression(entry.getValue(), tableNames, schemas);
            log.debug("Field '{}' = {} -> {}", entry.getKey(), entry.getValue(), field);
            resolved.put(entry.getKey(), field);
        }
        return resolved;
    }

    ResolvedField resolveExpression(String expression, List<String> tableNames, Map<String, TableSchema> schemas) {
        Matcher matcher = FIELD_PATTERN.matcher(expression);
        if (matcher.matches()) {
            if (matcher.group(3) != null) {
                return resolveIdentifier(matcher.group(1), matcher.group(3), tableNames, schemas);
            }
            return resolveIdentifier(null, matcher.group(1), tableNames, schemas);
        }

        if (isQuotedLiteral(expression)) {
            return new ResolvedField(FieldDescription.untyped(), null, FieldRef.literal());
        }

        String noQuotes = SqlTokenizer.removeQuotedStrings(expression);
        if (FUNCTION_CALL_PATTERN.matcher(noQuotes).find()) {
            List<String> functions = tokenGuard.getAndValidateSqlFunctions(noQuotes);
            FieldType type = functions.isEmpty() ? null : functionResultType(functions.get(0));
            FieldDescription description = type == null ? FieldDescription.untyped() : FieldDescription.of(type);
            return new ResolvedField(description, null, FieldRef.expression());
        }

        // Arithmetic and other computed expressions pass through untyped
        return new ResolvedField(FieldDescription.untyped(), null, FieldRef.expression());
    }

    static FieldType functionResultType(String function) {
        if (INTEGER_FUNCTIONS.contains(function)) {
            return FieldType.INTEGER;
        }
        if (FLOAT_FUNCTIONS.contains(function)) {
            return FieldType.FLOAT;
        }
        if (DATE_FUNCTIONS.contains(function)) {
            return FieldType.DATE;
        }
        return null;
    }

    private static boolean isQuotedLiteral(String expression) {
        if (expression.length() < 2) {
            return false;
        }
        char quote = expression.charAt(0);
        if (quote != '\'' && quote != '"') {
            return false;
        }
        return SqlTokenizer.findQuotedStringEnd(expression, quote, 1) == expression.length() - 1;
    }

    private ResolvedField resolveIdentifier(String tableName, String fieldName, List<String> tableNames,
                                            Map<String, TableSchema> schemas) {
        if (INTEGER_PAGE_FIELDS.contains(fieldName)) {
            return new ResolvedField(FieldDescription.of(FieldType.INTEGER), tableName,
                    FieldRef.pageProperty(tableName, fieldName));
        }
        if ("_pageTitle".equals(fieldName)) {
            return new ResolvedField(FieldDescription.untyped(), tableName, FieldRef.pageProperty(tableName, fieldName));
        }
        if ("_pageName".equals(fieldName)) {
            return new ResolvedField(FieldDescription.of(FieldType.PAGE), tableName,
                    FieldRef.pageProperty(tableName, fieldName));
        }

        FieldRef.Kind kind = FieldRef.Kind.DIRECT;
        if (VALUE_FIELD.equals(fieldName)) {
            String fieldTable = tableName;
            if (fieldTable == null) {
                // A bare _value belongs to the one auxiliary table in the query
                for (String declared : tableNames) {
                    if (declared.indexOf("__") > 0) {
                        fieldTable = declared;
                        break;
                    }
                }
            }
            if (fieldTable != null) {
                int separator = fieldTable.indexOf("__");
                if (separator <= 0) {
                    throw new SchemaResolutionException("Error: \"" + fieldTable
                            + "\" is not the table of a list field, so it has no " + VALUE_FIELD + " column.");
                }
                tableName = fieldTable.substring(0, separator);
                fieldName = fieldTable.substring(separator + 2);
                kind = FieldRef.Kind.LIST_VALUE;
            }
        } else if (fieldName.length() > FULL_SUFFIX.length() && fieldName.endsWith(FULL_SUFFIX)) {
            fieldName = fieldName.substring(0, fieldName.length() - FULL_SUFFIX.length());
            kind = FieldRef.Kind.LIST_FULL;
        }

        if (tableName != null) {
            TableSchema schema = schemas.get(tableName);
            if (schema == null) {
                throw new SchemaResolutionException("Error: no database table exists named \"" + tableName + "\".");
            }
            if (schema.hasField(fieldName)) {
                return new ResolvedField(schema.getField(fieldName), tableName, ref(kind, tableName, fieldName));
            }
            if (kind == FieldRef.Kind.DIRECT) {
                ResolvedField helper = resolveHelperColumn(tableName, fieldName);
                if (helper != null) {
                    return helper;
                }
            }
            throw new SchemaResolutionException("Error: no field named \"" + fieldName
                    + "\" found for the database table \"" + tableName + "\".");
        }

        if (kind == FieldRef.Kind.DIRECT) {
            ResolvedField helper = resolveHelperColumn(null, fieldName);
            if (helper != null) {
                return helper;
            }
        }

        // First declared table with the field wins
        for (Map.Entry<String, TableSchema> entry : schemas.entrySet()) {
            if (entry.getValue().hasField(fieldName)) {
                String owner = entry.getKey();
                return new ResolvedField(entry.getValue().getField(fieldName), owner, ref(kind, owner, fieldName));
            }
        }
        throw new SchemaResolutionException("Error: no field named \"" + fieldName
                + "\" found for any of the specified database tables.");
    }

    /**
     * {@code __lat}, {@code __lon} and {@code __precision} columns, which no schema lists
     */
    private static ResolvedField resolveHelperColumn(String tableName, String fieldName) {
        if (fieldName.endsWith(LAT_SUFFIX) || fieldName.endsWith(LON_SUFFIX)) {
            String baseField = fieldName.substring(0, fieldName.length() - LAT_SUFFIX.length());
            return new ResolvedField(FieldDescription.of(FieldType.COORDINATES_PART), tableName,
                    FieldRef.coordinatePart(tableName, baseField));
        }
        if (fieldName.endsWith(PRECISION_SUFFIX)) {
            String baseField = fieldName.substring(0, fieldName.length() - PRECISION_SUFFIX.length());
            return new ResolvedField(FieldDescription.of(FieldType.DATE_PRECISION), tableName,
                    FieldRef.datePrecision(tableName, baseField));
        }
        return null;
    }

    private static FieldRef ref(FieldRef.Kind kind, String tableName, String fieldName) {
        switch (kind) {
            case LIST_VALUE:
                return FieldRef.listValue(tableName, fieldName);
            case LIST_FULL:
                return FieldRef.listFull(tableName, fieldName);
            default:
                return FieldRef.direct(tableName, fieldName);
        }
    }
}
