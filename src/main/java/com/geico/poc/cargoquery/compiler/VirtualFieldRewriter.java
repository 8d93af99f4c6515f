package com.geico.poc.cargoquery.compiler;

import com.geico.poc.cargoquery.compiler.token.ClauseScanner;
import com.geico.poc.cargoquery.schema.FieldDescription;
import com.geico.poc.cargoquery.schema.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Rewrites references to list fields, whose values live in an auxiliary table
 * {@code <owner>__<field>} with a {@code _value} column, joined on
 * {@code <owner>._ID = <owner>__<field>._rowID}.
 *
 * Clauses are handled in a fixed order: where, join on, group by / having, fields, order by.
 * The first three can pull the auxiliary table into the query, which decides how the
 * last two are rewritten.
 */
public class VirtualFieldRewriter implements RewriteStage {

    private static final Logger log = LoggerFactory.getLogger(VirtualFieldRewriter.class);

    /**
     * Longer operators come first so that HOLDS never shadows HOLDS NOT LIKE.
     */
    private enum HoldsOperator {
        HOLDS_NOT_LIKE(" NOT LIKE ", "HOLDS", "NOT", "LIKE"),
        HOLDS_LIKE(" LIKE ", "HOLDS", "LIKE"),
        HOLDS_NOT("!=", "HOLDS", "NOT"),
        HOLDS("=", "HOLDS");

        private final String replacement;
        private final String[] keywords;

        HoldsOperator(String replacement, String... keywords) {
            this.replacement = replacement;
            this.keywords = keywords;
        }
    }

    @Override
    public QueryIr apply(QueryIr ir) {
        List<String[]> virtualFields = listFields(ir.getTableSchemas());
        if (virtualFields.isEmpty()) {
            return ir;
        }

        QueryIr.Builder builder = ir.toBuilder();
        String where = ir.getWhere();
        String groupBy = ir.getGroupBy();
        String having = ir.getHaving();
        String orderBy = ir.getOrderBy();

        // where
        for (String[] virtualField : virtualFields) {
            String tableName = virtualField[0];
            String fieldName = virtualField[1];
            String fieldTableName = fieldTableName(tableName, fieldName);
            AtomicBoolean replaced = new AtomicBoolean(false);

            where = rewriteHolds(where, tableName, fieldName, true, replaced);
            where = rewriteHolds(where, tableName, fieldName, false, replaced);

            if (replaced.get()) {
                builder.addFieldTable(fieldTableName, tableName);
                builder.mergeJoinConditions(Collections.singletonList(
                        JoinCondition.ownerToFieldTable(tableName, fieldTableName)));
            }
        }
        builder.where(where);

        // join on
        List<JoinCondition> keptConditions = new ArrayList<>();
        List<JoinCondition> newConditions = new ArrayList<>();
        for (JoinCondition joinCondition : builder.build().getJoinConditions()) {
            // HOLDS LIKE edges are left as written
            if (!joinCondition.isHolds()
                    || !isListField(virtualFields, joinCondition.getTable1(), joinCondition.getField1())) {
                keptConditions.add(joinCondition);
                continue;
            }
            String tableName = joinCondition.getTable1();
            String fieldTableName = fieldTableName(tableName, joinCondition.getField1());
            builder.addFieldTable(fieldTableName, tableName);
            newConditions.add(JoinCondition.ownerToFieldTable(tableName, fieldTableName));
            newConditions.add(JoinCondition.equality(fieldTableName, FieldTypeResolver.VALUE_FIELD,
                    joinCondition.getTable2(), joinCondition.getField2()));
        }
        builder.joinConditions(keptConditions).mergeJoinConditions(newConditions);

        // group by and having
        for (String[] virtualField : virtualFields) {
            String tableName = virtualField[0];
            String fieldName = virtualField[1];
            boolean found = containsReference(groupBy, tableName, fieldName)
                    || containsReference(having, tableName, fieldName)
                    || containsReference(groupBy, null, fieldName)
                    || containsReference(having, null, fieldName);
            if (!found) {
                continue;
            }
            String fieldTableName = fieldTableName(tableName, fieldName);
            if (!builder.isJoined(fieldTableName)) {
                builder.addFieldTable(fieldTableName, tableName);
                builder.mergeJoinConditions(Collections.singletonList(
                        JoinCondition.ownerToFieldTable(tableName, fieldTableName)));
            }
            // Qualified first, so that the bare pass never sees the table name
            String replacement = fieldTableName + "." + FieldTypeResolver.VALUE_FIELD;
            groupBy = replaceReferences(groupBy, tableName, fieldName, replacement);
            groupBy = replaceReferences(groupBy, null, fieldName, replacement);
            having = replaceReferences(having, tableName, fieldName, replacement);
            having = replaceReferences(having, null, fieldName, replacement);
        }
        builder.groupBy(groupBy).having(having);

        // fields
        for (Map.Entry<String, String> entry : ir.getAliasedFields().entrySet()) {
            String alias = entry.getKey();
            ResolvedField resolved = ir.getResolvedField(alias);
            if (!isListFieldReference(resolved)) {
                continue;
            }
            String tableName = resolved.getTable();
            String fieldName = resolved.getRef().getField();
            String fieldTableName = fieldTableName(tableName, fieldName);
            if (builder.isJoined(fieldTableName)) {
                builder.aliasedField(alias, fieldTableName + "." + FieldTypeResolver.VALUE_FIELD);
                builder.resolvedField(alias, resolved.withRef(FieldRef.listValue(tableName, fieldName)));
            } else {
                builder.aliasedField(alias, fieldName + FieldTypeResolver.FULL_SUFFIX);
                builder.resolvedField(alias, resolved.withRef(FieldRef.listFull(tableName, fieldName)));
            }
        }

        // order by
        for (String[] virtualField : virtualFields) {
            String tableName = virtualField[0];
            String fieldName = virtualField[1];
            if (!containsReference(orderBy, tableName, fieldName) && !containsReference(orderBy, null, fieldName)) {
                continue;
            }
            String fieldTableName = fieldTableName(tableName, fieldName);
            String replacement = builder.isJoined(fieldTableName)
                    ? fieldTableName + "." + FieldTypeResolver.VALUE_FIELD
                    : tableName + "." + fieldName + FieldTypeResolver.FULL_SUFFIX;
            orderBy = replaceReferences(orderBy, tableName, fieldName, replacement);
            orderBy = replaceReferences(orderBy, null, fieldName, replacement);
        }
        builder.orderBy(orderBy);

        QueryIr result = builder.build();
        log.debug("After list field rewrite: {}", result);
        return result;
    }

    static String fieldTableName(String tableName, String fieldName) {
        return tableName + "__" + fieldName;
    }

    /**
     * (table, field) pairs of every list field in the schemas
     */
    private static List<String[]> listFields(Map<String, TableSchema> schemas) {
        List<String[]> fields = new ArrayList<>();
        for (Map.Entry<String, TableSchema> schema : schemas.entrySet()) {
            for (Map.Entry<String, FieldDescription> field : schema.getValue().getFieldDescriptions().entrySet()) {
                if (field.getValue().isList()) {
                    fields.add(new String[]{schema.getKey(), field.getKey()});
                }
            }
        }
        return fields;
    }

    private static boolean isListField(List<String[]> virtualFields, String tableName, String fieldName) {
        for (String[] virtualField : virtualFields) {
            if (virtualField[0].equals(tableName) && virtualField[1].equals(fieldName)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isListFieldReference(ResolvedField resolved) {
        return resolved != null
                && resolved.getRef().is(FieldRef.Kind.DIRECT)
                && resolved.getTable() != null
                && resolved.getDescription().isList();
    }

    private static String rewriteHolds(String where, String tableName, String fieldName, boolean qualified,
                                       AtomicBoolean replaced) {
        String qualifier = qualified ? tableName : null;
        if (!containsReference(where, qualifier, fieldName)) {
            return where;
        }
        String valueColumn = fieldTableName(tableName, fieldName) + "." + FieldTypeResolver.VALUE_FIELD;

        String rewritten = ClauseScanner.rewrite(where, (tokens, index, out) -> {
            int end = ClauseScanner.matchReference(tokens, index, qualifier, fieldName);
            if (end < 0 || end >= tokens.size() || !tokens.get(end).isWhitespace()) {
                return 0;
            }
            for (HoldsOperator operator : HoldsOperator.values()) {
                int after = ClauseScanner.matchKeywords(tokens, end + 1, operator.keywords);
                if (after >= 0) {
                    after = ClauseScanner.skipWhitespace(tokens, after);
                    out.append(valueColumn).append(operator.replacement);
                    replaced.set(true);
                    return after - index;
                }
            }
            return 0;
        });

        if (containsReference(rewritten, qualifier, fieldName)) {
            throw new QuerySyntaxException("Error: operator for the virtual field '" + tableName + "." + fieldName
                    + "' must be 'HOLDS', 'HOLDS NOT', 'HOLDS LIKE' or 'HOLDS NOT LIKE'.");
        }
        return rewritten;
    }

    static boolean containsReference(String clause, String tableName, String fieldName) {
        return ClauseScanner.anyMatch(clause,
                (tokens, index) -> ClauseScanner.isReference(tokens, index, tableName, fieldName));
    }

    static String replaceReferences(String clause, String tableName, String fieldName, String replacement) {
        return ClauseScanner.rewrite(clause, (tokens, index, out) -> {
            int end = ClauseScanner.matchReference(tokens, index, tableName, fieldName);
            if (end < 0) {
                return 0;
            }
            out.append(replacement);
            return end - index;
        });
    }
}
