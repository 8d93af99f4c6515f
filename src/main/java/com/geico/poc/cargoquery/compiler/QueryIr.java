package com.geico.poc.cargoquery.compiler;

import com.geico.poc.cargoquery.schema.TableSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a query between two rewrite stages. Stages never modify a
 * snapshot; they derive a new one through {@link #toBuilder()}.
 */
public final class QueryIr {

    private final List<String> tables;
    private final Map<String, String> aliasedFields;
    private final Map<String, String> fieldStringAliases;
    private final Map<String, ResolvedField> resolvedFields;
    private final Map<String, TableSchema> tableSchemas;
    private final List<JoinCondition> joinConditions;
    private final String joinOn;
    private final String where;
    private final String groupBy;
    private final String having;
    private final String orderBy;
    private final boolean defaultOrderBy;
    private final Map<String, List<String>> searchTerms;

    private QueryIr(Builder b) {
        this.tables = Collections.unmodifiableList(new ArrayList<>(b.tables));
        this.aliasedFields = Collections.unmodifiableMap(new LinkedHashMap<>(b.aliasedFields));
        this.fieldStringAliases = Collections.unmodifiableMap(new LinkedHashMap<>(b.fieldStringAliases));
        this.resolvedFields = Collections.unmodifiableMap(new LinkedHashMap<>(b.resolvedFields));
        this.tableSchemas = Collections.unmodifiableMap(new LinkedHashMap<>(b.tableSchemas));
        this.joinConditions = Collections.unmodifiableList(new ArrayList<>(b.joinConditions));
        this.joinOn = b.joinOn;
        this.where = b.where;
        this.groupBy = b.groupBy;
        this.having = b.having;
        this.orderBy = b.orderBy;
        this.defaultOrderBy = b.defaultOrderBy;
        Map<String, List<String>> terms = new LinkedHashMap<>();
        b.searchTerms.forEach((alias, list) -> terms.put(alias, Collections.unmodifiableList(new ArrayList<>(list))));
        this.searchTerms = Collections.unmodifiableMap(terms);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.tables = new ArrayList<>(tables);
        b.aliasedFields = new LinkedHashMap<>(aliasedFields);
        b.fieldStringAliases = new LinkedHashMap<>(fieldStringAliases);
        b.resolvedFields = new LinkedHashMap<>(resolvedFields);
        b.tableSchemas = new LinkedHashMap<>(tableSchemas);
        b.joinConditions = new ArrayList<>(joinConditions);
        b.joinOn = joinOn;
        b.where = where;
        b.groupBy = groupBy;
        b.having = having;
        b.orderBy = orderBy;
        b.defaultOrderBy = defaultOrderBy;
        b.searchTerms = new LinkedHashMap<>(searchTerms);
        return b;
    }

    public List<String> getTables() {
        return tables;
    }

    public Map<String, String> getAliasedFields() {
        return aliasedFields;
    }

    /**
     * Verbatim field string from the request -> alias it was given
     */
    public Map<String, String> getFieldStringAliases() {
        return fieldStringAliases;
    }

    public Map<String, ResolvedField> getResolvedFields() {
        return resolvedFields;
    }

    public ResolvedField getResolvedField(String alias) {
        return resolvedFields.get(alias);
    }

    /**
     * Schemas of the declared tables, keyed by main table name
     */
    public Map<String, TableSchema> getTableSchemas() {
        return tableSchemas;
    }

    public List<JoinCondition> getJoinConditions() {
        return joinConditions;
    }

    public String getJoinOn() {
        return joinOn;
    }

    public String getWhere() {
        return where;
    }

    public String getGroupBy() {
        return groupBy;
    }

    public String getHaving() {
        return having;
    }

    public String getOrderBy() {
        return orderBy;
    }

    /**
     * True when the order by was not supplied and falls back to the first field
     */
    public boolean isDefaultOrderBy() {
        return defaultOrderBy;
    }

    public Map<String, List<String>> getSearchTerms() {
        return searchTerms;
    }

    /**
     * Whether any join condition already touches the table
     */
    public boolean isJoined(String tableName) {
        for (JoinCondition joinCondition : joinConditions) {
            if (joinCondition.involves(tableName)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "QueryIr{tables=" + tables + ", fields=" + aliasedFields + ", joins=" + joinConditions
                + ", where='" + where + "', groupBy='" + groupBy + "', having='" + having
                + "', orderBy='" + orderBy + "'}";
    }

    public static class Builder {
        private List<String> tables = new ArrayList<>();
        private Map<String, String> aliasedFields = new LinkedHashMap<>();
        private Map<String, String> fieldStringAliases = new LinkedHashMap<>();
        private Map<String, ResolvedField> resolvedFields = new LinkedHashMap<>();
        private Map<String, TableSchema> tableSchemas = new LinkedHashMap<>();
        private List<JoinCondition> joinConditions = new ArrayList<>();
        private String joinOn = "";
        private String where = "";
        private String groupBy = "";
        private String having = "";
        private String orderBy = "";
        private boolean defaultOrderBy;
        private Map<String, List<String>> searchTerms = new LinkedHashMap<>();

        public Builder tables(List<String> tables) {
            this.tables = new ArrayList<>(tables);
            return this;
        }

        /**
         * Insert an auxiliary table directly after its owner. No-op when it is already
         * declared or the owner is not.
         */
        public Builder addFieldTable(String fieldTableName, String ownerTable) {
            if (tables.contains(fieldTableName)) {
                return this;
            }
            int ownerIndex = tables.indexOf(ownerTable);
            if (ownerIndex < 0) {
                return this;
            }
            tables.add(ownerIndex + 1, fieldTableName);
            return this;
        }

        public Builder aliasedFields(Map<String, String> aliasedFields) {
            this.aliasedFields = new LinkedHashMap<>(aliasedFields);
            return this;
        }

        public Builder aliasedField(String alias, String expression) {
            this.aliasedFields.put(alias, expression);
            return this;
        }

        public Builder fieldStringAliases(Map<String, String> fieldStringAliases) {
            this.fieldStringAliases = new LinkedHashMap<>(fieldStringAliases);
            return this;
        }

        public Builder resolvedFields(Map<String, ResolvedField> resolvedFields) {
            this.resolvedFields = new LinkedHashMap<>(resolvedFields);
            return this;
        }

        public Builder resolvedField(String alias, ResolvedField resolvedField) {
            this.resolvedFields.put(alias, resolvedField);
            return this;
        }

        public Builder tableSchemas(Map<String, TableSchema> tableSchemas) {
            this.tableSchemas = new LinkedHashMap<>(tableSchemas);
            return this;
        }

        public Builder joinConditions(List<JoinCondition> joinConditions) {
            this.joinConditions = new ArrayList<>(joinConditions);
            return this;
        }

        /**
         * Append join conditions, skipping any whose endpoints are already joined the same way
         */
        public Builder mergeJoinConditions(List<JoinCondition> newConditions) {
            for (JoinCondition candidate : newConditions) {
                boolean found = false;
                for (JoinCondition existing : joinConditions) {
                    if (existing.sameEdge(candidate)) {
                        found = true;
                        break;
                    }
                }
                if (!found) {
                    joinConditions.add(candidate);
                }
            }
            return this;
        }

        public boolean isJoined(String tableName) {
            for (JoinCondition joinCondition : joinConditions) {
                if (joinCondition.involves(tableName)) {
                    return true;
                }
            }
            return false;
        }

        public Builder joinOn(String joinOn) {
            this.joinOn = joinOn == null ? "" : joinOn;
            return this;
        }

        public Builder where(String where) {
            this.where = where == null ? "" : where;
            return this;
        }

        public Builder groupBy(String groupBy) {
            this.groupBy = groupBy == null ? "" : groupBy;
            return this;
        }

        public Builder having(String having) {
            this.having = having == null ? "" : having;
            return this;
        }

        public Builder orderBy(String orderBy) {
            this.orderBy = orderBy == null ? "" : orderBy;
            return this;
        }

        public Builder defaultOrderBy(boolean defaultOrderBy) {
            this.defaultOrderBy = defaultOrderBy;
            return this;
        }

        public Builder searchTerms(String alias, List<String> terms) {
            this.searchTerms.put(alias, terms);
            return this;
        }

        public QueryIr build() {
            return new QueryIr(this);
        }
    }
}
