package com.geico.poc.cargoquery.compiler;

/**
 * The eight raw query parameters, exactly as supplied. Missing values are empty strings.
 */
public final class QuerySpec {

    private final String tables;
    private final String fields;
    private final String where;
    private final String joinOn;
    private final String groupBy;
    private final String having;
    private final String orderBy;
    private final String limit;

    private QuerySpec(Builder builder) {
        this.tables = nullToEmpty(builder.tables);
        this.fields = nullToEmpty(builder.fields);
        this.where = nullToEmpty(builder.where);
        this.joinOn = nullToEmpty(builder.joinOn);
        this.groupBy = nullToEmpty(builder.groupBy);
        this.having = nullToEmpty(builder.having);
        this.orderBy = nullToEmpty(builder.orderBy);
        this.limit = nullToEmpty(builder.limit);
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTables() {
        return tables;
    }

    public String getFields() {
        return fields;
    }

    public String getWhere() {
        return where;
    }

    public String getJoinOn() {
        return joinOn;
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

    public String getLimit() {
        return limit;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    @Override
    public String toString() {
        return "QuerySpec{tables='" + tables + "', fields='" + fields + "', where='" + where
                + "', joinOn='" + joinOn + "', groupBy='" + groupBy + "', having='" + having
                + "', orderBy='" + orderBy + "', limit='" + limit + "'}";
    }

    public static class Builder {
        private String tables;
        private String fields;
        private String where;
        private String joinOn;
        private String groupBy;
        private String having;
        private String orderBy;
        private String limit;

        public Builder tables(String tables) {
            this.tables = tables;
            return this;
        }

        public Builder fields(String fields) {
            this.fields = fields;
            return this;
        }

        public Builder where(String where) {
            this.where = where;
            return this;
        }

        public Builder joinOn(String joinOn) {
            this.joinOn = joinOn;
            return this;
        }

        public Builder groupBy(String groupBy) {
            this.groupBy = groupBy;
            return this;
        }

        public Builder having(String having) {
            this.having = having;
            return this;
        }

        public Builder orderBy(String orderBy) {
            this.orderBy = orderBy;
            return this;
        }

        public Builder limit(String limit) {
            this.limit = limit;
            return this;
        }

        public QuerySpec build() {
            return new QuerySpec(this);
        }
    }
}
