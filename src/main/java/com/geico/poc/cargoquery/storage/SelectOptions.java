package com.geico.poc.cargoquery.storage;

/**
 * GROUP BY, HAVING, ORDER BY and LIMIT of a SELECT. Null group by / having are omitted.
 */
public class SelectOptions {

    private final String groupBy;
    private final String having;
    private final String orderBy;
    private final int limit;

    public SelectOptions(String groupBy, String having, String orderBy, int limit) {
        this.groupBy = blankToNull(groupBy);
        this.having = blankToNull(having);
        this.orderBy = blankToNull(orderBy);
        this.limit = limit;
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

    public int getLimit() {
        return limit;
    }

    private static String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (groupBy != null) {
            sb.append("GROUP BY ").append(groupBy).append(' ');
        }
        if (having != null) {
            sb.append("HAVING ").append(having).append(' ');
        }
        if (orderBy != null) {
            sb.append("ORDER BY ").append(orderBy).append(' ');
        }
        return sb.append("LIMIT ").append(limit).toString();
    }
}
