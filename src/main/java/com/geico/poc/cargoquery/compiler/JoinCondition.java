package com.geico.poc.cargoquery.compiler;

import java.util.Objects;

/**
 * A join edge between two declared tables, before any storage prefixing.
 * {@code holds} and {@code holdsLike} mark edges written with HOLDS / HOLDS LIKE instead of '='.
 */
public class JoinCondition {

    public static final String LEFT_OUTER_JOIN = "LEFT OUTER JOIN";

    private final String table1;
    private final String field1;
    private final String table2;
    private final String field2;
    private final String joinType;
    private final boolean holds;
    private final boolean holdsLike;

    public JoinCondition(String table1, String field1, String table2, String field2,
                         String joinType, boolean holds, boolean holdsLike) {
        this.table1 = table1;
        this.field1 = field1;
        this.table2 = table2;
        this.field2 = field2;
        this.joinType = joinType;
        this.holds = holds;
        this.holdsLike = holdsLike;
    }

    public static JoinCondition equality(String table1, String field1, String table2, String field2) {
        return new JoinCondition(table1, field1, table2, field2, LEFT_OUTER_JOIN, false, false);
    }

    public static JoinCondition holdsLike(String table1, String field1, String table2, String field2) {
        return new JoinCondition(table1, field1, table2, field2, LEFT_OUTER_JOIN, false, true);
    }

    /**
     * Join from a list field's owner to its auxiliary value table
     */
    public static JoinCondition ownerToFieldTable(String ownerTable, String fieldTable) {
        return equality(ownerTable, "_ID", fieldTable, "_rowID");
    }

    public String getTable1() {
        return table1;
    }

    public String getField1() {
        return field1;
    }

    public String getTable2() {
        return table2;
    }

    public String getField2() {
        return field2;
    }

    public String getJoinType() {
        return joinType;
    }

    public boolean isHolds() {
        return holds;
    }

    public boolean isHoldsLike() {
        return holdsLike;
    }

    public boolean involves(String tableName) {
        return table1.equals(tableName) || table2.equals(tableName);
    }

    /**
     * Same endpoints, ignoring join type and HOLDS markers
     */
    public boolean sameEdge(JoinCondition other) {
        return table1.equals(other.table1) && field1.equals(other.field1)
                && table2.equals(other.table2) && field2.equals(other.field2);
    }

    /**
     * Get the full qualified left key (table.field)
     */
    public String getLeftKey() {
        return table1 + "." + field1;
    }

    /**
     * Get the full qualified right key (table.field)
     */
    public String getRightKey() {
        return table2 + "." + field2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JoinCondition)) return false;
        JoinCondition that = (JoinCondition) o;
        return sameEdge(that) && holds == that.holds && holdsLike == that.holdsLike
                && joinType.equals(that.joinType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table1, field1, table2, field2, joinType, holds, holdsLike);
    }

    @Override
    public String toString() {
        String operator = holdsLike ? " HOLDS LIKE " : holds ? " HOLDS " : " = ";
        return String.format("%s%s%s (%s)", getLeftKey(), operator, getRightKey(), joinType);
    }
}
