package com.geico.poc.cargoquery.storage;

import java.util.Objects;

/**
 * A rendered join: the join keyword and the ON condition with physical table names.
 */
public class JoinClause {

    private final String joinType;
    private final String condition;

    public JoinClause(String joinType, String condition) {
        this.joinType = joinType;
        this.condition = condition;
    }

    public String getJoinType() {
        return joinType;
    }

    public String getCondition() {
        return condition;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JoinClause)) return false;
        JoinClause that = (JoinClause) o;
        return joinType.equals(that.joinType) && condition.equals(that.condition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(joinType, condition);
    }

    @Override
    public String toString() {
        return joinType + " ON (" + condition + ")";
    }
}
