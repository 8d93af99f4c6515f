package com.geico.poc.cargoquery.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses the join on parameter and checks that it connects every declared table.
 *
 * Each comma-separated condition is one of
 *   Films.Director = People.Name
 *   Films.Genres HOLDS Genres.Name
 *   Films.Genres HOLDS LIKE Genres.Pattern
 */
public class JoinGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(JoinGraphBuilder.class);

    private static final String HOLDS = " HOLDS ";
    private static final String HOLDS_LIKE = " HOLDS LIKE ";

    public List<JoinCondition> build(String joinOnStr, List<String> tableNames) {
        List<JoinCondition> joinConditions = new ArrayList<>();

        if (joinOnStr == null || joinOnStr.trim().isEmpty()) {
            if (tableNames.size() > 1) {
                throw new JoinGraphException("Error: join conditions must be set for tables.");
            }
            return joinConditions;
        }

        for (String joinString : joinOnStr.split(",")) {
            joinConditions.add(parse(joinString));
        }

        checkConnected(joinConditions, tableNames);
        log.debug("Join conditions: {}", joinConditions);
        return joinConditions;
    }

    JoinCondition parse(String joinString) {
        // Operators are matched in upper case only
        String[] joinParts;
        boolean holds = false;
        boolean holdsLike = false;
        if (joinString.contains("=")) {
            joinParts = joinString.split("=", -1);
        } else if (joinString.contains(HOLDS_LIKE)) {
            joinParts = joinString.split(HOLDS_LIKE, -1);
            holdsLike = true;
        } else if (joinString.contains(HOLDS)) {
            joinParts = joinString.split(HOLDS, -1);
            holds = true;
        } else {
            throw new QuerySyntaxException("Missing '=' in join condition (" + joinString.trim() + ").");
        }

        String[] tableAndField1 = splitTableAndField(joinParts[0]);
        String[] tableAndField2 = splitTableAndField(joinParts[1]);
        return new JoinCondition(tableAndField1[0], tableAndField1[1], tableAndField2[0], tableAndField2[1],
                JoinCondition.LEFT_OUTER_JOIN, holds, holdsLike);
    }

    private static String[] splitTableAndField(String joinPart) {
        String trimmed = joinPart.trim();
        String[] tableAndField = trimmed.split("\\.", -1);
        if (tableAndField.length != 2 || tableAndField[0].trim().isEmpty() || tableAndField[1].trim().isEmpty()) {
            throw new QuerySyntaxException("Table and field name must both be specified in '" + trimmed + "'.");
        }
        return new String[]{tableAndField[0].trim(), tableAndField[1].trim()};
    }

    /**
     * Grow the set of reached tables from the first condition's left table until a full
     * pass over the conditions adds nothing.
     */
    void checkConnected(List<JoinCondition> joinConditions, List<String> tableNames) {
        for (JoinCondition joinCondition : joinConditions) {
            if (!tableNames.contains(joinCondition.getTable1())) {
                throw new JoinGraphException("Error: table \"" + joinCondition.getTable1()
                        + "\" is not in list of table names.");
            }
            if (!tableNames.contains(joinCondition.getTable2())) {
                throw new JoinGraphException("Error: table \"" + joinCondition.getTable2()
                        + "\" is not in list of table names.");
            }
        }

        Set<String> matchedTables = new LinkedHashSet<>();
        matchedTables.add(joinConditions.get(0).getTable1());
        boolean changed = true;
        while (changed && !matchedTables.containsAll(tableNames)) {
            changed = false;
            for (JoinCondition joinCondition : joinConditions) {
                String table1 = joinCondition.getTable1();
                String table2 = joinCondition.getTable2();
                if (matchedTables.contains(table1) && matchedTables.add(table2)) {
                    changed = true;
                }
                if (matchedTables.contains(table2) && matchedTables.add(table1)) {
                    changed = true;
                }
            }
        }

        for (String tableName : tableNames) {
            if (!matchedTables.contains(tableName)) {
                throw new JoinGraphException("Error: table \"" + tableName
                        + "\" is not included within the join conditions.");
            }
        }
    }
}
