package com.geico.poc.cargoquery.compiler;

import com.geico.poc.cargoquery.storage.BacktickQueryEngine;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static com.geico.poc.cargoquery.compiler.TestSchemas.initialIr;
import static com.geico.poc.cargoquery.compiler.TestSchemas.tables;
import static org.junit.jupiter.api.Assertions.*;

public class TablePrefixQualifierTest {

    private final TablePrefixQualifier qualifier = new TablePrefixQualifier(new BacktickQueryEngine());

    @Test
    public void testDeclaredTablesAreQualified() {
        String clause = "Films.Title = 'Films.Title' AND People.Name LIKE 'x' AND Other.Col = 1 AND Films.Title__full";

        assertEquals("`cargo__Films`.`Title` = 'Films.Title' AND `cargo__People`.`Name` LIKE 'x' "
                + "AND Other.Col = 1 AND `cargo__Films`.`Title__full`",
                qualifier.qualify(clause, tables("Films", "People")));
    }

    @Test
    public void testBareNamesAndCallsAreLeftAlone() {
        assertEquals("COUNT(Title) > 1 AND UPPER(`cargo__Films`.`Title`)",
                qualifier.qualify("COUNT(Title) > 1 AND UPPER(Films.Title)", tables("Films")));
    }

    @Test
    public void testEveryClauseIsQualified() {
        QueryIr ir = qualifier.apply(initialIr(QuerySpec.builder()
                .tables("Films")
                .fields("Films.Title, Runtime")
                .where("Films.Runtime > 90")
                .groupBy("Films.Title")
                .having("COUNT(Films.Runtime) > 0")
                .orderBy("Films.Runtime DESC")
                .build()));

        assertEquals("`cargo__Films`.`Title`", ir.getAliasedFields().get("Title"));
        assertEquals("Runtime", ir.getAliasedFields().get("Runtime"));
        assertEquals("`cargo__Films`.`Runtime` > 90", ir.getWhere());
        assertEquals("`cargo__Films`.`Title`", ir.getGroupBy());
        assertEquals("COUNT(`cargo__Films`.`Runtime`) > 0", ir.getHaving());
        assertEquals("`cargo__Films`.`Runtime` DESC", ir.getOrderBy());
        assertEquals(Arrays.asList("Films"), ir.getTables());
    }
}
