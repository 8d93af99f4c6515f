package com.geico.poc.cargoquery.validation;

import com.geico.poc.cargoquery.compiler.QuerySpec;
import com.geico.poc.cargoquery.compiler.SecurityViolationException;
import com.geico.poc.cargoquery.config.CargoQueryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class QueryTokenGuardTest {

    private QueryTokenGuard guard;

    @BeforeEach
    public void setup() {
        guard = new QueryTokenGuard(CargoQueryConfig.DEFAULT_ALLOWED_SQL_FUNCTIONS);
    }

    private static QuerySpec.Builder films() {
        return QuerySpec.builder().tables("Films").fields("Title");
    }

    @Test
    public void testOrdinaryQueryPasses() {
        QuerySpec spec = films()
                .where("Runtime > 90 AND (Title LIKE 'A%' OR NOT (Runtime IN (1, 2)))")
                .groupBy("Title")
                .having("COUNT(*) > 1")
                .orderBy("UPPER(Title) DESC")
                .limit("10")
                .build();

        ValidationResult result = guard.validate(spec);
        assertTrue(result.isValid(), "Unexpected errors: " + result.getErrors());
    }

    @Test
    @DisplayName("Keywords inside string literals are not violations")
    public void testKeywordsInLiteralsAreIgnored() {
        QuerySpec spec = films().where("Title = 'Select From Union; Into'").build();

        assertTrue(guard.validate(spec).isValid());
    }

    @Test
    public void testSelectInWhereIsRejected() {
        QuerySpec spec = films().where("Runtime IN (SELECT Runtime FROM Films)").build();

        ValidationResult result = guard.validate(spec);
        assertTrue(result.hasErrors());
        assertTrue(result.getErrors().contains("Error: the string \"SELECT\" cannot be used within a query."));
        assertTrue(result.getErrors().contains("Error: the string \"FROM\" cannot be used within a query."));
    }

    @Test
    public void testForbiddenSymbolsInEveryParameter() {
        assertTrue(guard.validate(QuerySpec.builder().tables("Films;").fields("Title").build()).hasErrors());
        assertTrue(guard.validate(films().fields("Title /* x */").build()).hasErrors());
        assertTrue(guard.validate(films().orderBy("Title; DROP TABLE x").build()).hasErrors());
        assertTrue(guard.validate(films().joinOn("Films.Title = @x.y").build()).hasErrors());
        assertTrue(guard.validate(films().limit("1 union").build()).hasErrors());
        assertTrue(guard.validate(films().groupBy("<?php").build()).hasErrors());
    }

    @Test
    @DisplayName("Comment markers hidden by HTML encoding are caught in where")
    public void testEncodedCommentInWhere() {
        QuerySpec spec = films().where("Title = 'x' &#35; comment").build();

        ValidationResult result = guard.validate(spec);
        assertTrue(result.getErrors().contains(
                "Error in \"where\" parameter: the string \"#\" cannot be used within a query."));
    }

    @Test
    @DisplayName("Comment markers inside a where literal are still rejected")
    public void testCommentMarkerInsideWhereLiteral() {
        QuerySpec spec = films().where("Title = 'a--b'").build();

        ValidationResult result = guard.validate(spec);
        assertEquals(1, result.getErrors().size());
        assertEquals("Error in \"where\" parameter: the string \"--\" cannot be used within a query.",
                result.getErrorMessage());
    }

    @Test
    public void testDisallowedFunctionIsRejected() {
        QuerySpec spec = films().where("SLEEP(5) = 0").build();

        ValidationResult result = guard.validate(spec);
        assertEquals("Error: the SQL function \"SLEEP()\" is not allowed.", result.getErrorMessage());
    }

    @Test
    public void testFunctionNamesInLiteralsAreIgnored() {
        QuerySpec spec = films().where("Title = 'sleep(5)'").build();

        assertTrue(guard.validate(spec).isValid());
    }

    @Test
    public void testEveryViolationIsCollected() {
        QuerySpec spec = films().where("BENCHMARK(1, 2) = 0").orderBy("LOAD_FILE(Title)").groupBy("a;b").build();

        ValidationResult result = guard.validate(spec);
        assertEquals(3, result.getErrors().size(), "Errors: " + result.getErrors());
        assertEquals(String.join("\n", result.getErrors()), result.getErrorMessage());
    }

    @Test
    public void testCheckThrowsSecurityViolation() {
        QuerySpec spec = films().where("Title = 'x' UNION ALL Title").build();

        SecurityViolationException e = assertThrows(SecurityViolationException.class, () -> guard.check(spec));
        assertEquals("Error: the string \"UNION\" cannot be used within a query.", e.getMessage());
    }

    @Test
    public void testFindFunctionCalls() {
        List<String> functions = QueryTokenGuard.findFunctionCalls("count(*) + Max (Runtime) * 2 (3)");

        assertEquals(Arrays.asList("COUNT", "MAX"), functions);
    }

    @Test
    public void testGetAndValidateSqlFunctions() {
        assertEquals(Arrays.asList("CONCAT", "UPPER"), guard.getAndValidateSqlFunctions("CONCAT(UPPER(Title), 'x')"));
        assertThrows(SecurityViolationException.class, () -> guard.getAndValidateSqlFunctions("USER()"));
    }

    @Test
    public void testLogicalOperatorsAreAlwaysAllowed() {
        QueryTokenGuard restrictive = new QueryTokenGuard(Arrays.asList("count"));

        assertTrue(restrictive.getAllowedFunctions().contains("COUNT"));
        assertTrue(restrictive.validate(films().where("NOT (Runtime > 1) AND (Runtime < 5)").build()).isValid());
    }
}
