package com.geico.poc.cargoquery.compiler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class FieldAliasResolverTest {

    private final FieldAliasResolver resolver = new FieldAliasResolver();

    @Test
    public void testDefaultAliases() {
        Map<String, String> fields = resolver.resolve("Films.Title, Release_date, _pageName").getAliasedFields();

        assertEquals(Arrays.asList("Title", "Release date", "_pageName"), Arrays.asList(fields.keySet().toArray()));
        assertEquals("Films.Title", fields.get("Title"));
        assertEquals("Release_date", fields.get("Release date"));
    }

    @Test
    public void testExplicitAlias() {
        FieldAliasResolver.Result result = resolver.resolve("COUNT(*) = Count, CONCAT(Title, '=') = Label");

        assertEquals("COUNT(*)", result.getAliasedFields().get("Count"));
        assertEquals("CONCAT(Title, '=')", result.getAliasedFields().get("Label"));
        assertEquals("Count", result.getAliasForFieldString("COUNT(*) = Count"));
    }

    @Test
    @DisplayName("Empty fields select _pageName")
    public void testEmptyFieldsDefaultToPageName() {
        Map<String, String> fields = resolver.resolve("  ").getAliasedFields();

        assertEquals(Collections.singletonMap("_pageName", "_pageName"), fields);
    }

    @Test
    @DisplayName("Blank aliases get distinct placeholders")
    public void testBlankAliases() {
        Map<String, String> fields = resolver.resolve("Title=, Runtime=").getAliasedFields();

        assertEquals("Title", fields.get("Blank value 1"));
        assertEquals("Runtime", fields.get("Blank value 2"));
    }

    @Test
    public void testDistinctIsRejected() {
        QuerySyntaxException e = assertThrows(QuerySyntaxException.class,
                () -> resolver.resolve("DISTINCT Title"));
        assertEquals(ErrorKind.SYNTAX, e.getKind());
    }

    @Test
    public void testFieldStringsAreKeptVerbatim() {
        FieldAliasResolver.Result result = resolver.resolve("Films.Director_name,Runtime=Length");

        assertEquals("Director name", result.getAliasForFieldString("Films.Director_name"));
        assertEquals("Length", result.getAliasForFieldString("Runtime=Length"));
    }
}
