package com.geico.poc.cargoquery.compiler;

import com.geico.poc.cargoquery.config.CargoQueryConfig;
import com.geico.poc.cargoquery.schema.FieldType;
import com.geico.poc.cargoquery.schema.TableSchema;
import com.geico.poc.cargoquery.validation.QueryTokenGuard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.geico.poc.cargoquery.compiler.TestSchemas.tables;
import static org.junit.jupiter.api.Assertions.*;

public class FieldTypeResolverTest {

    private FieldTypeResolver resolver;
    private List<String> tables;
    private Map<String, TableSchema> schemas;

    @BeforeEach
    public void setup() {
        resolver = new FieldTypeResolver(TestSchemas.provider(),
                new QueryTokenGuard(CargoQueryConfig.DEFAULT_ALLOWED_SQL_FUNCTIONS));
        tables = tables("Films", "People");
        schemas = resolver.loadSchemas(tables);
    }

    private ResolvedField resolve(String expression) {
        return resolver.resolveExpression(expression, tables, schemas);
    }

    @Test
    public void testLoadSchemasMapsFieldTablesToOwner() {
        Map<String, TableSchema> loaded = resolver.loadSchemas(tables("Films", "Films__Director"));

        assertEquals(1, loaded.size());
        assertSame(TestSchemas.FILMS, loaded.get("Films"));
    }

    @Test
    public void testUnknownTable() {
        SchemaResolutionException e = assertThrows(SchemaResolutionException.class,
                () -> resolver.loadSchemas(tables("Films", "Crew")));
        assertEquals("Error: no database table exists named \"Crew\".", e.getMessage());
    }

    @Test
    public void testQualifiedField() {
        ResolvedField field = resolve("Films.Runtime");

        assertEquals(FieldType.INTEGER, field.getDescription().getType());
        assertEquals("Films", field.getTable());
        assertEquals(FieldRef.direct("Films", "Runtime"), field.getRef());
    }

    @Test
    @DisplayName("Unqualified fields belong to the first declared table that has them")
    public void testBareFieldFirstTableWins() {
        ResolvedField born = resolve("Born");
        assertEquals("People", born.getTable());

        ResolvedField director = resolve("Director");
        assertEquals("Films", director.getTable());
        assertTrue(director.getDescription().isList());
    }

    @Test
    public void testPageProperties() {
        assertEquals(FieldType.PAGE, resolve("_pageName").getDescription().getType());
        assertEquals(FieldType.INTEGER, resolve("Films._ID").getDescription().getType());
        assertEquals(FieldType.INTEGER, resolve("_pageID").getDescription().getType());
        assertFalse(resolve("_pageTitle").getDescription().isTyped());
        assertTrue(resolve("_pageName").getRef().is(FieldRef.Kind.PAGE_PROPERTY));
    }

    @Test
    public void testValueOfFieldTable() {
        List<String> withFieldTable = tables("Films", "Films__Director");
        Map<String, TableSchema> loaded = resolver.loadSchemas(withFieldTable);

        ResolvedField qualified = resolver.resolveExpression("Films__Director._value", withFieldTable, loaded);
        assertEquals(FieldRef.listValue("Films", "Director"), qualified.getRef());
        assertEquals(FieldType.STRING, qualified.getDescription().getType());

        ResolvedField bare = resolver.resolveExpression("_value", withFieldTable, loaded);
        assertEquals(FieldRef.listValue("Films", "Director"), bare.getRef());
    }

    @Test
    public void testFullColumnOfListField() {
        ResolvedField field = resolve("Director__full");

        assertEquals(FieldRef.listFull("Films", "Director"), field.getRef());
        assertTrue(field.getDescription().isList());
    }

    @Test
    public void testHelperColumns() {
        List<String> placeTables = tables("Places");
        Map<String, TableSchema> placeSchemas = resolver.loadSchemas(placeTables);

        ResolvedField lat = resolver.resolveExpression("Places.Location__lat", placeTables, placeSchemas);
        assertEquals(FieldType.COORDINATES_PART, lat.getDescription().getType());
        assertEquals(FieldRef.coordinatePart("Places", "Location"), lat.getRef());

        ResolvedField precision = resolve("Release_date__precision");
        assertEquals(FieldType.DATE_PRECISION, precision.getDescription().getType());
        assertEquals(FieldRef.datePrecision(null, "Release_date"), precision.getRef());
    }

    @Test
    public void testFunctionResultTypes() {
        assertEquals(FieldType.INTEGER, resolve("COUNT(*)").getDescription().getType());
        assertEquals(FieldType.FLOAT, resolve("AVG(Runtime)").getDescription().getType());
        assertEquals(FieldType.DATE, resolve("DATE(Release_date)").getDescription().getType());
        assertFalse(resolve("CONCAT(Title, '!')").getDescription().isTyped());
        assertTrue(resolve("COUNT(*)").getRef().is(FieldRef.Kind.EXPRESSION));
    }

    @Test
    public void testDisallowedFunctionInField() {
        assertThrows(SecurityViolationException.class, () -> resolve("SLEEP(1)"));
    }

    @Test
    public void testLiteralsAndArithmetic() {
        ResolvedField literal = resolve("'Hello, world'");
        assertTrue(literal.getRef().is(FieldRef.Kind.LITERAL));
        assertNull(literal.getTable());

        ResolvedField arithmetic = resolve("Runtime * 60");
        assertTrue(arithmetic.getRef().is(FieldRef.Kind.EXPRESSION));
        assertFalse(arithmetic.getDescription().isTyped());
    }

    @Test
    public void testUnknownFields() {
        SchemaResolutionException qualified = assertThrows(SchemaResolutionException.class,
                () -> resolve("Films.Budget"));
        assertEquals("Error: no field named \"Budget\" found for the database table \"Films\".",
                qualified.getMessage());

        SchemaResolutionException bare = assertThrows(SchemaResolutionException.class, () -> resolve("Budget"));
        assertEquals("Error: no field named \"Budget\" found for any of the specified database tables.",
                bare.getMessage());
    }
}
