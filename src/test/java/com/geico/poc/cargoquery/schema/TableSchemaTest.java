package com.geico.poc.cargoquery.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.ArrayList;

import static org.junit.jupiter.api.Assertions.*;

public class TableSchemaTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    public void testReadSchemaDocument() throws Exception {
        String json = "{\"fields\": {"
                + "\"Title\": {\"type\": \"String\"},"
                + "\"Director\": {\"type\": \"String\", \"isList\": true, \"delimiter\": \";\"},"
                + "\"Location\": {\"type\": \"Coordinates\"},"
                + "\"Notes\": {}}}";

        TableSchema schema = objectMapper.readValue(json, TableSchema.class).withTableName("Films");

        assertEquals("Films", schema.getTableName());
        assertEquals(Arrays.asList("Title", "Director", "Location", "Notes"),
                new ArrayList<>(schema.getFieldDescriptions().keySet()));
        assertTrue(schema.getField("Director").isList());
        assertEquals(";", schema.getField("Director").getDelimiter());
        assertTrue(schema.getField("Location").hasType(FieldType.COORDINATES));
        assertFalse(schema.getField("Notes").isTyped());
    }

    @Test
    public void testTypeNamesAreCaseInsensitive() {
        assertEquals(FieldType.COORDINATES_PART, FieldType.fromName("coordinates part"));
        assertEquals(FieldType.DATE_PRECISION, FieldType.fromName("DATE_PRECISION"));
        assertThrows(IllegalArgumentException.class, () -> FieldType.fromName("Colour"));
    }

    @Test
    public void testWriteUsesDisplayNames() throws Exception {
        TableSchema schema = TableSchema.builder("Places").field("Location", FieldType.COORDINATES).build();

        String json = objectMapper.writeValueAsString(schema);
        assertTrue(json.contains("\"type\":\"Coordinates\""), json);
        assertEquals(schema.getFieldDescriptions().keySet(),
                objectMapper.readValue(json, TableSchema.class).getFieldDescriptions().keySet());
    }

    @Test
    public void testBuilderAndLookups() {
        TableSchema schema = TableSchema.builder("Films")
                .field("Title", FieldType.STRING)
                .listField("Genres", FieldType.STRING)
                .build();

        assertTrue(schema.hasField("Genres"));
        assertFalse(schema.hasField("genres"), "Field names are case-sensitive");
        assertEquals(",", schema.getField("Genres").getDelimiter());
        assertTrue(FieldType.DATETIME.isDate());
    }
}
