package com.geico.poc.cargoquery.compiler;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Map;

import static com.geico.poc.cargoquery.compiler.TestSchemas.initialIr;
import static org.junit.jupiter.api.Assertions.*;

public class DateFieldAugmenterTest {

    private final DateFieldAugmenter augmenter = new DateFieldAugmenter();

    private QueryIr augment(String fields) {
        return augmenter.apply(initialIr(QuerySpec.builder().tables("Films").fields(fields).build()));
    }

    @Test
    public void testPrecisionColumnFollowsDateField() {
        QueryIr ir = augment("Title, Release_date, Films.Release_date = Released");
        Map<String, String> fields = ir.getAliasedFields();

        assertEquals(Arrays.asList("Title", "Release date", "Released", "Release date__precision",
                "Released__precision"), Arrays.asList(fields.keySet().toArray(new String[0])));
        assertEquals("Release_date__precision", fields.get("Release date__precision"));
        assertEquals("Films.Release_date__precision", fields.get("Released__precision"));
        assertEquals(FieldRef.datePrecision("Films", "Release_date"),
                ir.getResolvedField("Released__precision").getRef());
    }

    @Test
    public void testFunctionsAndListsGetNoPrecision() {
        QueryIr ir = augment("Title, DATE(Release_date) = Day, Screenings");

        assertEquals(3, ir.getAliasedFields().size());
    }
}
