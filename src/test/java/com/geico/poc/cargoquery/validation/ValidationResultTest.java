package com.geico.poc.cargoquery.validation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ValidationResultTest {

    @Test
    public void testEmptyResultIsValid() {
        ValidationResult result = new ValidationResult();

        assertTrue(result.isValid());
        assertNull(result.getErrorMessage());
        assertEquals("Valid", result.toString());
    }

    @Test
    public void testDuplicateErrorsAreKeptOnce() {
        ValidationResult result = new ValidationResult();
        result.addError("a");
        result.addError("b");
        result.addError("a");

        assertEquals(2, result.getErrors().size());
        assertEquals("a\nb", result.getErrorMessage());
    }
}
