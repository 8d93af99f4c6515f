package com.geico.poc.cargoquery.compiler.token;

import com.geico.poc.cargoquery.compiler.QuerySyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SqlTokenizerTest {

    @Test
    @DisplayName("Token texts concatenate back to the input")
    public void testRenderReproducesInput() {
        String sql = "Films.Title = 'It''s \"here\"' AND  `odd name` >= 1.5 OR CONCAT(a,b)<>'x'";
        assertEquals(sql, SqlTokenizer.render(SqlTokenizer.tokenize(sql)));
    }

    @Test
    public void testTokenTypes() {
        List<SqlToken> tokens = SqlTokenizer.tokenize("Title = 'a.b' AND x");

        assertEquals(9, tokens.size());
        assertTrue(tokens.get(0).isWord("title"), "Word match should ignore case");
        assertTrue(tokens.get(1).isWhitespace());
        assertTrue(tokens.get(2).isSymbol('='));
        assertTrue(tokens.get(4).isString());
        assertEquals("a.b", tokens.get(4).unquotedText());
        assertTrue(tokens.get(6).isWord("AND"));
    }

    @Test
    public void testNumbersAndDigitLedWords() {
        List<SqlToken> tokens = SqlTokenizer.tokenize("1.5 2nd_value");

        assertEquals(SqlToken.Type.NUMBER, tokens.get(0).getType());
        assertEquals("1.5", tokens.get(0).getText());
        assertEquals(SqlToken.Type.WORD, tokens.get(2).getType());
        assertEquals("2nd_value", tokens.get(2).getText());
    }

    @Test
    public void testBacktickIdentifierIsOneToken() {
        List<SqlToken> tokens = SqlTokenizer.tokenize("`cargo__Films`.`Title`");

        assertEquals(3, tokens.size());
        assertEquals(SqlToken.Type.QUOTED_IDENTIFIER, tokens.get(0).getType());
        assertEquals("cargo__Films", tokens.get(0).unquotedText());
    }

    @Test
    public void testUnclosedLiteralIsRejected() {
        assertThrows(QuerySyntaxException.class, () -> SqlTokenizer.tokenize("Title = 'open"));
    }

    @Test
    public void testFindQuotedStringEndHonoursEscapes() {
        assertEquals(6, SqlTokenizer.findQuotedStringEnd("'it\\'s'", '\'', 1));
        assertEquals(6, SqlTokenizer.findQuotedStringEnd("'it''s'", '\'', 1));
        assertEquals(-1, SqlTokenizer.findQuotedStringEnd("'open", '\'', 1));
    }

    @Test
    public void testRemoveQuotedStrings() {
        assertEquals("Title =  AND x", SqlTokenizer.removeQuotedStrings("Title = 'select' AND x"));
        assertEquals("a =  OR b", SqlTokenizer.removeQuotedStrings("a = \"from\" OR b"));
        assertEquals("", SqlTokenizer.removeQuotedStrings(null));
    }
}
