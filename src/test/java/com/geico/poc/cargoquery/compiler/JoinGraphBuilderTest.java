package com.geico.poc.cargoquery.compiler;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.geico.poc.cargoquery.compiler.TestSchemas.tables;
import static org.junit.jupiter.api.Assertions.*;

public class JoinGraphBuilderTest {

    private final JoinGraphBuilder builder = new JoinGraphBuilder();

    @Test
    public void testSingleTableNeedsNoJoin() {
        assertTrue(builder.build("", tables("Films")).isEmpty());
    }

    @Test
    public void testMissingJoinForSeveralTables() {
        JoinGraphException e = assertThrows(JoinGraphException.class,
                () -> builder.build(" ", tables("Films", "People")));
        assertEquals("Error: join conditions must be set for tables.", e.getMessage());
    }

    @Test
    public void testEqualityJoin() {
        List<JoinCondition> joins = builder.build("Films.Director = People._pageName", tables("Films", "People"));

        assertEquals(1, joins.size());
        JoinCondition join = joins.get(0);
        assertEquals("Films.Director", join.getLeftKey());
        assertEquals("People._pageName", join.getRightKey());
        assertEquals(JoinCondition.LEFT_OUTER_JOIN, join.getJoinType());
        assertFalse(join.isHolds());
        assertFalse(join.isHoldsLike());
    }

    @Test
    public void testHoldsJoins() {
        List<JoinCondition> joins = builder.build(
                "Films.Director HOLDS People._pageName, Films.Genres HOLDS LIKE Genres.Pattern",
                tables("Films", "People", "Genres"));

        assertTrue(joins.get(0).isHolds());
        assertEquals("People", joins.get(0).getTable2());
        assertTrue(joins.get(1).isHoldsLike());
        assertEquals("Pattern", joins.get(1).getField2());
    }

    @Test
    public void testMissingOperator() {
        QuerySyntaxException e = assertThrows(QuerySyntaxException.class,
                () -> builder.build("Films.Director People._pageName", tables("Films", "People")));
        assertEquals("Missing '=' in join condition (Films.Director People._pageName).", e.getMessage());
    }

    @Test
    public void testFieldWithoutTable() {
        QuerySyntaxException e = assertThrows(QuerySyntaxException.class,
                () -> builder.build("Director = People._pageName", tables("Films", "People")));
        assertEquals("Table and field name must both be specified in 'Director'.", e.getMessage());
    }

    @Test
    public void testUndeclaredTable() {
        JoinGraphException e = assertThrows(JoinGraphException.class,
                () -> builder.build("Films.Director = Crew.Name", tables("Films", "People")));
        assertEquals("Error: table \"Crew\" is not in list of table names.", e.getMessage());
    }

    @Test
    public void testDisconnectedTable() {
        JoinGraphException e = assertThrows(JoinGraphException.class,
                () -> builder.build("Films.Director = People._pageName", tables("Films", "People", "Places")));
        assertEquals("Error: table \"Places\" is not included within the join conditions.", e.getMessage());
    }

    @Test
    public void testConnectivityThroughLaterCondition() {
        List<JoinCondition> joins = builder.build(
                "People.Name = Places.Name, Films.Director = People._pageName",
                tables("Films", "People", "Places"));

        assertEquals(2, joins.size());
    }

    @Test
    public void testTwoDisjointPairsAreRejected() {
        assertThrows(JoinGraphException.class, () -> builder.build(
                "Films.Title = People.Name, Places.Name = Genres.Name",
                tables("Films", "People", "Places", "Genres")));
    }
}
