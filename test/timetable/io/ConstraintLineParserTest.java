package timetable.io;

import org.junit.jupiter.api.Test;
import timetable.model.Constraint;
import timetable.model.ConstraintType;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConstraintLineParserTest {

    private final ConstraintLineParser parser = new ConstraintLineParser();

    @Test
    void threeTokens() {
        Constraint c = parser.parse(" Math , monday , P1-P2 ");

        assertEquals("Math", c.getCourseName());
        assertEquals("Monday", c.getDay());
        assertEquals("P1-P2", c.getPeriodRange());
        assertTrue(c.appliesToAllSections());
        assertEquals(ConstraintType.HARD, c.getType());
    }

    @Test
    void fourTokensWithSection() {
        Constraint c = parser.parse("Physics,B,Tuesday,P3");

        assertEquals("B", c.getSection());
        assertEquals("Tuesday", c.getDay());
        assertEquals("P3", c.getPeriodRange());
        assertNull(c.getMode());
    }

    @Test
    void fourTokensWithMode() {
        Constraint c = parser.parse("Physics,Tuesday,P3-P4,block");

        assertTrue(c.appliesToAllSections());
        assertEquals(ConstraintType.EXACT, c.getType());
        assertEquals("block", c.getMode());
    }

    @Test
    void fiveTokens() {
        Constraint exact = parser.parse("Lab,A,Friday,P1-P3,Exact");
        Constraint hard = parser.parse("Lab,A,Friday,P1-P3,soft");

        assertEquals("A", exact.getSection());
        assertTrue(exact.isExact());
        assertEquals(ConstraintType.HARD, hard.getType());
        assertNull(hard.getMode());
    }

    @Test
    void unknownDayIsKeptForTheResolverToReport() {
        assertEquals("Someday", parser.parse("Math,Someday,P1").getDay());
    }

    @Test
    void wrongTokenCount() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse("Math,Monday"));
        assertThrows(IllegalArgumentException.class, () -> parser.parse("a,b,c,d,e,f"));
    }
}
