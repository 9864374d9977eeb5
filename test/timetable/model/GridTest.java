package timetable.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GridTest {

    @Test
    void emptyGridBlocksLunchOnEveryDay() {
        Grid g = Grid.empty(4, 1);

        assertEquals(List.of("Monday", "Tuesday", "Wednesday", "Thursday", "Friday"), g.days());
        for (String d : g.days())
            assertEquals(List.of("", "LUNCH", "", ""), g.row(d));
        assertTrue(g.isFree("Monday", 0));
    }

    @Test
    void lunchOutsideGridIsIgnored() {
        Grid g = Grid.empty(2, 5);
        assertEquals(List.of("", ""), g.row("Friday"));
    }

    @Test
    void fromMapNormalizesCells() {
        Map<String, List<String>> src = new LinkedHashMap<>();
        src.put("Monday", Arrays.asList("Math", null, " Lunch "));
        src.put("Tuesday", List.of("English"));

        Grid g = Grid.fromMap(src);

        assertEquals(3, g.getPeriods());
        assertEquals(List.of("Math", "", "LUNCH"), g.row("Monday"));
        assertEquals(List.of("English", "", ""), g.row("Tuesday"));
        assertNull(g.row("Friday"));
    }

    @Test
    void copyIsIndependent() {
        Grid g = Grid.empty(2, -1);
        Grid c = g.copy();
        c.set("Monday", 0, "Math");

        assertTrue(g.isFree("Monday", 0));
        assertNotEquals(g, c);
        c.swap("Monday", 0, "Friday", 1);
        assertEquals("Math", c.get("Friday", 1));
    }

    @Test
    void periodsMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> Grid.empty(0, -1));
    }
}
