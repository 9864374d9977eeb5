package timetable.constraints;

import org.junit.jupiter.api.Test;
import timetable.model.Grid;
import timetable.model.PeriodRange;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlacementRuleTest {

    private static Grid grid() {
        Grid g = Grid.empty(3, 1);
        g.set("Monday", 0, "Data Structures - Dr. Lee");
        g.set("Monday", 2, "History");
        return g;
    }

    @Test
    void hardMatchesLooselyAndIgnoresTeacherSuffix() {
        assertTrue(new AtLeastOnceInWindow("data structures", "Monday", new PeriodRange(1, 2)).test(grid()));
        assertFalse(new AtLeastOnceInWindow("History", "Monday", new PeriodRange(1, 2)).test(grid()));
    }

    @Test
    void windowOfOnlyLunchOrBeyondTheRowPasses() {
        assertTrue(new FillsWholeWindow("Math", "Monday", new PeriodRange(2, 2)).test(grid()));
        assertTrue(new AtLeastOnceInWindow("Math", "Monday", new PeriodRange(5, 6)).test(grid()));
    }

    @Test
    void ruleSetExplainsOnlyFailures() {
        RuleSet rules = new RuleSet()
                .add(new AtLeastOnceInWindow("History", "Monday", new PeriodRange(3, 3)))
                .add(new FillsWholeWindow("History", "Monday", new PeriodRange(1, 3)))
                .add(new AtLeastOnceInWindow("Art", "Saturday", new PeriodRange(1, 1)));

        assertEquals(3, rules.size());
        assertFalse(rules.ok(grid()));
        assertEquals(2, rules.explain(grid()).size());
        assertEquals("Exact constraint violated: 'History' must fill Monday P1-P3. "
                + "Found: [Data Structures - Dr. Lee, LUNCH, History]", rules.explain(grid()).get(0));
        assertEquals("Constraint for 'Art' on Saturday (P1) - day missing", rules.explain(grid()).get(1));
    }
}
