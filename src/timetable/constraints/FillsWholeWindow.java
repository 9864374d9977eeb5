package timetable.constraints;

import timetable.model.PeriodRange;

import java.util.List;

/**
 * EXACT constraint: every non-lunch cell of the window holds the course.
 */
public class FillsWholeWindow extends PlacementRule {

    public FillsWholeWindow(String courseName, String day, PeriodRange range) {
        super(courseName, day, range);
    }

    @Override
    protected boolean satisfied(List<String> row, List<Integer> required) {
        for (int idx : required) {
            if (!matches(row.get(idx)))
                return false;
        }
        return true;
    }

    @Override
    protected String describe(List<String> found) {
        return "Exact constraint violated: '" + courseName + "' must fill " + day + " " + range
                + ". Found: " + found;
    }
}
