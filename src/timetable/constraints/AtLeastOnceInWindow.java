package timetable.constraints;

import timetable.model.PeriodRange;

import java.util.List;

/**
 * HARD constraint: the course shows up in at least one cell of the window.
 */
public class AtLeastOnceInWindow extends PlacementRule {

    public AtLeastOnceInWindow(String courseName, String day, PeriodRange range) {
        super(courseName, day, range);
    }

    @Override
    protected boolean satisfied(List<String> row, List<Integer> required) {
        for (int idx : required) {
            if (matches(row.get(idx)))
                return true;
        }
        return false;
    }

    @Override
    protected String describe(List<String> found) {
        return "Hard constraint violated: '" + courseName + "' expected on " + day + " in " + range
                + ". Found: " + found;
    }
}
