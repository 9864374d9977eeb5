package timetable.constraints;

import timetable.config.SchedulingConfig;
import timetable.core.TextNormalizer;
import timetable.model.Grid;
import timetable.model.PeriodRange;

import java.util.ArrayList;
import java.util.List;

/**
 * Common part of the HARD and EXACT checks: which cells of which day are looked at, and whether a
 * cell counts as the constrained course.
 */
public abstract class PlacementRule implements GridRule {
    protected final String courseName;
    protected final String day;
    protected final PeriodRange range;

    protected PlacementRule(String courseName, String day, PeriodRange range) {
        this.courseName = courseName;
        this.day = day;
        this.range = range;
    }

    /** 0-based indices of the range that exist in the row and are not the lunch block. */
    protected List<Integer> requiredIndices(List<String> row) {
        List<Integer> out = new ArrayList<>();
        for (int p = range.getFirst(); p <= range.getLast(); p++) {
            int idx = p - 1;
            if (idx < row.size() && !SchedulingConfig.LUNCH.equals(row.get(idx)))
                out.add(idx);
        }
        return out;
    }

    protected boolean matches(String cell) {
        if (cell == null || cell.isEmpty())
            return false;
        return TextNormalizer.looselyEquals(TextNormalizer.subjectOf(cell), courseName);
    }

    protected List<String> found(List<String> row) {
        List<String> present = new ArrayList<>();
        for (int p = range.getFirst(); p <= range.getLast(); p++) {
            int idx = p - 1;
            if (idx < row.size())
                present.add(row.get(idx));
        }
        return present;
    }

    @Override
    public boolean test(Grid grid) {
        List<String> row = grid.row(day);
        if (row == null)
            return false;
        List<Integer> required = requiredIndices(row);
        // nothing left to check (range beyond the grid or only lunch)
        if (required.isEmpty())
            return true;
        return satisfied(row, required);
    }

    protected abstract boolean satisfied(List<String> row, List<Integer> required);

    @Override
    public String getViolationMessage(Grid grid) {
        List<String> row = grid.row(day);
        if (row == null)
            return "Constraint for '" + courseName + "' on " + day + " (" + range + ") - day missing";
        return describe(found(row));
    }

    protected abstract String describe(List<String> found);
}
