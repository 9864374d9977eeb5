package timetable.core;

import timetable.model.Constraint;
import timetable.model.PeriodRange;

import java.util.Collections;
import java.util.List;

/**
 * A constraint whose day and range parsed, clipped to the grid, with its matched courses.
 */
public class ResolvedConstraint {
    private final Constraint source;
    private final String day;
    private final int dayIndex;
    private final PeriodRange range;
    private final List<Integer> allowedPeriods; // 0-based, lunch removed
    private final List<Integer> candidates;

    public ResolvedConstraint(Constraint source, String day, int dayIndex, PeriodRange range,
            List<Integer> allowedPeriods, List<Integer> candidates) {
        this.source = source;
        this.day = day;
        this.dayIndex = dayIndex;
        this.range = range;
        this.allowedPeriods = Collections.unmodifiableList(allowedPeriods);
        this.candidates = Collections.unmodifiableList(candidates);
    }

    public Constraint getSource() {
        return source;
    }

    public String getDay() {
        return day;
    }

    public int getDayIndex() {
        return dayIndex;
    }

    public PeriodRange getRange() {
        return range;
    }

    public List<Integer> getAllowedPeriods() {
        return allowedPeriods;
    }

    public List<Integer> getCandidates() {
        return candidates;
    }

    public boolean isMatched() {
        return !candidates.isEmpty();
    }

    public boolean isExact() {
        return source.isExact();
    }
}
