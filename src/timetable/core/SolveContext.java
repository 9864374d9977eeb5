package timetable.core;

import timetable.model.Course;
import timetable.model.IssueKind;
import timetable.model.SolveDiagnostics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a solver needs for one request, already resolved. Not shared between requests.
 */
public class SolveContext {
    private final Map<Integer, Course> courses;
    private final List<ResolvedConstraint> constraints;
    private final int periods;
    private final int lunchIndex;
    private final int timeLimitSeconds;
    private final long seed;
    private final SolveDiagnostics diagnostics;

    public SolveContext(Map<Integer, Course> courses, List<ResolvedConstraint> constraints, int periods,
            int lunchIndex, int timeLimitSeconds, long seed, SolveDiagnostics diagnostics) {
        this.courses = Collections.unmodifiableMap(new LinkedHashMap<>(courses));
        this.constraints = Collections.unmodifiableList(constraints);
        this.periods = periods;
        this.lunchIndex = lunchIndex;
        this.timeLimitSeconds = timeLimitSeconds;
        this.seed = seed;
        this.diagnostics = diagnostics;
    }

    /** id -> course, in request order (synthetic courses last). */
    public Map<Integer, Course> getCourses() {
        return courses;
    }

    public List<ResolvedConstraint> getConstraints() {
        return constraints;
    }

    public int getPeriods() {
        return periods;
    }

    /** 0-based, -1 when there is no lunch block. */
    public int getLunchIndex() {
        return lunchIndex;
    }

    public boolean isLunch(int period) {
        return period == lunchIndex;
    }

    public int getTimeLimitSeconds() {
        return timeLimitSeconds;
    }

    public long getSeed() {
        return seed;
    }

    public SolveDiagnostics getDiagnostics() {
        return diagnostics;
    }

    void report(IssueKind kind, String message) {
        if (diagnostics != null)
            diagnostics.addIssue(kind, message);
    }
}
