package timetable.model;

import timetable.config.SchedulingConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable snapshot of one solve request.
 */
public class TimetableRequest {
    private final List<Course> courses;
    private final List<Constraint> constraints;
    private final int periods;
    private final int lunch; // 1-based, 0 = no lunch block
    private final int timeLimitSeconds;
    private final long seed;

    public TimetableRequest(List<Course> courses, List<Constraint> constraints, int periods, int lunch,
            int timeLimitSeconds, long seed) {
        this.courses = Collections.unmodifiableList(new ArrayList<>(courses == null ? List.of() : courses));
        this.constraints = Collections.unmodifiableList(
                new ArrayList<>(constraints == null ? List.of() : constraints));
        this.periods = periods;
        this.lunch = lunch;
        this.timeLimitSeconds = timeLimitSeconds;
        this.seed = seed;
    }

    public TimetableRequest(List<Course> courses, List<Constraint> constraints, int periods, int lunch) {
        this(courses, constraints, periods, lunch, SchedulingConfig.DEFAULT_TIME_LIMIT_SECONDS,
                SchedulingConfig.RANDOM_SEED);
    }

    public List<Course> getCourses() {
        return courses;
    }

    public List<Constraint> getConstraints() {
        return constraints;
    }

    public int getPeriods() {
        return periods;
    }

    public int getLunch() {
        return lunch;
    }

    /** 0-based lunch column, -1 when there is none or it lies outside the grid. */
    public int lunchIndex() {
        return (lunch >= 1 && lunch <= periods) ? lunch - 1 : -1;
    }

    public int getTimeLimitSeconds() {
        return timeLimitSeconds;
    }

    public long getSeed() {
        return seed;
    }
}
