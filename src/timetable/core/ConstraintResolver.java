package timetable.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import timetable.config.SchedulingConfig;
import timetable.model.Constraint;
import timetable.model.Course;
import timetable.model.IssueKind;
import timetable.model.PeriodRange;
import timetable.model.SolveDiagnostics;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns raw constraints into {@link ResolvedConstraint}s. Malformed ones (bad day, bad range,
 * range entirely outside the grid) are dropped with a warning; the rest of the request goes on.
 */
public class ConstraintResolver {
    private static final Logger log = LoggerFactory.getLogger(ConstraintResolver.class);

    private final ConstraintMatcher matcher;

    public ConstraintResolver(ConstraintMatcher matcher) {
        this.matcher = matcher;
    }

    public List<ResolvedConstraint> resolveAll(List<Constraint> constraints, Map<Integer, Course> courses,
            int periods, int lunchIndex, SolveDiagnostics diagnostics) {
        List<ResolvedConstraint> out = new ArrayList<>();
        for (Constraint c : constraints) {
            resolve(c, courses, periods, lunchIndex, diagnostics).ifPresent(out::add);
        }
        return out;
    }

    public Optional<ResolvedConstraint> resolve(Constraint c, Map<Integer, Course> courses, int periods,
            int lunchIndex, SolveDiagnostics diagnostics) {
        if (c.getCourseName().isBlank()) {
            malformed(c, "no course text", diagnostics);
            return Optional.empty();
        }
        Optional<String> day = TextNormalizer.canonicalDay(c.getDay());
        if (day.isEmpty()) {
            malformed(c, "unknown day '" + c.getDay() + "'", diagnostics);
            return Optional.empty();
        }
        Optional<PeriodRange> range = PeriodRange.parse(c.getPeriodRange());
        if (range.isEmpty()) {
            malformed(c, "unparseable period range '" + c.getPeriodRange() + "'", diagnostics);
            return Optional.empty();
        }
        int start = range.get().getFirst() - 1;
        int end = Math.min(periods - 1, range.get().getLast() - 1);
        if (start > end) {
            malformed(c, "range " + range.get() + " lies outside " + periods + " periods", diagnostics);
            return Optional.empty();
        }

        List<Integer> allowed = allowedPeriods(start, end, lunchIndex);
        if (allowed.isEmpty()) {
            log.debug("Constraint {} covers only the lunch period; nothing to enforce", c);
            return Optional.empty();
        }

        List<Integer> candidates = matcher.match(c, courses);
        if (candidates.isEmpty()) {
            log.warn("Constraint '{}' matched no course", c.getCourseName());
            if (diagnostics != null)
                diagnostics.addIssue(IssueKind.MATCH_FAILURE, "no course matches '" + c.getCourseName() + "'");
        }
        int dayIndex = SchedulingConfig.DAYS.indexOf(day.get());
        return Optional.of(new ResolvedConstraint(c, day.get(), dayIndex, range.get(), allowed, candidates));
    }

    static List<Integer> allowedPeriods(int start, int end, int lunchIndex) {
        List<Integer> allowed = new ArrayList<>();
        for (int p = start; p <= end; p++) {
            if (p != lunchIndex)
                allowed.add(p);
        }
        return allowed;
    }

    private static void malformed(Constraint c, String why, SolveDiagnostics diagnostics) {
        log.warn("Skipping malformed constraint {}: {}", c, why);
        if (diagnostics != null)
            diagnostics.addIssue(IssueKind.MALFORMED_CONSTRAINT, c + ": " + why);
    }
}
