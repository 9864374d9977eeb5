package timetable.core;

import timetable.model.Constraint;
import timetable.model.Course;
import timetable.model.SolveDiagnostics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds solver contexts the way the engine does, without synthetic courses.
 */
final class SolveContexts {

    private SolveContexts() {
    }

    static SolveContext of(List<Course> courses, List<Constraint> constraints, int periods, int lunch,
            SolveDiagnostics diag) {
        Map<Integer, Course> map = new LinkedHashMap<>();
        for (Course c : courses)
            map.put(c.getId(), c);
        int lunchIndex = (lunch >= 1 && lunch <= periods) ? lunch - 1 : -1;
        List<ResolvedConstraint> resolved = new ConstraintResolver(new ConstraintMatcher())
                .resolveAll(constraints, map, periods, lunchIndex, diag);
        return new SolveContext(map, resolved, periods, lunchIndex, 10, 42L, diag);
    }
}
