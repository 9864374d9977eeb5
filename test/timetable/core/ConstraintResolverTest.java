package timetable.core;

import org.junit.jupiter.api.Test;
import timetable.model.Constraint;
import timetable.model.ConstraintType;
import timetable.model.Course;
import timetable.model.IssueKind;
import timetable.model.SolveDiagnostics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConstraintResolverTest {

    private final ConstraintResolver resolver = new ConstraintResolver(new ConstraintMatcher());
    private final Map<Integer, Course> courses = new LinkedHashMap<>();

    ConstraintResolverTest() {
        courses.put(1, new Course(1, "Math", 2));
    }

    @Test
    void windowIsClippedAndSkipsLunch() {
        SolveDiagnostics diag = new SolveDiagnostics();
        Optional<ResolvedConstraint> rc = resolver.resolve(
                new Constraint("Math", "tuesday", "P2-P9", ConstraintType.HARD), courses, 5, 2, diag);

        assertTrue(rc.isPresent());
        assertEquals("Tuesday", rc.get().getDay());
        assertEquals(1, rc.get().getDayIndex());
        assertEquals(List.of(1, 3, 4), rc.get().getAllowedPeriods());
        assertEquals(List.of(1), rc.get().getCandidates());
        assertTrue(diag.getIssues().isEmpty());
    }

    @Test
    void badDayAndBadRangeAreReportedAndSkipped() {
        SolveDiagnostics diag = new SolveDiagnostics();
        List<ResolvedConstraint> out = resolver.resolveAll(List.of(
                new Constraint("Math", "Funday", "P1", ConstraintType.HARD),
                new Constraint("Math", "Monday", "first", ConstraintType.HARD),
                new Constraint("Math", "Monday", "P7-P8", ConstraintType.HARD),
                new Constraint("Math", "Monday", "P1", ConstraintType.HARD)), courses, 6, -1, diag);

        assertEquals(1, out.size());
        assertEquals(3, diag.getIssues().stream()
                .filter(i -> i.getKind() == IssueKind.MALFORMED_CONSTRAINT).count());
    }

    @Test
    void lunchOnlyWindowIsDroppedQuietly() {
        SolveDiagnostics diag = new SolveDiagnostics();
        Optional<ResolvedConstraint> rc = resolver.resolve(
                new Constraint("Math", "Monday", "P3", ConstraintType.HARD), courses, 5, 2, diag);

        assertFalse(rc.isPresent());
        assertTrue(diag.getIssues().isEmpty());
    }

    @Test
    void unmatchedCourseIsKeptWithMatchFailure() {
        SolveDiagnostics diag = new SolveDiagnostics();
        Optional<ResolvedConstraint> rc = resolver.resolve(
                new Constraint("Chemistry", "Monday", "P1", ConstraintType.HARD), courses, 5, -1, diag);

        assertTrue(rc.isPresent());
        assertFalse(rc.get().isMatched());
        assertTrue(diag.hasIssue(IssueKind.MATCH_FAILURE));
    }
}
