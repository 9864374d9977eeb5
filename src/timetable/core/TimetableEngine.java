package timetable.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import timetable.config.SchedulingConfig;
import timetable.config.SolverCapability;
import timetable.constraints.RuleSet;
import timetable.model.Constraint;
import timetable.model.Course;
import timetable.model.Grid;
import timetable.model.IssueKind;
import timetable.model.PeriodRange;
import timetable.model.SolveDiagnostics;
import timetable.model.SolvePath;
import timetable.model.SolveResult;
import timetable.model.TimetableException;
import timetable.model.TimetableRequest;
import timetable.model.ValidationReport;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point of the engine: picks the solving path, validates the result and optionally runs
 * local improvement. Holds no per-request state, so one instance can serve concurrent calls.
 */
public class TimetableEngine {
    private static final Logger log = LoggerFactory.getLogger(TimetableEngine.class);

    private final SolverCapability capability;
    private final TimetableSolver exact;
    private final TimetableSolver fallback;
    private final LocalImprover improver;
    private final ConstraintMatcher matcher = new ConstraintMatcher();
    private final ConstraintResolver resolver = new ConstraintResolver(matcher);
    private final GridValidator validator = new GridValidator();

    public TimetableEngine(SolverCapability capability) {
        this(capability, new ExactTimetableSolver(), new GreedyTimetableSolver(), new LocalImprover());
    }

    public TimetableEngine(SolverCapability capability, TimetableSolver exact, TimetableSolver fallback,
            LocalImprover improver) {
        this.capability = capability;
        this.exact = exact;
        this.fallback = fallback;
        this.improver = improver;
    }

    public SolveResult generate(TimetableRequest request) {
        return generate(request, false);
    }

    /**
     * Always returns a grid unless the request itself is unusable (no courses, no periods).
     *
     * @param improve run local improvement on the chosen grid
     */
    public SolveResult generate(TimetableRequest request, boolean improve) {
        if (request.getCourses().isEmpty())
            throw new TimetableException(TimetableException.Reason.NO_COURSES, "no courses supplied");
        if (request.getPeriods() <= 0)
            throw new TimetableException(TimetableException.Reason.INVALID_REQUEST,
                    "periods must be positive, got " + request.getPeriods());

        SolveDiagnostics diagnostics = new SolveDiagnostics();
        Map<Integer, Course> courses = indexCourses(request.getCourses());
        int synthetic = addSyntheticCourses(courses, request.getConstraints(), diagnostics);
        diagnostics.setSyntheticCourses(synthetic);

        int lunchIndex = request.lunchIndex();
        List<ResolvedConstraint> resolved = resolver.resolveAll(request.getConstraints(), courses,
                request.getPeriods(), lunchIndex, diagnostics);
        SolveContext ctx = new SolveContext(courses, resolved, request.getPeriods(), lunchIndex,
                request.getTimeLimitSeconds(), request.getSeed(), diagnostics);

        Grid grid = solve(ctx, diagnostics);

        RuleSet rules = validator.rulesFor(request.getConstraints(), null);
        ValidationReport report = new ValidationReport(rules.explain(grid));

        if (improve) {
            LocalImprover.Result r = improver.improve(grid, lunchIndex, rules, request.getSeed());
            diagnostics.recordImprovement(r.getIterations(), r.getAccepted(), r.getScoreBefore(), r.getScoreAfter());
            if (r.getScoreAfter() > r.getScoreBefore()) {
                grid = r.getGrid();
                report = new ValidationReport(rules.explain(grid));
            }
        }

        if (!report.isOk()) {
            log.warn("Grid violates {} constraint(s): {}", report.getViolations().size(), report.getViolations());
            for (String v : report.getViolations())
                diagnostics.addIssue(IssueKind.VALIDATION_FAILURE, v);
        }
        log.info("Timetable generated via {} ({} courses, {} synthetic, {} constraints, valid={})",
                diagnostics.getPath(), courses.size(), synthetic, resolved.size(), report.isOk());
        return new SolveResult(grid, report, diagnostics);
    }

    /**
     * Checks a grid the caller edited or stored. Nothing is re-solved.
     */
    public ValidationReport validate(Map<String, List<String>> grid, List<Constraint> constraints, String section) {
        return validator.validate(Grid.fromMap(grid), constraints, section);
    }

    private Grid solve(SolveContext ctx, SolveDiagnostics diagnostics) {
        if (capability == SolverCapability.EXACT_WITH_FALLBACK && exact != null) {
            try {
                Optional<Grid> g = exact.solve(ctx);
                if (g.isPresent()) {
                    diagnostics.setPath(SolvePath.EXACT);
                    return g.get();
                }
            } catch (RuntimeException | LinkageError e) {
                log.error("Solver {} failed; using {}", exact.name(), fallback.name(), e);
                diagnostics.addIssue(IssueKind.SOLVER_ERROR, exact.name() + ": " + e.getMessage());
            }
        }
        try {
            Optional<Grid> g = fallback.solve(ctx);
            if (g.isPresent()) {
                diagnostics.setPath(SolvePath.GREEDY);
                return g.get();
            }
        } catch (RuntimeException e) {
            log.error("Solver {} failed; using placeholder grid", fallback.name(), e);
            diagnostics.addIssue(IssueKind.SOLVER_ERROR, fallback.name() + ": " + e.getMessage());
        }
        diagnostics.setPath(SolvePath.PLACEHOLDER);
        return placeholder(new ArrayList<>(ctx.getCourses().values()), ctx.getPeriods(), ctx.getLunchIndex());
    }

    /**
     * Course labels round-robin over the week, lunch blocked. Last resort when no solver answered.
     */
    public static Grid placeholder(List<Course> courses, int periods, int lunchIndex) {
        List<String> labels = new ArrayList<>();
        for (Course c : courses)
            labels.add(c.label());
        if (labels.isEmpty())
            labels.add(SchedulingConfig.FREE_LABEL);

        Grid grid = Grid.empty(periods, lunchIndex);
        int idx = 0;
        for (String d : grid.days()) {
            for (int p = 0; p < periods; p++) {
                if (p == lunchIndex)
                    continue;
                grid.set(d, p, labels.get(idx % labels.size()));
                idx++;
            }
        }
        return grid;
    }

    private static Map<Integer, Course> indexCourses(List<Course> courses) {
        Map<Integer, Course> map = new LinkedHashMap<>();
        for (Course c : courses) {
            if (map.putIfAbsent(c.getId(), c) != null)
                log.warn("Duplicate course id {}; keeping the first ({})", c.getId(), map.get(c.getId()).label());
        }
        return map;
    }

    /**
     * Every constraint that no real course matches gets a placeholder course (negative id) named
     * after its text, so the solvers can still place it. Lives only for this request.
     */
    private int addSyntheticCourses(Map<Integer, Course> courses, List<Constraint> constraints,
            SolveDiagnostics diagnostics) {
        Map<Integer, Course> real = new LinkedHashMap<>(courses);
        Set<String> created = new HashSet<>();
        int nextId = -1;
        for (Constraint cons : constraints) {
            String text = cons.getCourseName().trim().replaceAll("\\s+", " ");
            String norm = TextNormalizer.normalize(text);
            if (norm.isEmpty() || created.contains(norm))
                continue;
            if (!matcher.match(cons, real).isEmpty())
                continue;
            while (courses.containsKey(nextId))
                nextId--;
            int credits = PeriodRange.parse(cons.getPeriodRange()).map(PeriodRange::width).orElse(1);
            courses.put(nextId, new Course(nextId, text, text, credits, cons.getSection(), null));
            created.add(norm);
            log.warn("Constraint '{}' matched no course; placing its text as synthetic course {}", text, nextId);
            diagnostics.addIssue(IssueKind.MATCH_FAILURE, "no course matches '" + text + "'");
            nextId--;
        }
        return created.size();
    }
}
