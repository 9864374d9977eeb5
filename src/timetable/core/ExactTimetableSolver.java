package timetable.core;

import com.google.ortools.Loader;
import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverStatus;
import com.google.ortools.sat.LinearExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import timetable.config.SchedulingConfig;
import timetable.model.Course;
import timetable.model.Grid;
import timetable.model.IssueKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CP-SAT model with one boolean per (course, day, period).
 * <p>
 * Hard rules: every course at least once a week, at most once a day, no two courses of the same
 * teacher or section label in one cell, nothing in the lunch column. Constraint rules: HARD needs one
 * candidate occurrence in the window; EXACT with one candidate must cover every allowed period,
 * with several candidates their combined count must reach the window size.
 */
public class ExactTimetableSolver implements TimetableSolver {
    private static final Logger log = LoggerFactory.getLogger(ExactTimetableSolver.class);

    // sections without a label share one group
    private static final String DEFAULT_SECTION_GROUP = "A";

    @Override
    public String name() {
        return "cp-sat";
    }

    @Override
    public Optional<Grid> solve(SolveContext ctx) {
        Loader.loadNativeLibraries();

        int days = SchedulingConfig.DAYS.size();
        int periods = ctx.getPeriods();
        List<Integer> ids = new ArrayList<>(ctx.getCourses().keySet());

        CpModel model = new CpModel();
        Map<Integer, BoolVar[][]> x = new LinkedHashMap<>();
        for (int cid : ids) {
            BoolVar[][] v = new BoolVar[days][periods];
            for (int d = 0; d < days; d++) {
                for (int p = 0; p < periods; p++) {
                    v[d][p] = model.newBoolVar("x_c" + cid + "_d" + d + "_p" + p);
                }
            }
            x.put(cid, v);
        }

        addCourseRules(model, x, days, periods);
        addConflictRules(model, ctx, x, days, periods);
        addLunchBlock(model, ctx, x, days);
        addPlacementRules(model, ctx, x);

        List<BoolVar> all = new ArrayList<>();
        for (BoolVar[][] v : x.values()) {
            for (BoolVar[] row : v) {
                for (BoolVar b : row)
                    all.add(b);
            }
        }
        model.maximize(LinearExpr.sum(all.toArray(new BoolVar[0])));

        CpSolver solver = new CpSolver();
        solver.getParameters()
                .setMaxTimeInSeconds(ctx.getTimeLimitSeconds())
                .setNumSearchWorkers(SchedulingConfig.SOLVER_WORKERS)
                .setRandomSeed(SchedulingConfig.EXACT_SOLVER_SEED);

        CpSolverStatus status = solver.solve(model);
        log.debug("CP-SAT status {} after {}s ({} courses, {} vars)",
                status, solver.wallTime(), ids.size(), all.size());

        switch (status) {
            case OPTIMAL:
            case FEASIBLE:
                return Optional.of(decode(ctx, solver, x, ids));
            case INFEASIBLE:
                log.warn("No feasible CP-SAT assignment; falling back");
                ctx.report(IssueKind.INFEASIBLE, "exact model is infeasible");
                return Optional.empty();
            case UNKNOWN:
                log.warn("CP-SAT found nothing within {}s; falling back", ctx.getTimeLimitSeconds());
                ctx.report(IssueKind.TIMEOUT, "exact solver exceeded " + ctx.getTimeLimitSeconds() + "s");
                return Optional.empty();
            default:
                log.warn("CP-SAT returned {}; falling back", status);
                ctx.report(IssueKind.SOLVER_ERROR, "exact solver status " + status);
                return Optional.empty();
        }
    }

    private void addCourseRules(CpModel model, Map<Integer, BoolVar[][]> x, int days, int periods) {
        for (BoolVar[][] v : x.values()) {
            List<BoolVar> week = new ArrayList<>();
            for (int d = 0; d < days; d++) {
                model.addLessOrEqual(LinearExpr.sum(v[d]), 1);
                for (int p = 0; p < periods; p++)
                    week.add(v[d][p]);
            }
            model.addGreaterOrEqual(LinearExpr.sum(week.toArray(new BoolVar[0])), 1);
        }
    }

    private void addConflictRules(CpModel model, SolveContext ctx, Map<Integer, BoolVar[][]> x,
            int days, int periods) {
        Map<Integer, List<Integer>> byTeacher = new LinkedHashMap<>();
        Map<String, List<Integer>> bySection = new LinkedHashMap<>();
        for (Map.Entry<Integer, Course> e : ctx.getCourses().entrySet()) {
            Course c = e.getValue();
            if (c.getTeacherId() != null)
                byTeacher.computeIfAbsent(c.getTeacherId(), k -> new ArrayList<>()).add(e.getKey());
            String sec = c.getSection().isBlank() ? DEFAULT_SECTION_GROUP : c.getSection().trim();
            bySection.computeIfAbsent(sec, k -> new ArrayList<>()).add(e.getKey());
        }

        List<List<Integer>> groups = new ArrayList<>(byTeacher.values());
        groups.addAll(bySection.values());
        for (List<Integer> group : groups) {
            if (group.size() < 2)
                continue;
            for (int d = 0; d < days; d++) {
                for (int p = 0; p < periods; p++) {
                    BoolVar[] cell = new BoolVar[group.size()];
                    for (int i = 0; i < group.size(); i++)
                        cell[i] = x.get(group.get(i))[d][p];
                    model.addLessOrEqual(LinearExpr.sum(cell), 1);
                }
            }
        }
    }

    private void addLunchBlock(CpModel model, SolveContext ctx, Map<Integer, BoolVar[][]> x, int days) {
        int lunch = ctx.getLunchIndex();
        if (lunch < 0)
            return;
        for (BoolVar[][] v : x.values()) {
            for (int d = 0; d < days; d++)
                model.addEquality(v[d][lunch], 0);
        }
    }

    private void addPlacementRules(CpModel model, SolveContext ctx, Map<Integer, BoolVar[][]> x) {
        for (ResolvedConstraint rc : ctx.getConstraints()) {
            if (!rc.isMatched()) {
                log.debug("Constraint '{}' has no course in the model; not enforced", rc.getSource().getCourseName());
                continue;
            }
            List<BoolVar> window = new ArrayList<>();
            for (int cid : rc.getCandidates()) {
                BoolVar[][] v = x.get(cid);
                for (int p : rc.getAllowedPeriods())
                    window.add(v[rc.getDayIndex()][p]);
            }
            LinearExpr sum = LinearExpr.sum(window.toArray(new BoolVar[0]));
            int size = rc.getAllowedPeriods().size();

            if (!rc.isExact()) {
                model.addGreaterOrEqual(sum, 1);
            } else if (rc.getCandidates().size() == 1) {
                model.addEquality(sum, size);
            } else {
                // several courses share the reservation; only the total is enforced
                model.addGreaterOrEqual(sum, size);
            }
        }
    }

    private Grid decode(SolveContext ctx, CpSolver solver, Map<Integer, BoolVar[][]> x, List<Integer> ids) {
        Grid grid = Grid.empty(ctx.getPeriods(), ctx.getLunchIndex());
        List<String> days = SchedulingConfig.DAYS;
        for (int d = 0; d < days.size(); d++) {
            for (int p = 0; p < ctx.getPeriods(); p++) {
                if (ctx.isLunch(p))
                    continue;
                for (int cid : ids) {
                    if (solver.booleanValue(x.get(cid)[d][p])) {
                        grid.set(days.get(d), p, ctx.getCourses().get(cid).label());
                        break;
                    }
                }
            }
        }
        return grid;
    }
}
