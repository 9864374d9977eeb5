package timetable.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import timetable.config.SchedulingConfig;
import timetable.model.Course;
import timetable.model.Grid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Constructive fallback. Places constraints first, in input order, then fills every remaining
 * free cell round-robin from a seeded shuffle of all course labels. Always returns a full grid.
 * <p>
 * The filler does not look at teachers or sections, and a label may repeat within a day.
 */
public class GreedyTimetableSolver implements TimetableSolver {
    private static final Logger log = LoggerFactory.getLogger(GreedyTimetableSolver.class);

    @Override
    public String name() {
        return "greedy";
    }

    @Override
    public Optional<Grid> solve(SolveContext ctx) {
        Grid grid = Grid.empty(ctx.getPeriods(), ctx.getLunchIndex());

        for (ResolvedConstraint rc : ctx.getConstraints())
            place(grid, rc, ctx);

        fill(grid, ctx);
        return Optional.of(grid);
    }

    private void place(Grid grid, ResolvedConstraint rc, SolveContext ctx) {
        String day = rc.getDay();
        List<Integer> window = rc.getAllowedPeriods();

        if (!rc.isMatched()) {
            // unknown course: put the text itself in the window, spelled like a known label if it is one
            String text = rc.getSource().getCourseName().trim();
            String literal = TextNormalizer.buildLabelMap(ctx.getCourses().values())
                    .getOrDefault(TextNormalizer.normalize(text), text);
            placeOnce(grid, day, window, literal);
            log.debug("Placed literal '{}' on {} {}", literal, day, rc.getRange());
            return;
        }

        Course rep = ctx.getCourses().get(rc.getCandidates().get(0));
        String label = rep.label();
        if (rc.isExact()) {
            for (int p : window) {
                if (grid.isFree(day, p))
                    grid.set(day, p, label);
            }
        } else {
            placeOnce(grid, day, window, label);
        }
    }

    private static void placeOnce(Grid grid, String day, List<Integer> window, String label) {
        for (int p : window) {
            if (grid.isFree(day, p)) {
                grid.set(day, p, label);
                return;
            }
        }
        // window already full: overwrite its first cell
        grid.set(day, window.get(0), label);
    }

    private void fill(Grid grid, SolveContext ctx) {
        List<String> labels = new ArrayList<>();
        for (Course c : ctx.getCourses().values())
            labels.add(c.label());
        if (labels.isEmpty())
            labels.add(SchedulingConfig.FREE_LABEL);
        Collections.shuffle(labels, new Random(ctx.getSeed()));

        int idx = 0;
        for (int p = 0; p < ctx.getPeriods(); p++) {
            if (ctx.isLunch(p))
                continue;
            for (String day : grid.days()) {
                if (grid.isFree(day, p)) {
                    grid.set(day, p, labels.get(idx % labels.size()));
                    idx++;
                }
            }
        }
    }
}
