package timetable.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import timetable.config.SchedulingConfig;
import timetable.constraints.RuleSet;
import timetable.model.Grid;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;

/**
 * Random pairwise cell swaps that raise the diversity score while the grid stays valid.
 * Best-effort hill climbing; the lunch column is never touched.
 */
public class LocalImprover {
    private static final Logger log = LoggerFactory.getLogger(LocalImprover.class);

    private final int maxIterations;
    private final double targetFraction;

    public LocalImprover() {
        this(SchedulingConfig.IMPROVE_ITERATIONS, SchedulingConfig.DIVERSITY_TARGET);
    }

    public LocalImprover(int maxIterations, double targetFraction) {
        this.maxIterations = maxIterations;
        this.targetFraction = targetFraction;
    }

    public static class Result {
        private final Grid grid;
        private final int iterations;
        private final int accepted;
        private final double scoreBefore;
        private final double scoreAfter;

        Result(Grid grid, int iterations, int accepted, double scoreBefore, double scoreAfter) {
            this.grid = grid;
            this.iterations = iterations;
            this.accepted = accepted;
            this.scoreBefore = scoreBefore;
            this.scoreAfter = scoreAfter;
        }

        public Grid getGrid() { return grid; }
        public int getIterations() { return iterations; }
        public int getAccepted() { return accepted; }
        public double getScoreBefore() { return scoreBefore; }
        public double getScoreAfter() { return scoreAfter; }
    }

    /**
     * For every period column, the number of distinct labels over all days (free and LUNCH cells
     * excluded), summed.
     */
    public static double diversityScore(Grid grid) {
        double score = 0;
        for (int p = 0; p < grid.getPeriods(); p++) {
            Set<String> seen = new HashSet<>();
            for (String d : grid.days()) {
                String v = grid.get(d, p);
                if (v.isEmpty() || v.trim().equalsIgnoreCase(SchedulingConfig.LUNCH))
                    continue;
                seen.add(v.trim().toLowerCase(Locale.ROOT));
            }
            score += seen.size();
        }
        return score;
    }

    /**
     * @param lunchIndex 0-based lunch column, -1 for none
     * @param rules      validity check applied to every tentative swap
     */
    public Result improve(Grid start, int lunchIndex, RuleSet rules, long seed) {
        Grid best = start.copy();
        double before = diversityScore(best);
        double bestScore = before;

        List<String> days = best.days();
        List<int[]> slots = new ArrayList<>();
        for (int di = 0; di < days.size(); di++) {
            for (int p = 0; p < best.getPeriods(); p++) {
                if (p != lunchIndex)
                    slots.add(new int[] { di, p });
            }
        }
        if (slots.size() < 2)
            return new Result(best, 0, 0, before, before);

        int usablePeriods = best.getPeriods() - ((lunchIndex >= 0 && lunchIndex < best.getPeriods()) ? 1 : 0);
        double target = usablePeriods * days.size() * targetFraction;

        Random rnd = new Random(seed);
        int accepted = 0;
        int it = 0;
        while (it < maxIterations) {
            it++;
            int i = rnd.nextInt(slots.size());
            int j = rnd.nextInt(slots.size() - 1);
            if (j >= i)
                j++;
            String dayA = days.get(slots.get(i)[0]);
            int pa = slots.get(i)[1];
            String dayB = days.get(slots.get(j)[0]);
            int pb = slots.get(j)[1];
            if (best.get(dayA, pa).equals(best.get(dayB, pb)))
                continue;

            Grid candidate = best.copy();
            candidate.swap(dayA, pa, dayB, pb);
            if (!rules.ok(candidate))
                continue;
            double sc = diversityScore(candidate);
            if (sc > bestScore) {
                best = candidate;
                bestScore = sc;
                accepted++;
                if (bestScore >= target)
                    break;
            }
        }
        log.debug("Local improvement: {} iterations, {} swaps, score {} -> {}", it, accepted, before, bestScore);
        return new Result(best, it, accepted, before, bestScore);
    }
}
