package timetable.core;

import timetable.model.Grid;

import java.util.Optional;

public interface TimetableSolver {
    /**
     * @return a complete grid, or empty when this solver has no answer (the caller falls back)
     */
    Optional<Grid> solve(SolveContext context);

    String name();
}
