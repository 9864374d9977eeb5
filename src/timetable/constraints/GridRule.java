package timetable.constraints;

import timetable.model.Grid;

public interface GridRule {
    // Does the grid satisfy the rule?
    boolean test(Grid grid);

    // Shown when test() fails; may describe what was found in the grid
    String getViolationMessage(Grid grid);
}
