package timetable.model;

public enum SolvePath {
    EXACT,
    GREEDY,
    PLACEHOLDER
}
