package timetable.model;

public enum IssueKind {
    MATCH_FAILURE,
    MALFORMED_CONSTRAINT,
    INFEASIBLE,
    TIMEOUT,
    SOLVER_ERROR,
    VALIDATION_FAILURE
}
