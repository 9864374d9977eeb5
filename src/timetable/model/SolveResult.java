package timetable.model;

public class SolveResult {
    private final Grid grid;
    private final ValidationReport validation;
    private final SolveDiagnostics diagnostics;

    public SolveResult(Grid grid, ValidationReport validation, SolveDiagnostics diagnostics) {
        this.grid = grid;
        this.validation = validation;
        this.diagnostics = diagnostics;
    }

    public Grid getGrid() {
        return grid;
    }

    public ValidationReport getValidation() {
        return validation;
    }

    public SolveDiagnostics getDiagnostics() {
        return diagnostics;
    }
}
