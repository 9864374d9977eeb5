package timetable.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class ValidationReport {
    private final List<String> violations;

    public ValidationReport(List<String> violations) {
        this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
    }

    public boolean isOk() {
        return violations.isEmpty();
    }

    public List<String> getViolations() {
        return violations;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ValidationReport))
            return false;
        return violations.equals(((ValidationReport) o).violations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(violations);
    }

    @Override
    public String toString() {
        return isOk() ? "ok" : "violations=" + violations;
    }
}
