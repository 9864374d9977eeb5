package timetable.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import timetable.constraints.AtLeastOnceInWindow;
import timetable.constraints.FillsWholeWindow;
import timetable.constraints.RuleSet;
import timetable.model.Constraint;
import timetable.model.Grid;
import timetable.model.PeriodRange;
import timetable.model.ValidationReport;

import java.util.List;
import java.util.Optional;

/**
 * Re-checks a finished grid against the HARD/EXACT constraints, whoever produced it.
 * Read-only: the grid is never modified.
 */
public class GridValidator {
    private static final Logger log = LoggerFactory.getLogger(GridValidator.class);

    public ValidationReport validate(Grid grid, List<Constraint> constraints) {
        return validate(grid, constraints, null);
    }

    /**
     * @param section when not null, constraints filtered to another section are ignored
     */
    public ValidationReport validate(Grid grid, List<Constraint> constraints, String section) {
        return new ValidationReport(rulesFor(constraints, section).explain(grid));
    }

    /**
     * Builds the rule set once so repeated checks (local improvement) don't re-parse constraints.
     */
    public RuleSet rulesFor(List<Constraint> constraints, String section) {
        RuleSet rules = new RuleSet();
        for (Constraint c : constraints) {
            if (c.getCourseName().isBlank())
                continue;
            if (section != null && !c.appliesToAllSections() && !c.getSection().equals(section))
                continue;
            Optional<String> day = TextNormalizer.canonicalDay(c.getDay());
            Optional<PeriodRange> range = PeriodRange.parse(c.getPeriodRange());
            if (day.isEmpty() || range.isEmpty()) {
                log.debug("Not validating malformed constraint {}", c);
                continue;
            }
            String name = c.getCourseName().trim();
            if (c.isExact())
                rules.add(new FillsWholeWindow(name, day.get(), range.get()));
            else
                rules.add(new AtLeastOnceInWindow(name, day.get(), range.get()));
        }
        return rules;
    }
}
