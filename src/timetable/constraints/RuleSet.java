package timetable.constraints;

import timetable.model.Grid;

import java.util.ArrayList;
import java.util.List;

public class RuleSet {
    private final List<GridRule> list = new ArrayList<>();

    public RuleSet add(GridRule r) {
        list.add(r);
        return this;
    }

    public int size() {
        return list.size();
    }

    public boolean ok(Grid g) {
        for (GridRule r : list) {
            if (!r.test(g))
                return false;
        }
        return true;
    }

    public List<String> explain(Grid g) {
        List<String> reasons = new ArrayList<>();
        for (GridRule r : list) {
            if (!r.test(g)) {
                reasons.add(r.getViolationMessage(g));
            }
        }
        return reasons;
    }
}
