package timetable.export;

import timetable.model.Grid;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Flat (day, period, label) rows, the shape a saved timetable is stored in, and back.
 */
public class GridRows {

    private static final List<String> DAY_ORDER =
            List.of("Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday");

    public static class Entry {
        private final String day;
        private final int period; // 1-based
        private final String label;

        public Entry(String day, int period, String label) {
            this.day = day;
            this.period = period;
            this.label = label == null ? "" : label;
        }

        public String getDay() { return day; }
        public int getPeriod() { return period; }
        public String getLabel() { return label; }
    }

    public static List<Entry> flatten(Grid grid) {
        List<Entry> out = new ArrayList<>();
        for (String d : grid.days()) {
            for (int p = 0; p < grid.getPeriods(); p++)
                out.add(new Entry(d, p + 1, grid.get(d, p)));
        }
        return out;
    }

    /**
     * Rebuilds a grid. Known weekdays come first in calendar order, other day names after them
     * alphabetically; missing periods are free cells.
     */
    public static Grid rebuild(List<Entry> rows) {
        if (rows.isEmpty())
            throw new IllegalArgumentException("no rows to rebuild a grid from");
        Map<String, Map<Integer, String>> byDay = new LinkedHashMap<>();
        int maxPeriod = 0;
        for (Entry e : rows) {
            if (e.getPeriod() < 1)
                continue;
            byDay.computeIfAbsent(e.getDay(), k -> new LinkedHashMap<>()).put(e.getPeriod(), e.getLabel());
            maxPeriod = Math.max(maxPeriod, e.getPeriod());
        }
        if (maxPeriod == 0)
            throw new IllegalArgumentException("rows carry no valid period");

        List<String> days = new ArrayList<>();
        for (String d : DAY_ORDER) {
            if (byDay.containsKey(d))
                days.add(d);
        }
        for (String d : new TreeSet<>(byDay.keySet())) {
            if (!days.contains(d))
                days.add(d);
        }

        Map<String, List<String>> cells = new LinkedHashMap<>();
        for (String d : days) {
            List<String> row = new ArrayList<>();
            for (int p = 1; p <= maxPeriod; p++)
                row.add(byDay.get(d).getOrDefault(p, ""));
            cells.put(d, row);
        }
        return Grid.fromMap(cells);
    }
}
