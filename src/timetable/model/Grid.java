package timetable.model;

import timetable.config.SchedulingConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Weekly grid: day name -> exactly {@code periods} cells. "" is a free cell,
 * {@link SchedulingConfig#LUNCH} the blocked period.
 */
public class Grid {
    private final Map<String, List<String>> rows = new LinkedHashMap<>();
    private final int periods;

    public Grid(List<String> days, int periods) {
        if (periods <= 0)
            throw new IllegalArgumentException("periods must be positive: " + periods);
        this.periods = periods;
        for (String d : days) {
            List<String> row = new ArrayList<>(periods);
            for (int p = 0; p < periods; p++)
                row.add("");
            rows.put(d, row);
        }
    }

    /**
     * Empty weekday grid with the lunch column already blocked.
     *
     * @param lunchIndex 0-based lunch column, or -1 for none
     */
    public static Grid empty(int periods, int lunchIndex) {
        Grid g = new Grid(SchedulingConfig.DAYS, periods);
        if (lunchIndex >= 0 && lunchIndex < periods) {
            for (String d : g.days())
                g.set(d, lunchIndex, SchedulingConfig.LUNCH);
        }
        return g;
    }

    /**
     * Builds a grid from a caller supplied map (e.g. a manually edited one). Null cells become "",
     * any spelling of lunch becomes LUNCH, short rows are padded.
     */
    public static Grid fromMap(Map<String, List<String>> source) {
        int width = 0;
        for (List<String> row : source.values())
            width = Math.max(width, row == null ? 0 : row.size());
        Grid g = new Grid(new ArrayList<>(source.keySet()), Math.max(1, width));
        for (Map.Entry<String, List<String>> e : source.entrySet()) {
            List<String> row = e.getValue();
            if (row == null)
                continue;
            for (int p = 0; p < row.size(); p++)
                g.set(e.getKey(), p, normalizeCell(row.get(p)));
        }
        return g;
    }

    static String normalizeCell(String cell) {
        if (cell == null)
            return "";
        if (cell.trim().equalsIgnoreCase(SchedulingConfig.LUNCH))
            return SchedulingConfig.LUNCH;
        return cell;
    }

    public int getPeriods() {
        return periods;
    }

    public List<String> days() {
        return new ArrayList<>(rows.keySet());
    }

    public List<String> row(String day) {
        List<String> r = rows.get(day);
        return r == null ? null : Collections.unmodifiableList(r);
    }

    public String get(String day, int period) {
        return rows.get(day).get(period);
    }

    public void set(String day, int period, String value) {
        rows.get(day).set(period, value == null ? "" : value);
    }

    public boolean isFree(String day, int period) {
        return get(day, period).isEmpty();
    }

    public void swap(String dayA, int periodA, String dayB, int periodB) {
        String a = get(dayA, periodA);
        set(dayA, periodA, get(dayB, periodB));
        set(dayB, periodB, a);
    }

    public Grid copy() {
        Grid g = new Grid(days(), periods);
        for (Map.Entry<String, List<String>> e : rows.entrySet()) {
            for (int p = 0; p < periods; p++)
                g.set(e.getKey(), p, e.getValue().get(p));
        }
        return g;
    }

    /** Detached copy, suitable for serialization. */
    public Map<String, List<String>> toMap() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : rows.entrySet())
            out.put(e.getKey(), new ArrayList<>(e.getValue()));
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Grid))
            return false;
        Grid other = (Grid) o;
        return periods == other.periods && rows.equals(other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rows, periods);
    }

    @Override
    public String toString() {
        return rows.toString();
    }
}
