package timetable.core;

import timetable.config.SchedulingConfig;
import timetable.model.Course;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical forms for course text, day names and grid cells.
 */
public final class TextNormalizer {

    private TextNormalizer() {
    }

    /** Trim, collapse inner whitespace, lower-case. Null gives "". */
    public static String normalize(String s) {
        if (s == null)
            return "";
        String t = s.trim();
        if (t.isEmpty())
            return "";
        return t.replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    /**
     * Maps "monday", " MONDAY " etc. to "Monday". Anything that is not one of the five
     * weekdays gives an empty result.
     */
    public static Optional<String> canonicalDay(String raw) {
        if (raw == null)
            return Optional.empty();
        String t = raw.trim();
        if (t.isEmpty())
            return Optional.empty();
        String day = t.substring(0, 1).toUpperCase(Locale.ROOT) + t.substring(1).toLowerCase(Locale.ROOT);
        return SchedulingConfig.DAYS.contains(day) ? Optional.of(day) : Optional.empty();
    }

    /**
     * Cells may carry a teacher suffix ("Math - Smith"); only the subject part is compared.
     */
    public static String subjectOf(String cell) {
        if (cell == null)
            return "";
        int i = cell.indexOf(" - ");
        return (i >= 0 ? cell.substring(0, i) : cell).trim();
    }

    /** Tokens of an already normalized text, split on whitespace, '/' and '-'. */
    public static List<String> tokens(String normalized) {
        List<String> out = new ArrayList<>();
        for (String t : normalized.split("[\\s/\\-]+")) {
            if (!t.isEmpty())
                out.add(t);
        }
        return out;
    }

    /** Containment in either direction, on normalized text. Empty never matches. */
    public static boolean looselyEquals(String a, String b) {
        String x = normalize(a);
        String y = normalize(b);
        if (x.isEmpty() || y.isEmpty())
            return false;
        return x.equals(y) || x.contains(y) || y.contains(x);
    }

    /**
     * normalized name / code / label -> display label of the course. Blank names and codes are
     * not keyed.
     */
    public static Map<String, String> buildLabelMap(Collection<Course> courses) {
        Map<String, String> map = new LinkedHashMap<>();
        for (Course c : courses) {
            String label = c.label();
            map.put(normalize(label), label);
            if (!c.getName().isBlank())
                map.put(normalize(c.getName()), label);
            if (!c.getCode().isBlank())
                map.put(normalize(c.getCode()), label);
        }
        return map;
    }
}
