package timetable.io;

import timetable.config.SchedulingConfig;
import timetable.core.TextNormalizer;
import timetable.model.Constraint;
import timetable.model.ConstraintType;

import java.util.Locale;
import java.util.Set;

/**
 * Parses one typed constraint line:
 * <pre>
 *   course,day,P1-P3
 *   course,section,day,P1-P3
 *   course,day,P1-P3,mode
 *   course,section,day,P1-P3,mode
 * </pre>
 * With four tokens the second one decides: a weekday means there is no section. A mode of
 * exact/block/full makes the constraint EXACT.
 */
public class ConstraintLineParser {

    private static final Set<String> EXACT_MODES = Set.of("exact", "block", "full");

    public Constraint parse(String line) {
        if (line == null)
            throw new IllegalArgumentException("Constraint line is null");
        String[] raw = line.split(",", -1);
        String[] parts = new String[raw.length];
        for (int i = 0; i < raw.length; i++)
            parts[i] = raw[i].trim();

        String course;
        String section = SchedulingConfig.DEFAULT_SECTION;
        String day;
        String range;
        String mode = null;
        switch (parts.length) {
            case 3:
                course = parts[0];
                day = parts[1];
                range = parts[2];
                break;
            case 4:
                if (TextNormalizer.canonicalDay(parts[1]).isPresent()) {
                    course = parts[0];
                    day = parts[1];
                    range = parts[2];
                    mode = parts[3];
                } else {
                    course = parts[0];
                    section = parts[1];
                    day = parts[2];
                    range = parts[3];
                }
                break;
            case 5:
                course = parts[0];
                section = parts[1];
                day = parts[2];
                range = parts[3];
                mode = parts[4];
                break;
            default:
                throw new IllegalArgumentException(
                        "Constraint format invalid. Expected 3-5 comma-separated tokens: " + line);
        }

        String canonicalDay = TextNormalizer.canonicalDay(day).orElse(day);
        ConstraintType type = ConstraintType.HARD;
        String annotation = null;
        if (mode != null && EXACT_MODES.contains(mode.toLowerCase(Locale.ROOT))) {
            type = ConstraintType.EXACT;
            annotation = mode;
        }
        return new Constraint(course, section.isEmpty() ? SchedulingConfig.DEFAULT_SECTION : section,
                canonicalDay, range, type, annotation);
    }
}
