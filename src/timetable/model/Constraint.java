package timetable.model;

import timetable.config.SchedulingConfig;

import java.util.Locale;

/**
 * A placement rule as the user typed it. Nothing here is validated; the day and the
 * period range are parsed (and possibly rejected) when a solve resolves the constraint.
 */
public class Constraint {
    private final String courseName;
    private final String section;
    private final String day;
    private final String periodRange;
    private final ConstraintType type;
    private final String mode;

    public Constraint(String courseName, String section, String day, String periodRange,
            ConstraintType type, String mode) {
        this.courseName = courseName == null ? "" : courseName;
        this.section = (section == null || section.isBlank()) ? SchedulingConfig.DEFAULT_SECTION : section.trim();
        this.day = day == null ? "" : day;
        this.periodRange = periodRange == null ? "" : periodRange;
        this.type = type == null ? ConstraintType.HARD : type;
        this.mode = mode;
    }

    public Constraint(String courseName, String day, String periodRange, ConstraintType type) {
        this(courseName, null, day, periodRange, type, null);
    }

    public String getCourseName() {
        return courseName;
    }

    public String getSection() {
        return section;
    }

    public boolean appliesToAllSections() {
        return section.equalsIgnoreCase(SchedulingConfig.DEFAULT_SECTION);
    }

    public String getDay() {
        return day;
    }

    public String getPeriodRange() {
        return periodRange;
    }

    public ConstraintType getType() {
        return type;
    }

    public String getMode() {
        return mode;
    }

    /**
     * Exact either by type or because the mode annotation says so.
     */
    public boolean isExact() {
        return type == ConstraintType.EXACT
                || (mode != null && mode.toLowerCase(Locale.ROOT).contains("exact"));
    }

    @Override
    public String toString() {
        return courseName + "," + section + "," + day + "," + periodRange + "," + type;
    }
}
