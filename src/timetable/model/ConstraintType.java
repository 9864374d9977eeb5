package timetable.model;

public enum ConstraintType {
    /** At least one occurrence inside the range. */
    HARD,
    /** The whole range is reserved for the course. */
    EXACT;

    public static ConstraintType parse(String raw) {
        if (raw != null && raw.trim().equalsIgnoreCase("exact"))
            return EXACT;
        return HARD;
    }
}
