package timetable.config;

import java.time.LocalTime;
import java.util.List;

public class SchedulingConfig {
    public static final List<String> DAYS = List.of("Monday", "Tuesday", "Wednesday", "Thursday", "Friday");
    public static final String LUNCH = "LUNCH";
    public static final String DEFAULT_SECTION = "ALL";
    public static final String FREE_LABEL = "Free";

    public static final int DEFAULT_PERIODS = 6;
    public static final int DEFAULT_LUNCH = 0;
    public static final int DEFAULT_TIME_LIMIT_SECONDS = 20;
    public static final long RANDOM_SEED = 42L;

    // CP-SAT
    public static final int EXACT_SOLVER_SEED = 1;
    public static final int SOLVER_WORKERS = 1;

    // local improvement
    public static final int IMPROVE_ITERATIONS = 600;
    public static final double DIVERSITY_TARGET = 0.7;

    public static final long WATCHDOG_GRACE_SECONDS = 5;

    public static final int DEFAULT_PERIOD_MINUTES = 50;
    public static final LocalTime DEFAULT_DAY_START = LocalTime.of(8, 0);
}
