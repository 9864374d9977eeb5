package timetable.config;

/**
 * Which solving paths an engine instance may use. Chosen once, when the engine is built.
 */
public enum SolverCapability {
    /** CP-SAT first, greedy when it has no result. */
    EXACT_WITH_FALLBACK,
    /** Greedy only. */
    FALLBACK_ONLY
}
