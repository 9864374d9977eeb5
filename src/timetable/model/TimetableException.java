package timetable.model;

/**
 * Terminal failure of a solve request. Everything recoverable ends up in
 * {@link SolveDiagnostics} instead.
 */
public class TimetableException extends RuntimeException {

    public enum Reason {
        NO_COURSES,
        INVALID_REQUEST,
        CANCELLED,
        TIMEOUT,
        FAILED
    }

    private final Reason reason;

    public TimetableException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TimetableException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
