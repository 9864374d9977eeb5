package timetable.model;

/**
 * A recoverable problem met during one solve. Never thrown, only reported.
 */
public class EngineIssue {
    private final IssueKind kind;
    private final String message;

    public EngineIssue(IssueKind kind, String message) {
        this.kind = kind;
        this.message = message;
    }

    public IssueKind getKind() {
        return kind;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
