package timetable.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What happened while producing a grid. Filled in by the engine, read by the caller.
 */
public class SolveDiagnostics {
    private SolvePath path;
    private final List<EngineIssue> issues = new ArrayList<>();
    private int syntheticCourses;
    private int improvementIterations;
    private int acceptedSwaps;
    private double scoreBefore;
    private double scoreAfter;

    public SolvePath getPath() {
        return path;
    }

    public void setPath(SolvePath path) {
        this.path = path;
    }

    public void addIssue(IssueKind kind, String message) {
        issues.add(new EngineIssue(kind, message));
    }

    public List<EngineIssue> getIssues() {
        return Collections.unmodifiableList(issues);
    }

    public boolean hasIssue(IssueKind kind) {
        for (EngineIssue i : issues) {
            if (i.getKind() == kind)
                return true;
        }
        return false;
    }

    public int getSyntheticCourses() {
        return syntheticCourses;
    }

    public void setSyntheticCourses(int syntheticCourses) {
        this.syntheticCourses = syntheticCourses;
    }

    public int getImprovementIterations() {
        return improvementIterations;
    }

    public int getAcceptedSwaps() {
        return acceptedSwaps;
    }

    public double getScoreBefore() {
        return scoreBefore;
    }

    public double getScoreAfter() {
        return scoreAfter;
    }

    public void recordImprovement(int iterations, int accepted, double before, double after) {
        this.improvementIterations = iterations;
        this.acceptedSwaps = accepted;
        this.scoreBefore = before;
        this.scoreAfter = after;
    }
}
