package timetable.runner;

import timetable.model.SolveResult;
import timetable.model.TimetableException;

/**
 * Receives exactly one of the two callbacks per submitted request, on the worker thread.
 */
public interface SolveListener {
    void onFinished(SolveResult result);

    void onError(TimetableException error);
}
