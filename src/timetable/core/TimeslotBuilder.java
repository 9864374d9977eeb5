package timetable.core;

import timetable.model.TimeRange;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Clock times of the periods of a day, for headers and exports. The engine itself only
 * works with period indices.
 */
public class TimeslotBuilder {

    public List<TimeRange> build(LocalTime dayStart, int periodMinutes, int periods) {
        if (periodMinutes <= 0)
            throw new IllegalArgumentException("period length must be positive");
        List<TimeRange> result = new ArrayList<>();
        LocalTime start = dayStart;
        for (int p = 0; p < periods; p++) {
            LocalTime end = start.plusMinutes(periodMinutes);
            // don't run past midnight
            if (!end.isAfter(start)) break;
            result.add(new TimeRange(start, end));
            start = end;
        }
        return result;
    }

    /** "P1 (08:00-08:50)" style headers, one per period. */
    public List<String> headers(LocalTime dayStart, int periodMinutes, int periods) {
        List<TimeRange> slots = build(dayStart, periodMinutes, periods);
        List<String> out = new ArrayList<>();
        for (int p = 0; p < periods; p++) {
            String h = "P" + (p + 1);
            if (p < slots.size())
                h += " (" + slots.get(p) + ")";
            out.add(h);
        }
        return out;
    }
}
