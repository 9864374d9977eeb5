package timetable.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Inclusive, 1-based period span such as "P1-P3", "P2" or "3-4".
 */
public class PeriodRange {
    private final int first;
    private final int last;

    public PeriodRange(int first, int last) {
        if (first < 1 || last < first)
            throw new IllegalArgumentException("invalid period range " + first + "-" + last);
        this.first = first;
        this.last = last;
    }

    public int getFirst() {
        return first;
    }

    public int getLast() {
        return last;
    }

    public int width() {
        return last - first + 1;
    }

    /**
     * Parses the range text. Reversed bounds are swapped; anything that is not a number
     * after dropping the "P" prefix gives an empty result.
     */
    public static Optional<PeriodRange> parse(String text) {
        if (text == null)
            return Optional.empty();
        String t = text.trim().toUpperCase(Locale.ROOT);
        if (t.isEmpty())
            return Optional.empty();
        try {
            int a;
            int b;
            int dash = t.indexOf('-');
            if (dash >= 0) {
                a = parsePeriod(t.substring(0, dash));
                b = parsePeriod(t.substring(dash + 1));
            } else {
                a = parsePeriod(t);
                b = a;
            }
            if (a > b) {
                int tmp = a;
                a = b;
                b = tmp;
            }
            if (a < 1)
                return Optional.empty();
            return Optional.of(new PeriodRange(a, b));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static int parsePeriod(String token) {
        String s = token.trim();
        if (s.startsWith("P"))
            s = s.substring(1).trim();
        return Integer.parseInt(s);
    }

    @Override
    public String toString() {
        return first == last ? "P" + first : "P" + first + "-P" + last;
    }
}
