package timetable.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import timetable.model.Constraint;
import timetable.model.Course;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Resolves the free-text course of a constraint to course ids.
 * <p>
 * Tiers are tried in order and the first one with any hit wins:
 * <ol>
 * <li>exact: text equals the normalized name or code</li>
 * <li>token: a token of the text (split on space, '/', '-') is contained in, or contains,
 * the name or code</li>
 * <li>prefix/suffix: text starts or ends the name or code, or the other way round</li>
 * </ol>
 * The section filter applies to every tier. Ids come back in the iteration order of the
 * course map.
 */
public class ConstraintMatcher {
    private static final Logger log = LoggerFactory.getLogger(ConstraintMatcher.class);

    public List<Integer> match(Constraint constraint, Map<Integer, Course> courses) {
        String target = TextNormalizer.normalize(constraint.getCourseName());
        if (target.isEmpty())
            return new ArrayList<>();

        List<Integer> matches = exactTier(target, constraint, courses);
        if (!matches.isEmpty()) {
            log.debug("Constraint '{}' exact-matched {}", constraint.getCourseName(), matches);
            return matches;
        }
        matches = tokenTier(target, constraint, courses);
        if (!matches.isEmpty()) {
            log.debug("Constraint '{}' token-matched {}", constraint.getCourseName(), matches);
            return matches;
        }
        matches = affixTier(target, constraint, courses);
        if (!matches.isEmpty()) {
            log.debug("Constraint '{}' prefix/suffix-matched {}", constraint.getCourseName(), matches);
            return matches;
        }
        log.debug("No course for constraint '{}' (norm='{}')", constraint.getCourseName(), target);
        return matches;
    }

    private List<Integer> exactTier(String target, Constraint cons, Map<Integer, Course> courses) {
        List<Integer> out = new ArrayList<>();
        for (Map.Entry<Integer, Course> e : courses.entrySet()) {
            Course c = e.getValue();
            if (!sectionAllowed(cons, c))
                continue;
            if (target.equals(TextNormalizer.normalize(c.getName()))
                    || target.equals(TextNormalizer.normalize(c.getCode())))
                out.add(e.getKey());
        }
        return out;
    }

    private List<Integer> tokenTier(String target, Constraint cons, Map<Integer, Course> courses) {
        List<String> tokens = TextNormalizer.tokens(target);
        List<Integer> out = new ArrayList<>();
        for (Map.Entry<Integer, Course> e : courses.entrySet()) {
            Course c = e.getValue();
            if (!sectionAllowed(cons, c))
                continue;
            String name = TextNormalizer.normalize(c.getName());
            String code = TextNormalizer.normalize(c.getCode());
            for (String tk : tokens) {
                if (overlaps(tk, name) || overlaps(tk, code)) {
                    out.add(e.getKey());
                    break;
                }
            }
        }
        return out;
    }

    private List<Integer> affixTier(String target, Constraint cons, Map<Integer, Course> courses) {
        List<Integer> out = new ArrayList<>();
        for (Map.Entry<Integer, Course> e : courses.entrySet()) {
            Course c = e.getValue();
            if (!sectionAllowed(cons, c))
                continue;
            String name = TextNormalizer.normalize(c.getName());
            String code = TextNormalizer.normalize(c.getCode());
            if (affix(target, name) || affix(target, code))
                out.add(e.getKey());
        }
        return out;
    }

    // an empty name/code would otherwise be contained in every token
    private static boolean overlaps(String token, String field) {
        return !field.isEmpty() && (field.contains(token) || token.contains(field));
    }

    private static boolean affix(String target, String field) {
        if (field.isEmpty())
            return false;
        return field.startsWith(target) || field.endsWith(target)
                || target.startsWith(field) || target.endsWith(field);
    }

    private static boolean sectionAllowed(Constraint cons, Course c) {
        return cons.appliesToAllSections() || c.getSection().trim().equals(cons.getSection());
    }
}
