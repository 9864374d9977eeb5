package timetable.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import timetable.model.Constraint;
import timetable.model.Course;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class CsvDataLoader {
    private static final Logger log = LoggerFactory.getLogger(CsvDataLoader.class);

    /**
     * Course rows: {@code id;name;code;credits;section;teacher_id}. Commas, semicolons or tabs
     * separate columns; only id and name are required. Header, blank and comment lines are skipped.
     */
    public static List<Course> loadCourses(Path path) throws IOException {
        List<Course> result = new ArrayList<>();

        try (BufferedReader br = Files.newBufferedReader(path)) {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                String t = stripBom(line).trim();
                if (t.isEmpty() || t.startsWith("#")) continue;

                String norm = t.replace('\t', ';').replace(',', ';');
                String[] parts = norm.split(";", -1);

                String p0 = parts[0].trim();
                String p0l = p0.toLowerCase(Locale.ROOT);
                if (p0l.equals("id") || p0l.contains("course")) continue; // header

                int id;
                try {
                    id = Integer.parseInt(p0);
                } catch (NumberFormatException e) {
                    log.warn("{}:{} bad course id '{}', line skipped", path.getFileName(), lineNo, p0);
                    continue;
                }
                String name = col(parts, 1);
                String code = col(parts, 2);
                int credits = 1;
                if (!col(parts, 3).isEmpty()) {
                    try { credits = Integer.parseInt(col(parts, 3)); } catch (NumberFormatException ignored) { credits = 1; }
                }
                String section = col(parts, 4);
                Integer teacherId = null;
                if (!col(parts, 5).isEmpty()) {
                    try { teacherId = Integer.valueOf(col(parts, 5)); } catch (NumberFormatException ignored) { teacherId = null; }
                }
                if (name.isEmpty() && code.isEmpty()) {
                    log.warn("{}:{} course {} has neither name nor code, line skipped", path.getFileName(), lineNo, id);
                    continue;
                }
                result.add(new Course(id, name, code, credits, section, teacherId));
            }
        }

        log.info("Loaded courses: {}", result.size());
        return result;
    }

    /**
     * One constraint per line in the typed form understood by {@link ConstraintLineParser}.
     * Lines that do not parse are skipped with a warning.
     */
    public static List<Constraint> loadConstraints(Path path) throws IOException {
        ConstraintLineParser parser = new ConstraintLineParser();
        List<Constraint> result = new ArrayList<>();

        try (BufferedReader br = Files.newBufferedReader(path)) {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                String t = stripBom(line).trim();
                if (t.isEmpty() || t.startsWith("#")) continue;
                try {
                    result.add(parser.parse(t));
                } catch (IllegalArgumentException e) {
                    log.warn("{}:{} {}", path.getFileName(), lineNo, e.getMessage());
                }
            }
        }

        log.info("Loaded constraints: {}", result.size());
        return result;
    }

    private static String col(String[] parts, int i) {
        return i < parts.length ? parts[i].trim() : "";
    }

    private static String stripBom(String s) {
        if (s == null) return "";
        return s.startsWith("\uFEFF") ? s.substring(1) : s;
    }
}
