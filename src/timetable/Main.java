package timetable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import timetable.config.SchedulingConfig;
import timetable.config.SolverCapability;
import timetable.core.TimeslotBuilder;
import timetable.core.TimetableEngine;
import timetable.export.GridExporter;
import timetable.io.CsvDataLoader;
import timetable.io.RequestCodec;
import timetable.model.Constraint;
import timetable.model.Course;
import timetable.model.SolveResult;
import timetable.model.TimetableException;
import timetable.model.TimetableRequest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line front end.
 * <pre>
 *   Main &lt;request.json | -&gt; [options]
 *   Main --courses courses.csv --constraints constraints.txt [--periods N] [--lunch L] [options]
 *
 *   options: --improve --fallback-only --time-limit S --seed N --xlsx out.xlsx --csv out.csv
 * </pre>
 * Prints the grid as one JSON line on stdout; violations go to the log.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        try {
            System.exit(run(args));
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.exit(2);
        }
    }

    static int run(String[] args) {
        String requestPath = null;
        Path coursesPath = null;
        Path constraintsPath = null;
        Path xlsx = null;
        Path csv = null;
        boolean improve = false;
        boolean fallbackOnly = false;
        Integer periods = null;
        Integer lunch = null;
        Integer timeLimit = null;
        Long seed = null;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--improve": improve = true; break;
                case "--fallback-only": fallbackOnly = true; break;
                case "--courses": coursesPath = Path.of(value(args, ++i, a)); break;
                case "--constraints": constraintsPath = Path.of(value(args, ++i, a)); break;
                case "--periods": periods = intValue(args, ++i, a); break;
                case "--lunch": lunch = intValue(args, ++i, a); break;
                case "--time-limit": timeLimit = intValue(args, ++i, a); break;
                case "--seed": seed = Long.parseLong(value(args, ++i, a)); break;
                case "--xlsx": xlsx = Path.of(value(args, ++i, a)); break;
                case "--csv": csv = Path.of(value(args, ++i, a)); break;
                default:
                    if (a.startsWith("--"))
                        throw new IllegalArgumentException("Unknown option " + a);
                    requestPath = a;
            }
        }

        try {
            TimetableRequest request;
            RequestCodec codec = new RequestCodec();
            if (coursesPath != null) {
                List<Course> courses = CsvDataLoader.loadCourses(coursesPath);
                List<Constraint> constraints = constraintsPath == null ? List.of()
                        : CsvDataLoader.loadConstraints(constraintsPath);
                request = new TimetableRequest(courses, constraints,
                        periods != null ? periods : SchedulingConfig.DEFAULT_PERIODS,
                        lunch != null ? lunch : SchedulingConfig.DEFAULT_LUNCH,
                        timeLimit != null ? timeLimit : SchedulingConfig.DEFAULT_TIME_LIMIT_SECONDS,
                        seed != null ? seed : SchedulingConfig.RANDOM_SEED);
            } else if (requestPath == null || requestPath.equals("-")) {
                request = codec.readRequest(System.in);
            } else {
                try (InputStream in = Files.newInputStream(Path.of(requestPath))) {
                    request = codec.readRequest(in);
                }
            }
            if (coursesPath == null) {
                request = override(request, periods, lunch, timeLimit, seed);
            }

            TimetableEngine engine = new TimetableEngine(
                    fallbackOnly ? SolverCapability.FALLBACK_ONLY : SolverCapability.EXACT_WITH_FALLBACK);
            SolveResult result = engine.generate(request, improve);

            if (!result.getValidation().isOk()) {
                for (String v : result.getValidation().getViolations())
                    log.warn(v);
            }

            List<String> headers = new TimeslotBuilder().headers(SchedulingConfig.DEFAULT_DAY_START,
                    SchedulingConfig.DEFAULT_PERIOD_MINUTES, request.getPeriods());
            if (xlsx != null)
                GridExporter.exportExcel(result.getGrid(), headers, xlsx);
            if (csv != null)
                GridExporter.exportCsv(result.getGrid(), headers, csv);

            System.out.println(codec.writeGrid(result.getGrid()));
            return 0;
        } catch (TimetableException e) {
            log.error("Timetable generation failed ({}): {}", e.getReason(), e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("I/O error: {}", e.getMessage(), e);
            return 1;
        }
    }

    private static TimetableRequest override(TimetableRequest r, Integer periods, Integer lunch, Integer timeLimit,
            Long seed) {
        if (periods == null && lunch == null && timeLimit == null && seed == null)
            return r;
        return new TimetableRequest(r.getCourses(), r.getConstraints(),
                periods != null ? periods : r.getPeriods(),
                lunch != null ? lunch : r.getLunch(),
                timeLimit != null ? timeLimit : r.getTimeLimitSeconds(),
                seed != null ? seed : r.getSeed());
    }

    private static String value(String[] args, int i, String option) {
        if (i >= args.length)
            throw new IllegalArgumentException("Missing value for " + option);
        return args[i];
    }

    private static int intValue(String[] args, int i, String option) {
        try {
            return Integer.parseInt(value(args, i, option));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Option " + option + " expects a number");
        }
    }
}
