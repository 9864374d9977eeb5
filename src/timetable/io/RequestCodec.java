package timetable.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import timetable.config.SchedulingConfig;
import timetable.model.Constraint;
import timetable.model.ConstraintType;
import timetable.model.Course;
import timetable.model.EngineIssue;
import timetable.model.Grid;
import timetable.model.SolveResult;
import timetable.model.TimetableRequest;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of requests and grids, field names as the storage and UI layers use them
 * (course_name, period_range, time_limit, ...).
 */
public class RequestCodec {
    private static final Logger log = LoggerFactory.getLogger(RequestCodec.class);

    private final ObjectMapper mapper = new ObjectMapper();

    public TimetableRequest readRequest(InputStream in) throws IOException {
        return toRequest(mapper.readTree(in));
    }

    public TimetableRequest readRequest(String json) throws IOException {
        return toRequest(mapper.readTree(json));
    }

    private TimetableRequest toRequest(JsonNode root) throws IOException {
        if (root == null || !root.isObject())
            throw new IOException("Request must be a JSON object");

        List<Course> courses = new ArrayList<>();
        int nextMissingId = -1;
        for (JsonNode c : root.path("courses")) {
            int id;
            if (c.hasNonNull("id")) {
                id = c.get("id").asInt();
            } else {
                id = nextMissingId--;
            }
            courses.add(new Course(
                    id,
                    c.hasNonNull("course_name") ? c.get("course_name").asText() : c.path("name").asText(""),
                    c.path("course_code").asText(""),
                    c.path("credits").asInt(1),
                    c.path("section").asText(""),
                    teacherId(c.get("teacher_id"), id)));
        }

        List<Constraint> constraints = new ArrayList<>();
        for (JsonNode c : root.path("constraints")) {
            String range = c.hasNonNull("period_range") ? c.get("period_range").asText() : c.path("periods").asText("");
            constraints.add(new Constraint(
                    c.path("course_name").asText(""),
                    c.path("section").asText(SchedulingConfig.DEFAULT_SECTION),
                    c.path("day").asText(""),
                    range,
                    ConstraintType.parse(c.path("type").asText("Hard")),
                    c.hasNonNull("mode") ? c.get("mode").asText() : null));
        }

        return new TimetableRequest(courses, constraints,
                root.path("periods").asInt(SchedulingConfig.DEFAULT_PERIODS),
                root.path("lunch").asInt(SchedulingConfig.DEFAULT_LUNCH),
                root.path("time_limit").asInt(SchedulingConfig.DEFAULT_TIME_LIMIT_SECONDS),
                root.path("seed").asLong(SchedulingConfig.RANDOM_SEED));
    }

    /** Numeric id or null; anything else is dropped rather than folded into one teacher. */
    private static Integer teacherId(JsonNode node, int courseId) {
        if (node == null || node.isNull())
            return null;
        String text = node.asText().trim();
        if (text.isEmpty())
            return null;
        try {
            return Integer.valueOf(text);
        } catch (NumberFormatException e) {
            log.warn("Course {}: teacher_id '{}' is not a number, ignored", courseId, text);
            return null;
        }
    }

    /** Grid as a single-line JSON object: day -> cells. */
    public String writeGrid(Grid grid) throws IOException {
        return mapper.writeValueAsString(grid.toMap());
    }

    public Grid readGrid(String json) throws IOException {
        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isObject())
            throw new IOException("Grid must be a JSON object");
        Map<String, List<String>> rows = new LinkedHashMap<>();
        root.fields().forEachRemaining(e -> {
            List<String> cells = new ArrayList<>();
            for (JsonNode cell : e.getValue())
                cells.add(cell.isNull() ? "" : cell.asText());
            rows.put(e.getKey(), cells);
        });
        if (rows.isEmpty())
            throw new IOException("Grid has no days");
        return Grid.fromMap(rows);
    }

    /** Grid plus validation and diagnostics. */
    public String writeResult(SolveResult result) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        root.set("grid", mapper.valueToTree(result.getGrid().toMap()));
        root.put("valid", result.getValidation().isOk());
        ArrayNode violations = root.putArray("violations");
        result.getValidation().getViolations().forEach(violations::add);
        root.put("path", String.valueOf(result.getDiagnostics().getPath()));
        ArrayNode issues = root.putArray("issues");
        for (EngineIssue i : result.getDiagnostics().getIssues()) {
            ObjectNode n = issues.addObject();
            n.put("kind", i.getKind().name());
            n.put("message", i.getMessage());
        }
        return mapper.writeValueAsString(root);
    }
}
