package timetable.io;

import org.junit.jupiter.api.Test;
import timetable.config.SchedulingConfig;
import timetable.model.Constraint;
import timetable.model.ConstraintType;
import timetable.model.Course;
import timetable.model.Grid;
import timetable.model.IssueKind;
import timetable.model.SolveDiagnostics;
import timetable.model.SolvePath;
import timetable.model.SolveResult;
import timetable.model.TimetableRequest;
import timetable.model.ValidationReport;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RequestCodecTest {

    private final RequestCodec codec = new RequestCodec();

    @Test
    void readsFullRequest() throws Exception {
        String json = "{\"courses\":["
                + "{\"id\":1,\"course_name\":\"Math\",\"course_code\":\"M1\",\"credits\":2,\"section\":\"A\",\"teacher_id\":5},"
                + "{\"name\":\"English\",\"credits\":1}],"
                + "\"constraints\":["
                + "{\"course_name\":\"Math\",\"day\":\"Monday\",\"period_range\":\"P1-P2\",\"type\":\"Exact\"},"
                + "{\"course_name\":\"English\",\"section\":\"B\",\"day\":\"Friday\",\"periods\":\"P3\",\"type\":\"Hard\",\"mode\":\"note\"}],"
                + "\"periods\":4,\"lunch\":3,\"time_limit\":7,\"seed\":11}";

        TimetableRequest req = codec.readRequest(json);

        assertEquals(4, req.getPeriods());
        assertEquals(2, req.lunchIndex());
        assertEquals(7, req.getTimeLimitSeconds());
        assertEquals(11L, req.getSeed());

        Course math = req.getCourses().get(0);
        assertEquals("M1", math.getCode());
        assertEquals(5, math.getTeacherId());
        Course english = req.getCourses().get(1);
        assertEquals("English", english.getName());
        assertTrue(english.getId() < 0);
        assertNull(english.getTeacherId());

        Constraint first = req.getConstraints().get(0);
        assertEquals(ConstraintType.EXACT, first.getType());
        assertTrue(first.appliesToAllSections());
        Constraint second = req.getConstraints().get(1);
        assertEquals("P3", second.getPeriodRange());
        assertEquals("B", second.getSection());
        assertEquals("note", second.getMode());
    }

    @Test
    void nonNumericTeacherIdIsDropped() throws Exception {
        TimetableRequest req = codec.readRequest("{\"courses\":["
                + "{\"id\":1,\"course_name\":\"Math\",\"teacher_id\":\"T7\"},"
                + "{\"id\":2,\"course_name\":\"Art\",\"teacher_id\":\"T8\"},"
                + "{\"id\":3,\"course_name\":\"Music\",\"teacher_id\":\" 12 \"}]}");

        assertNull(req.getCourses().get(0).getTeacherId());
        assertNull(req.getCourses().get(1).getTeacherId());
        assertEquals(12, req.getCourses().get(2).getTeacherId());
    }

    @Test
    void defaultsForMissingFields() throws Exception {
        TimetableRequest req = codec.readRequest("{\"courses\":[{\"id\":1,\"course_name\":\"Math\"}]}");

        assertEquals(SchedulingConfig.DEFAULT_PERIODS, req.getPeriods());
        assertEquals(-1, req.lunchIndex());
        assertEquals(SchedulingConfig.DEFAULT_TIME_LIMIT_SECONDS, req.getTimeLimitSeconds());
        assertEquals(SchedulingConfig.RANDOM_SEED, req.getSeed());
        assertTrue(req.getConstraints().isEmpty());
    }

    @Test
    void rejectsNonObjects() {
        assertThrows(IOException.class, () -> codec.readRequest("[1,2]"));
        assertThrows(IOException.class, () -> codec.readGrid("{}"));
    }

    @Test
    void gridJsonKeepsDayOrder() throws Exception {
        Grid g = Grid.empty(2, 1);
        g.set("Monday", 0, "Math");

        String json = codec.writeGrid(g);

        assertTrue(json.startsWith("{\"Monday\":[\"Math\",\"LUNCH\"],\"Tuesday\":"));
        assertEquals(g, codec.readGrid(json));
    }

    @Test
    void readGridNormalizesCells() throws Exception {
        Grid g = codec.readGrid("{\"Monday\":[\"Math\",null,\"lunch\"],\"Tuesday\":[\"English\"]}");

        assertEquals(List.of("Math", "", "LUNCH"), g.row("Monday"));
        assertEquals(List.of("English", "", ""), g.row("Tuesday"));
    }

    @Test
    void resultCarriesDiagnostics() throws Exception {
        SolveDiagnostics diag = new SolveDiagnostics();
        diag.setPath(SolvePath.GREEDY);
        diag.addIssue(IssueKind.INFEASIBLE, "no model");
        SolveResult r = new SolveResult(Grid.empty(1, -1), new ValidationReport(List.of("bad")), diag);

        String json = codec.writeResult(r);

        assertTrue(json.contains("\"valid\":false"));
        assertTrue(json.contains("\"violations\":[\"bad\"]"));
        assertTrue(json.contains("\"path\":\"GREEDY\""));
        assertTrue(json.contains("\"kind\":\"INFEASIBLE\""));
    }
}
