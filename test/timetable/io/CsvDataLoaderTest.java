package timetable.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import timetable.model.Constraint;
import timetable.model.ConstraintType;
import timetable.model.Course;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class CsvDataLoaderTest {

    @TempDir
    Path dir;

    @Test
    void loadsCoursesWithMixedDelimiters() throws Exception {
        Path f = dir.resolve("courses.csv");
        Files.writeString(f, "\uFEFFid;name;code;credits;section;teacher_id\n"
                + "1;Mathematics;MATH101;3;A;7\n"
                + "# retired\n"
                + "\n"
                + "2,English,ENG101,2,B,\n"
                + "3\tPhysics\n"
                + "x;Broken;;;;\n"
                + "4;;;;;\n", StandardCharsets.UTF_8);

        List<Course> courses = CsvDataLoader.loadCourses(f);

        assertEquals(3, courses.size());
        Course math = courses.get(0);
        assertEquals(1, math.getId());
        assertEquals("MATH101", math.getCode());
        assertEquals(3, math.getCredits());
        assertEquals("A", math.getSection());
        assertEquals(7, math.getTeacherId());

        Course english = courses.get(1);
        assertEquals("B", english.getSection());
        assertNull(english.getTeacherId());

        Course physics = courses.get(2);
        assertEquals("Physics", physics.getName());
        assertEquals(1, physics.getCredits());
    }

    @Test
    void loadsConstraintsSkippingBadLines() throws Exception {
        Path f = dir.resolve("constraints.txt");
        Files.writeString(f, "Math,Monday,P1-P2,exact\n"
                + "# comment\n"
                + "only,two\n"
                + "English,B,wednesday,P3\n", StandardCharsets.UTF_8);

        List<Constraint> cons = CsvDataLoader.loadConstraints(f);

        assertEquals(2, cons.size());
        assertEquals(ConstraintType.EXACT, cons.get(0).getType());
        assertEquals("Wednesday", cons.get(1).getDay());
        assertEquals("B", cons.get(1).getSection());
    }
}
