package timetable;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    @TempDir
    Path dir;

    @Test
    void solvesFromCsvFilesAndExports() throws Exception {
        Path courses = dir.resolve("courses.csv");
        Files.writeString(courses, "id;name;code;credits;section;teacher_id\n1;Math;M1;2;A;1\n2;English;E1;1;A;2\n",
                StandardCharsets.UTF_8);
        Path constraints = dir.resolve("constraints.txt");
        Files.writeString(constraints, "Math,Monday,P1\n", StandardCharsets.UTF_8);
        Path csv = dir.resolve("out.csv");

        int code = Main.run(new String[] { "--courses", courses.toString(), "--constraints", constraints.toString(),
                "--periods", "4", "--lunch", "3", "--fallback-only", "--csv", csv.toString() });

        assertEquals(0, code);
        List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        assertEquals(6, lines.size());
        assertTrue(lines.get(0).startsWith("Day,P1 (08:00-08:50)"));
        assertTrue(lines.get(1).startsWith("Monday,Math,"));
    }

    @Test
    void solvesFromJsonRequest() throws Exception {
        Path req = dir.resolve("request.json");
        Files.writeString(req, "{\"courses\":[{\"id\":1,\"name\":\"Math\",\"credits\":2}],\"periods\":3,\"lunch\":2}",
                StandardCharsets.UTF_8);

        assertEquals(0, Main.run(new String[] { req.toString(), "--fallback-only", "--improve" }));
    }

    @Test
    void failuresMapToExitCodes() {
        assertEquals(1, Main.run(new String[] { dir.resolve("missing.json").toString() }));
        assertThrows(IllegalArgumentException.class, () -> Main.run(new String[] { "--bogus" }));
        assertThrows(IllegalArgumentException.class, () -> Main.run(new String[] { "--periods", "many" }));
    }
}
