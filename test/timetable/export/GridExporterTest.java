package timetable.export;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import timetable.model.Grid;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class GridExporterTest {

    @TempDir
    Path dir;

    private static Grid sample() {
        Grid g = Grid.empty(3, 1);
        g.set("Monday", 0, "Math");
        g.set("Monday", 2, "Lab, part 1");
        g.set("Tuesday", 0, "Say \"hi\"");
        return g;
    }

    @Test
    void rowsUseGivenHeadersThenDefaults() {
        List<String[]> rows = GridExporter.toRows(sample(), List.of("P1 (08:00-08:50)"));

        assertEquals(6, rows.size());
        assertArrayEquals(new String[] { "Day", "P1 (08:00-08:50)", "P2", "P3" }, rows.get(0));
        assertArrayEquals(new String[] { "Monday", "Math", "LUNCH", "Lab, part 1" }, rows.get(1));
    }

    @Test
    void csvQuotesWhereNeeded() throws Exception {
        Path out = dir.resolve("grid.csv");
        GridExporter.exportCsv(sample(), null, out);

        List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
        assertEquals(6, lines.size());
        assertEquals("Day,P1,P2,P3", lines.get(0));
        assertEquals("Monday,Math,LUNCH,\"Lab, part 1\"", lines.get(1));
        assertEquals("Tuesday,\"Say \"\"hi\"\"\",LUNCH,", lines.get(2));
    }

    @Test
    void excelSheetHoldsTheGrid() throws Exception {
        Path out = dir.resolve("grid.xlsx");
        GridExporter.exportExcel(sample(), null, out);

        try (InputStream in = Files.newInputStream(out); XSSFWorkbook wb = new XSSFWorkbook(in)) {
            Sheet sheet = wb.getSheet("Timetable");
            assertEquals(5, sheet.getLastRowNum());
            Row monday = sheet.getRow(1);
            assertEquals("Monday", monday.getCell(0).getStringCellValue());
            assertEquals("Math", monday.getCell(1).getStringCellValue());
            assertEquals("LUNCH", monday.getCell(2).getStringCellValue());
            assertEquals("P3", sheet.getRow(0).getCell(3).getStringCellValue());
        }
    }
}
