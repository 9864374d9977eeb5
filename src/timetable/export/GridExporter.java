package timetable.export;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import timetable.model.Grid;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class GridExporter {

    // [Day, P1, P2, ...] followed by one row per day
    public static List<String[]> toRows(Grid grid, List<String> periodHeaders) {
        List<String[]> rows = new ArrayList<>();
        String[] header = new String[grid.getPeriods() + 1];
        header[0] = "Day";
        for (int p = 0; p < grid.getPeriods(); p++)
            header[p + 1] = (periodHeaders != null && p < periodHeaders.size()) ? periodHeaders.get(p) : "P" + (p + 1);
        rows.add(header);

        for (String d : grid.days()) {
            String[] r = new String[grid.getPeriods() + 1];
            r[0] = d;
            for (int p = 0; p < grid.getPeriods(); p++)
                r[p + 1] = grid.get(d, p);
            rows.add(r);
        }
        return rows;
    }

    public static void exportExcel(Grid grid, List<String> periodHeaders, Path outputPath) throws IOException {
        List<String[]> rows = toRows(grid, periodHeaders);
        try (XSSFWorkbook wb = new XSSFWorkbook()) {
            Sheet sheet = wb.createSheet("Timetable");

            int r = 0;
            for (String[] rowData : rows) {
                Row row = sheet.createRow(r++);
                for (int c = 0; c < rowData.length; c++) {
                    Cell cell = row.createCell(c);
                    cell.setCellValue(rowData[c] == null ? "" : rowData[c]);
                }
            }

            // width from text length; autoSizeColumn needs font metrics a headless host may lack
            for (int c = 0; c <= grid.getPeriods(); c++) {
                int longest = 4;
                for (String[] rowData : rows) {
                    if (rowData[c] != null)
                        longest = Math.max(longest, rowData[c].length());
                }
                sheet.setColumnWidth(c, Math.min(255, longest + 2) * 256);
            }

            try (FileOutputStream fos = new FileOutputStream(outputPath.toFile())) {
                wb.write(fos);
            }
        }
    }

    public static void exportCsv(Grid grid, List<String> periodHeaders, Path outputPath) throws IOException {
        try (Writer w = Files.newBufferedWriter(outputPath, StandardCharsets.UTF_8)) {
            for (String[] row : toRows(grid, periodHeaders)) {
                for (int c = 0; c < row.length; c++) {
                    if (c > 0) w.write(',');
                    w.write(csvEscape(row[c]));
                }
                w.write('\n');
            }
        }
    }

    private static String csvEscape(String v) {
        if (v == null) return "";
        if (v.contains(",") || v.contains("\"") || v.contains("\n"))
            return "\"" + v.replace("\"", "\"\"") + "\"";
        return v;
    }
}
