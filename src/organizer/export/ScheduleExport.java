package organizer.export;

import com.lowagie.text.Document;
import com.lowagie.text.DocumentException;
import com.lowagie.text.Element;
import com.lowagie.text.Font;
import com.lowagie.text.FontFactory;
import com.lowagie.text.Paragraph;
import com.lowagie.text.Phrase;
import com.lowagie.text.pdf.PdfPCell;
import com.lowagie.text.pdf.PdfPTable;
import com.lowagie.text.pdf.PdfWriter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import organizer.core.AssignmentGrid;
import organizer.core.Schedule;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the final timetable for people who read it outside the program.
 */
public class ScheduleExport {

    // characters, one per header column
    private static final int[] COLUMN_WIDTHS = {11, 12, 15, 20, 12, 40};

    /**
     * Workbook with a "Schedule" sheet (one row per lesson) and a "Cost trace" sheet
     * (earnings after every annealing iteration).
     */
    public static void exportExcel(Schedule schedule, Path outputPath) throws IOException {
        AssignmentGrid grid = schedule.getGrid();
        try (XSSFWorkbook wb = new XSSFWorkbook()) {
            Sheet sheet = wb.createSheet("Schedule");
            int r = 0;
            Row headerRow = sheet.createRow(r++);
            for (int c = 0; c < ScheduleFormatter.HEADER.length; c++) {
                headerRow.createCell(c).setCellValue(ScheduleFormatter.HEADER[c]);
                sheet.setColumnWidth(c, COLUMN_WIDTHS[c] * 256);
            }
            for (String[] rowData : ScheduleFormatter.rows(grid)) {
                Row row = sheet.createRow(r++);
                for (int c = 0; c < rowData.length; c++) {
                    row.createCell(c).setCellValue(rowData[c]);
                }
            }
            Row total = sheet.createRow(++r);
            total.createCell(0).setCellValue("Earnings");
            total.createCell(1).setCellValue(schedule.getCost());

            Sheet traceSheet = wb.createSheet("Cost trace");
            Row traceHeader = traceSheet.createRow(0);
            traceHeader.createCell(0).setCellValue("Iteration");
            traceHeader.createCell(1).setCellValue("Earnings");
            List<Double> trace = schedule.getLastCostTrace();
            for (int i = 0; i < trace.size(); i++) {
                Row row = traceSheet.createRow(i + 1);
                row.createCell(0).setCellValue(i + 1);
                row.createCell(1).setCellValue(trace.get(i));
            }

            try (OutputStream out = Files.newOutputStream(outputPath)) {
                wb.write(out);
            }
        }
        System.out.println("Schedule exported to " + outputPath);
    }

    /** One table per classroom, then the earnings. */
    public static void exportPdf(Schedule schedule, Path outputPath) throws IOException {
        if (outputPath == null) throw new IllegalArgumentException("outputPath is null");
        AssignmentGrid grid = schedule.getGrid();

        // Build PDF in memory first to avoid partial/invalid files
        ByteArrayOutputStream baos = new ByteArrayOutputStream(64 * 1024);
        Document doc = new Document();
        try {
            PdfWriter.getInstance(doc, baos);
            doc.open();

            Font titleFont = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 14);
            Font headerFont = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 10);
            Font cellFont = FontFactory.getFont(FontFactory.HELVETICA, 10);

            Paragraph title = new Paragraph("Weekly Schedule", titleFont);
            title.setAlignment(Element.ALIGN_CENTER);
            doc.add(title);

            List<String[]> rows = ScheduleFormatter.rows(grid);
            for (int c = 0; c < grid.getClassroomCount(); c++) {
                doc.add(new Paragraph(" "));
                doc.add(new Paragraph("Classroom " + c, headerFont));
                doc.add(new Paragraph(" "));

                PdfPTable table = new PdfPTable(ScheduleFormatter.HEADER.length - 1);
                table.setWidthPercentage(100);
                for (int h = 1; h < ScheduleFormatter.HEADER.length; h++) {
                    PdfPCell hc = new PdfPCell(new Phrase(ScheduleFormatter.HEADER[h], headerFont));
                    hc.setHorizontalAlignment(Element.ALIGN_CENTER);
                    hc.setPadding(4f);
                    table.addCell(hc);
                }
                String classroom = String.valueOf(c);
                for (String[] row : rows) {
                    if (!row[0].equals(classroom)) continue;
                    for (int k = 1; k < row.length; k++) {
                        PdfPCell cc = new PdfPCell(new Phrase(row[k], cellFont));
                        cc.setPadding(3f);
                        table.addCell(cc);
                    }
                }
                doc.add(table);
            }

            doc.add(new Paragraph(" "));
            doc.add(new Paragraph("Earnings: " + schedule.getCost(), headerFont));
        } catch (DocumentException e) {
            throw new IOException("Could not build PDF: " + e.getMessage(), e);
        } finally {
            if (doc.isOpen()) doc.close();
        }

        Files.write(outputPath, baos.toByteArray());
        System.out.println("Schedule exported to " + outputPath);
    }
}
