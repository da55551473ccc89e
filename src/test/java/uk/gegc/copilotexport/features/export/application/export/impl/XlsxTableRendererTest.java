package uk.gegc.copilotexport.features.export.application.export.impl;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;
import org.slf4j.LoggerFactory;
import uk.gegc.copilotexport.features.export.application.table.TabularSerializer;
import uk.gegc.copilotexport.features.export.domain.model.ExportFormat;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportFile;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportPayload;
import uk.gegc.copilotexport.features.export.domain.model.table.SpreadsheetTable;
import uk.gegc.copilotexport.features.export.domain.model.table.TableRow;

import java.io.InputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Execution(ExecutionMode.CONCURRENT)
@DisplayName("XlsxTableRenderer Tests")
class XlsxTableRendererTest {

    private XlsxTableRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new XlsxTableRenderer();
    }

    @Test
    @DisplayName("supports: only TABLE")
    void supports_tableOnly() {
        assertThat(renderer.supports(ExportFormat.TABLE)).isTrue();
        assertThat(renderer.supports(ExportFormat.DOCUMENT)).isFalse();
    }

    @Test
    @DisplayName("render: single sheet with bold header row and fixed column widths")
    void render_headerAndWidths() throws Exception {
        // When
        ExportFile file = renderer.render(ExportPayload.ofTable(table(List.of()), "chat.xlsx"));

        // Then
        assertThat(file.contentType()).isEqualTo("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");
        try (InputStream in = file.contentSupplier().get(); XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            assertThat(workbook.getNumberOfSheets()).isEqualTo(1);
            Sheet sheet = workbook.getSheet("Chat Export");
            Row header = sheet.getRow(0);
            assertThat(header.getCell(0).getStringCellValue()).isEqualTo("Message #");
            assertThat(header.getCell(5).getStringCellValue()).isEqualTo("Project Context");
            assertThat(workbook.getFontAt(header.getCell(0).getCellStyle().getFontIndex()).getBold()).isTrue();
            assertThat(sheet.getColumnWidth(0)).isEqualTo(10 * 256);
            assertThat(sheet.getColumnWidth(2)).isEqualTo(80 * 256);
            assertThat(sheet.getColumnWidth(5)).isEqualTo(20 * 256);
            assertThat(sheet.getLastRowNum()).isZero();
        }
    }

    @Test
    @DisplayName("render: rows keep their order and values")
    void render_rowsInOrder() throws Exception {
        // Given
        List<TableRow> rows = List.of(
                new TableRow(1, "You", "Hi", "2024-03-01 10:00:00", null, null),
                new TableRow(2, "Work Buddy", "Hello", "2024-03-01 10:00:05", 0.87, "Apollo")
        );

        // When
        ExportFile file = renderer.render(ExportPayload.ofTable(table(rows), "chat.xlsx"));

        // Then
        try (InputStream in = file.contentSupplier().get(); XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            Sheet sheet = workbook.getSheetAt(0);
            assertThat(sheet.getLastRowNum()).isEqualTo(2);
            Row second = sheet.getRow(2);
            assertThat(second.getCell(0).getNumericCellValue()).isEqualTo(2.0);
            assertThat(second.getCell(1).getStringCellValue()).isEqualTo("Work Buddy");
            assertThat(second.getCell(2).getStringCellValue()).isEqualTo("Hello");
            assertThat(second.getCell(3).getStringCellValue()).isEqualTo("2024-03-01 10:00:05");
            assertThat(second.getCell(4).getNumericCellValue()).isEqualTo(0.87);
            assertThat(second.getCell(5).getStringCellValue()).isEqualTo("Apollo");
        }
    }

    @Test
    @DisplayName("render: missing optional values are blank cells")
    void render_missingValues_blankCells() throws Exception {
        List<TableRow> rows = List.of(new TableRow(1, "You", "", null, null, null));

        ExportFile file = renderer.render(ExportPayload.ofTable(table(rows), "chat.xlsx"));

        try (InputStream in = file.contentSupplier().get(); XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            Row row = workbook.getSheetAt(0).getRow(1);
            for (int column = 2; column <= 5; column++) {
                assertThat(row.getCell(column).getCellType()).isEqualTo(CellType.BLANK);
            }
        }
    }

    @Test
    @DisplayName("render: zero confidence is written as a number")
    void render_zeroConfidence_numericCell() throws Exception {
        List<TableRow> rows = List.of(new TableRow(1, "Work Buddy", "Unsure", null, 0.0, null));

        ExportFile file = renderer.render(ExportPayload.ofTable(table(rows), "chat.xlsx"));

        try (InputStream in = file.contentSupplier().get(); XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            Row row = workbook.getSheetAt(0).getRow(1);
            assertThat(row.getCell(4).getCellType()).isEqualTo(CellType.NUMERIC);
            assertThat(row.getCell(4).getNumericCellValue()).isZero();
        }
    }

    @Test
    @DisplayName("render: text over the XLSX cell limit is truncated and the row is still written")
    void render_oversizedContent_truncatedWithWarning() throws Exception {
        // Given
        Logger logger = (Logger) LoggerFactory.getLogger(XlsxTableRenderer.class);
        ListAppender<ILoggingEvent> listAppender = new ListAppender<>();
        listAppender.start();
        logger.addAppender(listAppender);
        List<TableRow> rows = List.of(
                new TableRow(1, "Work Buddy", "x".repeat(40_000), null, null, null),
                new TableRow(2, "You", "Thanks", null, null, null)
        );

        try {
            // When
            ExportFile file = renderer.render(ExportPayload.ofTable(table(rows), "chat.xlsx"));

            // Then
            try (InputStream in = file.contentSupplier().get(); XSSFWorkbook workbook = new XSSFWorkbook(in)) {
                Sheet sheet = workbook.getSheetAt(0);
                assertThat(sheet.getLastRowNum()).isEqualTo(2);
                assertThat(sheet.getRow(1).getCell(2).getStringCellValue())
                        .hasSize(XlsxTableRenderer.MAX_CELL_TEXT_LENGTH)
                        .isEqualTo("x".repeat(32_767));
                assertThat(sheet.getRow(2).getCell(2).getStringCellValue()).isEqualTo("Thanks");
            }
            assertThat(listAppender.list).anySatisfy(event -> {
                assertThat(event.getLevel()).isEqualTo(Level.WARN);
                assertThat(event.getFormattedMessage()).contains("row=1", "originalLength=40000");
            });
        } finally {
            logger.detachAppender(listAppender);
        }
    }

    @Test
    @DisplayName("render: truncation never splits a surrogate pair")
    void render_truncationAtSurrogatePair_keepsPairWhole() throws Exception {
        String content = "x".repeat(XlsxTableRenderer.MAX_CELL_TEXT_LENGTH - 1) + "\uD83D\uDE00" + "tail";
        List<TableRow> rows = List.of(new TableRow(1, "You", content, null, null, null));

        ExportFile file = renderer.render(ExportPayload.ofTable(table(rows), "chat.xlsx"));

        try (InputStream in = file.contentSupplier().get(); XSSFWorkbook workbook = new XSSFWorkbook(in)) {
            String written = workbook.getSheetAt(0).getRow(1).getCell(2).getStringCellValue();
            assertThat(written).isEqualTo("x".repeat(XlsxTableRenderer.MAX_CELL_TEXT_LENGTH - 1));
        }
    }

    private SpreadsheetTable table(List<TableRow> rows) {
        return new SpreadsheetTable(
                TabularSerializer.SHEET_NAME, TabularSerializer.HEADERS, TabularSerializer.COLUMN_WIDTHS, rows);
    }
}
