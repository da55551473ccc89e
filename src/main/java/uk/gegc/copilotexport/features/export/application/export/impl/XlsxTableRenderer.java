package uk.gegc.copilotexport.features.export.application.export.impl;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;
import uk.gegc.copilotexport.features.export.application.export.ExportRenderer;
import uk.gegc.copilotexport.features.export.domain.exception.ExportRenderingException;
import uk.gegc.copilotexport.features.export.domain.model.ExportFormat;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportFile;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportPayload;
import uk.gegc.copilotexport.features.export.domain.model.table.SpreadsheetTable;
import uk.gegc.copilotexport.features.export.domain.model.table.TableRow;
import uk.gegc.copilotexport.features.export.infra.ExportMediaTypeResolver;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Writes a {@link SpreadsheetTable} as a single XLSX sheet. Text longer than an XLSX cell can hold
 * is truncated to the cell limit so every entry still gets its row.
 */
@Component
@Slf4j
public class XlsxTableRenderer implements ExportRenderer {

    static final int MAX_CELL_TEXT_LENGTH = SpreadsheetVersion.EXCEL2007.getMaxTextLength();

    private static final int CONTENT_COLUMN = 2;

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.TABLE;
    }

    @Override
    public ExportFile render(ExportPayload payload) {
        SpreadsheetTable table = payload.table();
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(table.sheetName());

            // Header
            CellStyle headerStyle = headerStyle(workbook);
            Row header = sheet.createRow(0);
            for (int i = 0; i < table.headers().size(); i++) {
                Cell cell = header.createCell(i);
                cell.setCellValue(table.headers().get(i));
                cell.setCellStyle(headerStyle);
            }

            // Data rows; missing optional values stay blank cells
            CellStyle contentStyle = workbook.createCellStyle();
            contentStyle.setWrapText(true);
            contentStyle.setVerticalAlignment(VerticalAlignment.TOP);
            int rowIdx = 1;
            for (TableRow tableRow : table.rows()) {
                Row row = sheet.createRow(rowIdx++);
                row.createCell(0).setCellValue(tableRow.ordinal());
                setText(row, 1, tableRow.sender(), tableRow);
                setText(row, CONTENT_COLUMN, tableRow.content(), tableRow);
                row.getCell(CONTENT_COLUMN).setCellStyle(contentStyle);
                setText(row, 3, tableRow.timestamp(), tableRow);
                if (tableRow.confidence() != null) {
                    row.createCell(4).setCellValue(tableRow.confidence());
                } else {
                    row.createCell(4);
                }
                setText(row, 5, tableRow.projectContext(), tableRow);
            }

            // Fixed widths, POI counts in 1/256 of a character
            for (int i = 0; i < table.columnWidths().size(); i++) {
                sheet.setColumnWidth(i, table.columnWidths().get(i) * 256);
            }
            sheet.createFreezePane(0, 1);

            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            workbook.write(baos);
            byte[] bytes = baos.toByteArray();

            return new ExportFile(
                    payload.filename(),
                    ExportMediaTypeResolver.XLSX,
                    () -> new ByteArrayInputStream(bytes),
                    bytes.length
            );
        } catch (IOException | IllegalArgumentException e) {
            throw new ExportRenderingException("Failed to render XLSX export", e);
        }
    }

    private void setText(Row row, int column, String value, TableRow tableRow) {
        Cell cell = row.createCell(column);
        if (value != null && !value.isEmpty()) {
            cell.setCellValue(fitToCell(value, column, tableRow));
        }
    }

    private String fitToCell(String value, int column, TableRow tableRow) {
        if (value.length() <= MAX_CELL_TEXT_LENGTH) {
            return value;
        }
        int end = MAX_CELL_TEXT_LENGTH;
        // Do not split a surrogate pair
        if (Character.isHighSurrogate(value.charAt(end - 1))) {
            end--;
        }
        log.warn("Truncated XLSX cell text: row={}, column={}, originalLength={}, keptLength={}",
                tableRow.ordinal(), column, value.length(), end);
        return value.substring(0, end);
    }

    private CellStyle headerStyle(Workbook workbook) {
        Font bold = workbook.createFont();
        bold.setBold(true);
        CellStyle style = workbook.createCellStyle();
        style.setFont(bold);
        return style;
    }
}
