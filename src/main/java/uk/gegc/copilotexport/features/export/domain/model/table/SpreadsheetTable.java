package uk.gegc.copilotexport.features.export.domain.model.table;

import java.util.List;

/**
 * A single-sheet table: header names, column widths in characters, and rows in input order.
 */
public record SpreadsheetTable(
        String sheetName,
        List<String> headers,
        List<Integer> columnWidths,
        List<TableRow> rows
) {
    public SpreadsheetTable {
        if (sheetName == null || sheetName.isBlank()) {
            throw new IllegalArgumentException("Sheet name cannot be null or blank");
        }
        headers = List.copyOf(headers);
        columnWidths = List.copyOf(columnWidths);
        rows = List.copyOf(rows);
        if (headers.size() != TableRow.ARITY || columnWidths.size() != TableRow.ARITY) {
            throw new IllegalArgumentException("Table needs exactly " + TableRow.ARITY + " headers and widths");
        }
    }
}
