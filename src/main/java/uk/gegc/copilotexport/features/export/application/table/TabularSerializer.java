package uk.gegc.copilotexport.features.export.application.table;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.copilotexport.features.export.application.ExportTimestampFormatter;
import uk.gegc.copilotexport.features.export.config.ExportProperties;
import uk.gegc.copilotexport.features.export.domain.model.TranscriptEntry;
import uk.gegc.copilotexport.features.export.domain.model.table.SpreadsheetTable;
import uk.gegc.copilotexport.features.export.domain.model.table.TableRow;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps transcript entries 1:1 to fixed-schema rows, in input order.
 */
@Component
@RequiredArgsConstructor
public class TabularSerializer {

    public static final String SHEET_NAME = "Chat Export";

    public static final List<String> HEADERS = List.of(
            "Message #", "Sender", "Content", "Timestamp", "Confidence", "Project Context");

    /**
     * Column widths in characters, independent of content.
     */
    public static final List<Integer> COLUMN_WIDTHS = List.of(10, 15, 80, 20, 12, 20);

    private final ExportProperties properties;
    private final ExportTimestampFormatter timestampFormatter;

    public SpreadsheetTable serialize(List<TranscriptEntry> entries) {
        List<TableRow> rows = new ArrayList<>(entries.size());
        int ordinal = 1;
        for (TranscriptEntry entry : entries) {
            rows.add(new TableRow(
                    ordinal++,
                    properties.displayName(entry.sender()),
                    entry.content(),
                    entry.timestamp() != null ? timestampFormatter.format(entry.timestamp()) : null,
                    entry.confidence(),
                    entry.projectContext()
            ));
        }
        return new SpreadsheetTable(SHEET_NAME, HEADERS, COLUMN_WIDTHS, rows);
    }
}
