package uk.gegc.copilotexport.features.export.domain.model.table;

/**
 * One fixed-arity spreadsheet row. Null optional values stay null here and
 * become empty cells when written.
 */
public record TableRow(
        int ordinal,
        String sender,
        String content,
        String timestamp,
        Double confidence,
        String projectContext
) {
    public static final int ARITY = 6;
}
