package uk.gegc.copilotexport.features.export.domain.model.export;

/**
 * Where a sink put an export.
 *
 * @param filename      stored filename
 * @param location      sink-specific location, e.g. an absolute path or {@code memory:<name>}
 * @param contentLength stored size in bytes
 */
public record SavedExport(String filename, String location, long contentLength) {
}
