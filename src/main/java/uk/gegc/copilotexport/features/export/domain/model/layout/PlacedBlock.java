package uk.gegc.copilotexport.features.export.domain.model.layout;

/**
 * A block together with its top offset from the upper edge of the usable page area.
 */
public record PlacedBlock(PageBlock block, float offset) {
}
