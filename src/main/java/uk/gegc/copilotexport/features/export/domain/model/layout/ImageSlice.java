package uk.gegc.copilotexport.features.export.domain.model.layout;

import uk.gegc.copilotexport.features.export.domain.model.Snapshot;

/**
 * A vertical band of a snapshot, drawn at page width.
 *
 * @param snapshot     the source bitmap
 * @param sourceY      first source pixel row of the band (inclusive)
 * @param sourceHeight number of source pixel rows in the band
 * @param width        drawn width in page units
 * @param height       drawn height in page units
 */
public record ImageSlice(Snapshot snapshot, int sourceY, int sourceHeight, float width, float height)
        implements PageBlock {

    @Override
    public BlockKind kind() {
        return BlockKind.IMAGE_SLICE;
    }

    public int sourceEndY() {
        return sourceY + sourceHeight;
    }
}
