package uk.gegc.copilotexport.features.export.domain.model.layout;

/**
 * A unit of laid-out content with a fixed height in page units (points).
 * Blocks are never split across pages.
 */
public sealed interface PageBlock permits TextBlock, ImageSlice {

    BlockKind kind();

    float height();
}
