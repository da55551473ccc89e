package uk.gegc.copilotexport.features.export.domain.model.layout;

/**
 * A single, already wrapped line of text.
 */
public record TextBlock(BlockKind kind, String text, FontSpec font, float height) implements PageBlock {
    public TextBlock {
        if (kind == null || kind == BlockKind.IMAGE_SLICE) {
            throw new IllegalArgumentException("Text block requires a text kind but was " + kind);
        }
        if (text == null) {
            text = "";
        }
        if (font == null) {
            throw new IllegalArgumentException("Font cannot be null");
        }
    }
}
