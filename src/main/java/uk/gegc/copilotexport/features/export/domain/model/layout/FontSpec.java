package uk.gegc.copilotexport.features.export.domain.model.layout;

/**
 * Font descriptor for measurement and rendering. The family is always Helvetica.
 */
public record FontSpec(FontStyle style, float size) {

    public static FontSpec bold(float size) {
        return new FontSpec(FontStyle.BOLD, size);
    }

    public static FontSpec normal(float size) {
        return new FontSpec(FontStyle.NORMAL, size);
    }

    public static FontSpec italic(float size) {
        return new FontSpec(FontStyle.ITALIC, size);
    }
}
