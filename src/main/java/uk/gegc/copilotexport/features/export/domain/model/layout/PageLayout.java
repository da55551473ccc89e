package uk.gegc.copilotexport.features.export.domain.model.layout;

/**
 * Page geometry in PDF points.
 */
public record PageLayout(
        float pageWidth,
        float pageHeight,
        float marginTop,
        float marginBottom,
        float marginLeft,
        float marginRight
) {
    public static final float A4_WIDTH = 595.28f;
    public static final float A4_HEIGHT = 841.89f;

    public static PageLayout a4(float margin) {
        return new PageLayout(A4_WIDTH, A4_HEIGHT, margin, margin, margin, margin);
    }

    public float usableWidth() {
        return pageWidth - marginLeft - marginRight;
    }

    public float usableHeight() {
        return pageHeight - marginTop - marginBottom;
    }
}
