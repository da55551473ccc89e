package uk.gegc.copilotexport.features.export.application.layout;

import org.apache.pdfbox.pdmodel.font.PDType1Font;
import uk.gegc.copilotexport.features.export.domain.model.layout.FontStyle;

/**
 * Maps font treatments to the PDF standard-14 Helvetica faces.
 * Measurement and rendering must use the same faces.
 */
public final class PdfFonts {

    private PdfFonts() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static PDType1Font of(FontStyle style) {
        return switch (style) {
            case BOLD -> PDType1Font.HELVETICA_BOLD;
            case NORMAL -> PDType1Font.HELVETICA;
            case ITALIC -> PDType1Font.HELVETICA_OBLIQUE;
        };
    }
}
