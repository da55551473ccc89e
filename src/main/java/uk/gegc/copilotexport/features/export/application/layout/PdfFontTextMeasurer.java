package uk.gegc.copilotexport.features.export.application.layout;

import org.apache.pdfbox.pdmodel.font.PDFont;
import org.springframework.stereotype.Component;
import uk.gegc.copilotexport.features.export.domain.exception.MeasurementException;
import uk.gegc.copilotexport.features.export.domain.model.layout.FontSpec;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link TextMeasurer} backed by the Helvetica AFM metrics shipped with PDFBox.
 * Characters the font cannot encode are replaced with '?' so every returned line can be shown as is.
 */
@Component
public class PdfFontTextMeasurer implements TextMeasurer {

    private static final char REPLACEMENT = '?';

    @Override
    public List<String> wrap(String text, float maxWidth, FontSpec font) {
        validate(maxWidth, font);
        PDFont pdFont = PdfFonts.of(font.style());
        String normalized = sanitize(text == null ? "" : text, pdFont);

        List<String> lines = new ArrayList<>();
        for (String paragraph : normalized.split("\n", -1)) {
            wrapParagraph(paragraph, maxWidth, font.size(), pdFont, lines);
        }
        return List.copyOf(lines);
    }

    @Override
    public float width(String text, FontSpec font) {
        validate(Float.MAX_VALUE, font);
        PDFont pdFont = PdfFonts.of(font.style());
        return widthOf(sanitize(text == null ? "" : text, pdFont), font.size(), pdFont);
    }

    private void wrapParagraph(String paragraph, float maxWidth, float fontSize, PDFont font, List<String> lines) {
        String trimmed = paragraph.strip();
        if (trimmed.isEmpty()) {
            lines.add("");
            return;
        }

        StringBuilder line = new StringBuilder();
        for (String word : trimmed.split(" +")) {
            if (line.length() > 0) {
                if (widthOf(line + " " + word, fontSize, font) <= maxWidth) {
                    line.append(' ').append(word);
                    continue;
                }
                lines.add(line.toString());
                line.setLength(0);
            }

            if (widthOf(word, fontSize, font) <= maxWidth) {
                line.append(word);
            } else {
                int tail = breakToken(word, maxWidth, fontSize, font, lines);
                line.append(word, tail, word.length());
            }
        }
        if (line.length() > 0) {
            lines.add(line.toString());
        }
    }

    /**
     * Hard-breaks a token wider than the line in a single pass, at code point boundaries.
     * Every full line goes to {@code lines}; a line holds at least one code point.
     *
     * @return start index of the unfinished last piece
     */
    private int breakToken(String token, float maxWidth, float fontSize, PDFont font, List<String> lines) {
        int start = 0;
        // Glyph space units, summed in the same order PDFBox sums a whole string
        float units = 0f;
        int index = 0;
        while (index < token.length()) {
            int next = index + Character.charCount(token.codePointAt(index));
            float glyphUnits = unitsOf(token.substring(index, next), font);
            if ((units + glyphUnits) / 1000 * fontSize > maxWidth && index > start) {
                lines.add(token.substring(start, index));
                start = index;
                units = 0f;
            }
            units += glyphUnits;
            index = next;
        }
        return start;
    }

    private float widthOf(String text, float fontSize, PDFont font) {
        return unitsOf(text, font) / 1000 * fontSize;
    }

    private float unitsOf(String text, PDFont font) {
        try {
            return font.getStringWidth(text);
        } catch (IOException e) {
            throw new MeasurementException("Failed to measure text with font " + font.getName(), e);
        }
    }

    private String sanitize(String text, PDFont font) {
        String unified = text.replace("\r\n", "\n").replace('\r', '\n');
        StringBuilder out = new StringBuilder(unified.length());
        unified.codePoints().forEach(codePoint -> {
            if (codePoint == '\n') {
                out.append('\n');
            } else if (Character.isWhitespace(codePoint) || Character.isISOControl(codePoint)) {
                out.append(' ');
            } else if (canEncode(codePoint, font)) {
                out.appendCodePoint(codePoint);
            } else {
                out.append(REPLACEMENT);
            }
        });
        return out.toString();
    }

    private boolean canEncode(int codePoint, PDFont font) {
        try {
            font.encode(new String(Character.toChars(codePoint)));
            return true;
        } catch (IllegalArgumentException | IOException e) {
            return false;
        }
    }

    private void validate(float maxWidth, FontSpec font) {
        if (font == null || font.style() == null) {
            throw new MeasurementException("Font must be specified");
        }
        if (!(font.size() > 0f)) {
            throw new MeasurementException("Font size must be positive but was " + font.size());
        }
        if (!(maxWidth > 0f)) {
            throw new MeasurementException("Maximum line width must be positive but was " + maxWidth);
        }
    }
}
