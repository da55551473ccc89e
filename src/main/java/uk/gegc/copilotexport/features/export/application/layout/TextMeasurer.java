package uk.gegc.copilotexport.features.export.application.layout;

import uk.gegc.copilotexport.features.export.domain.model.layout.FontSpec;

import java.util.List;

/**
 * Wraps text into lines that fit a maximum width under given font metrics.
 * Implementations must be pure: identical inputs always give identical output.
 */
public interface TextMeasurer {

    /**
     * @return non-empty list of lines, each no wider than {@code maxWidth} unless it holds a single character
     * @throws uk.gegc.copilotexport.features.export.domain.exception.MeasurementException if the width or font make measurement impossible
     */
    List<String> wrap(String text, float maxWidth, FontSpec font);

    float width(String text, FontSpec font);
}
