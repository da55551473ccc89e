package uk.gegc.copilotexport.features.export.application;

import org.springframework.stereotype.Component;
import uk.gegc.copilotexport.features.export.config.ExportProperties;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

/**
 * Formats message and exported-at timestamps in the zone of the application clock.
 */
@Component
public class ExportTimestampFormatter {

    private final DateTimeFormatter formatter;

    public ExportTimestampFormatter(ExportProperties properties, Clock clock) {
        this.formatter = DateTimeFormatter.ofPattern(properties.getDateTimePattern())
                .withZone(clock.getZone());
    }

    /**
     * @return the formatted instant, or an empty string for {@code null}
     */
    public String format(Instant instant) {
        return instant != null ? formatter.format(instant) : "";
    }
}
