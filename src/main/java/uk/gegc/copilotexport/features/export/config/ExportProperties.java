package uk.gegc.copilotexport.features.export.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import uk.gegc.copilotexport.features.export.domain.model.Sender;
import uk.gegc.copilotexport.features.export.domain.model.layout.PageLayout;

import java.nio.file.Path;

@Component
@Data
@Validated
@ConfigurationProperties(prefix = "copilot.export")
public class ExportProperties {

    /**
     * Display name used for assistant messages in headers and the Sender column.
     */
    @NotBlank
    private String assistantName = "Work Buddy";

    /**
     * Display name used for user messages.
     */
    @NotBlank
    private String userName = "You";

    @NotBlank
    private String transcriptTitle = "Work Buddy Chat Export";

    @NotBlank
    private String snapshotTitle = "Insights Dashboard Export";

    @NotBlank
    private String defaultTranscriptFilename = "work-buddy-chat";

    @NotBlank
    private String defaultSnapshotFilename = "insights-dashboard";

    /**
     * Prefix for single-message exports; the entry id is appended.
     */
    @NotBlank
    private String messageFilenamePrefix = "work-buddy-message-";

    /**
     * Pattern for message and exported-at timestamps, rendered in the zone of the application clock.
     */
    @NotBlank
    private String dateTimePattern = "yyyy-MM-dd HH:mm:ss";

    /**
     * Directory the file system sink writes exports to.
     */
    @NotBlank
    private String outputDir = Path.of(System.getProperty("java.io.tmpdir"), "copilot-exports").toString();

    @Valid
    @NotNull
    private Memory memory = new Memory();

    @Valid
    @NotNull
    private Typography typography = new Typography();

    @Valid
    @NotNull
    private Margins margins = new Margins();

    public String displayName(Sender sender) {
        return sender == Sender.USER ? userName : assistantName;
    }

    public PageLayout transcriptLayout() {
        return PageLayout.a4(margins.getTranscript());
    }

    public PageLayout snapshotLayout() {
        return PageLayout.a4(margins.getSnapshot());
    }

    /**
     * Bounds of the in-memory fallback store.
     */
    @Data
    public static class Memory {
        @Min(value = 1, message = "copilot.export.memory.max-entries must be at least 1")
        private int maxEntries = 20;

        @Min(value = 1, message = "copilot.export.memory.max-bytes must be at least 1")
        private long maxBytes = 64L * 1024 * 1024;
    }

    @Data
    public static class Typography {
        private float titleSize = 16f;
        private float exportedAtSize = 10f;
        private float headerSize = 12f;
        private float bodySize = 10f;
        private float timestampSize = 8f;

        /**
         * Line height as a multiple of the font size.
         */
        @DecimalMin("1.0")
        private float lineSpacing = 1.2f;

        /**
         * Vertical space between two transcript entries, in points.
         */
        @DecimalMin("0.0")
        private float entrySpacing = 14f;
    }

    @Data
    public static class Margins {
        /**
         * Page margin for transcript documents, in points.
         */
        @DecimalMin("0.0")
        private float transcript = 50f;

        /**
         * Page margin for snapshot documents, in points (10 mm).
         */
        @DecimalMin("0.0")
        private float snapshot = 28.35f;
    }
}
