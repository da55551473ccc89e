package uk.gegc.copilotexport.features.export.application.layout;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.copilotexport.features.export.application.ExportTimestampFormatter;
import uk.gegc.copilotexport.features.export.config.ExportProperties;
import uk.gegc.copilotexport.features.export.domain.exception.MeasurementException;
import uk.gegc.copilotexport.features.export.domain.model.TranscriptEntry;
import uk.gegc.copilotexport.features.export.domain.model.layout.BlockKind;
import uk.gegc.copilotexport.features.export.domain.model.layout.FontSpec;
import uk.gegc.copilotexport.features.export.domain.model.layout.PaginatedDocument;
import uk.gegc.copilotexport.features.export.domain.model.layout.TextBlock;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out a chat transcript: per entry a bold sender header, the wrapped content lines,
 * and an italic timestamp line when the entry has one.
 */
@Component
@RequiredArgsConstructor
public class TranscriptPaginator {

    private final TextMeasurer textMeasurer;
    private final ExportProperties properties;
    private final ExportTimestampFormatter timestampFormatter;

    public PaginatedDocument paginate(List<TranscriptEntry> entries) {
        return paginate(entries, new PageComposer(properties.transcriptLayout()));
    }

    /**
     * Appends the transcript to {@code composer} and finishes it.
     * All entries are measured before the first block is placed.
     */
    public PaginatedDocument paginate(List<TranscriptEntry> entries, PageComposer composer) {
        float maxWidth = composer.layout().usableWidth();
        if (!(maxWidth > 0f)) {
            throw new MeasurementException("Usable page width must be positive but was " + maxWidth);
        }

        List<List<TextBlock>> laidOut = new ArrayList<>(entries.size());
        for (TranscriptEntry entry : entries) {
            laidOut.add(blocksFor(entry, maxWidth));
        }

        float entrySpacing = properties.getTypography().getEntrySpacing();
        for (List<TextBlock> entryBlocks : laidOut) {
            composer.placeAfterGap(entrySpacing, entryBlocks.get(0));
            for (TextBlock block : entryBlocks.subList(1, entryBlocks.size())) {
                composer.place(block);
            }
        }
        return composer.finish();
    }

    private List<TextBlock> blocksFor(TranscriptEntry entry, float maxWidth) {
        ExportProperties.Typography typography = properties.getTypography();
        FontSpec headerFont = FontSpec.bold(typography.getHeaderSize());
        FontSpec bodyFont = FontSpec.normal(typography.getBodySize());
        FontSpec timestampFont = FontSpec.italic(typography.getTimestampSize());

        List<TextBlock> blocks = new ArrayList<>();
        // The header is a single line and is never wrapped
        String header = String.join(" ",
                textMeasurer.wrap(properties.displayName(entry.sender()) + ":", Float.MAX_VALUE, headerFont));
        blocks.add(line(BlockKind.HEADER, header, headerFont));

        for (String contentLine : textMeasurer.wrap(entry.content(), maxWidth, bodyFont)) {
            blocks.add(line(BlockKind.CONTENT, contentLine, bodyFont));
        }

        if (entry.timestamp() != null) {
            String time = "Time: " + timestampFormatter.format(entry.timestamp());
            for (String timeLine : textMeasurer.wrap(time, maxWidth, timestampFont)) {
                blocks.add(line(BlockKind.TIMESTAMP, timeLine, timestampFont));
            }
        }
        return blocks;
    }

    private TextBlock line(BlockKind kind, String text, FontSpec font) {
        return new TextBlock(kind, text, font, font.size() * properties.getTypography().getLineSpacing());
    }
}
