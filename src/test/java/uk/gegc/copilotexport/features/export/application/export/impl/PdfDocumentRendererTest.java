package uk.gegc.copilotexport.features.export.application.export.impl;

import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;
import uk.gegc.copilotexport.features.export.application.ExportTimestampFormatter;
import uk.gegc.copilotexport.features.export.application.layout.PageComposer;
import uk.gegc.copilotexport.features.export.application.layout.PdfFontTextMeasurer;
import uk.gegc.copilotexport.features.export.application.layout.SnapshotSlicer;
import uk.gegc.copilotexport.features.export.application.layout.TranscriptPaginator;
import uk.gegc.copilotexport.features.export.config.ExportProperties;
import uk.gegc.copilotexport.features.export.domain.model.ExportFormat;
import uk.gegc.copilotexport.features.export.domain.model.Snapshot;
import uk.gegc.copilotexport.features.export.domain.model.TranscriptEntry;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportFile;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportPayload;
import uk.gegc.copilotexport.features.export.domain.model.layout.BlockKind;
import uk.gegc.copilotexport.features.export.domain.model.layout.FontSpec;
import uk.gegc.copilotexport.features.export.domain.model.layout.PageLayout;
import uk.gegc.copilotexport.features.export.domain.model.layout.PaginatedDocument;
import uk.gegc.copilotexport.features.export.domain.model.layout.TextBlock;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Execution(ExecutionMode.CONCURRENT)
@DisplayName("PdfDocumentRenderer Tests")
class PdfDocumentRendererTest {

    private PdfDocumentRenderer renderer;
    private TranscriptPaginator paginator;

    @BeforeEach
    void setUp() {
        renderer = new PdfDocumentRenderer();
        ExportProperties properties = new ExportProperties();
        Clock clock = Clock.fixed(Instant.parse("2024-03-01T09:00:00Z"), ZoneOffset.UTC);
        paginator = new TranscriptPaginator(
                new PdfFontTextMeasurer(), properties, new ExportTimestampFormatter(properties, clock));
    }

    @Test
    @DisplayName("supports: only DOCUMENT")
    void supports_documentOnly() {
        assertThat(renderer.supports(ExportFormat.DOCUMENT)).isTrue();
        assertThat(renderer.supports(ExportFormat.TABLE)).isFalse();
    }

    @Test
    @DisplayName("render: transcript text is readable back from the PDF")
    void render_transcript_textExtractable() throws Exception {
        // Given
        PaginatedDocument document = paginator.paginate(List.of(
                TranscriptEntry.user("1", "Hi", Instant.parse("2024-03-01T10:15:30Z")),
                TranscriptEntry.assistant("2", "Hello! How can I help with Apollo?", null)
        ));

        // When
        ExportFile file = renderer.render(ExportPayload.ofDocument(document, "chat.pdf"));

        // Then
        assertThat(file.filename()).isEqualTo("chat.pdf");
        assertThat(file.contentType()).isEqualTo("application/pdf");
        assertThat(file.contentLength()).isPositive();
        try (InputStream in = file.contentSupplier().get(); PDDocument pdf = PDDocument.load(in)) {
            String text = new PDFTextStripper().getText(pdf);
            assertThat(pdf.getNumberOfPages()).isEqualTo(1);
            assertThat(text).contains("You:", "Hi", "Time: 2024-03-01 10:15:30", "Work Buddy:", "How can I help with Apollo?");
        }
    }

    @Test
    @DisplayName("render: one PDF page per laid-out page, title in document info")
    void render_multiPage_pageCountAndTitle() throws Exception {
        // Given
        PageComposer composer = new PageComposer(PageLayout.a4(50f));
        composer.place(new TextBlock(BlockKind.TITLE, "Work Buddy Chat Export", FontSpec.bold(16f), 19.2f));
        PaginatedDocument document = paginator.paginate(
                List.of(TranscriptEntry.assistant("1", "line ".repeat(2000), null)), composer);

        // When
        ExportFile file = renderer.render(ExportPayload.ofDocument(document, "long.pdf"));

        // Then
        try (InputStream in = file.contentSupplier().get(); PDDocument pdf = PDDocument.load(in)) {
            assertThat(pdf.getNumberOfPages()).isEqualTo(document.pageCount()).isGreaterThan(1);
            assertThat(pdf.getDocumentInformation().getTitle()).isEqualTo("Work Buddy Chat Export");
            assertThat(pdf.getPage(0).getMediaBox().getWidth()).isCloseTo(PageLayout.A4_WIDTH, within(0.01f));
        }
    }

    @Test
    @DisplayName("render: every snapshot slice becomes an image on its own page")
    void render_snapshotSlices_imagePerPage() throws Exception {
        // Given
        BufferedImage image = new BufferedImage(80, 250, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        graphics.setColor(Color.ORANGE);
        graphics.fillRect(0, 0, 80, 250);
        graphics.dispose();
        PaginatedDocument document = new SnapshotSlicer().slice(
                new Snapshot(image), new PageComposer(new PageLayout(70f, 100f, 0f, 0f, 0f, 0f)));

        // When
        ExportFile file = renderer.render(ExportPayload.ofDocument(document, "dashboard.pdf"));

        // Then
        try (InputStream in = file.contentSupplier().get(); PDDocument pdf = PDDocument.load(in)) {
            assertThat(pdf.getNumberOfPages()).isEqualTo(3);
            for (PDPage page : pdf.getPages()) {
                List<COSName> names = toList(page.getResources().getXObjectNames());
                assertThat(names).hasSize(1);
                assertThat(page.getResources().getXObject(names.get(0))).isInstanceOf(PDImageXObject.class);
            }
        }
    }

    private static List<COSName> toList(Iterable<COSName> names) {
        List<COSName> list = new ArrayList<>();
        names.forEach(list::add);
        return list;
    }
}
