package uk.gegc.copilotexport.features.export.application.export.impl;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.springframework.stereotype.Component;
import uk.gegc.copilotexport.features.export.application.export.ExportRenderer;
import uk.gegc.copilotexport.features.export.application.layout.PdfFonts;
import uk.gegc.copilotexport.features.export.domain.exception.ExportRenderingException;
import uk.gegc.copilotexport.features.export.domain.model.ExportFormat;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportFile;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportPayload;
import uk.gegc.copilotexport.features.export.domain.model.layout.BlockKind;
import uk.gegc.copilotexport.features.export.domain.model.layout.ImageSlice;
import uk.gegc.copilotexport.features.export.domain.model.layout.Page;
import uk.gegc.copilotexport.features.export.domain.model.layout.PageLayout;
import uk.gegc.copilotexport.features.export.domain.model.layout.PaginatedDocument;
import uk.gegc.copilotexport.features.export.domain.model.layout.PlacedBlock;
import uk.gegc.copilotexport.features.export.domain.model.layout.TextBlock;
import uk.gegc.copilotexport.features.export.infra.ExportMediaTypeResolver;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Calendar;

/**
 * Draws a {@link PaginatedDocument} with PDFBox. Layout decisions are already final here:
 * every placed block is drawn at its offset, one PDF page per laid-out page.
 */
@Component
public class PdfDocumentRenderer implements ExportRenderer {

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.DOCUMENT;
    }

    @Override
    public ExportFile render(ExportPayload payload) {
        PaginatedDocument document = payload.document();
        try (PDDocument pdf = new PDDocument()) {
            PageLayout layout = document.layout();
            PDRectangle pageSize = new PDRectangle(layout.pageWidth(), layout.pageHeight());

            for (Page page : document.pages()) {
                PDPage pdPage = new PDPage(pageSize);
                pdf.addPage(pdPage);
                try (PDPageContentStream contentStream = new PDPageContentStream(pdf, pdPage)) {
                    for (PlacedBlock placed : page.blocks()) {
                        float top = layout.pageHeight() - layout.marginTop() - placed.offset();
                        if (placed.block() instanceof TextBlock text) {
                            writeLine(contentStream, text, layout.marginLeft(), top);
                        } else if (placed.block() instanceof ImageSlice slice) {
                            drawSlice(pdf, contentStream, slice, layout.marginLeft(), top);
                        }
                    }
                }
            }

            describe(pdf, document);
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            pdf.save(baos);
            byte[] bytes = baos.toByteArray();

            return new ExportFile(
                    payload.filename(),
                    ExportMediaTypeResolver.PDF,
                    () -> new ByteArrayInputStream(bytes),
                    bytes.length
            );
        } catch (IOException | IllegalArgumentException e) {
            throw new ExportRenderingException("Failed to render PDF export", e);
        }
    }

    private void writeLine(PDPageContentStream contentStream, TextBlock text, float x, float top) throws IOException {
        if (text.text().isEmpty()) {
            return;
        }
        float baseline = top - text.font().size();
        contentStream.beginText();
        contentStream.setFont(PdfFonts.of(text.font().style()), text.font().size());
        contentStream.newLineAtOffset(x, baseline);
        contentStream.showText(text.text());
        contentStream.endText();
    }

    private void drawSlice(PDDocument pdf, PDPageContentStream contentStream, ImageSlice slice,
                           float x, float top) throws IOException {
        if (slice.sourceHeight() == 0) {
            return;
        }
        BufferedImage source = slice.snapshot().image();
        BufferedImage band = source.getSubimage(0, slice.sourceY(), source.getWidth(), slice.sourceHeight());
        PDImageXObject image = LosslessFactory.createFromImage(pdf, band);
        contentStream.drawImage(image, x, top - slice.height(), slice.width(), slice.height());
    }

    private void describe(PDDocument pdf, PaginatedDocument document) {
        PDDocumentInformation info = pdf.getDocumentInformation();
        document.textBlocks(BlockKind.TITLE).stream()
                .findFirst()
                .ifPresent(title -> info.setTitle(title.text()));
        info.setCreator("copilot-export");
        info.setCreationDate(Calendar.getInstance());
    }
}
