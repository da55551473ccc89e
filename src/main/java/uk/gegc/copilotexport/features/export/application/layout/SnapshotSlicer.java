package uk.gegc.copilotexport.features.export.application.layout;

import org.springframework.stereotype.Component;
import uk.gegc.copilotexport.features.export.domain.exception.MeasurementException;
import uk.gegc.copilotexport.features.export.domain.model.Snapshot;
import uk.gegc.copilotexport.features.export.domain.model.layout.ImageSlice;
import uk.gegc.copilotexport.features.export.domain.model.layout.PaginatedDocument;

/**
 * Scales a snapshot to the usable page width and cuts it into vertical bands, one per page.
 *
 * <p>Every band takes either the rest of the current page or the rest of the image, and a new
 * page is opened whenever image remains. Source pixel bands are contiguous and cover the whole
 * bitmap exactly once.
 */
@Component
public class SnapshotSlicer {

    private static final double EPSILON = 1e-6;

    public PaginatedDocument slice(Snapshot snapshot, PageComposer composer) {
        float pageWidth = composer.layout().usableWidth();
        if (!(pageWidth > 0f)) {
            throw new MeasurementException("Usable page width must be positive but was " + pageWidth);
        }

        double scale = (double) pageWidth / snapshot.width();
        double scaledHeight = snapshot.height() * scale;
        double consumed = 0;
        int sourceY = 0;

        while (scaledHeight - consumed > EPSILON) {
            double remaining = composer.remainingHeight();
            if (remaining <= EPSILON) {
                composer.breakPage();
                remaining = composer.remainingHeight();
            }

            double sliceHeight = Math.min(remaining, scaledHeight - consumed);
            double end = consumed + sliceHeight;
            boolean last = scaledHeight - end <= EPSILON;

            int sourceEnd = last
                    ? snapshot.height()
                    : (int) Math.min(snapshot.height(), Math.round(end / scale));
            sourceEnd = Math.max(sourceY, sourceEnd);

            composer.place(new ImageSlice(snapshot, sourceY, sourceEnd - sourceY, pageWidth, (float) sliceHeight));
            consumed = end;
            sourceY = sourceEnd;

            if (!last) {
                composer.breakPage();
            }
        }
        return composer.finish();
    }
}
