package uk.gegc.copilotexport.features.export.application.layout;

import uk.gegc.copilotexport.features.export.domain.exception.MeasurementException;

/**
 * Tracks the current page index and the vertical offset inside the usable page area.
 * A block is never rejected: if it does not fit, it goes to the top of a fresh page.
 */
public class PageCursor {

    /**
     * Absorbs float rounding when a block is sized to exactly the remaining space.
     */
    static final float FIT_TOLERANCE = 0.001f;

    private final float usableHeight;
    private int pageIndex;
    private float offset;

    public PageCursor(float usableHeight) {
        if (!(usableHeight > 0f)) {
            throw new MeasurementException("Usable page height must be positive but was " + usableHeight);
        }
        this.usableHeight = usableHeight;
    }

    public Reservation reserve(float height) {
        return reserveAfterGap(0f, height);
    }

    /**
     * Reserves {@code height} after a {@code gap}. The gap is only consumed together with the block;
     * at the top of a page, or when a new page has to be opened, it is dropped.
     */
    public Reservation reserveAfterGap(float gap, float height) {
        if (height < 0f || gap < 0f) {
            throw new IllegalArgumentException("Heights cannot be negative");
        }
        if (offset == 0f) {
            // Empty page: place here even if the block overflows
            offset = height;
            return new Reservation(true, false, pageIndex, 0f);
        }
        float start = offset + gap;
        if (start + height <= usableHeight + FIT_TOLERANCE) {
            offset = start + height;
            return new Reservation(true, false, pageIndex, start);
        }
        pageIndex++;
        offset = height;
        return new Reservation(true, true, pageIndex, 0f);
    }

    public void breakPage() {
        pageIndex++;
        offset = 0f;
    }

    public float remainingHeight() {
        return Math.max(0f, usableHeight - offset);
    }

    public int pageIndex() {
        return pageIndex;
    }

    public float offset() {
        return offset;
    }

    public float usableHeight() {
        return usableHeight;
    }

    /**
     * @param fits          always true, kept for callers that branch on it
     * @param newPageOpened the block starts a page that did not exist before this call
     * @param pageIndex     page the block was placed on
     * @param offset        top of the block within the usable area
     */
    public record Reservation(boolean fits, boolean newPageOpened, int pageIndex, float offset) {
    }
}
