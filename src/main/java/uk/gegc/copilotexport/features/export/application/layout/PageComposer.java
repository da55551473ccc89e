package uk.gegc.copilotexport.features.export.application.layout;

import uk.gegc.copilotexport.features.export.domain.model.layout.Page;
import uk.gegc.copilotexport.features.export.domain.model.layout.PageBlock;
import uk.gegc.copilotexport.features.export.domain.model.layout.PageLayout;
import uk.gegc.copilotexport.features.export.domain.model.layout.PaginatedDocument;
import uk.gegc.copilotexport.features.export.domain.model.layout.PlacedBlock;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects placed blocks into pages as a {@link PageCursor} hands out positions.
 * Single use: once {@link #finish()} is called the composer rejects further blocks.
 */
public class PageComposer {

    private final PageLayout layout;
    private final PageCursor cursor;
    private final List<Page> closedPages = new ArrayList<>();
    private List<PlacedBlock> currentBlocks = new ArrayList<>();
    private boolean finished;

    public PageComposer(PageLayout layout) {
        if (layout == null) {
            throw new IllegalArgumentException("Layout cannot be null");
        }
        this.layout = layout;
        this.cursor = new PageCursor(layout.usableHeight());
    }

    public PlacedBlock place(PageBlock block) {
        return placeAfterGap(0f, block);
    }

    public PlacedBlock placeAfterGap(float gap, PageBlock block) {
        ensureOpen();
        PageCursor.Reservation reservation = cursor.reserveAfterGap(gap, block.height());
        if (reservation.newPageOpened()) {
            closeCurrentPage();
        }
        PlacedBlock placed = new PlacedBlock(block, reservation.offset());
        currentBlocks.add(placed);
        return placed;
    }

    public void breakPage() {
        ensureOpen();
        closeCurrentPage();
        cursor.breakPage();
    }

    public float remainingHeight() {
        return cursor.remainingHeight();
    }

    public int currentPageIndex() {
        return cursor.pageIndex();
    }

    public PageLayout layout() {
        return layout;
    }

    public PaginatedDocument finish() {
        ensureOpen();
        finished = true;
        closeCurrentPage();
        return new PaginatedDocument(layout, closedPages);
    }

    private void closeCurrentPage() {
        closedPages.add(new Page(closedPages.size(), currentBlocks));
        currentBlocks = new ArrayList<>();
    }

    private void ensureOpen() {
        if (finished) {
            throw new IllegalStateException("Document already finished");
        }
    }
}
