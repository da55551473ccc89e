package uk.gegc.copilotexport.features.export.domain.model.layout;

import java.util.List;
import java.util.stream.Stream;

/**
 * Ordered pages laid out against one page geometry. Always holds at least one page.
 */
public record PaginatedDocument(PageLayout layout, List<Page> pages) {
    public PaginatedDocument {
        if (layout == null) {
            throw new IllegalArgumentException("Layout cannot be null");
        }
        if (pages == null || pages.isEmpty()) {
            throw new IllegalArgumentException("A document needs at least one page");
        }
        pages = List.copyOf(pages);
    }

    public int pageCount() {
        return pages.size();
    }

    /**
     * All blocks in page order, then placement order.
     */
    public Stream<PageBlock> blocks() {
        return pages.stream()
                .flatMap(page -> page.blocks().stream())
                .map(PlacedBlock::block);
    }

    public List<TextBlock> textBlocks(BlockKind kind) {
        return blocks()
                .filter(TextBlock.class::isInstance)
                .map(TextBlock.class::cast)
                .filter(block -> block.kind() == kind)
                .toList();
    }

    public List<ImageSlice> imageSlices() {
        return blocks()
                .filter(ImageSlice.class::isInstance)
                .map(ImageSlice.class::cast)
                .toList();
    }
}
