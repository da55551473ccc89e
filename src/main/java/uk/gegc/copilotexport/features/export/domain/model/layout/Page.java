package uk.gegc.copilotexport.features.export.domain.model.layout;

import java.util.List;

/**
 * A closed page. Blocks are kept in placement order.
 */
public record Page(int index, List<PlacedBlock> blocks) {
    public Page {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public float usedHeight() {
        return blocks.stream()
                .map(placed -> placed.offset() + placed.block().height())
                .reduce(0f, Math::max);
    }
}
