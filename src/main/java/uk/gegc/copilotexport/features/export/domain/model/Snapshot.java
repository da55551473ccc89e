package uk.gegc.copilotexport.features.export.domain.model;

import java.awt.image.BufferedImage;

/**
 * A fully captured bitmap of a rendered dashboard view.
 */
public record Snapshot(BufferedImage image) {
    public Snapshot {
        if (image == null) {
            throw new IllegalArgumentException("Snapshot image cannot be null");
        }
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new IllegalArgumentException("Snapshot must have positive dimensions");
        }
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }
}
