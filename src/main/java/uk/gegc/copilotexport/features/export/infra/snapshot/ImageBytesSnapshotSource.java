package uk.gegc.copilotexport.features.export.infra.snapshot;

import uk.gegc.copilotexport.features.export.application.SnapshotSource;
import uk.gegc.copilotexport.features.export.domain.exception.SourceUnavailableException;
import uk.gegc.copilotexport.features.export.domain.model.Snapshot;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Snapshot source backed by an encoded image (PNG, JPEG, ...) that a client already rendered.
 * Decoding happens on the given executor.
 */
public class ImageBytesSnapshotSource implements SnapshotSource {

    private final byte[] imageBytes;
    private final String description;
    private final Executor executor;

    public ImageBytesSnapshotSource(byte[] imageBytes, String description, Executor executor) {
        this.imageBytes = imageBytes != null ? imageBytes : new byte[0];
        this.description = description;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Snapshot> capture() {
        return CompletableFuture.supplyAsync(this::decode, executor);
    }

    @Override
    public String description() {
        return description;
    }

    private Snapshot decode() {
        if (imageBytes.length == 0) {
            throw new SourceUnavailableException("Snapshot " + description + " is empty");
        }
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        } catch (IOException e) {
            throw new SourceUnavailableException("Snapshot " + description + " could not be decoded", e);
        }
        if (image == null) {
            throw new SourceUnavailableException("Snapshot " + description + " is not a supported image format");
        }
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new SourceUnavailableException("Snapshot " + description + " has no pixels");
        }
        return new Snapshot(image);
    }
}
