package uk.gegc.copilotexport.features.export.application;

import uk.gegc.copilotexport.features.export.domain.model.Snapshot;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to a renderable surface. Capture is asynchronous and completes only once the whole bitmap is available.
 */
public interface SnapshotSource {

    /**
     * @return a future completing with the bitmap, or exceptionally if the surface could not be captured
     */
    CompletableFuture<Snapshot> capture();

    default String description() {
        return getClass().getSimpleName();
    }
}
