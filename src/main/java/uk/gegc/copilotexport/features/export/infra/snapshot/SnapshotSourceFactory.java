package uk.gegc.copilotexport.features.export.infra.snapshot;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import uk.gegc.copilotexport.features.export.application.SnapshotSource;

import java.util.concurrent.Executor;

@Component
public class SnapshotSourceFactory {

    private final Executor exportTaskExecutor;

    public SnapshotSourceFactory(@Qualifier("exportTaskExecutor") Executor exportTaskExecutor) {
        this.exportTaskExecutor = exportTaskExecutor;
    }

    public SnapshotSource fromImageBytes(byte[] imageBytes, String description) {
        return new ImageBytesSnapshotSource(imageBytes, description, exportTaskExecutor);
    }
}
