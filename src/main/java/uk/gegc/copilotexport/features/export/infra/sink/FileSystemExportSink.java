package uk.gegc.copilotexport.features.export.infra.sink;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.copilotexport.features.export.application.ExportSink;
import uk.gegc.copilotexport.features.export.domain.exception.SaveErrorKind;
import uk.gegc.copilotexport.features.export.domain.model.export.ExportFile;
import uk.gegc.copilotexport.features.export.domain.model.export.SavedExport;
import uk.gegc.copilotexport.features.export.infra.ExportMediaTypeResolver;
import uk.gegc.copilotexport.shared.result.Result;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Writes exports into one directory. Content goes to a temporary file first and is moved into
 * place once complete, so a failed save never leaves a partial export under the final name.
 */
@Slf4j
public class FileSystemExportSink implements ExportSink {

    private final Path directory;
    private final ExportMediaTypeResolver mediaTypeResolver;

    public FileSystemExportSink(Path directory, ExportMediaTypeResolver mediaTypeResolver) {
        this.directory = directory.toAbsolutePath().normalize();
        this.mediaTypeResolver = mediaTypeResolver;
    }

    @Override
    public Result<SavedExport, SaveErrorKind> save(ExportFile file) {
        if (!isSafeFilename(file.filename())) {
            return Result.failure(SaveErrorKind.REJECTED, "Unsafe export filename: " + file.filename());
        }
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            return Result.failure(SaveErrorKind.TARGET_UNAVAILABLE,
                    "Export directory " + directory + " is not available: " + e.getMessage());
        }

        Path target = directory.resolve(file.filename());
        Path temp;
        try {
            temp = Files.createTempFile(directory, ".export-", ".part");
        } catch (IOException e) {
            // Nothing can be created in the directory at all
            return Result.failure(SaveErrorKind.TARGET_UNAVAILABLE,
                    "Export directory " + directory + " is not writable: " + e.getMessage());
        }
        try {
            try (InputStream in = file.contentSupplier().get()) {
                Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
            }
            moveIntoPlace(temp, target);
            long size = Files.size(target);
            log.debug("Saved export: path={}, bytes={}", target, size);
            return Result.ok(new SavedExport(file.filename(), target.toString(), size));
        } catch (IOException | UncheckedIOException e) {
            String message = "Failed to write export " + target + ": " + e.getMessage();
            deleteQuietly(temp, e);
            return Result.failure(SaveErrorKind.WRITE_FAILED, message);
        }
    }

    @Override
    public Optional<ExportFile> open(String filename) {
        if (!isSafeFilename(filename)) {
            return Optional.empty();
        }
        Path path = directory.resolve(filename);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            long size = Files.size(path);
            return Optional.of(new ExportFile(
                    filename,
                    mediaTypeResolver.contentTypeForFilename(filename),
                    () -> {
                        try {
                            return Files.newInputStream(path);
                        } catch (IOException e) {
                            throw new UncheckedIOException(e);
                        }
                    },
                    size));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read export " + path, e);
        }
    }

    public Path directory() {
        return directory;
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp, Exception original) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanupFailure) {
            original.addSuppressed(cleanupFailure);
            log.warn("Could not remove temporary export file {}", temp, original);
        }
    }

    private boolean isSafeFilename(String filename) {
        if (filename == null || filename.isBlank()
                || filename.contains("/") || filename.contains("\\")
                || filename.equals(".") || filename.equals("..")) {
            return false;
        }
        return directory.resolve(filename).normalize().getParent().equals(directory);
    }
}
