package uk.gegc.copilotexport.features.export.infra.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import uk.gegc.copilotexport.features.export.application.ExportSink;
import uk.gegc.copilotexport.features.export.config.ExportProperties;
import uk.gegc.copilotexport.features.export.infra.ExportMediaTypeResolver;
import uk.gegc.copilotexport.features.export.infra.sink.FallbackExportSink;
import uk.gegc.copilotexport.features.export.infra.sink.FileSystemExportSink;
import uk.gegc.copilotexport.features.export.infra.sink.InMemoryExportSink;

import java.nio.file.Path;

/**
 * Exports are written to the configured directory, and kept in a bounded in-memory store
 * when that directory cannot be created or written to.
 */
@Configuration
@Slf4j
public class ExportSinkConfig {

    @Bean
    public ExportSink exportSink(ExportProperties properties, ExportMediaTypeResolver mediaTypeResolver) {
        FileSystemExportSink fileSystemSink =
                new FileSystemExportSink(Path.of(properties.getOutputDir()), mediaTypeResolver);
        ExportProperties.Memory memory = properties.getMemory();
        log.info("Export sink configured - Directory: {}, Fallback: in-memory (max {} exports, {} bytes)",
                fileSystemSink.directory(), memory.getMaxEntries(), memory.getMaxBytes());
        return new FallbackExportSink(fileSystemSink,
                new InMemoryExportSink(memory.getMaxEntries(), memory.getMaxBytes()));
    }
}
