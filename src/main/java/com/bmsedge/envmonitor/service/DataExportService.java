package com.bmsedge.envmonitor.service;

import com.bmsedge.envmonitor.dto.TelemetryDocumentDTO;
import com.bmsedge.envmonitor.exception.DataExportException;
import com.bmsedge.envmonitor.exception.StoreQueryException;
import com.bmsedge.envmonitor.model.QueryWindow;
import com.bmsedge.envmonitor.model.TelemetryDocument;
import com.bmsedge.envmonitor.model.TelemetryFields;
import com.bmsedge.envmonitor.repository.TelemetryStoreGateway;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

@Service
@Slf4j
public class DataExportService {

    public static final String DEFAULT_EXPORT_FILE = "time_series_export.json";

    private final TelemetryStoreGateway gateway;
    private final ObjectMapper exportMapper;
    private final Path exportDir;

    public DataExportService(TelemetryStoreGateway gateway,
                             ObjectMapper objectMapper,
                             @Value("${telemetry.export.dir:exports}") String exportDir) {
        this.gateway = gateway;
        this.exportDir = Path.of(exportDir).toAbsolutePath().normalize();
        this.exportMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Resolves a file name inside the export directory.
     *
     * @throws IllegalArgumentException if the name is blank or points outside the export directory
     */
    public Path resolveExportFile(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Export file name must not be blank");
        }
        Path resolved = exportDir.resolve(name).normalize();
        if (!resolved.startsWith(exportDir) || resolved.equals(exportDir)) {
            throw new IllegalArgumentException("Export file must stay inside " + exportDir + ": " + name);
        }
        return resolved;
    }

    /**
     * Writes every document of the window, oldest first, as a JSON array.
     *
     * @return number of exported documents
     * @throws DataExportException if the store cannot be read or the file cannot be written;
     *                             a failed read leaves any existing file untouched
     */
    public int exportToJson(Path file, QueryWindow window) {
        List<TelemetryDocumentDTO> documents = load(window).stream()
                .map(TelemetryDocumentDTO::from)
                .collect(Collectors.toList());

        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            exportMapper.writeValue(file.toFile(), documents);
        } catch (IOException e) {
            log.error("❌ Error exporting data to {}: {}", file, e.getMessage());
            throw new DataExportException("Failed to export data to " + file, e);
        }

        log.info("✅ Exported {} documents to {}", documents.size(), file);
        return documents.size();
    }

    private List<TelemetryDocument> load(QueryWindow window) {
        try {
            return gateway.find(new Query(window.toCriteria()).with(Sort.by(Sort.Direction.ASC, TelemetryFields.TIMESTAMP)));
        } catch (StoreQueryException e) {
            log.error("❌ Error reading data for export: {}", e.getMessage());
            throw new DataExportException("Failed to read data for export", e);
        }
    }
}
