package io.github.yok.forcelink.core;

import com.google.common.annotations.VisibleForTesting;
import io.github.yok.forcelink.config.ApiConfig;
import io.github.yok.forcelink.config.CsvSettings;
import io.github.yok.forcelink.exception.ConfigException;
import io.github.yok.forcelink.exception.ForceLinkException;
import io.github.yok.forcelink.exception.MappingException;
import io.github.yok.forcelink.mapping.DecisionProvider;
import io.github.yok.forcelink.mapping.FieldMapper;
import io.github.yok.forcelink.model.Batch;
import io.github.yok.forcelink.model.FieldMapping;
import io.github.yok.forcelink.model.Operation;
import io.github.yok.forcelink.model.SourceTable;
import io.github.yok.forcelink.model.SyncSummary;
import io.github.yok.forcelink.sink.CsvErrorSink;
import io.github.yok.forcelink.sink.CsvSuccessSink;
import io.github.yok.forcelink.sink.SuccessSink;
import io.github.yok.forcelink.store.RemoteObjectStore;
import io.github.yok.forcelink.store.Session;
import io.github.yok.forcelink.store.SessionProvider;
import io.github.yok.forcelink.util.CsvUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Synchronizes one CSV file with one remote object.
 *
 * <p>
 * <strong>Processing flow:</strong>
 * </p>
 * <ol>
 * <li>Validate the object name, batch size and upsert external id.</li>
 * <li>Read the source file.</li>
 * <li>Log in and describe the target object (a failed describe disables field validation).</li>
 * <li>Negotiate the field mapping through the decision provider.</li>
 * <li>Dispatch the rows through {@link BatchDispatcher}, writing failures to the error file.</li>
 * </ol>
 */
@Slf4j
public class SyncService {

    private final BatchDispatcher dispatcher;
    private final RemoteObjectStore store;
    private final SessionProvider sessionProvider;
    private final ApiConfig apiConfig;
    private final CsvSettings csvSettings;
    private final FieldMapper fieldMapper;
    private final Clock clock;

    public SyncService(BatchDispatcher dispatcher, RemoteObjectStore store,
            SessionProvider sessionProvider, ApiConfig apiConfig, CsvSettings csvSettings) {
        this(dispatcher, store, sessionProvider, apiConfig, csvSettings, new FieldMapper(),
                Clock.systemDefaultZone());
    }

    @VisibleForTesting
    SyncService(BatchDispatcher dispatcher, RemoteObjectStore store,
            SessionProvider sessionProvider, ApiConfig apiConfig, CsvSettings csvSettings,
            FieldMapper fieldMapper, Clock clock) {
        this.dispatcher = dispatcher;
        this.store = store;
        this.sessionProvider = sessionProvider;
        this.apiConfig = apiConfig;
        this.csvSettings = csvSettings;
        this.fieldMapper = fieldMapper;
        this.clock = clock;
    }

    /**
     * Runs one synchronization.
     *
     * @param file source CSV file
     * @param objectName target object, e.g. {@code Account}
     * @param operation bulk operation
     * @param decisions decision provider for the column mapping
     * @param batchSize chunk size, or {@code null} for {@code api.batch-size}
     * @param externalIdField external id field (upsert only)
     * @return run summary
     * @throws ConfigException if the run is misconfigured or the file cannot be read
     * @throws io.github.yok.forcelink.exception.AuthException if login fails
     * @throws MappingException if the mapping is invalid
     */
    public SyncSummary sync(Path file, String objectName, Operation operation,
            DecisionProvider decisions, Integer batchSize, String externalIdField) {
        if (StringUtils.isBlank(objectName)) {
            throw new ConfigException("Object name is required.");
        }
        if (operation == null) {
            throw new ConfigException("Operation is required.");
        }
        int effectiveBatchSize = batchSize != null ? batchSize : apiConfig.getBatchSize();
        Batch.validateSize(effectiveBatchSize);
        if (operation == Operation.UPSERT && StringUtils.isBlank(externalIdField)) {
            throw new ConfigException("External ID field is required for upsert.");
        }
        String extId = StringUtils.trimToNull(externalIdField);

        SourceTable table = read(file);
        log.info("Read {} row(s) with columns {} from {}", table.size(), table.getHeader(), file);
        if (table.isEmpty()) {
            log.info("Nothing to synchronize.");
            return SyncSummary.builder().objectName(objectName).operation(operation).build();
        }

        Session session = sessionProvider.acquire();
        FieldMapping mapping =
                fieldMapper.map(table.getHeader(), describe(session, objectName), decisions);
        if (mapping.getMappedFields().isEmpty()) {
            throw new MappingException("No column is mapped; nothing to send.");
        }
        String requiredKey = operation.requiredKey(extId);
        if (requiredKey != null && !mapping.getMappedFields().containsValue(requiredKey)) {
            throw new ConfigException("Field '" + requiredKey + "' required for "
                    + operation.getLabel() + " is not mapped from any column.");
        }

        String sourceName = file.getFileName().toString();
        SyncSummary summary;
        try (CsvErrorSink errorSink =
                new CsvErrorSink(csvSettings, sourceName, table.getHeader(), clock);
                SuccessSink successSink = successSink(sourceName, table)) {
            summary = dispatcher.dispatch(DispatchRequest.builder().objectName(objectName)
                    .operation(operation).rows(table.getRows()).fieldMapping(mapping)
                    .batchSize(effectiveBatchSize).externalIdField(extId).errorSink(errorSink)
                    .successSink(successSink).build());
        }
        log.info("Sync finished: object={}, operation={}, total={}, succeeded={}, failed={}, "
                + "skipped={}", objectName, operation.getLabel(), summary.getTotal(),
                summary.getSucceeded(), summary.getFailed(), summary.getSkipped());
        summary.getErrorFileIfAny().ifPresent(path -> log.warn("Failed records saved to {}", path));
        return summary;
    }

    private SourceTable read(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new ConfigException("Source file not found: " + file);
        }
        try {
            return CsvUtils.readTable(file, csvSettings);
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigException("Cannot read source file " + file + ": " + e.getMessage(),
                    e);
        }
    }

    // null disables field validation
    private Set<String> describe(Session session, String objectName) {
        try {
            Set<String> fields = store.describeFields(session, objectName);
            log.debug("{} has {} field(s)", objectName, fields.size());
            return fields.isEmpty() ? null : fields;
        } catch (ForceLinkException e) {
            log.warn("Could not describe {} ({}); target fields will not be validated",
                    objectName, e.getMessage());
            return null;
        }
    }

    private SuccessSink successSink(String sourceName, SourceTable table) {
        return csvSettings.getResultDirectoryIfEnabled()
                .<SuccessSink>map(dir -> new CsvSuccessSink(dir, csvSettings, sourceName,
                        table.getHeader(), clock))
                .orElse(SuccessSink.NONE);
    }
}
