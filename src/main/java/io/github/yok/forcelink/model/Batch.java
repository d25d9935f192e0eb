package io.github.yok.forcelink.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.github.yok.forcelink.exception.ConfigException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;

/**
 * Bounded group of payloads submitted to the remote store in one call.
 *
 * <p>
 * Invariants: {@code records.size() <= maxSize <= 200}; {@code externalIdField} is non-blank when
 * (and only kept when) the operation is {@link Operation#UPSERT}.
 * </p>
 */
@Getter
@ToString
public final class Batch {

    /**
     * Hard limit of records per remote call.
     */
    public static final int MAX_SIZE_LIMIT = 200;

    private final Operation operation;
    private final List<Map<String, String>> records;
    private final String externalIdField;
    private final int maxSize;

    private Batch(Operation operation, List<Map<String, String>> records, String externalIdField,
            int maxSize) {
        this.operation = operation;
        this.records = records;
        this.externalIdField = externalIdField;
        this.maxSize = maxSize;
    }

    /**
     * Creates a batch after checking its invariants.
     *
     * @param operation bulk operation
     * @param records payloads in submission order
     * @param externalIdField external id field; required for upsert, dropped otherwise
     * @param maxSize configured chunk size
     * @return validated batch
     * @throws ConfigException if the size bound or the external id rule is violated
     */
    public static Batch of(Operation operation, List<Map<String, String>> records,
            String externalIdField, int maxSize) {
        Preconditions.checkNotNull(operation, "operation must not be null");
        Preconditions.checkNotNull(records, "records must not be null");
        validateSize(maxSize);
        if (records.size() > maxSize) {
            throw new ConfigException(
                    "Batch holds " + records.size() + " records but max size is " + maxSize);
        }
        String extId = null;
        if (operation == Operation.UPSERT) {
            if (externalIdField == null || externalIdField.isBlank()) {
                throw new ConfigException("External ID field is required for upsert.");
            }
            extId = externalIdField.trim();
        }
        ImmutableList.Builder<Map<String, String>> copy = ImmutableList.builder();
        for (Map<String, String> record : records) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(record)));
        }
        return new Batch(operation, copy.build(), extId, maxSize);
    }

    /**
     * Checks a chunk size against {@link #MAX_SIZE_LIMIT}.
     *
     * @param size requested chunk size
     * @throws ConfigException if the size is not within {@code 1..200}
     */
    public static void validateSize(int size) {
        if (size < 1 || size > MAX_SIZE_LIMIT) {
            throw new ConfigException(
                    "Batch size must be between 1 and " + MAX_SIZE_LIMIT + " (was " + size + ")");
        }
    }

    public int size() {
        return records.size();
    }
}
