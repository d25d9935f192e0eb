package io.github.yok.forcelink.model;

import io.github.yok.forcelink.exception.ConfigException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Bulk operations supported against the remote object store.
 *
 * <p>
 * Each constant knows which payload key a record must carry before it can be submitted:
 * {@code Id} for {@link #UPDATE} and {@link #DELETE}, the external id field for {@link #UPSERT},
 * nothing for {@link #INSERT}.
 * </p>
 */
@Getter
public enum Operation {

    // Create new records
    INSERT("insert"),

    // Modify records addressed by Id
    UPDATE("update"),

    // Insert-or-update keyed by an external id field
    UPSERT("upsert"),

    // Remove records addressed by Id
    DELETE("delete");

    // Lower-case name used on the command line and in error files
    private final String label;

    Operation(String label) {
        this.label = label;
    }

    /**
     * Resolves an operation from its (case-insensitive) label.
     *
     * @param value label such as {@code "upsert"}
     * @return matching operation
     * @throws ConfigException if the value is blank or unknown
     */
    public static Operation fromLabel(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigException("Operation is required.");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(op -> op.label.equals(normalized)).findFirst()
                .orElseThrow(() -> new ConfigException("Unknown operation: " + value
                        + " (expected one of " + Arrays.stream(values()).map(Operation::getLabel)
                                .collect(Collectors.joining(", "))
                        + ")"));
    }

    /**
     * Returns the payload key every record must carry for this operation.
     *
     * @param externalIdField external id field (used by {@link #UPSERT} only)
     * @return required key, or {@code null} when no key is required
     */
    public String requiredKey(String externalIdField) {
        switch (this) {
            case UPDATE:
            case DELETE:
                return "Id";
            case UPSERT:
                return externalIdField;
            default:
                return null;
        }
    }
}
