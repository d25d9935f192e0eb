package io.github.yok.forcelink.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.yok.forcelink.exception.MappingException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, immutable correspondence between source columns and target fields.
 *
 * <p>
 * A column is either mapped to a target field or skipped. No two columns may claim the same target
 * field; {@link Builder#map(String, String)} enforces this as columns are added. Skipped columns
 * never appear in a payload produced by {@link #apply(SourceRow)}.
 * </p>
 */
public final class FieldMapping {

    // source column -> target field (absent value = skipped), in source order
    private final ImmutableMap<String, Optional<String>> entries;

    private FieldMapping(Map<String, Optional<String>> entries) {
        this.entries = ImmutableMap.copyOf(entries);
    }

    /**
     * Starts a new mapping.
     *
     * @return empty builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a mapping that sends every column to a field of the same name.
     *
     * @param columns source columns in order
     * @return identity mapping
     */
    public static FieldMapping identity(List<String> columns) {
        Builder builder = builder();
        columns.forEach(column -> builder.map(column, column));
        return builder.build();
    }

    /**
     * Returns the source columns in their original order, skipped ones included.
     *
     * @return source columns
     */
    public List<String> getSourceColumns() {
        return ImmutableList.copyOf(entries.keySet());
    }

    /**
     * Returns the target field of a column.
     *
     * @param column source column
     * @return target field, or empty if the column is skipped or unknown
     */
    public Optional<String> targetOf(String column) {
        Optional<String> target = entries.get(column);
        return target == null ? Optional.empty() : target;
    }

    /**
     * Returns whether a column is skipped.
     *
     * @param column source column
     * @return {@code true} if the column was declined
     */
    public boolean isSkipped(String column) {
        return entries.containsKey(column) && entries.get(column).isEmpty();
    }

    /**
     * Returns the mapped (non-skipped) columns and their target fields, in source order.
     *
     * @return column -> field
     */
    public Map<String, String> getMappedFields() {
        Map<String, String> mapped = new LinkedHashMap<>();
        entries.forEach((column, target) -> target.ifPresent(field -> mapped.put(column, field)));
        return mapped;
    }

    /**
     * Produces the operation-ready payload of a row: target field -> value, skipped columns
     * dropped, columns absent from the row ignored.
     *
     * @param row source row
     * @return payload in source column order
     */
    public Map<String, String> apply(SourceRow row) {
        Map<String, String> payload = new LinkedHashMap<>();
        entries.forEach((column, target) -> {
            if (target.isPresent() && row.getValues().containsKey(column)) {
                payload.put(target.get(), row.get(column));
            }
        });
        return payload;
    }

    @Override
    public String toString() {
        return "FieldMapping" + entries;
    }

    /**
     * Accumulates column decisions; rejects a target field claimed twice.
     */
    public static final class Builder {

        private final Map<String, Optional<String>> entries = new LinkedHashMap<>();

        // lower-cased target field -> column that claimed it; remote field names ignore case
        private final Map<String, String> claimedBy = new HashMap<>();

        private Builder() {}

        /**
         * Maps a column to a target field.
         *
         * @param column source column
         * @param targetField target field
         * @return this builder
         * @throws MappingException if the target field, compared without case, is already claimed
         *         by an earlier column
         */
        public Builder map(String column, String targetField) {
            String key = targetField.toLowerCase(Locale.ROOT);
            String previous = claimedBy.get(key);
            if (previous != null) {
                throw new MappingException("Target field '" + targetField
                        + "' is already mapped from column '" + previous + "'; column '" + column
                        + "' cannot claim it.");
            }
            checkNewColumn(column);
            claimedBy.put(key, column);
            entries.put(column, Optional.of(targetField));
            return this;
        }

        /**
         * Records a column as skipped.
         *
         * @param column source column
         * @return this builder
         */
        public Builder skip(String column) {
            checkNewColumn(column);
            entries.put(column, Optional.empty());
            return this;
        }

        /**
         * Returns the immutable mapping.
         *
         * @return mapping
         */
        public FieldMapping build() {
            return new FieldMapping(entries);
        }

        private void checkNewColumn(String column) {
            if (entries.containsKey(column)) {
                throw new MappingException("Column '" + column + "' is mapped more than once.");
            }
        }
    }
}
