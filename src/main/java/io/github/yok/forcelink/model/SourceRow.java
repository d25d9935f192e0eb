package io.github.yok.forcelink.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One row read from a source file, kept in its original (pre-mapping) form.
 *
 * <p>
 * Column order follows the source header. The row number is 1-based and counts data rows only.
 * </p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SourceRow {

    // 1-based position of this row among the data rows of the file
    private final long rowNumber;

    // column name -> raw cell value, in header order
    private final Map<String, String> values;

    /**
     * Creates a row.
     *
     * @param rowNumber 1-based data row number
     * @param values column values in header order (copied)
     */
    public SourceRow(long rowNumber, Map<String, String> values) {
        this.rowNumber = rowNumber;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Returns the raw value of a column.
     *
     * @param column column name
     * @return value, or {@code null} if the column is absent
     */
    public String get(String column) {
        return values.get(column);
    }
}
