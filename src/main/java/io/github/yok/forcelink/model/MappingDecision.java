package io.github.yok.forcelink.model;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Answer of a decision provider for one source column: skip it, or map it to a target field.
 */
@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class MappingDecision {

    private static final MappingDecision SKIP = new MappingDecision(true, null);

    private final boolean skipped;

    // null means "use the source column name"
    private final String targetField;

    /**
     * Declines the column.
     *
     * @return skip decision
     */
    public static MappingDecision skip() {
        return SKIP;
    }

    /**
     * Maps the column to the given field; a blank value keeps the column name.
     *
     * @param targetField target field name, may be blank
     * @return map decision
     */
    public static MappingDecision mapTo(String targetField) {
        String trimmed = targetField == null ? null : targetField.trim();
        return new MappingDecision(false, trimmed == null || trimmed.isEmpty() ? null : trimmed);
    }

    /**
     * Maps the column to a field of the same name.
     *
     * @return map decision
     */
    public static MappingDecision keep() {
        return new MappingDecision(false, null);
    }

    /**
     * Resolves the effective target field for a column.
     *
     * @param column source column name
     * @return target field, or {@code null} if skipped
     */
    public String resolveTarget(String column) {
        if (skipped) {
            return null;
        }
        return targetField == null ? column : targetField;
    }
}
