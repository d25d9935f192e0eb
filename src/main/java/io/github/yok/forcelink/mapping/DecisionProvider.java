package io.github.yok.forcelink.mapping;

import io.github.yok.forcelink.model.FieldChange;
import io.github.yok.forcelink.model.MappingDecision;
import java.util.List;

/**
 * Source of operator decisions: per-column mapping answers and yes/no confirmation of enrichment
 * diffs.
 *
 * <p>
 * Implementations may prompt a human ({@link ConsoleDecisionProvider}) or answer from presets
 * ({@link PresetDecisionProvider}).
 * </p>
 */
public interface DecisionProvider {

    /**
     * Decides what to do with one source column.
     *
     * @param column source column name
     * @return skip, or the target field (blank keeps the column name)
     */
    MappingDecision mapDecision(String column);

    /**
     * Asks whether the proposed changes may be written.
     *
     * @param diff non-empty list of changes
     * @return {@code true} to apply the changes
     */
    boolean confirm(List<FieldChange> diff);
}
