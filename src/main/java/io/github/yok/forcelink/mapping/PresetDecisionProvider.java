package io.github.yok.forcelink.mapping;

import com.google.common.collect.ImmutableMap;
import io.github.yok.forcelink.model.FieldChange;
import io.github.yok.forcelink.model.MappingDecision;
import java.util.List;
import java.util.Map;

/**
 * Non-interactive decision provider.
 *
 * <p>
 * Columns listed in the preset map are mapped to the given field (an empty string keeps the
 * column name); other columns are kept as-is when {@code mapUnlisted} is set, otherwise skipped.
 * Confirmation always returns {@code autoConfirm}.
 * </p>
 */
public class PresetDecisionProvider implements DecisionProvider {

    private final Map<String, String> presets;
    private final boolean mapUnlisted;
    private final boolean autoConfirm;

    public PresetDecisionProvider(Map<String, String> presets, boolean mapUnlisted,
            boolean autoConfirm) {
        this.presets = ImmutableMap.copyOf(presets);
        this.mapUnlisted = mapUnlisted;
        this.autoConfirm = autoConfirm;
    }

    /**
     * Provider used by {@code --yes}: every column keeps its name, every diff is accepted.
     *
     * @return accepting provider
     */
    public static PresetDecisionProvider acceptAll() {
        return new PresetDecisionProvider(ImmutableMap.of(), true, true);
    }

    @Override
    public MappingDecision mapDecision(String column) {
        if (presets.containsKey(column)) {
            return MappingDecision.mapTo(presets.get(column));
        }
        return mapUnlisted ? MappingDecision.keep() : MappingDecision.skip();
    }

    @Override
    public boolean confirm(List<FieldChange> diff) {
        return autoConfirm;
    }
}
