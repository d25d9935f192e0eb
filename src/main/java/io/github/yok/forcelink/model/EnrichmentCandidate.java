package io.github.yok.forcelink.model;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Current and proposed values of one record, restricted to the fields enrichment may touch.
 *
 * <p>
 * Proposed values outside {@code allowedFields} are dropped at construction, so the proposed key
 * set is always a subset of the allow-list. Blank proposals are dropped as well.
 * </p>
 */
@Getter
@ToString
public final class EnrichmentCandidate {

    private final String recordId;
    private final String objectType;
    private final Map<String, String> currentValues;
    private final Map<String, String> proposedValues;
    private final Set<String> allowedFields;

    /**
     * Creates a candidate.
     *
     * @param recordId record id
     * @param objectType object type (e.g. {@code Account})
     * @param currentValues values fetched from the remote store
     * @param proposedValues values produced by the scraper (may contain extra fields)
     * @param allowedFields allow-list for the object type
     */
    public EnrichmentCandidate(String recordId, String objectType,
            Map<String, String> currentValues, Map<String, String> proposedValues,
            Set<String> allowedFields) {
        this.recordId = recordId;
        this.objectType = objectType;
        this.allowedFields = ImmutableSet.copyOf(allowedFields);
        Map<String, String> current = new LinkedHashMap<>();
        currentValues.forEach((k, v) -> current.put(k, Strings.nullToEmpty(v)));
        this.currentValues = ImmutableMap.copyOf(current);
        Map<String, String> proposed = new LinkedHashMap<>();
        proposedValues.forEach((field, value) -> {
            if (this.allowedFields.contains(field) && StringUtils.isNotBlank(value)) {
                proposed.put(field, value.trim());
            }
        });
        this.proposedValues = ImmutableMap.copyOf(proposed);
    }

    /**
     * Computes the fields whose proposed value differs from the current value, in allow-list
     * order.
     *
     * @return changes; empty when there is nothing to update
     */
    public List<FieldChange> diff() {
        List<FieldChange> changes = new ArrayList<>();
        for (String field : allowedFields) {
            String proposed = proposedValues.get(field);
            if (proposed == null) {
                continue;
            }
            String current = currentValues.getOrDefault(field, "");
            if (!proposed.equals(current)) {
                changes.add(new FieldChange(field, current, proposed));
            }
        }
        return changes;
    }
}
