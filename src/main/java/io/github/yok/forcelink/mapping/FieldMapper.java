package io.github.yok.forcelink.mapping;

import com.google.common.base.Preconditions;
import io.github.yok.forcelink.exception.MappingException;
import io.github.yok.forcelink.model.FieldMapping;
import io.github.yok.forcelink.model.MappingDecision;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds a {@link FieldMapping} by asking a {@link DecisionProvider} about every source column, in
 * column order, exactly once.
 */
@Slf4j
public class FieldMapper {

    /**
     * Resolves the mapping for a source header.
     *
     * @param columns source columns in header order
     * @param knownFields target fields known to exist; {@code null} disables the check
     * @param provider decision provider
     * @return mapping with one entry per column
     * @throws MappingException if two columns target the same field, or a target field is not in
     *         {@code knownFields}
     */
    public FieldMapping map(List<String> columns, Set<String> knownFields,
            DecisionProvider provider) {
        Preconditions.checkNotNull(columns, "columns must not be null");
        Preconditions.checkNotNull(provider, "provider must not be null");
        FieldMapping.Builder builder = FieldMapping.builder();
        for (String column : columns) {
            MappingDecision decision = provider.mapDecision(column);
            if (decision == null || decision.isSkipped()) {
                log.info("Column [{}] skipped", column);
                builder.skip(column);
                continue;
            }
            String target = decision.resolveTarget(column);
            if (knownFields != null) {
                target = canonicalField(knownFields, target).orElseThrow(
                        () -> new MappingException("Target field '" + decision.resolveTarget(column)
                                + "' for column '" + column
                                + "' does not exist on the target object."));
            }
            builder.map(column, target);
            log.info("Column [{}] -> field [{}]", column, target);
        }
        return builder.build();
    }

    // Field names are case-insensitive on the remote side; use the declared spelling
    private static Optional<String> canonicalField(Set<String> fields, String target) {
        if (fields.contains(target)) {
            return Optional.of(target);
        }
        return fields.stream().filter(field -> field.equalsIgnoreCase(target)).findFirst();
    }
}
