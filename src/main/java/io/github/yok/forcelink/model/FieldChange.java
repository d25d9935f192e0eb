package io.github.yok.forcelink.model;

import lombok.Value;

/**
 * One line of an enrichment diff: a field whose proposed value differs from the current one.
 */
@Value
public class FieldChange {
    String field;
    // empty string when the field has no current value
    String currentValue;
    String proposedValue;
}
