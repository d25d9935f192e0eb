package io.github.yok.forcelink.model;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Getter;
import lombok.ToString;

/**
 * Header and rows of a source file, in file order.
 */
@Getter
@ToString
public final class SourceTable {

    private final List<String> header;
    private final List<SourceRow> rows;

    public SourceTable(List<String> header, List<SourceRow> rows) {
        this.header = ImmutableList.copyOf(header);
        this.rows = ImmutableList.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
