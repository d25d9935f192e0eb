package io.github.yok.forcelink.model;

import java.util.List;
import java.util.Map;
import lombok.Value;

/**
 * One page of query results.
 *
 * <p>
 * {@code fieldNames} is the column order of this page; {@code nextToken} is {@code null} on the
 * last page.
 * </p>
 */
@Value
public class QueryPage {
    List<String> fieldNames;
    List<Map<String, String>> records;
    String nextToken;

    public boolean isDone() {
        return nextToken == null;
    }
}
