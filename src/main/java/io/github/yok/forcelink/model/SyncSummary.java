package io.github.yok.forcelink.model;

import java.nio.file.Path;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one dispatch run.
 *
 * <p>
 * {@code total = succeeded + failed + skipped}. Records are skipped only when the run is cancelled
 * before their chunk is started.
 * </p>
 */
@Value
@Builder
public class SyncSummary {

    String objectName;
    Operation operation;
    int total;
    int succeeded;
    int failed;
    int skipped;
    int chunks;
    boolean cancelled;

    // null when no record failed
    Path errorFile;

    public Optional<Path> getErrorFileIfAny() {
        return Optional.ofNullable(errorFile);
    }
}
