package io.github.yok.forcelink.util;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import lombok.RequiredArgsConstructor;
import org.apache.commons.io.FilenameUtils;

/**
 * Resolves per-run output file names of the form {@code <prefix>_<base>_<yyyyMMdd_HHmmss>.csv}.
 *
 * <p>
 * A run never reuses an existing file: when the name is taken, {@code _2}, {@code _3}, ... is
 * appended before the extension.
 * </p>
 */
@RequiredArgsConstructor
public class RunFileNameResolver {

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Clock clock;

    /**
     * Resolves a unique file in the given directory.
     *
     * @param directory target directory (need not exist yet)
     * @param prefix file name prefix, e.g. {@code failed}
     * @param source source name; only its base name without extension is used; may be blank
     * @return path that does not exist at call time
     */
    public Path resolve(Path directory, String prefix, String source) {
        Preconditions.checkNotNull(directory, "directory must not be null");
        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP);
        String base = FilenameUtils.getBaseName(Strings.nullToEmpty(source));
        StringBuilder stem = new StringBuilder(prefix);
        if (!base.isEmpty()) {
            stem.append('_').append(base.replaceAll("[^A-Za-z0-9._-]", "_"));
        }
        stem.append('_').append(timestamp);
        Path candidate = directory.resolve(stem + ".csv");
        int suffix = 2;
        while (Files.exists(candidate)) {
            candidate = directory.resolve(stem + "_" + suffix + ".csv");
            suffix++;
        }
        return candidate;
    }
}
