package io.github.yok.forcelink.config;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;
import lombok.Value;

/**
 * Immutable CSV settings shared by the source reader, the sinks and the query exporter.
 */
@Value
public class CsvSettings {

    Charset charset;
    char delimiter;
    Path errorDirectory;

    // null disables the success log
    Path resultDirectory;

    /**
     * UTF-8, comma-delimited, errors written under {@code errorDirectory}, no success log.
     *
     * @param errorDirectory error directory
     * @return settings
     */
    public static CsvSettings utf8(Path errorDirectory) {
        return new CsvSettings(StandardCharsets.UTF_8, ',', errorDirectory, null);
    }

    public Optional<Path> getResultDirectoryIfEnabled() {
        return Optional.ofNullable(resultDirectory);
    }
}
