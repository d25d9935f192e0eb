package io.github.yok.forcelink.config;

import io.github.yok.forcelink.exception.ConfigException;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Path;
import java.nio.file.Paths;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration class that binds the {@code csv} section in {@code application.yml}.
 *
 * <pre>
 * csv:
 *   encoding: 'utf-8'
 *   delimiter: ','
 *   error-directory: 'errors'
 *   result-directory: 'results'   # optional
 * </pre>
 */
@ConfigurationProperties(prefix = "csv")
@Data
public class CsvConfig {

    // Character set of source files, error files and exports
    private String encoding = "UTF-8";

    // Single-character field delimiter
    private String delimiter = ",";

    // Directory receiving one error file per run
    private String errorDirectory = "errors";

    // Directory receiving success logs; blank disables them
    private String resultDirectory;

    /**
     * Converts these settings into an immutable {@link CsvSettings}.
     *
     * @return CSV settings
     * @throws ConfigException if the encoding is unknown or the delimiter is not one character
     */
    public CsvSettings toSettings() {
        Charset charset;
        try {
            charset = Charset.forName(StringUtils.defaultIfBlank(encoding, "UTF-8").trim());
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            throw new ConfigException("Unsupported csv.encoding: " + encoding, e);
        }
        String unescaped = "\\t".equals(delimiter) ? "\t" : delimiter;
        if (unescaped == null || unescaped.length() != 1) {
            throw new ConfigException(
                    "csv.delimiter must be exactly one character (was '" + delimiter + "')");
        }
        if (StringUtils.isBlank(errorDirectory)) {
            throw new ConfigException("csv.error-directory is not configured.");
        }
        Path results = StringUtils.isBlank(resultDirectory) ? null : Paths.get(resultDirectory);
        return new CsvSettings(charset, unescaped.charAt(0), Paths.get(errorDirectory), results);
    }
}
