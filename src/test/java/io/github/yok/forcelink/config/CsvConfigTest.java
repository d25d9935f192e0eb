package io.github.yok.forcelink.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.forcelink.exception.ConfigException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import org.junit.jupiter.api.Test;

class CsvConfigTest {

    @Test
    void toSettings_正常ケース_既定値_UTF8カンマerrorsとなること() {
        CsvSettings settings = new CsvConfig().toSettings();

        assertEquals(StandardCharsets.UTF_8, settings.getCharset());
        assertEquals(',', settings.getDelimiter());
        assertEquals(Paths.get("errors"), settings.getErrorDirectory());
        assertFalse(settings.getResultDirectoryIfEnabled().isPresent());
    }

    @Test
    void toSettings_正常ケース_タブ区切りと結果ディレクトリを指定する_反映されること() {
        CsvConfig config = new CsvConfig();
        config.setDelimiter("\\t");
        config.setEncoding("Shift_JIS");
        config.setResultDirectory("results");

        CsvSettings settings = config.toSettings();

        assertEquals('\t', settings.getDelimiter());
        assertEquals("Shift_JIS", settings.getCharset().name());
        assertTrue(settings.getResultDirectoryIfEnabled().isPresent());
        assertEquals(Paths.get("results"), settings.getResultDirectory());
    }

    @Test
    void toSettings_異常ケース_未知の文字コード_ConfigExceptionが送出されること() {
        CsvConfig config = new CsvConfig();
        config.setEncoding("NO-SUCH-CHARSET");
        assertThrows(ConfigException.class, config::toSettings);
    }

    @Test
    void toSettings_異常ケース_区切り文字が2文字_ConfigExceptionが送出されること() {
        CsvConfig config = new CsvConfig();
        config.setDelimiter(";;");
        assertThrows(ConfigException.class, config::toSettings);
    }

    @Test
    void toSettings_異常ケース_エラーディレクトリ未設定_ConfigExceptionが送出されること() {
        CsvConfig config = new CsvConfig();
        config.setErrorDirectory("");
        assertThrows(ConfigException.class, config::toSettings);
    }
}
