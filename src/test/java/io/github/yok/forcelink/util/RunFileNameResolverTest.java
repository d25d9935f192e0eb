package io.github.yok.forcelink.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RunFileNameResolverTest {

    private final Clock clock =
            Clock.fixed(Instant.parse("2024-03-05T06:07:08Z"), ZoneOffset.UTC);

    @Test
    void resolve_正常ケース_接頭辞とベース名と時刻からファイル名が決まること(@TempDir Path tmp) {
        Path path = new RunFileNameResolver(clock).resolve(tmp, "failed", "data/accounts.csv");
        assertEquals(tmp.resolve("failed_accounts_20240305_060708.csv"), path);
    }

    @Test
    void resolve_正常ケース_同名ファイルが存在する場合は連番が付与されること(@TempDir Path tmp)
            throws Exception {
        RunFileNameResolver resolver = new RunFileNameResolver(clock);
        Files.createFile(tmp.resolve("failed_accounts_20240305_060708.csv"));
        Files.createFile(tmp.resolve("failed_accounts_20240305_060708_2.csv"));

        Path path = resolver.resolve(tmp, "failed", "accounts.csv");

        assertEquals(tmp.resolve("failed_accounts_20240305_060708_3.csv"), path);
    }

    @Test
    void resolve_正常ケース_ソース名が空の場合は接頭辞と時刻のみとなること(@TempDir Path tmp) {
        Path path = new RunFileNameResolver(clock).resolve(tmp, "upload_success", null);
        assertEquals(tmp.resolve("upload_success_20240305_060708.csv"), path);
    }
}
