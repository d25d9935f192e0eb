package io.github.yok.forcelink.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.forcelink.config.CsvSettings;
import io.github.yok.forcelink.exception.ErrorSinkException;
import io.github.yok.forcelink.model.Operation;
import io.github.yok.forcelink.model.SourceRow;
import io.github.yok.forcelink.model.SourceTable;
import io.github.yok.forcelink.util.CsvUtils;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvErrorSinkTest {

    private final Clock clock =
            Clock.fixed(Instant.parse("2024-05-01T09:30:00Z"), ZoneOffset.ofHours(9));

    private static SourceRow row(long number, String name, String phone) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("Name", name);
        values.put("Phone", phone);
        return new SourceRow(number, values);
    }

    @Test
    void record_正常ケース_元の列と失敗理由と時刻と操作が書き込まれること(@TempDir Path tmp)
            throws Exception {
        CsvSettings settings = CsvSettings.utf8(tmp.resolve("errors"));
        Path file;
        try (CsvErrorSink sink =
                new CsvErrorSink(settings, "accounts.csv", List.of("Name", "Phone"), clock)) {
            sink.record(row(2, "Globex", "555"), "REQUIRED_FIELD_MISSING: Name", Operation.UPSERT);
            sink.record(row(3, "Initech, Inc.", ""), null, Operation.UPSERT);
            assertEquals(2, sink.getCount());
            file = sink.getFile().orElseThrow();
        }

        assertEquals("failed_accounts_20240501_183000.csv", file.getFileName().toString());
        SourceTable table = CsvUtils.readTable(file, settings);
        assertEquals(List.of("Name", "Phone", CsvErrorSink.ERROR_REASON, CsvErrorSink.FAILED_AT,
                CsvErrorSink.SOURCE_OPERATION), table.getHeader());
        assertEquals(2, table.size());
        SourceRow first = table.getRows().get(0);
        assertEquals("Globex", first.get("Name"));
        assertEquals("REQUIRED_FIELD_MISSING: Name", first.get(CsvErrorSink.ERROR_REASON));
        assertEquals("2024-05-01T18:30:00+09:00", first.get(CsvErrorSink.FAILED_AT));
        assertEquals("upsert", first.get(CsvErrorSink.SOURCE_OPERATION));
        assertEquals("Initech, Inc.", table.getRows().get(1).get("Name"));
        assertEquals("Unknown error", table.getRows().get(1).get(CsvErrorSink.ERROR_REASON));
    }

    @Test
    void close_正常ケース_失敗がなければファイルが作成されないこと(@TempDir Path tmp) throws Exception {
        Path dir = tmp.resolve("errors");
        try (CsvErrorSink sink =
                new CsvErrorSink(CsvSettings.utf8(dir), "accounts.csv", List.of("Name"), clock)) {
            assertFalse(sink.getFile().isPresent());
            assertEquals(0, sink.getCount());
        }
        assertFalse(Files.exists(dir));
    }

    @Test
    void record_正常ケース_既存ファイルを上書きせず別名で作成されること(@TempDir Path tmp)
            throws Exception {
        CsvSettings settings = CsvSettings.utf8(tmp);
        Path existing = tmp.resolve("failed_accounts_20240501_183000.csv");
        Files.writeString(existing, "previous run");

        Path file;
        try (CsvErrorSink sink =
                new CsvErrorSink(settings, "accounts.csv", List.of("Name", "Phone"), clock)) {
            sink.record(row(1, "Acme", ""), "boom", Operation.INSERT);
            file = sink.getFile().orElseThrow();
        }

        assertEquals("failed_accounts_20240501_183000_2.csv", file.getFileName().toString());
        assertEquals("previous run", Files.readString(existing));
    }

    @Test
    void record_異常ケース_出力先がファイル_ErrorSinkExceptionが送出されること(@TempDir Path tmp)
            throws Exception {
        Path blocker = tmp.resolve("errors");
        Files.writeString(blocker, "not a directory");

        try (CsvErrorSink sink = new CsvErrorSink(CsvSettings.utf8(blocker), "accounts.csv",
                List.of("Name", "Phone"), clock)) {
            ErrorSinkException ex = assertThrows(ErrorSinkException.class,
                    () -> sink.record(row(1, "Acme", ""), "boom", Operation.INSERT));
            assertTrue(ex.getMessage().contains("row 1"));
        }
    }
}
