package io.github.yok.forcelink.mapping;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import io.github.yok.forcelink.exception.ForceLinkException;
import io.github.yok.forcelink.model.FieldChange;
import io.github.yok.forcelink.model.MappingDecision;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConsoleDecisionProviderTest {

    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    private ConsoleDecisionProvider provider(String input) {
        return new ConsoleDecisionProvider(new BufferedReader(new StringReader(input)),
                new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    void mapDecision_正常ケース_yと空入力で列名のまま対応付けられること() {
        MappingDecision decision = provider("y\n\n").mapDecision("Phone");

        assertFalse(decision.isSkipped());
        assertEquals("Phone", decision.resolveTarget("Phone"));
    }

    @Test
    void mapDecision_正常ケース_フィールド名を入力すると変更されること() {
        MappingDecision decision = provider("yes\n  MobilePhone \n").mapDecision("Tel");

        assertEquals("MobilePhone", decision.resolveTarget("Tel"));
    }

    @Test
    void mapDecision_正常ケース_nでスキップされること() {
        assertTrue(provider("N\n").mapDecision("Memo").isSkipped());
    }

    @Test
    void mapDecision_正常ケース_不正な回答は再度質問されること() {
        MappingDecision decision = provider("maybe\nn\n").mapDecision("Memo");

        assertTrue(decision.isSkipped());
        assertTrue(printed().contains("Please answer y(es) or n(o)."));
    }

    @Test
    void mapDecision_異常ケース_入力が終了している_ForceLinkExceptionが送出されること() {
        ConsoleDecisionProvider provider = provider("");
        assertThrows(ForceLinkException.class, () -> provider.mapDecision("Name"));
    }

    @Test
    void confirm_正常ケース_差分が表示されyesで承認されること() {
        boolean confirmed = provider("yes\n")
                .confirm(List.of(new FieldChange("Phone", "", "555-0100")));

        assertTrue(confirmed);
        assertTrue(printed().contains("Proposed changes:"));
        assertTrue(printed().contains("  Phone: '' -> '555-0100'"));
    }

    @Test
    void confirm_正常ケース_noで却下されること() {
        assertFalse(provider("no\n").confirm(List.of(new FieldChange("Phone", "1", "2"))));
    }

    @Test
    void system_正常ケース_標準入出力に結び付いたインスタンスが生成されること() {
        assertNotNull(ConsoleDecisionProvider.system());
    }
}
