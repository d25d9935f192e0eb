package io.github.yok.forcelink.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

class MaskingLogUtilTest {

    @Test
    void maskText_正常ケース_値がマスクされnullと空文字はそのまま返ること() {
        assertEquals("***", MaskingLogUtil.maskText("password"));
        assertEquals("", MaskingLogUtil.maskText(""));
        assertNull(MaskingLogUtil.maskText(null));
    }

    @Test
    void maskToken_正常ケース_先頭4文字のみ残ること() {
        assertEquals("00Dx***", MaskingLogUtil.maskToken("00Dx0000000abcd!AQ"));
        assertEquals("***", MaskingLogUtil.maskToken("short"));
        assertNull(MaskingLogUtil.maskToken(null));
    }

    @Test
    void maskBody_正常ケース_SOAPのパスワードとセッションIDがマスクされること() {
        String body = "<n1:username>ops@example.com</n1:username>"
                + "<n1:password>s3cretTOKEN</n1:password><sessionId>00Dabc!xyz</sessionId>";

        String masked = MaskingLogUtil.maskBody(body);

        assertTrue(masked.contains("ops@example.com"));
        assertTrue(masked.contains("<n1:password>***</n1:password>"));
        assertTrue(masked.contains("<sessionId>***</sessionId>"));
        assertFalse(masked.contains("s3cretTOKEN"));
        assertFalse(masked.contains("00Dabc!xyz"));
    }

    @Test
    void maskBody_正常ケース_該当箇所がなければ変更されないこと() {
        assertEquals("plain text", MaskingLogUtil.maskBody("plain text"));
        assertNull(MaskingLogUtil.maskBody(null));
    }
}
