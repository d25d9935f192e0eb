package io.github.yok.forcelink.store;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import java.util.List;
import org.junit.jupiter.api.Test;

class ErrorClassifierTest {

    @Test
    void isTransient_正常ケース_一時的なエラーコードを含む場合trueとなること() {
        assertTrue(ErrorClassifier.isTransient(List.of("FIELD_CUSTOM_VALIDATION_EXCEPTION",
                "UNABLE_TO_LOCK_ROW")));
        assertTrue(ErrorClassifier.isTransient(List.of("REQUEST_LIMIT_EXCEEDED")));
    }

    @Test
    void isTransient_正常ケース_恒久的なエラーコードのみの場合falseとなること() {
        assertFalse(ErrorClassifier.isTransient(List.of("REQUIRED_FIELD_MISSING")));
        assertFalse(ErrorClassifier.isTransient(List.of()));
    }

    @Test
    void isTransientStatus_正常ケース_429と5xxのみ一時的と判定されること() {
        assertTrue(ErrorClassifier.isTransientStatus(429));
        assertTrue(ErrorClassifier.isTransientStatus(500));
        assertTrue(ErrorClassifier.isTransientStatus(503));
        assertFalse(ErrorClassifier.isTransientStatus(400));
        assertFalse(ErrorClassifier.isTransientStatus(404));
        assertFalse(ErrorClassifier.isTransientStatus(200));
    }
}
