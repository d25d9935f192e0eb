package io.github.yok.forcelink.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.forcelink.exception.ConfigException;
import org.junit.jupiter.api.Test;

class OperationTest {

    @Test
    void fromLabel_正常ケース_大文字小文字と前後空白を無視して解決されること() {
        assertEquals(Operation.UPSERT, Operation.fromLabel(" Upsert "));
        assertEquals(Operation.DELETE, Operation.fromLabel("delete"));
    }

    @Test
    void fromLabel_異常ケース_未知の操作_ConfigExceptionが送出されること() {
        assertThrows(ConfigException.class, () -> Operation.fromLabel("merge"));
        assertThrows(ConfigException.class, () -> Operation.fromLabel(null));
    }

    @Test
    void requiredKey_正常ケース_操作ごとの必須キーが返ること() {
        assertNull(Operation.INSERT.requiredKey("Ext__c"));
        assertEquals("Id", Operation.UPDATE.requiredKey("Ext__c"));
        assertEquals("Id", Operation.DELETE.requiredKey(null));
        assertEquals("Ext__c", Operation.UPSERT.requiredKey("Ext__c"));
    }
}
