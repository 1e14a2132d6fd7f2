package com.dispatchguard.core.dlq;

import com.dispatchguard.model.DeadLetterStoreOptions;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DeadLetterTableNameHandlerTest {

    @Test
    void rewritesOnlyTheLogicalTable() {
        DeadLetterTableNameHandler handler = new DeadLetterTableNameHandler(
                DeadLetterStoreOptions.builder().schema("ops").table("dlq").build());

        assertEquals("ops.dlq", handler.dynamicTableName("select 1", "dead_letter_entries"));
        assertEquals("ops.dlq", handler.dynamicTableName("select 1", "DEAD_LETTER_ENTRIES"));
        assertEquals("orders", handler.dynamicTableName("select 1", "orders"));
    }

    @Test
    void rejectsUnsafeIdentifiers() {
        assertThrows(IllegalArgumentException.class, () -> new DeadLetterTableNameHandler(
                DeadLetterStoreOptions.builder().schema("ops`; --").build()));
    }
}
