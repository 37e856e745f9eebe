package io.github.eutro.decompir.test;

import io.github.eutro.decompir.core.build.StorageRecords;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StorageRecordsTest {
    @Test
    void testClassify() {
        List<StorageRecords.Record> records = StorageRecords.of(Arrays.asList(
                "R0", "gv_0x2a010", "var.-12", "tmp", "var.x", "PC"));
        assertEquals(4, records.size());

        assertEquals(StorageRecords.Kind.REGISTER, records.get(0).kind);
        assertNull(records.get(0).va);

        StorageRecords.Record global = records.get(1);
        assertEquals(StorageRecords.Kind.GLOBAL, global.kind);
        assertEquals("0x2a010", global.va);

        StorageRecords.Record stack = records.get(2);
        assertEquals(StorageRecords.Kind.STACK, stack.kind);
        assertEquals(Integer.valueOf(-12), stack.offset);
        assertEquals("var.-12: stack -12", stack.toString());

        assertEquals("PC", records.get(3).name);
    }

    @Test
    void testUnknownNames() {
        assertNull(StorageRecords.classify("rtn_4"));
        assertNull(StorageRecords.classify("R13"));
    }
}
