package io.github.eutro.decompir.test;

import com.google.gson.JsonParseException;
import io.github.eutro.decompir.api.DecompilerConfig;
import io.github.eutro.decompir.core.conf.CallingConvention;
import org.junit.jupiter.api.Test;

import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

public class DecompilerConfigTest {
    private static DecompilerConfig read(String json) {
        return DecompilerConfig.read(new StringReader(json));
    }

    @Test
    void testDefaults() {
        DecompilerConfig config = read("{}");
        assertEquals(CallingConvention.ARM, config.callingConvention);
        assertTrue(config.macros.isEmpty());
        assertTrue(config.substitute);
    }

    @Test
    void testSettings() {
        DecompilerConfig config = read("{\"callingConvention\": \"mips\","
                + " \"macros\": {\"0x41\": \"O_APPEND_WRONLY\", \"7\": \"ALL\"},"
                + " \"substitute\": false}");
        assertEquals(CallingConvention.MIPS, config.callingConvention);
        assertEquals("O_APPEND_WRONLY", config.macros.get(0x41L));
        assertEquals("ALL", config.macros.get(7L));
        assertFalse(config.substitute);
    }

    @Test
    void testInvalid() {
        assertThrows(JsonParseException.class, () -> read("\"arm\""));
        assertThrows(JsonParseException.class, () -> read("{\"callingConvention\": \"vax\"}"));
        assertThrows(JsonParseException.class, () -> read("{\"macros\": {\"zero\": \"O_RDONLY\"}}"));
    }
}
