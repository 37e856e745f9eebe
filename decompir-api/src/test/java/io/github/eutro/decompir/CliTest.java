package io.github.eutro.decompir;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CliTest {
    private static Path copyResource(Path dir, String name) throws Exception {
        Path target = dir.resolve(name);
        try (InputStream in = CliTest.class.getResourceAsStream("/" + name)) {
            Files.copy(in, target);
        }
        return target;
    }

    @Test
    void testWritesOutputs(@TempDir Path dir) throws Exception {
        Path input = copyResource(dir, "scenario1.json");
        Path out = dir.resolve("out");
        assertEquals(0, Cli.run(new String[]{"-o", out.toString(), input.toString()}));
        assertEquals("scenario1(){\n   y = 6;\n   return y;\n}\n",
                new String(Files.readAllBytes(out.resolve("scenario1.c")), StandardCharsets.UTF_8));
        assertTrue(Files.exists(out.resolve("scenario1.json")));
    }

    @Test
    void testConfig(@TempDir Path dir) throws Exception {
        Path input = copyResource(dir, "open_call.json");
        Path config = dir.resolve("config.json");
        Files.write(config, "{\"macros\": {\"576\": \"O_CREAT\"}}".getBytes(StandardCharsets.UTF_8));
        Path out = dir.resolve("out");
        assertEquals(0, Cli.run(new String[]{"--config", config.toString(), "--output", out.toString(), "--", input.toString()}));
        String text = new String(Files.readAllBytes(out.resolve("open_call.c")), StandardCharsets.UTF_8);
        assertTrue(text.contains("open(\"log.txt\", O_CREAT)"), text);
    }

    @Test
    void testFailures(@TempDir Path dir) throws Exception {
        Path good = copyResource(dir, "scenario1.json");
        Path bad = dir.resolve("bad.json");
        Files.write(bad, "{\"name\": \"bad\", \"body\": 0, \"nodes\": [{\"id\": 0, \"tag\": \"goto\"}]}"
                .getBytes(StandardCharsets.UTF_8));
        Path out = dir.resolve("out");
        assertEquals(1, Cli.run(new String[]{"-o", out.toString(), bad.toString(), good.toString()}));
        assertTrue(Files.exists(out.resolve("scenario1.c")));

        Path cyclic = dir.resolve("cyclic.json");
        Files.write(cyclic, "{\"name\": \"cyclic\", \"body\": 0, \"nodes\": [{\"id\": 0, \"tag\": \"block\", \"args\": [0]}]}"
                .getBytes(StandardCharsets.UTF_8));
        Path cyclicOut = dir.resolve("cyclic-out");
        assertEquals(1, Cli.run(new String[]{"-o", cyclicOut.toString(), cyclic.toString(), good.toString()}));
        assertTrue(Files.exists(cyclicOut.resolve("scenario1.c")));
        assertFalse(Files.exists(cyclicOut.resolve("cyclic.c")));

        assertEquals(1, Cli.run(new String[]{dir.resolve("missing.json").toString()}));
        assertEquals(1, Cli.run(new String[]{"--frobnicate"}));
        assertEquals(1, Cli.run(new String[]{"-c"}));
        assertEquals(1, Cli.run(new String[0]));
        assertEquals(0, Cli.run(new String[]{"--help"}));
    }
}
