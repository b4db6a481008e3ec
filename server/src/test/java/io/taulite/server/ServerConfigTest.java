package io.taulite.server;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ServerConfigTest {

    @TempDir Path tmp;

    @Test
    void defaults_without_flags() {
        var cfg = ServerConfig.defaults();

        assertEquals(7701, cfg.port());
        assertEquals(Path.of("./data"), cfg.dataDir());
        assertEquals(ServerConfig.Backend.DURABLE, cfg.backend());
        assertEquals(10_000, cfg.catalogCapacity());
        assertEquals(50_000, cfg.snapshotEvery());
        assertEquals(1024 * 1024, cfg.maxPayloadBytes());
    }

    @Test
    void flags_are_parsed() {
        var cfg = ServerConfig.fromArgs(new String[]{
                "-p", "9000", "--data-dir", "/tmp/tau", "--backend", "memory",
                "--catalog-capacity", "5", "--snapshot-every", "10", "--max-payload-bytes", "2048"});

        assertEquals(9000, cfg.port());
        assertEquals(Path.of("/tmp/tau"), cfg.dataDir());
        assertEquals(ServerConfig.Backend.MEMORY, cfg.backend());
        assertEquals(5, cfg.catalogCapacity());
        assertEquals(10, cfg.snapshotEvery());
        assertEquals(2048, cfg.maxPayloadBytes());
    }

    @Test
    void flags_override_json_file() throws Exception {
        Path file = tmp.resolve("tau.json");
        Files.writeString(file, """
                {
                  "port": 8100,
                  "backend": "memory",
                  "catalogCapacity": 42
                }
                """);

        var cfg = ServerConfig.fromArgs(new String[]{"--port", "8200", "--config", file.toString()});

        assertEquals(8200, cfg.port());
        assertEquals(ServerConfig.Backend.MEMORY, cfg.backend());
        assertEquals(42, cfg.catalogCapacity());
        assertEquals(50_000, cfg.snapshotEvery());
    }

    @Test
    void bad_input_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[]{"--bogus"}));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[]{"--port"}));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[]{"--port", "abc"}));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[]{"--backend", "tape"}));
        assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromArgs(new String[]{"--catalog-capacity", "0"}));
        assertThrows(UncheckedIOException.class,
                () -> ServerConfig.fromArgs(new String[]{"--config", tmp.resolve("missing.json").toString()}));
    }

    @Test
    void help_flag_is_detected() {
        assertTrue(ServerConfig.wantsHelp(new String[]{"--port", "1", "-h"}));
        assertFalse(ServerConfig.wantsHelp(new String[]{"--port", "1"}));
        assertTrue(ServerConfig.usage().contains("--snapshot-every"));
    }
}
