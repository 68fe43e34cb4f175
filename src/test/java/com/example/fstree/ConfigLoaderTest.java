package com.example.fstree;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void readsAllSettings() throws Exception {
        Path dir = Files.createTempDirectory("config-test");
        Path config = Files.writeString(dir.resolve("config.json"), """
                {
                  "workingDirectory": "%s",
                  "followLinks": true,
                  "copyBufferSize": 1024,
                  "directoryMode": "rwxr-x---",
                  "threadCount": 3,
                  "detectContentTypes": true,
                  "unknownSetting": "ignored"
                }
                """.formatted(dir));

        FileTreeConfig loaded = new ConfigLoader().load(config);

        assertEquals(dir, loaded.workingDirectory());
        assertTrue(loaded.followLinks());
        assertEquals(1024, loaded.copyBufferSize());
        assertEquals(PosixFilePermissions.fromString("rwxr-x---"), loaded.directoryMode().orElseThrow());
        assertEquals(3, loaded.threadCount());
        assertTrue(loaded.detectContentTypes());
    }

    @Test
    void fallsBackToDefaults() throws Exception {
        Path dir = Files.createTempDirectory("config-test");
        Path config = Files.writeString(dir.resolve("config.json"), "{\"copyBufferSize\": 0}");

        FileTreeConfig loaded = new ConfigLoader().load(config);
        FileTreeConfig defaults = FileTreeConfig.defaults();

        assertEquals(defaults.workingDirectory(), loaded.workingDirectory());
        assertEquals(ByteStreamCopier.DEFAULT_BUFFER_SIZE, loaded.copyBufferSize());
        assertEquals(defaults.threadCount(), loaded.threadCount());
        assertFalse(loaded.followLinks());
        assertTrue(loaded.directoryMode().isEmpty());
    }

    @Test
    void rejectsMalformedMode() throws Exception {
        Path dir = Files.createTempDirectory("config-test");
        Path config = Files.writeString(dir.resolve("config.json"), "{\"directoryMode\": \"755\"}");

        assertThrows(IllegalArgumentException.class, () -> new ConfigLoader().load(config));
    }
}
