package io.slwhitelist.core.db;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DatabaseConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileIsCreatedWithMysqlDefaults() {
        Path configPath = tempDir.resolve("config/database.json");

        DatabaseConfig config = DatabaseConfig.load(configPath);

        assertTrue(Files.exists(configPath));
        assertFalse(config.hasJdbcUrlOverride());
        assertEquals("jdbc:mysql://localhost:3306/squadjs", config.resolveJdbcUrl());
    }

    @Test
    void jdbcUrlOverrideWins() throws IOException {
        Path configPath = tempDir.resolve("database.json");
        Files.writeString(configPath, "{\"jdbcUrl\":\"jdbc:h2:mem:x\",\"host\":\"db.internal\"}");

        DatabaseConfig config = DatabaseConfig.load(configPath);

        assertTrue(config.hasJdbcUrlOverride());
        assertEquals("jdbc:h2:mem:x", config.resolveJdbcUrl());
    }

    @Test
    void malformedFileFallsBackToDefaults() throws IOException {
        Path configPath = tempDir.resolve("database.json");
        Files.writeString(configPath, "{ not json");

        DatabaseConfig config = DatabaseConfig.load(configPath);

        assertEquals("localhost", config.getHost());
        assertEquals(3306, config.getPort());
    }
}
