package com.boxcoxep.core.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class BoxCoxConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    public void clearProperty() {
        System.clearProperty(BoxCoxConfigLoader.CONFIG_PROPERTY);
    }

    @Test
    public void testClasspathConfig() {
        BoxCoxConfig.ConfigRoot config = BoxCoxConfigLoader.load();
        assertNotNull(config.quadrature);
        assertEquals(240, config.quadrature.steps.intValue());
        assertEquals(6.0, config.quadrature.truncationStdDevs.doubleValue(), 1e-12);
        assertEquals(100.0, config.quadrature.fallbackVariance.doubleValue(), 1e-12);
        assertEquals(1e-12, config.quadrature.precisionFloor.doubleValue(), 1e-24);
        assertEquals(1e-12, config.jacobian.minVariance.doubleValue(), 1e-24);
    }

    @Test
    public void testSystemPropertyOverridesClasspath() throws Exception {
        File file = tempDir.resolve("custom.json").toFile();
        Files.writeString(file.toPath(), "{ \"quadrature\": { \"steps\": 100 } }");
        System.setProperty(BoxCoxConfigLoader.CONFIG_PROPERTY, file.getAbsolutePath());

        BoxCoxConfig.ConfigRoot config = BoxCoxConfigLoader.load();
        assertEquals(100, config.quadrature.steps.intValue());
        assertNull(config.quadrature.minVariance);
        assertNull(config.jacobian);
    }

    @Test
    public void testMissingFileFails() {
        System.setProperty(BoxCoxConfigLoader.CONFIG_PROPERTY, tempDir.resolve("absent.json").toString());
        assertThrows(RuntimeException.class, BoxCoxConfigLoader::load);
    }

    @Test
    public void testMalformedJsonFails() {
        byte[] bytes = "{ \"quadrature\": ".getBytes(StandardCharsets.UTF_8);
        RuntimeException e = assertThrows(RuntimeException.class,
                () -> BoxCoxConfigLoader.read(new ByteArrayInputStream(bytes)));
        assertNotNull(e.getCause());
    }

    @Test
    public void testUnknownKeysIgnored() {
        byte[] bytes = "{ \"extra\": 1, \"jacobian\": { \"minVariance\": 0.5, \"other\": true } }"
                .getBytes(StandardCharsets.UTF_8);
        BoxCoxConfig.ConfigRoot config = BoxCoxConfigLoader.read(new ByteArrayInputStream(bytes));
        assertEquals(0.5, config.jacobian.minVariance.doubleValue(), 1e-12);
    }
}
