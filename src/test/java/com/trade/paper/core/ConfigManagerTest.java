package com.trade.paper.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConfigManager 单元测试
 */
class ConfigManagerTest {

    @Test
    void load_shouldReadClasspathDefaults() {
        ConfigManager config = ConfigManager.load(null);

        assertEquals("https://fapi.binance.com", config.getProperty("binance.rest.base-url"));
        assertEquals(1000, config.getLongProperty("stream.reconnect.base-delay-ms", 0));
        assertEquals(0, new BigDecimal("0.0004").compareTo(config.getDecimalProperty("ledger.taker-fee", null)));
        assertTrue(config.getBooleanProperty("stream.control-frames.enabled", false));
    }

    @Test
    void load_shouldOverlayOverrideFile(@TempDir Path dir) throws Exception {
        Path override = dir.resolve("config.properties");
        Files.writeString(override, "ledger.initial-balance=5000\nstream.control-frames.enabled=false\n",
                StandardCharsets.UTF_8);

        ConfigManager config = ConfigManager.load(override);

        assertEquals(0, new BigDecimal("5000").compareTo(config.getDecimalProperty("ledger.initial-balance", null)));
        assertFalse(config.getBooleanProperty("stream.control-frames.enabled", true));
        // 未覆盖的键保留默认值
        assertEquals(125, config.getIntProperty("ledger.max-leverage", 0));
    }

    @Test
    void getters_shouldFallBackToDefaults() {
        Properties properties = new Properties();
        properties.setProperty("bad.int", "abc");
        properties.setProperty("bad.decimal", "1.2.3");
        properties.setProperty("blank", "  ");
        ConfigManager config = new ConfigManager(properties);

        assertEquals(7, config.getIntProperty("bad.int", 7));
        assertEquals(0, BigDecimal.ONE.compareTo(config.getDecimalProperty("bad.decimal", BigDecimal.ONE)));
        assertFalse(config.hasProperty("blank"));
        assertEquals("x", config.getProperty("missing", "x"));
    }

    @Test
    void getProperty_shouldThrowWhenRequiredKeyMissing() {
        ConfigManager config = new ConfigManager(new Properties());
        assertThrows(IllegalStateException.class, () -> config.getProperty("missing"));
    }
}
