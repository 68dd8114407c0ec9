package com.trade.paper.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * 配置管理器
 * 先加载类路径下的默认配置 paper-trading.properties，
 * 再用工作目录下的 config.properties（如存在）覆盖
 */
public class ConfigManager {

    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);

    public static final String DEFAULTS_RESOURCE = "paper-trading.properties";
    public static final String OVERRIDE_FILE = "config.properties";

    private final Properties properties;

    public ConfigManager(Properties properties) {
        this.properties = new Properties();
        this.properties.putAll(properties);
    }

    /**
     * 加载默认配置并叠加工作目录下的覆盖文件
     */
    public static ConfigManager load() {
        return load(Paths.get(OVERRIDE_FILE));
    }

    public static ConfigManager load(Path overrideFile) {
        Properties properties = new Properties();
        try (InputStream in = ConfigManager.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("缺少默认配置文件: " + DEFAULTS_RESOURCE);
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                properties.load(reader);
            }
        } catch (IOException e) {
            throw new IllegalStateException("无法加载默认配置: " + DEFAULTS_RESOURCE, e);
        }

        if (overrideFile != null && Files.exists(overrideFile)) {
            try (Reader reader = Files.newBufferedReader(overrideFile, StandardCharsets.UTF_8)) {
                properties.load(reader);
                logger.info("已加载覆盖配置: {}", overrideFile.toAbsolutePath());
            } catch (IOException e) {
                throw new IllegalStateException("无法加载配置文件: " + overrideFile, e);
            }
        }
        return new ConfigManager(properties);
    }

    /**
     * 获取配置属性
     */
    public String getProperty(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalStateException("配置项缺失: " + key);
        }
        return value.trim();
    }

    public String getProperty(String key, String defaultValue) {
        return hasProperty(key) ? getProperty(key) : defaultValue;
    }

    /**
     * 检查属性是否存在
     */
    public boolean hasProperty(String key) {
        String value = properties.getProperty(key);
        return value != null && !value.trim().isEmpty();
    }

    /**
     * 获取整数配置
     */
    public int getIntProperty(String key, int defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(getProperty(key));
        } catch (NumberFormatException e) {
            logger.warn("配置项 {} 不是有效整数，使用默认值 {}", key, defaultValue);
            return defaultValue;
        }
    }

    public long getLongProperty(String key, long defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }
        try {
            return Long.parseLong(getProperty(key));
        } catch (NumberFormatException e) {
            logger.warn("配置项 {} 不是有效整数，使用默认值 {}", key, defaultValue);
            return defaultValue;
        }
    }

    /**
     * 获取布尔配置
     */
    public boolean getBooleanProperty(String key, boolean defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }
        return Boolean.parseBoolean(getProperty(key));
    }

    /**
     * 获取小数配置，金额类配置必须走这里
     */
    public BigDecimal getDecimalProperty(String key, BigDecimal defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }
        try {
            return new BigDecimal(getProperty(key));
        } catch (NumberFormatException e) {
            logger.warn("配置项 {} 不是有效数字，使用默认值 {}", key, defaultValue);
            return defaultValue;
        }
    }
}
