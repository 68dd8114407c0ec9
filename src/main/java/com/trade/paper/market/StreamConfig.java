package com.trade.paper.market;

import com.trade.paper.core.ConfigManager;

import java.time.Duration;

/**
 * 行情连接配置
 */
public class StreamConfig {

    private String baseUrl = "wss://fstream.binance.com";
    private Duration reconnectBaseDelay = Duration.ofSeconds(1);
    private Duration reconnectMaxDelay = Duration.ofSeconds(30);
    private double reconnectMultiplier = 1.5;
    private boolean controlFramesEnabled = true;
    private String depthSpeed = "100ms";

    public static StreamConfig from(ConfigManager config) {
        return builder()
                .baseUrl(config.getProperty("binance.ws.base-url", "wss://fstream.binance.com"))
                .reconnectBaseDelay(Duration.ofMillis(config.getLongProperty("stream.reconnect.base-delay-ms", 1000)))
                .reconnectMaxDelay(Duration.ofMillis(config.getLongProperty("stream.reconnect.max-delay-ms", 30000)))
                .reconnectMultiplier(Double.parseDouble(config.getProperty("stream.reconnect.multiplier", "1.5")))
                .controlFramesEnabled(config.getBooleanProperty("stream.control-frames.enabled", true))
                .depthSpeed(config.getProperty("stream.depth.speed", "100ms"))
                .build();
    }

    public String getBaseUrl() { return baseUrl; }
    public Duration getReconnectBaseDelay() { return reconnectBaseDelay; }
    public Duration getReconnectMaxDelay() { return reconnectMaxDelay; }
    public double getReconnectMultiplier() { return reconnectMultiplier; }
    public boolean isControlFramesEnabled() { return controlFramesEnabled; }
    public String getDepthSpeed() { return depthSpeed; }

    public ReconnectBackoff newBackoff() {
        return new ReconnectBackoff(reconnectBaseDelay, reconnectMaxDelay, reconnectMultiplier);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final StreamConfig config = new StreamConfig();

        public Builder baseUrl(String value) {
            config.baseUrl = value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
            return this;
        }

        public Builder reconnectBaseDelay(Duration value) {
            config.reconnectBaseDelay = value;
            return this;
        }

        public Builder reconnectMaxDelay(Duration value) {
            config.reconnectMaxDelay = value;
            return this;
        }

        public Builder reconnectMultiplier(double value) {
            config.reconnectMultiplier = value;
            return this;
        }

        public Builder controlFramesEnabled(boolean value) {
            config.controlFramesEnabled = value;
            return this;
        }

        public Builder depthSpeed(String value) {
            config.depthSpeed = value;
            return this;
        }

        public StreamConfig build() {
            return config;
        }
    }
}
