package com.recnos.sensors.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServerConfigTest {

    @Test
    @DisplayName("Should use defaults without properties or arguments")
    void shouldUseDefaults() {
        ServerConfig config = ServerConfig.load(new Properties(), new String[0]);

        assertThat(config.port()).isEqualTo(8080);
        assertThat(config.queryTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.maxContentLength()).isEqualTo(65536);
        assertThat(config.workerThreads()).isPositive();
    }

    @Test
    @DisplayName("Should let arguments override system properties")
    void shouldPreferArgumentsOverProperties() {
        Properties properties = new Properties();
        properties.setProperty("sensors.port", "9090");
        properties.setProperty("sensors.query.timeout.ms", "1500");
        properties.setProperty("sensors.worker.threads", "3");

        ServerConfig fromProperties = ServerConfig.load(properties, new String[0]);
        ServerConfig fromArgs = ServerConfig.load(properties, new String[]{"7070", "2"});

        assertThat(fromProperties.port()).isEqualTo(9090);
        assertThat(fromProperties.queryTimeout()).isEqualTo(Duration.ofMillis(1500));
        assertThat(fromProperties.workerThreads()).isEqualTo(3);
        assertThat(fromArgs.port()).isEqualTo(7070);
        assertThat(fromArgs.queryTimeout()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("Should fall back to defaults for invalid values")
    void shouldFallBackOnInvalidValues() {
        Properties properties = new Properties();
        properties.setProperty("sensors.max.content.length", "-1");

        ServerConfig config = ServerConfig.load(properties, new String[]{"not-a-port", "0"});

        assertThat(config.port()).isEqualTo(ServerConfig.DEFAULT_PORT);
        assertThat(config.queryTimeout()).isEqualTo(ServerConfig.DEFAULT_QUERY_TIMEOUT);
        assertThat(config.maxContentLength()).isEqualTo(ServerConfig.DEFAULT_MAX_CONTENT_LENGTH);
    }

    @Test
    @DisplayName("Should fall back to the default timeout when seconds overflow milliseconds")
    void shouldFallBackOnTimeoutOverflow() {
        ServerConfig config = ServerConfig.load(new Properties(), new String[]{"8080", "9223372036854775807"});

        assertThat(config.queryTimeout()).isEqualTo(ServerConfig.DEFAULT_QUERY_TIMEOUT);
    }

    @Test
    @DisplayName("Should reject invalid values passed to the constructor")
    void shouldValidateInConstructor() {
        assertThatThrownBy(() -> new ServerConfig(70000, Duration.ofSeconds(1), 1024, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ServerConfig.defaults().withQueryTimeout(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
