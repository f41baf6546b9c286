package br.com.marmitas.realtime.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RealtimeConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("WS_MAX_CONNECTIONS");
        System.clearProperty("WS_ENTITY_TYPES");
        System.clearProperty("WS_MONITORING_INTERVAL");
        System.clearProperty("APP_ENV");
    }

    @Test
    void fromEnvFallsBackToSystemProperties() {
        System.setProperty("WS_MAX_CONNECTIONS", "250");
        System.setProperty("WS_ENTITY_TYPES", "orders, products,,menus");
        System.setProperty("WS_MONITORING_INTERVAL", "15000");
        System.setProperty("APP_ENV", "production");

        RealtimeConfig config = RealtimeConfig.fromEnv();

        assertEquals(250, config.maxConnections());
        assertEquals(List.of("orders", "products", "menus"), config.entityTypes());
        assertEquals(Duration.ofSeconds(15), config.monitoringInterval());
        assertTrue(config.isProduction());
    }

    @Test
    void malformedNumbersUseDefaults() {
        System.setProperty("WS_MAX_CONNECTIONS", "lots");

        assertEquals(1000, RealtimeConfig.fromEnv().maxConnections());
    }

    @Test
    void defaultsCoverStorefrontTables() {
        RealtimeConfig config = RealtimeConfig.defaults();

        assertEquals(9, config.entityTypes().size());
        assertFalse(config.isProduction());
        assertFalse(config.requireAuthentication());
    }
}
