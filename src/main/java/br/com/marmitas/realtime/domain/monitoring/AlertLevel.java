package br.com.marmitas.realtime.domain.monitoring;

/**
 * Alert severity levels for realtime monitoring
 */
public enum AlertLevel {
    /**
     * CRITICAL - Immediate action required
     * Examples: change feed down, WebSocket listener not accepting
     */
    CRITICAL,

    /**
     * HIGH - Action required soon
     * Examples: connection ceiling exceeded
     */
    HIGH,

    /**
     * INFO - General information
     */
    INFO
}
