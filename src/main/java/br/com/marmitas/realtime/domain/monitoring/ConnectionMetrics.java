package br.com.marmitas.realtime.domain.monitoring;

/**
 * Immutable snapshot of the connection monitor's counters.
 *
 * {@code totalConnections} and {@code authenticatedConnections} reflect the last sample;
 * every other counter only grows.
 */
public record ConnectionMetrics(
    int totalConnections,
    int authenticatedConnections,
    int peakConnections,
    long messagesProcessed,
    long connectionErrors,
    long reconnects
) {}
