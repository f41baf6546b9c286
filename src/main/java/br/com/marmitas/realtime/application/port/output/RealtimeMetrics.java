package br.com.marmitas.realtime.application.port.output;

/**
 * Metrics sink for the fan-out pipeline.
 *
 * Implementations can publish to Prometheus, CloudWatch, etc.
 */
public interface RealtimeMetrics {

    /**
     * Publish the latest connection sample.
     *
     * @param total Currently open connections
     * @param authenticated Currently authenticated connections
     * @param peak Highest total seen so far
     */
    void updateConnectionGauges(int total, int authenticated, int peak);

    /**
     * Publish registry size.
     */
    void updateSubscriptionGauges(int clients, int subscriptions);

    /**
     * Record an inbound client message.
     *
     * @param messageType Wire type (ping, authenticate, subscribe, ...)
     */
    void recordMessageProcessed(String messageType);

    void recordConnectionError();

    void recordReconnect();

    void recordAuthentication(boolean success);

    /**
     * Record a change notification dropped by the transformer.
     *
     * @param reason UNMAPPED_TABLE, UNKNOWN_OPERATION, MISSING_ID, INVALID_PAYLOAD or ERROR
     */
    void recordTransformRejected(String reason);

    /**
     * Record the outcome of one fan-out.
     *
     * @param entityType Entity type of the event
     * @param delivered Successful per-subscription deliveries
     * @param failed Failed per-subscription deliveries
     */
    void recordFanOut(String entityType, int delivered, int failed);
}
