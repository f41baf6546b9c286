package br.com.marmitas.realtime.application.fanout;

/**
 * Outcome of pushing one event.
 *
 * @param matchedSubscriptions subscriptions whose kind and filters accepted the event
 * @param delivered sends the transport accepted
 * @param failed sends that returned false or threw
 */
public record FanOutResult(int matchedSubscriptions, int delivered, int failed) {
    public static final FanOutResult NONE = new FanOutResult(0, 0, 0);
}
