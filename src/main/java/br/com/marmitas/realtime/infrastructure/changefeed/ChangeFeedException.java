package br.com.marmitas.realtime.infrastructure.changefeed;

/**
 * The change-feed listener lost, or could not establish, its database subscription.
 */
public class ChangeFeedException extends RuntimeException {
    private final String channel;

    public ChangeFeedException(String channel, String message, Throwable cause) {
        super(message + " (channel=" + channel + ")", cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
