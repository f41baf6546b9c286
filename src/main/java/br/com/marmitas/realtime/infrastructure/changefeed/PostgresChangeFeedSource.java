package br.com.marmitas.realtime.infrastructure.changefeed;

import br.com.marmitas.realtime.application.port.output.ChangeFeedSource;
import br.com.marmitas.realtime.domain.change.ChangeRecord;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Change feed backed by PostgreSQL LISTEN/NOTIFY.
 *
 * A trigger on each watched table calls {@code pg_notify(channel, json)} with
 * {@code {table, schema, eventType, new, old}} (see {@code db/change_feed_trigger.sql}).
 * One pooled connection is held for the LISTEN session and polled on a daemon thread.
 * If the session breaks, the listener waits and subscribes again.
 */
public final class PostgresChangeFeedSource implements ChangeFeedSource {
    private static final Logger log = LoggerFactory.getLogger(PostgresChangeFeedSource.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    // Channel names are spliced into LISTEN, which takes no bind parameters
    private static final Pattern CHANNEL_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

    static final Duration RETRY_DELAY = Duration.ofSeconds(5);

    private final DataSource dataSource;
    private final String channel;
    private final Duration pollInterval;

    private volatile boolean running = false;
    private volatile Thread worker;
    private volatile Connection listenConnection;

    public PostgresChangeFeedSource(DataSource dataSource, String channel, Duration pollInterval) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        if (!CHANNEL_NAME.matcher(channel).matches()) {
            throw new IllegalArgumentException("Invalid notification channel name: " + channel);
        }
    }

    @Override
    public synchronized void start(Consumer<ChangeRecord> consumer) {
        Objects.requireNonNull(consumer, "consumer");
        if (running) {
            return;
        }
        running = true;

        Thread t = new Thread(() -> runLoop(consumer), "change-feed-" + channel);
        t.setDaemon(true);
        worker = t;
        t.start();

        log.info("[CHANGE-FEED] Started listener on channel {}", channel);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;

        Thread t = worker;
        worker = null;
        if (t != null) {
            t.interrupt();
            try {
                t.join(RETRY_DELAY.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        closeQuietly();
        log.info("[CHANGE-FEED] Stopped listener on channel {}", channel);
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void runLoop(Consumer<ChangeRecord> consumer) {
        while (running) {
            try {
                listen(consumer);
            } catch (ChangeFeedException e) {
                if (!running) {
                    break;
                }
                log.error("[CHANGE-FEED] {}; retrying in {}s", e.getMessage(), RETRY_DELAY.toSeconds(), e.getCause());
                closeQuietly();
                try {
                    Thread.sleep(RETRY_DELAY.toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    private void listen(Consumer<ChangeRecord> consumer) {
        PGConnection pg;
        try {
            listenConnection = dataSource.getConnection();
            listenConnection.setAutoCommit(true);
            try (Statement stmt = listenConnection.createStatement()) {
                stmt.execute("LISTEN " + channel);
            }
            pg = listenConnection.unwrap(PGConnection.class);
            log.info("[CHANGE-FEED] Listening on channel {}", channel);
        } catch (SQLException e) {
            throw new ChangeFeedException(channel, "Failed to subscribe", e);
        }

        int timeoutMs = (int) Math.max(1, pollInterval.toMillis());
        while (running && !Thread.currentThread().isInterrupted()) {
            PGNotification[] notifications;
            try {
                notifications = pg.getNotifications(timeoutMs);
            } catch (SQLException e) {
                throw new ChangeFeedException(channel, "Lost notification session", e);
            }
            if (notifications == null) {
                continue;
            }
            for (PGNotification notification : notifications) {
                dispatch(notification.getParameter(), consumer);
            }
        }
    }

    private void dispatch(String payload, Consumer<ChangeRecord> consumer) {
        Optional<ChangeRecord> change = parse(payload);
        if (change.isEmpty()) {
            return;
        }
        try {
            consumer.accept(change.get());
        } catch (Exception e) {
            log.error("[CHANGE-FEED] Consumer failed for table {}", change.get().table(), e);
        }
    }

    /**
     * Parse a notification payload; empty (with a WARN) if it is not a change record.
     */
    static Optional<ChangeRecord> parse(String payload) {
        if (payload == null || payload.isBlank()) {
            log.warn("[CHANGE-FEED] Empty notification payload");
            return Optional.empty();
        }
        try {
            ChangeRecord change = MAPPER.readValue(payload, ChangeRecord.class);
            if (change == null || change.table() == null) {
                log.warn("[CHANGE-FEED] Notification without table: {}", payload);
                return Optional.empty();
            }
            return Optional.of(change);
        } catch (Exception e) {
            log.warn("[CHANGE-FEED] Malformed notification payload: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void closeQuietly() {
        Connection conn = listenConnection;
        listenConnection = null;
        if (conn == null) {
            return;
        }
        try {
            conn.close();
        } catch (SQLException e) {
            log.debug("[CHANGE-FEED] Error closing listen connection: {}", e.getMessage());
        }
    }
}
