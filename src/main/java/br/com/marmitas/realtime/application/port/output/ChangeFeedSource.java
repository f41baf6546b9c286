package br.com.marmitas.realtime.application.port.output;

import br.com.marmitas.realtime.domain.change.ChangeRecord;

import java.util.function.Consumer;

/**
 * Port for the database change feed. The event transformer is its only consumer.
 */
public interface ChangeFeedSource {

    void start(Consumer<ChangeRecord> consumer);

    /**
     * Idempotent.
     */
    void stop();

    boolean isRunning();
}
