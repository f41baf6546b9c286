package br.com.marmitas.realtime.application.monitoring;

import br.com.marmitas.realtime.domain.monitoring.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Alert notification service.
 *
 * Currently logs to SLF4J; paging and chat integrations hook in here.
 */
public class AlertService {
    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    /**
     * Send alert to configured channels.
     *
     * @param alert Alert to send
     */
    public void sendAlert(Alert alert) {
        switch (alert.level()) {
            case CRITICAL:
                log.error("[ALERT-CRITICAL] {} - {}", alert.type(), alert.message());
                break;
            case HIGH:
                log.warn("[ALERT-HIGH] {} - {}", alert.type(), alert.message());
                break;
            case INFO:
                log.info("[ALERT-INFO] {} - {}", alert.type(), alert.message());
                break;
        }

        if (!alert.details().isEmpty()) {
            log.info("[ALERT-DETAILS] {}", alert.details());
        }
    }
}
