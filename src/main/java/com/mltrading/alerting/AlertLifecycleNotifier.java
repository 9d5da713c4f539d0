package com.mltrading.alerting;

import com.mltrading.config.AlertConfigHolder;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Announces application startup and shutdown through the alert pipeline when
 * {@code mltrading.alerts.lifecycle-alerts} is on.
 */
@Component
public class AlertLifecycleNotifier {

    private static final Logger log = LoggerFactory.getLogger(AlertLifecycleNotifier.class);

    private final AlertManager alertManager;
    private final AlertConfigHolder configHolder;
    private final String applicationName;

    public AlertLifecycleNotifier(
            AlertManager alertManager,
            AlertConfigHolder configHolder,
            @Value("${spring.application.name:mltrading-alerting}") String applicationName) {
        this.alertManager = alertManager;
        this.configHolder = configHolder;
        this.applicationName = applicationName;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!configHolder.current().isLifecycleAlerts()) {
            return;
        }
        log.info("Sending startup alert for {}", applicationName);
        alertManager.process(AlertFactory.createSystemStartupAlert(applicationName, version(), Map.of()));
    }

    @EventListener(ContextClosedEvent.class)
    public void onContextClosed() {
        if (!configHolder.current().isLifecycleAlerts()) {
            return;
        }
        log.info("Sending shutdown alert for {}", applicationName);
        alertManager.process(AlertFactory.createSystemShutdownAlert(applicationName, null, Map.of()));
    }

    private String version() {
        return getClass().getPackage().getImplementationVersion();
    }
}
