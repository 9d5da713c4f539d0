package com.mltrading.alerting.transport;

import com.mltrading.domain.enums.TransportFailureKind;
import com.mltrading.domain.model.Alert;
import com.mltrading.exception.TransportException;

/**
 * Transport used when {@code mltrading.alerts.email.enabled=false}. It reports itself
 * unavailable, so AlertManager fails alerts that pass filtering into the fallback sink
 * without calling {@link #send}; a direct send fails as UNAVAILABLE.
 */
public class DisabledEmailTransport implements EmailTransport {

    @Override
    public void send(Alert alert) {
        throw new TransportException(TransportFailureKind.UNAVAILABLE, "E-mail alerts are disabled");
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public void testConnection() {
        throw new TransportException(TransportFailureKind.UNAVAILABLE, "E-mail alerts are disabled");
    }
}
