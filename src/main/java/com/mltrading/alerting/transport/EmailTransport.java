package com.mltrading.alerting.transport;

import com.mltrading.domain.model.Alert;
import com.mltrading.exception.TransportException;

/**
 * Outbound delivery of alerts. The alerting core depends only on this interface;
 * the SMTP implementation and its credentials are injected and can be swapped for a
 * no-op or mock.
 */
public interface EmailTransport {

    /**
     * Delivers one alert. Connection handling (open, authenticate, transmit, close)
     * is scoped to this call and bounded by the configured timeout.
     *
     * @throws TransportException on timeout, connection failure, authentication
     *     rejection or server refusal
     */
    void send(Alert alert);

    /** True when the transport is enabled and has everything it needs to send. */
    boolean isAvailable();

    /**
     * Connects and authenticates without sending an alert body.
     *
     * @throws TransportException if the handshake fails
     */
    void testConnection();
}
