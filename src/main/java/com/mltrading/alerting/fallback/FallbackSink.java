package com.mltrading.alerting.fallback;

import com.mltrading.domain.model.Alert;

/**
 * Durable record of alerts that were not delivered: filtered, rate-limited or
 * failed. Invoked for every outcome other than SENT so no alert vanishes from the
 * operational record.
 */
public interface FallbackSink {

    /**
     * Records the full alert with the reason it was not delivered.
     *
     * @throws java.io.UncheckedIOException if the record could not be written
     */
    void log(Alert alert, String reason);
}
