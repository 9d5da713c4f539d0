package com.mltrading.exception;

import com.mltrading.domain.enums.TransportFailureKind;
import lombok.Getter;

/**
 * The outbound transport failed to deliver an alert (timeout, connection refused,
 * authentication rejected, server refusal). Counted by the circuit breaker.
 */
@Getter
public class TransportException extends BaseException {

    private final TransportFailureKind kind;

    public TransportException(TransportFailureKind kind, String message) {
        super(ErrorCode.TRANSPORT_ERROR, message);
        this.kind = kind;
    }

    public TransportException(TransportFailureKind kind, String message, Throwable cause) {
        super(ErrorCode.TRANSPORT_ERROR, message, cause);
        this.kind = kind;
    }
}
