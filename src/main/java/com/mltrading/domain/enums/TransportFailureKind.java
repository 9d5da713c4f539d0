package com.mltrading.domain.enums;

/**
 * Classifies why the outbound transport rejected a send.
 */
public enum TransportFailureKind {
    TIMEOUT,
    CONNECTION,
    AUTHENTICATION,

    /** Transport switched off or missing credentials/recipient. */
    UNAVAILABLE,

    /** Server answered but refused the message. */
    PROTOCOL
}
