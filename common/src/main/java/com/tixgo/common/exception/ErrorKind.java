package com.tixgo.common.exception;

/**
 * Failure categories surfaced to callers. Presentation layers map these to transport status codes.
 */
public enum ErrorKind {
    NOT_FOUND,
    FORBIDDEN,
    INVALID_TRANSITION,
    INSUFFICIENT_STOCK,
    SLOT_LIMIT_EXCEEDED,
    ALREADY_PAID,
    NOT_ACCEPTED,
    NOT_APPROVED,
    DEPARTURE_PASSED,
    VENDOR_SUSPENDED,
    PAYMENT_NOT_COMPLETED,
    VALIDATION_ERROR,
    UNAUTHENTICATED,
    CONCURRENT_UPDATE,
    UNAVAILABLE
}
