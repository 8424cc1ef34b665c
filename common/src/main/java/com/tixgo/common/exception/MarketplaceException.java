package com.tixgo.common.exception;

import lombok.Getter;

@Getter
public class MarketplaceException extends RuntimeException {

    private final ErrorKind kind;

    public MarketplaceException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MarketplaceException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static MarketplaceException notFound(String resource, Object id) {
        return new MarketplaceException(ErrorKind.NOT_FOUND, resource + " not found: " + id);
    }

    public static MarketplaceException forbidden(String message) {
        return new MarketplaceException(ErrorKind.FORBIDDEN, message);
    }

    public static MarketplaceException validation(String message) {
        return new MarketplaceException(ErrorKind.VALIDATION_ERROR, message);
    }

    public static MarketplaceException invalidTransition(String message) {
        return new MarketplaceException(ErrorKind.INVALID_TRANSITION, message);
    }
}
