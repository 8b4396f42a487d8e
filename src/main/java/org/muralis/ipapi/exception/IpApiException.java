package org.muralis.ipapi.exception;

/**
 * Base class of every failure raised while performing a lookup.
 */
public abstract class IpApiException extends RuntimeException {

    protected IpApiException(String message) {
        super(message);
    }

    protected IpApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
