package org.muralis.ipapi.exception;

/**
 * The response body was empty, not JSON, or not shaped like a lookup result.
 */
public class IpApiDeserializationException extends IpApiException {

    public IpApiDeserializationException(String message) {
        super(message);
    }

    public IpApiDeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
