package org.muralis.ipapi.exception;

/**
 * The request never produced an HTTP response (connection, DNS, TLS or I/O failure).
 */
public class IpApiTransportException extends IpApiException {

    public IpApiTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
