package org.muralis.ipapi.exception;

import lombok.Getter;

/**
 * The API answered with a non-success HTTP status.
 */
@Getter
public class IpApiStatusException extends IpApiException {

    private final int statusCode;

    public IpApiStatusException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }
}
