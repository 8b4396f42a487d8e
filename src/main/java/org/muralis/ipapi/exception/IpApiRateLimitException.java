package org.muralis.ipapi.exception;

import lombok.Getter;

/**
 * HTTP 429 from the API. ip-api.com allows 45 requests per minute from one address
 * and reports the seconds until the window resets in the {@code X-Ttl} header.
 */
@Getter
public class IpApiRateLimitException extends IpApiStatusException {

    public static final int UNKNOWN_TTL = -1;

    private final int secondsToReset;

    public IpApiRateLimitException(String message, int secondsToReset) {
        super(message, 429);
        this.secondsToReset = secondsToReset;
    }

    public boolean isTtlKnown() {
        return secondsToReset != UNKNOWN_TTL;
    }
}
