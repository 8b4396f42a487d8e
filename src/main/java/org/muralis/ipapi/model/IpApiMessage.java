package org.muralis.ipapi.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Failure marker of a lookup entry; {@code message} is only sent when the lookup failed.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IpApiMessage(
    String status,
    String message
) {

    public boolean isFail() {
        return "fail".equals(status);
    }
}
