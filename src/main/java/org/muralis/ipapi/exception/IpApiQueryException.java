package org.muralis.ipapi.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The API answered normally but reported the lookup as failed.
 */
@Getter
public class IpApiQueryException extends IpApiException {

    @Getter
    @RequiredArgsConstructor
    public enum Reason {
        /** Malformed IP address or non-existent domain, e.g. {@code 1.1.1.one} */
        INVALID_QUERY("invalid query"),
        /** Address inside a private network, e.g. {@code 192.168.1.1} */
        PRIVATE_RANGE("private range"),
        /** Reserved address, e.g. {@code 127.0.0.1} */
        RESERVED_RANGE("reserved range"),
        OTHER(null);

        private final String apiMessage;

        public static Reason fromApiMessage(String message) {
            for (Reason reason : values()) {
                if (reason.apiMessage != null && reason.apiMessage.equals(message)) {
                    return reason;
                }
            }
            return OTHER;
        }
    }

    private final Reason reason;
    private final String apiMessage;

    public IpApiQueryException(String apiMessage) {
        super(apiMessage != null ? "Lookup failed: " + apiMessage : "Lookup failed");
        this.reason = Reason.fromApiMessage(apiMessage);
        this.apiMessage = apiMessage;
    }
}
