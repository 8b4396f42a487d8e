package org.muralis.ipapi.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Optional response attributes of the ip-api.com JSON endpoint.
 * Each constant maps to a bit of the numeric {@code fields} query parameter.
 */
@Getter
@RequiredArgsConstructor
public enum IpApiField {

    CONTINENT("continent", 1 << 20),
    CONTINENT_CODE("continentCode", 1 << 21),
    COUNTRY("country", 1),
    COUNTRY_CODE("countryCode", 1 << 1),
    REGION("region", 1 << 2),
    REGION_NAME("regionName", 1 << 3),
    CITY("city", 1 << 4),
    DISTRICT("district", 1 << 19),
    ZIP("zip", 1 << 5),
    LAT("lat", 1 << 6),
    LON("lon", 1 << 7),
    TIMEZONE("timezone", 1 << 8),
    OFFSET("offset", 1 << 25),
    CURRENCY("currency", 1 << 23),
    ISP("isp", 1 << 9),
    ORG("org", 1 << 10),
    AS("as", 1 << 11),
    ASNAME("asname", 1 << 22),
    REVERSE("reverse", 1 << 12),
    MOBILE("mobile", 1 << 16),
    PROXY("proxy", 1 << 17),
    HOSTING("hosting", 1 << 24),
    QUERY("query", 1 << 13);

    /**
     * Bit of the error message attribute. Not selectable, always requested
     * so that failed lookups can be told apart from successful ones.
     */
    public static final int MESSAGE_BIT = 1 << 15;

    private final String jsonName;
    private final int bit;
}
