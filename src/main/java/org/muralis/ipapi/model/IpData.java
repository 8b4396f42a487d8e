package org.muralis.ipapi.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Geolocation data returned for one lookup target.
 * <p>
 * Every attribute is {@code null} unless it was requested through
 * {@link org.muralis.ipapi.client.IpApiConfig} and the API actually
 * returned it.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class IpData {

    private String continent;
    private String continentCode;
    private String country;
    /** ISO 3166-1 alpha-2 */
    private String countryCode;
    /** Region/state short code (FIPS or ISO) */
    private String region;
    private String regionName;
    private String city;
    private String district;
    private String zip;
    private Double lat;
    private Double lon;
    private String timezone;
    /** UTC DST offset in seconds */
    private Integer offset;
    private String currency;
    private String isp;
    private String org;
    /** AS number and organization, empty for blocks not announced in BGP tables */
    private String as;
    private String asname;
    private String reverse;
    private Boolean mobile;
    private Boolean proxy;
    private Boolean hosting;
    /** IP or domain the lookup was made for */
    private String query;
}
