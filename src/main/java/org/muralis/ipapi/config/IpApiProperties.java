package org.muralis.ipapi.config;

import lombok.Data;
import org.muralis.ipapi.client.IpApiClient;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "ip-api")
public class IpApiProperties {

    /**
     * Whether to register the {@link IpApiClient} bean.
     */
    private boolean enabled = true;

    /**
     * Scheme and host the lookups are sent to.
     */
    private String baseUrl = IpApiClient.DEFAULT_BASE_URL;
}
