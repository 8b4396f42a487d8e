package org.muralis.ipapi.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.muralis.ipapi.client.IpApiClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.web.client.RestClientAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.client.RestClient;

/**
 * Registers an {@link IpApiClient} pointed at {@code ip-api.base-url}.
 * Applications can replace either bean by declaring their own.
 */
@Slf4j
@AutoConfiguration(after = {JacksonAutoConfiguration.class, RestClientAutoConfiguration.class})
@ConditionalOnProperty(prefix = "ip-api", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(IpApiProperties.class)
public class RestClientConfig {

    @Bean
    @ConditionalOnMissingBean(name = "ipApiRestClient")
    public RestClient ipApiRestClient(IpApiProperties properties,
                                      ObjectProvider<RestClient.Builder> restClientBuilder) {
        log.info("Configuring ip-api RestClient with base URL {}", properties.getBaseUrl());
        return restClientBuilder.getIfAvailable(RestClient::builder)
                .baseUrl(properties.getBaseUrl())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public IpApiClient ipApiClient(@Qualifier("ipApiRestClient") RestClient ipApiRestClient,
                                   ObjectProvider<ObjectMapper> objectMapper) {
        return new IpApiClient(ipApiRestClient, objectMapper.getIfAvailable(ObjectMapper::new));
    }
}
