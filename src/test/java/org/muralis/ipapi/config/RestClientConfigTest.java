package org.muralis.ipapi.config;

import org.junit.jupiter.api.Test;
import org.muralis.ipapi.client.IpApiClient;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.web.client.RestClientAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockingDetails;

class RestClientConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    JacksonAutoConfiguration.class,
                    RestClientAutoConfiguration.class,
                    RestClientConfig.class));

    @Configuration
    static class CustomClientConfig {
        @Bean
        public IpApiClient ipApiClient() {
            return mock(IpApiClient.class);
        }
    }

    @Test
    void testClientBeansAreCreated() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(IpApiClient.class);
            assertThat(context).hasBean("ipApiRestClient");
            assertThat(context.getBean(IpApiProperties.class).getBaseUrl())
                    .isEqualTo(IpApiClient.DEFAULT_BASE_URL);
        });
    }

    @Test
    void testBaseUrlIsBound() {
        contextRunner.withPropertyValues("ip-api.base-url=https://geo.internal.example")
                .run(context -> assertThat(context.getBean(IpApiProperties.class).getBaseUrl())
                        .isEqualTo("https://geo.internal.example"));
    }

    @Test
    void testDisabledByProperty() {
        contextRunner.withPropertyValues("ip-api.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(IpApiClient.class);
                    assertThat(context).doesNotHaveBean("ipApiRestClient");
                });
    }

    @Test
    void testWorksWithoutRestClientBuilderBean() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(RestClientConfig.class))
                .run(context -> {
                    assertThat(context).hasSingleBean(IpApiClient.class);
                    assertThat(context).hasSingleBean(RestClient.class);
                });
    }

    @Test
    void testUserClientTakesPrecedence() {
        contextRunner.withUserConfiguration(CustomClientConfig.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(IpApiClient.class);
                    assertThat(mockingDetails(context.getBean(IpApiClient.class)).isMock()).isTrue();
                });
    }
}
