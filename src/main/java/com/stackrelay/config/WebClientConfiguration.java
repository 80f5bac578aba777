package com.stackrelay.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * WebClient configuration for calls to the Stack Exchange API.
 */
@Configuration
public class WebClientConfiguration {

    // Question bodies with answers routinely exceed the 256KB default
    private static final int MAX_IN_MEMORY_SIZE = 4 * 1024 * 1024;

    private final StackRelayProperties properties;

    public WebClientConfiguration(StackRelayProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient stackExchangeWebClient() {
        // The API always answers gzip-compressed
        HttpClient httpClient = HttpClient.create()
                .compress(true)
                .responseTimeout(properties.getApi().getTimeout());

        return WebClient.builder()
                .baseUrl(properties.getApi().getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                        .build())
                .build();
    }
}
