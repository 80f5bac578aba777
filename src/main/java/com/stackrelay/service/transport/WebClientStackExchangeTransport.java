package com.stackrelay.service.transport;

import com.stackrelay.config.StackRelayProperties;
import com.stackrelay.exception.StackApiException;
import com.stackrelay.exception.TransientNetworkException;
import com.stackrelay.exception.ValidationException;
import com.stackrelay.model.AccessMode;
import com.stackrelay.model.ApiOperation;
import com.stackrelay.model.ApiRequest;
import com.stackrelay.model.UpstreamResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Stack Exchange transport over Spring WebClient.
 * Authenticated calls carry the application key as the {@code key} query parameter.
 */
@Slf4j
@Component
public class WebClientStackExchangeTransport implements StackExchangeTransport {

    static final String KEY_PARAM = "key";

    private final WebClient webClient;
    private final UpstreamResponseMapper responseMapper;
    private final StackRelayProperties.ApiConfig config;

    public WebClientStackExchangeTransport(WebClient webClient,
                                           UpstreamResponseMapper responseMapper,
                                           StackRelayProperties properties) {
        this.webClient = webClient;
        this.responseMapper = responseMapper;
        this.config = properties.getApi();
    }

    @Override
    public Mono<UpstreamResponse> execute(ApiRequest request, AccessMode mode) {
        if (mode == AccessMode.AUTHENTICATED && !config.hasApiKey()) {
            return Mono.error(new ValidationException("No API key configured for authenticated access"));
        }

        ApiOperation operation = request.getOperation();
        log.info("Calling Stack Exchange {} ({}) as {}", operation.getPath(), operation, mode);

        return webClient.get()
                .uri(uriBuilder -> buildUri(uriBuilder, request, mode))
                .accept(MediaType.APPLICATION_JSON)
                .exchangeToMono(response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> responseMapper.map(
                                response.statusCode().value(),
                                response.headers().asHttpHeaders(),
                                body)))
                .timeout(config.getTimeout())
                .onErrorMap(WebClientStackExchangeTransport::isNetworkError,
                        error -> new TransientNetworkException(
                                "Network error calling " + operation.getPath() + ": " + error.getMessage(), error))
                .doOnSuccess(response -> log.debug("Received {} response for {}", mode, operation))
                .doOnError(error -> log.debug("Call to {} failed: {}", operation.getPath(), error.getMessage()));
    }

    URI buildUri(UriBuilder uriBuilder, ApiRequest request, AccessMode mode) {
        ApiOperation operation = request.getOperation();
        Map<String, Object> variables = new HashMap<>();

        uriBuilder.path("/" + operation.getPath());
        request.getParameters().forEach((name, value) -> {
            if (operation.hasIdsVariable() && ApiOperation.IDS_PARAM.equals(name)) {
                variables.put(name, value);
                return;
            }
            // Values go through variables so braces in search text are never read as templates
            uriBuilder.queryParam(name, "{" + name + "}");
            variables.put(name, value);
        });

        if (mode == AccessMode.AUTHENTICATED) {
            uriBuilder.queryParam(KEY_PARAM, "{" + KEY_PARAM + "}");
            variables.put(KEY_PARAM, config.getApiKey());
        }

        return uriBuilder.build(variables);
    }

    private static boolean isNetworkError(Throwable error) {
        if (error instanceof StackApiException) {
            return false;
        }
        return error instanceof WebClientRequestException
                || error instanceof TimeoutException
                || error instanceof IOException;
    }
}
