package com.stackrelay.service.transport;

import com.stackrelay.model.AccessMode;
import com.stackrelay.model.ApiRequest;
import com.stackrelay.model.UpstreamResponse;
import reactor.core.publisher.Mono;

/**
 * Physical transport to the Stack Exchange API.
 * Implementations handle authentication, quota metadata extraction and error
 * classification into the {@code com.stackrelay.exception} hierarchy.
 */
public interface StackExchangeTransport {

    /**
     * Issue one call.
     *
     * @param request logical request
     * @param mode    AUTHENTICATED or UNAUTHENTICATED
     * @return response with quota metadata; errors are {@code StackApiException}s
     */
    Mono<UpstreamResponse> execute(ApiRequest request, AccessMode mode);
}
