package com.stackrelay.service.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stackrelay.exception.RateLimitException;
import com.stackrelay.exception.StackApiException;
import com.stackrelay.exception.UpstreamServerException;
import com.stackrelay.exception.ValidationException;
import com.stackrelay.model.QuotaInfo;
import com.stackrelay.model.UpstreamResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Turns a raw API answer into an {@link UpstreamResponse} or a classified exception.
 *
 * Stack Exchange reports most failures as HTTP 400 with an {@code error_id} in the
 * wrapper object, so the body decides as much as the status:
 * - 429, {@code error_id} 502 (throttle_violation) or a throttle/quota message: rate limit
 * - 5xx, {@code error_id} 500 (internal_error) or 503 (temporarily_unavailable): server error
 * - any other 4xx or {@code error_id}: validation error
 */
@Slf4j
@Component
public class UpstreamResponseMapper {

    static final String REMAINING_HEADER = "x-ratelimit-remaining";
    static final String RESET_HEADER = "x-ratelimit-reset";

    private static final int THROTTLE_VIOLATION = 502;
    private static final int INTERNAL_ERROR = 500;
    private static final int TEMPORARILY_UNAVAILABLE = 503;

    private final ObjectMapper objectMapper;

    public UpstreamResponseMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws StackApiException when the answer is an error
     */
    public UpstreamResponse map(int status, HttpHeaders headers, String body) {
        JsonNode json = parse(status, body);
        Integer errorId = json.hasNonNull("error_id") ? json.get("error_id").asInt() : null;

        if (status >= 400 || errorId != null) {
            throw classify(status, headers, json, errorId);
        }

        return new UpstreamResponse(json, extractQuota(headers, json));
    }

    StackApiException classify(int status, HttpHeaders headers, JsonNode json, Integer errorId) {
        String message = describe(status, json);
        String lowered = message.toLowerCase(Locale.ROOT);

        if (status == HttpStatus.TOO_MANY_REQUESTS.value()
                || (errorId != null && errorId == THROTTLE_VIOLATION)
                || lowered.contains("throttle")
                || lowered.contains("quota")) {
            return new RateLimitException("Stack Exchange rate limit exceeded: " + message,
                    retryAfter(headers, json));
        }

        if (status >= 500 || (errorId != null && (errorId == INTERNAL_ERROR || errorId == TEMPORARILY_UNAVAILABLE))) {
            return new UpstreamServerException("Stack Exchange server error: " + message,
                    status >= 500 ? status : errorId);
        }

        return new ValidationException("Stack Exchange API error: " + message, errorId);
    }

    QuotaInfo extractQuota(HttpHeaders headers, JsonNode json) {
        Integer remaining = intField(json, "quota_remaining");
        if (remaining == null) {
            remaining = parseInt(headers.getFirst(REMAINING_HEADER));
        }

        Long resetEpoch = parseLong(headers.getFirst(RESET_HEADER));
        Integer backoff = intField(json, "backoff");

        return QuotaInfo.builder()
                .remaining(remaining)
                .max(intField(json, "quota_max"))
                .resetAt(resetEpoch != null ? Instant.ofEpochSecond(resetEpoch) : null)
                .backoff(backoff != null ? Duration.ofSeconds(backoff) : null)
                .build();
    }

    private JsonNode parse(int status, String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            if (status >= 400) {
                // Error pages from the front proxy are HTML; classify by status alone
                return objectMapper.createObjectNode();
            }
            throw new UpstreamServerException("Malformed response body: " + e.getOriginalMessage(), status);
        }
    }

    private Duration retryAfter(HttpHeaders headers, JsonNode json) {
        Long seconds = parseLong(headers.getFirst(HttpHeaders.RETRY_AFTER));
        if (seconds == null) {
            Integer backoff = intField(json, "backoff");
            seconds = backoff != null ? backoff.longValue() : null;
        }
        return seconds != null ? Duration.ofSeconds(seconds) : null;
    }

    private String describe(int status, JsonNode json) {
        String errorMessage = json.path("error_message").asText("");
        String errorName = json.path("error_name").asText("");
        if (!errorMessage.isEmpty()) {
            return errorName.isEmpty() ? errorMessage : errorName + " - " + errorMessage;
        }
        return "HTTP error " + status;
    }

    private static Integer intField(JsonNode json, String field) {
        JsonNode node = json.get(field);
        return node != null && node.canConvertToInt() ? node.asInt() : null;
    }

    private static Integer parseInt(String value) {
        Long parsed = parseLong(value);
        return parsed != null && parsed <= Integer.MAX_VALUE && parsed >= 0 ? parsed.intValue() : null;
    }

    private static Long parseLong(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring unparsable rate limit value: {}", value);
            return null;
        }
    }
}
