package com.stackrelay.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.stackrelay.config.StackRelayProperties;
import com.stackrelay.exception.QuestionNotFoundException;
import com.stackrelay.exception.ValidationException;
import com.stackrelay.model.ApiOperation;
import com.stackrelay.model.ApiRequest;
import com.stackrelay.model.RequestPriority;
import com.stackrelay.service.dispatch.RequestDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Stack Overflow queries served through the dispatch layer.
 * Validates arguments, builds the API parameters and picks a priority; caching,
 * dedup, access mode and retries are handled by the {@link RequestDispatcher}.
 */
@Slf4j
@Service
public class StackOverflowQueryService {

    static final int MAX_PAGE_SIZE = 50;
    static final Set<String> SORT_ORDERS = Set.of("activity", "votes", "creation", "relevance");

    private final RequestDispatcher dispatcher;
    private final String site;

    public StackOverflowQueryService(RequestDispatcher dispatcher, StackRelayProperties properties) {
        this.dispatcher = dispatcher;
        this.site = properties.getApi().getSite();
    }

    /**
     * Search questions by title text.
     *
     * @param sort one of activity, votes, creation, relevance; null for relevance
     */
    public Mono<JsonNode> searchQuestions(String query, int page, int limit, String sort) {
        if (query == null || query.isBlank()) {
            return Mono.error(new ValidationException("Search query cannot be empty"));
        }

        return Mono.defer(() -> {
            Map<String, String> params = pagedSearch(page, limit, sort, "relevance");
            params.put("intitle", query.trim());
            log.debug("Searching questions for '{}' (page={}, limit={})", query, page, limit);
            return dispatch(ApiOperation.SEARCH_QUESTIONS, params, RequestPriority.NORMAL);
        });
    }

    /**
     * Search questions carrying all of the given tags.
     *
     * @param sort one of activity, votes, creation, relevance; null for activity
     */
    public Mono<JsonNode> searchByTags(List<String> tags, int page, int limit, String sort) {
        List<String> cleaned = tags == null ? List.of() : tags.stream()
                .filter(tag -> tag != null && !tag.isBlank())
                .map(String::trim)
                .collect(Collectors.toList());
        if (cleaned.isEmpty()) {
            return Mono.error(new ValidationException("Tags cannot be empty"));
        }

        return Mono.defer(() -> {
            Map<String, String> params = pagedSearch(page, limit, sort, "activity");
            params.put("tagged", String.join(";", cleaned));
            log.debug("Searching questions tagged {} (page={}, limit={})", cleaned, page, limit);
            return dispatch(ApiOperation.SEARCH_BY_TAGS, params, RequestPriority.NORMAL);
        });
    }

    /**
     * Fetch one question with its body, optionally with its answers (highest voted first)
     * attached under {@code answers}.
     */
    public Mono<JsonNode> getQuestionDetails(long questionId, boolean includeAnswers) {
        if (questionId < 1) {
            return Mono.error(new ValidationException("Question id must be positive, got: " + questionId));
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put(ApiOperation.IDS_PARAM, Long.toString(questionId));
        params.put("filter", "withbody");
        params.put("site", site);

        Mono<JsonNode> question = dispatch(ApiOperation.QUESTION_DETAILS, params, RequestPriority.HIGH)
                .map(payload -> firstItem(payload, questionId));

        if (!includeAnswers) {
            return question;
        }

        Map<String, String> answerParams = new LinkedHashMap<>(params);
        answerParams.put("sort", "votes");
        answerParams.put("order", "desc");

        return question.flatMap(item -> dispatch(ApiOperation.QUESTION_ANSWERS, answerParams, RequestPriority.HIGH)
                .map(answers -> withAnswers(item, answers)));
    }

    private Mono<JsonNode> dispatch(ApiOperation operation, Map<String, String> params, RequestPriority priority) {
        ApiRequest request = ApiRequest.of(operation, params);
        return Mono.fromFuture(() -> dispatcher.enqueue(request, priority));
    }

    private Map<String, String> pagedSearch(int page, int limit, String sort, String defaultSort) {
        if (page < 1) {
            throw new ValidationException("Page must be >= 1, got: " + page);
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new ValidationException("Limit must be between 1 and " + MAX_PAGE_SIZE + ", got: " + limit);
        }
        String effectiveSort = sort == null || sort.isBlank() ? defaultSort : sort.trim().toLowerCase();
        if (!SORT_ORDERS.contains(effectiveSort)) {
            throw new ValidationException("Unsupported sort order: " + sort);
        }

        Map<String, String> params = new LinkedHashMap<>();
        params.put("page", Integer.toString(page));
        params.put("pagesize", Integer.toString(limit));
        params.put("sort", effectiveSort);
        params.put("order", "desc");
        params.put("site", site);
        return params;
    }

    private static JsonNode firstItem(JsonNode payload, long questionId) {
        JsonNode items = payload.path("items");
        if (!items.isArray() || items.isEmpty()) {
            throw new QuestionNotFoundException(questionId);
        }
        return items.get(0);
    }

    // Payloads are shared with the cache, so attach answers to a copy
    private static JsonNode withAnswers(JsonNode question, JsonNode answersPayload) {
        ObjectNode result = question.deepCopy();
        JsonNode items = answersPayload.path("items");
        ArrayNode answers = result.putArray("answers");
        if (items.isArray()) {
            items.forEach(answer -> answers.add(answer.deepCopy()));
        }
        return result;
    }
}
