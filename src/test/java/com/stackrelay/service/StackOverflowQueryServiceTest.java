package com.stackrelay.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stackrelay.config.JacksonConfiguration;
import com.stackrelay.config.StackRelayProperties;
import com.stackrelay.exception.QuestionNotFoundException;
import com.stackrelay.exception.ValidationException;
import com.stackrelay.model.AccessMode;
import com.stackrelay.model.ApiOperation;
import com.stackrelay.model.ApiRequest;
import com.stackrelay.model.QuotaInfo;
import com.stackrelay.model.UpstreamResponse;
import com.stackrelay.service.cache.ResultCache;
import com.stackrelay.service.canonicalization.RequestFingerprinter;
import com.stackrelay.service.dispatch.RequestDispatcher;
import com.stackrelay.service.dispatch.RequestQueue;
import com.stackrelay.service.ratelimit.AccessModeSelector;
import com.stackrelay.service.ratelimit.RateLimitTracker;
import com.stackrelay.service.ratelimit.RequestThrottle;
import com.stackrelay.service.retry.RetryPolicy;
import com.stackrelay.support.FakeTransport;
import com.stackrelay.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StackOverflowQueryService running on a real dispatcher with a scripted transport.
 */
class StackOverflowQueryServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final ObjectMapper objectMapper = JacksonConfiguration.configure(new ObjectMapper());

    private FakeTransport transport;
    private RequestDispatcher dispatcher;
    private StackOverflowQueryService service;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        StackRelayProperties properties = new StackRelayProperties();
        properties.getQueue().setMaxConcurrent(2);

        RateLimitTracker tracker = new RateLimitTracker(false, Duration.ofMinutes(5), clock);
        ResultCache cache = new ResultCache(Duration.ofMinutes(5), 100, clock);
        RequestQueue queue = new RequestQueue(cache, new RequestFingerprinter(), properties, clock);

        transport = new FakeTransport(this::answer);
        dispatcher = new RequestDispatcher(
                queue,
                transport,
                new AccessModeSelector(tracker, 50, clock),
                tracker,
                new RequestThrottle(tracker, 0, clock),
                new RetryPolicy(3, Duration.ofMillis(10), Duration.ofMillis(100)),
                cache,
                properties);
        dispatcher.start();

        service = new StackOverflowQueryService(dispatcher, properties);
    }

    @AfterEach
    void tearDown() {
        dispatcher.stop();
    }

    @Test
    void testSearchQuestionsBuildsParameters() {
        JsonNode result = service.searchQuestions("python asyncio", 2, 15, null).block(TIMEOUT);

        assertNotNull(result);
        ApiRequest request = onlyCall().getRequest();
        assertEquals(ApiOperation.SEARCH_QUESTIONS, request.getOperation());
        assertEquals("python asyncio", request.parameter("intitle"));
        assertEquals("2", request.parameter("page"));
        assertEquals("15", request.parameter("pagesize"));
        assertEquals("relevance", request.parameter("sort"));
        assertEquals("desc", request.parameter("order"));
        assertEquals("stackoverflow", request.parameter("site"));
        assertEquals(AccessMode.UNAUTHENTICATED, onlyCall().getMode());
    }

    @Test
    void testSearchByTagsJoinsTags() {
        service.searchByTags(List.of("java", " spring-boot "), 1, 10, "votes").block(TIMEOUT);

        ApiRequest request = onlyCall().getRequest();
        assertEquals(ApiOperation.SEARCH_BY_TAGS, request.getOperation());
        assertEquals("java;spring-boot", request.parameter("tagged"));
        assertEquals("votes", request.parameter("sort"));
    }

    @Test
    void testSearchByTagsDefaultsToActivity() {
        service.searchByTags(List.of("java"), 1, 10, null).block(TIMEOUT);

        assertEquals("activity", onlyCall().getRequest().parameter("sort"));
    }

    @Test
    void testRepeatedSearchIsServedFromCache() {
        service.searchQuestions("python asyncio", 1, 10, "relevance").block(TIMEOUT);
        service.searchQuestions("  python asyncio", 1, 10, null).block(TIMEOUT);

        assertEquals(1, transport.callCount());
    }

    @Test
    void testInvalidArgumentsAreRejectedWithoutCalling() {
        ValidationException empty = assertThrows(ValidationException.class,
                () -> service.searchQuestions("  ", 1, 10, null).block(TIMEOUT));
        assertEquals("Search query cannot be empty", empty.getMessage());

        ValidationException noTags = assertThrows(ValidationException.class,
                () -> service.searchByTags(List.of(" "), 1, 10, null).block(TIMEOUT));
        assertEquals("Tags cannot be empty", noTags.getMessage());

        assertThrows(ValidationException.class, () -> service.searchQuestions("q", 0, 10, null).block(TIMEOUT));
        assertThrows(ValidationException.class, () -> service.searchQuestions("q", 1, 51, null).block(TIMEOUT));
        assertThrows(ValidationException.class, () -> service.searchQuestions("q", 1, 10, "hot").block(TIMEOUT));
        assertThrows(ValidationException.class, () -> service.getQuestionDetails(0, false).block(TIMEOUT));

        assertEquals(0, transport.callCount());
    }

    @Test
    void testQuestionDetailsWithAnswers() {
        JsonNode question = service.getQuestionDetails(11227809, true).block(TIMEOUT);

        assertNotNull(question);
        assertEquals(11227809, question.get("question_id").asLong());
        assertEquals(2, question.get("answers").size());
        assertEquals(11227902, question.get("answers").get(0).get("answer_id").asLong());

        List<FakeTransport.Call> calls = transport.calls();
        assertEquals(2, calls.size());
        assertEquals(ApiOperation.QUESTION_DETAILS, calls.get(0).getRequest().getOperation());
        assertEquals("withbody", calls.get(0).getRequest().parameter("filter"));
        assertEquals(ApiOperation.QUESTION_ANSWERS, calls.get(1).getRequest().getOperation());
        assertEquals("votes", calls.get(1).getRequest().parameter("sort"));
    }

    @Test
    void testAttachingAnswersLeavesCachedQuestionUntouched() {
        service.getQuestionDetails(11227809, true).block(TIMEOUT);

        JsonNode plain = service.getQuestionDetails(11227809, false).block(TIMEOUT);

        assertNotNull(plain);
        assertFalse(plain.has("answers"));
        assertEquals(2, transport.callCount());
    }

    @Test
    void testMissingQuestion() {
        QuestionNotFoundException error = assertThrows(QuestionNotFoundException.class,
                () -> service.getQuestionDetails(404, false).block(TIMEOUT));

        assertEquals("Question 404 not found", error.getMessage());
    }

    private FakeTransport.Call onlyCall() {
        List<FakeTransport.Call> calls = transport.calls();
        assertEquals(1, calls.size());
        return calls.get(0);
    }

    private Mono<UpstreamResponse> answer(ApiRequest request, AccessMode mode) {
        String body;
        switch (request.getOperation()) {
            case QUESTION_DETAILS:
                body = "404".equals(request.parameter("ids"))
                        ? "{\"items\":[]}"
                        : "{\"items\":[{\"question_id\":11227809,\"title\":\"Why is processing a sorted array faster?\"}]}";
                break;
            case QUESTION_ANSWERS:
                body = "{\"items\":[{\"answer_id\":11227902,\"score\":34000},{\"answer_id\":11303693,\"score\":4000}]}";
                break;
            default:
                body = "{\"items\":[{\"question_id\":1}],\"has_more\":false}";
        }
        return Mono.fromCallable(() -> new UpstreamResponse(objectMapper.readTree(body),
                QuotaInfo.builder().remaining(299).max(300).build()));
    }
}
