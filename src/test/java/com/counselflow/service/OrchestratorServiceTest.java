package com.counselflow.service;

import com.counselflow.MutableClock;
import com.counselflow.cache.ResponseCache;
import com.counselflow.config.CounselFlowProperties;
import com.counselflow.exception.ProviderUnavailableException;
import com.counselflow.exception.ValidationException;
import com.counselflow.model.GenerationRequest;
import com.counselflow.model.NormalizedResponse;
import com.counselflow.provider.FakeLlmProvider;
import com.counselflow.provider.LlmProvider;
import com.counselflow.provider.ProviderRegistry;
import com.counselflow.resilience.CircuitState;
import com.counselflow.resilience.ProviderCircuitBreaker;
import com.counselflow.service.health.ProviderHealthRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorServiceTest {

    private CounselFlowProperties properties;
    private MutableClock clock;
    private ProviderCircuitBreaker breaker;
    private ProviderHealthRegistry healthRegistry;
    private FakeLlmProvider openai;
    private FakeLlmProvider anthropic;

    @BeforeEach
    void setUp() {
        properties = new CounselFlowProperties();
        properties.getOrchestrator().setBackoffBase(Duration.ofMillis(1));
        properties.getOrchestrator().setRequestTimeout(Duration.ofSeconds(5));
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        openai = new FakeLlmProvider("openai");
        anthropic = new FakeLlmProvider("anthropic");
    }

    private OrchestratorService orchestrator(LlmProvider... providers) {
        ProviderRegistry registry = new ProviderRegistry(Arrays.asList(providers));
        breaker = new ProviderCircuitBreaker(3, Duration.ofSeconds(60), clock);
        healthRegistry = new ProviderHealthRegistry(registry, breaker);
        ResponseCache cache = new ResponseCache(Duration.ofMinutes(5), 100, clock);
        return new OrchestratorService(registry, breaker, healthRegistry, cache, new PromptSanitizer(50_000), properties);
    }

    private static GenerationRequest request(String provider) {
        return GenerationRequest.builder()
                .prompt("Summarize the indemnification clause")
                .provider(provider)
                .build();
    }

    @Test
    void testSecondIdenticalCallIsServedFromCache() {
        OrchestratorService orchestrator = orchestrator(openai, anthropic);

        StepVerifier.create(orchestrator.generateText(request("openai")))
                .assertNext(response -> {
                    assertFalse(response.isCached());
                    assertEquals("openai", response.getProvider());
                })
                .verifyComplete();

        StepVerifier.create(orchestrator.generateText(request("openai")))
                .assertNext(response -> {
                    assertTrue(response.isCached());
                    assertEquals("answer from openai", response.getContent());
                })
                .verifyComplete();

        assertEquals(1, openai.calls());
    }

    @Test
    void testCallerChangesDoNotAffectLaterCacheHits() {
        OrchestratorService orchestrator = orchestrator(openai);

        NormalizedResponse first = orchestrator.generateText(request("openai")).block();
        assertNotNull(first);
        first.setContent("edited by caller");

        StepVerifier.create(orchestrator.generateText(request("openai")))
                .assertNext(response -> {
                    assertTrue(response.isCached());
                    assertEquals("answer from openai", response.getContent());
                })
                .verifyComplete();
    }

    @Test
    void testCancelledClosedCallDoesNotReleaseAnotherProbe() {
        openai.hang();
        OrchestratorService orchestrator = orchestrator(openai);
        GenerationRequest request = request("openai").toBuilder().useCache(false).build();

        Disposable inFlight = orchestrator.generateText(request).subscribe();
        assertEquals(1, openai.calls());

        breaker.recordFailure("openai");
        breaker.recordFailure("openai");
        breaker.recordFailure("openai");
        clock.advance(Duration.ofSeconds(61));
        assertTrue(breaker.canExecute("openai"));

        inFlight.dispose();

        assertEquals(CircuitState.HALF_OPEN, breaker.getState("openai"));
        assertFalse(breaker.canExecute("openai"));
    }

    @Test
    void testCancelledProbeFreesTheSlot() {
        OrchestratorService orchestrator = orchestrator(openai);
        GenerationRequest request = request("openai").toBuilder().useCache(false).build();
        breaker.recordFailure("openai");
        breaker.recordFailure("openai");
        breaker.recordFailure("openai");
        clock.advance(Duration.ofSeconds(61));
        openai.hang();

        Disposable probe = orchestrator.generateText(request).subscribe();
        assertEquals(1, openai.calls());
        assertFalse(breaker.canExecute("openai"));

        probe.dispose();

        assertTrue(breaker.canExecute("openai"));
    }

    @Test
    void testCacheBypassedWhenDisabledOnRequest() {
        OrchestratorService orchestrator = orchestrator(openai);
        GenerationRequest request = request("openai").toBuilder().useCache(false).build();

        orchestrator.generateText(request).block();
        StepVerifier.create(orchestrator.generateText(request))
                .assertNext(response -> assertFalse(response.isCached()))
                .verifyComplete();

        assertEquals(2, openai.calls());
    }

    @Test
    void testOpenBreakerRoutesToHealthyProvider() {
        OrchestratorService orchestrator = orchestrator(openai, anthropic);
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure("openai");
        }

        StepVerifier.create(orchestrator.generateText(request("openai")))
                .assertNext(response -> assertEquals("anthropic", response.getProvider()))
                .verifyComplete();

        assertEquals(0, openai.calls());
        assertEquals(1, anthropic.calls());
    }

    @Test
    void testFailureFallsBackToNextProvider() {
        openai.failOnce();
        OrchestratorService orchestrator = orchestrator(openai, anthropic);

        StepVerifier.create(orchestrator.generateText(request("openai")))
                .assertNext(response -> assertEquals("anthropic", response.getProvider()))
                .verifyComplete();

        assertEquals(1, openai.calls());
        assertEquals(1, breaker.snapshot("openai").failureCount());
        assertEquals(1, healthRegistry.errorCount("openai"));
        assertEquals(1, healthRegistry.requestCount("anthropic"));
    }

    @Test
    void testSingleProviderRetriesAfterTransientFailure() {
        openai.failOnce();
        OrchestratorService orchestrator = orchestrator(openai);

        StepVerifier.create(orchestrator.generateText(request(null)))
                .assertNext(response -> assertEquals("openai", response.getProvider()))
                .verifyComplete();

        assertEquals(2, openai.calls());
        assertEquals(CircuitState.CLOSED, breaker.getState("openai"));
        assertEquals(0, breaker.snapshot("openai").failureCount());
    }

    @Test
    void testExhaustedAttemptsFail() {
        openai.alwaysFail();
        anthropic.alwaysFail();
        OrchestratorService orchestrator = orchestrator(openai, anthropic);

        StepVerifier.create(orchestrator.generateText(request("openai")))
                .expectError(ProviderUnavailableException.class)
                .verify();

        assertEquals(3, openai.calls() + anthropic.calls());
    }

    @Test
    void testRetryCountBoundsAttempts() {
        openai.alwaysFail();
        OrchestratorService orchestrator = orchestrator(openai);

        StepVerifier.create(orchestrator.generateText(request("openai").toBuilder().retryCount(2).build()))
                .expectError(ProviderUnavailableException.class)
                .verify();

        assertEquals(2, openai.calls());
        assertEquals(CircuitState.CLOSED, breaker.getState("openai"));
    }

    @Test
    void testOpeningBreakerStopsRetries() {
        openai.alwaysFail();
        OrchestratorService orchestrator = orchestrator(openai);

        StepVerifier.create(orchestrator.generateText(request("openai").toBuilder().retryCount(5).build()))
                .expectError(ProviderUnavailableException.class)
                .verify();

        assertEquals(3, openai.calls());
        assertEquals(CircuitState.OPEN, breaker.getState("openai"));
    }

    @Test
    void testModelOverrideAppliesOnlyToRequestedProvider() {
        openai.failOnce();
        OrchestratorService orchestrator = orchestrator(openai, anthropic);
        GenerationRequest request = request("openai").toBuilder().model("gpt-4-turbo").build();

        StepVerifier.create(orchestrator.generateText(request))
                .assertNext(response -> assertEquals("anthropic-model", response.getModel()))
                .verifyComplete();

        assertEquals(List.of("gpt-4-turbo"), openai.models());
        assertNull(anthropic.models().get(0));
    }

    @Test
    void testPinnedRequestNeverFallsBack() {
        anthropic.alwaysFail();
        OrchestratorService orchestrator = orchestrator(openai, anthropic);
        GenerationRequest request = request("anthropic").toBuilder()
                .allowFallback(false)
                .retryCount(2)
                .build();

        StepVerifier.create(orchestrator.generateText(request))
                .expectError(ProviderUnavailableException.class)
                .verify();

        assertEquals(2, anthropic.calls());
        assertEquals(0, openai.calls());
    }

    @Test
    void testPinnedRequestWithOpenBreakerFailsFast() {
        OrchestratorService orchestrator = orchestrator(openai, anthropic);
        for (int i = 0; i < 3; i++) {
            breaker.recordFailure("anthropic");
        }

        StepVerifier.create(orchestrator.generateText(request("anthropic").toBuilder().allowFallback(false).build()))
                .expectError(ProviderUnavailableException.class)
                .verify();

        assertEquals(0, anthropic.calls());
        assertEquals(0, openai.calls());
    }

    @Test
    void testUnknownProviderFallsBackUnlessPinned() {
        OrchestratorService orchestrator = orchestrator(openai, anthropic);

        StepVerifier.create(orchestrator.generateText(request("mistral").toBuilder().allowFallback(false).build()))
                .expectError(ProviderUnavailableException.class)
                .verify();

        StepVerifier.create(orchestrator.generateText(request("mistral")))
                .assertNext(response -> assertEquals("openai", response.getProvider()))
                .verifyComplete();
    }

    @Test
    void testNoProvidersConfigured() {
        OrchestratorService orchestrator = orchestrator();

        StepVerifier.create(orchestrator.generateText(request(null)))
                .expectError(ProviderUnavailableException.class)
                .verify();
    }

    @Test
    void testInvalidRequestsAreRejected() {
        OrchestratorService orchestrator = orchestrator(openai);

        StepVerifier.create(orchestrator.generateText(GenerationRequest.builder().prompt("   ").build()))
                .expectError(ValidationException.class)
                .verify();
        StepVerifier.create(orchestrator.generateText(request(null).toBuilder().temperature(2.5).build()))
                .expectError(ValidationException.class)
                .verify();
        StepVerifier.create(orchestrator.generateText(request(null).toBuilder().maxTokens(0).build()))
                .expectError(ValidationException.class)
                .verify();
        StepVerifier.create(orchestrator.generateText(request(null).toBuilder().retryCount(0).build()))
                .expectError(ValidationException.class)
                .verify();

        assertEquals(0, openai.calls());
    }

    @Test
    void testPromptIsSanitizedBeforeDispatch() {
        OrchestratorService orchestrator = orchestrator(openai);
        GenerationRequest request = GenerationRequest.builder()
                .prompt("Review this clause<script>alert('x')</script>")
                .build();

        orchestrator.generateText(request).block();

        assertEquals("Review this clause", openai.prompts().get(0));
    }

    @Test
    void testBackoffDoublesAndIsCapped() {
        properties.getOrchestrator().setBackoffBase(Duration.ofSeconds(1));
        OrchestratorService orchestrator = orchestrator(openai);

        assertEquals(Duration.ofSeconds(1), orchestrator.backoff(0));
        assertEquals(Duration.ofSeconds(2), orchestrator.backoff(1));
        assertEquals(Duration.ofSeconds(8), orchestrator.backoff(3));
        assertEquals(Duration.ofSeconds(30), orchestrator.backoff(10));
    }
}
