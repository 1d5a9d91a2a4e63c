package com.counselflow.provider;

import com.counselflow.config.CounselFlowProperties;
import com.counselflow.config.JacksonConfiguration;
import com.counselflow.exception.ProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OpenAiProviderTest {

    private static final String COMPLETION = """
            {
              "id": "chatcmpl-123",
              "model": "gpt-4-0613",
              "choices": [{"index": 0, "message": {"role": "assistant", "content": "Consideration is required."},
                           "finish_reason": "stop"}],
              "usage": {"prompt_tokens": 12, "completion_tokens": 18, "total_tokens": 30}
            }
            """;

    private final List<ClientRequest> requests = new ArrayList<>();
    private CounselFlowProperties properties;

    @BeforeEach
    void setUp() {
        properties = new CounselFlowProperties();
        CounselFlowProperties.ProviderConfig config = new CounselFlowProperties.ProviderConfig();
        config.setApiKey("sk-test");
        config.setBaseUrl("http://llm.test/v1/");
        properties.getProviders().put("openai", config);
    }

    private OpenAiProvider provider(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new OpenAiProvider(webClient, properties, JacksonConfiguration.createObjectMapper());
    }

    @Test
    void testNormalizesCompletion() {
        StepVerifier.create(provider(HttpStatus.OK, COMPLETION).generate("Is consideration required?", null, 100, 0.1,
                        Duration.ofSeconds(5)))
                .assertNext(response -> {
                    assertEquals("Consideration is required.", response.getContent());
                    assertEquals("openai", response.getProvider());
                    assertEquals("gpt-4-0613", response.getModel());
                    assertEquals(30, response.getTokensUsed());
                    assertEquals(30 / 1000.0 * 0.045, response.getCostEstimate(), 1e-9);
                    assertEquals("chatcmpl-123", response.getRequestId());
                    assertEquals("stop", response.getMetadata().get("finish_reason"));
                    assertFalse(response.isCached());
                })
                .verifyComplete();

        ClientRequest request = requests.get(0);
        assertEquals("http://llm.test/v1/chat/completions", request.url().toString());
        assertEquals("Bearer sk-test", request.headers().getFirst(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void testHttpErrorCarriesStatus() {
        StepVerifier.create(provider(HttpStatus.TOO_MANY_REQUESTS, "{\"error\": {\"message\": \"rate limited\"}}")
                        .generate("prompt", "gpt-4", 100, 0.1, Duration.ofSeconds(5)))
                .expectErrorSatisfies(error -> {
                    assertTrue(error instanceof ProviderException);
                    assertEquals(429, ((ProviderException) error).getStatusCode().intValue());
                    assertEquals("openai", ((ProviderException) error).getProvider());
                })
                .verify();
    }

    @Test
    void testEmptyContentIsAnError() {
        String empty = "{\"choices\": [{\"message\": {\"content\": \"\"}}], \"usage\": {\"total_tokens\": 3}}";

        StepVerifier.create(provider(HttpStatus.OK, empty).generate("prompt", null, 100, 0.1, Duration.ofSeconds(5)))
                .expectError(ProviderException.class)
                .verify();
    }

    @Test
    void testTimeoutIsMappedToProviderException() {
        WebClient hanging = WebClient.builder().exchangeFunction(request -> Mono.never()).build();
        OpenAiProvider provider = new OpenAiProvider(hanging, properties, JacksonConfiguration.createObjectMapper());

        StepVerifier.create(provider.generate("prompt", null, 100, 0.1, Duration.ofMillis(50)))
                .expectErrorSatisfies(error -> {
                    assertTrue(error instanceof ProviderException);
                    assertTrue(error.getMessage().contains("timed out"));
                })
                .verify();
    }

    @Test
    void testConnectionTestReportsFailureAsFalse() {
        StepVerifier.create(provider(HttpStatus.INTERNAL_SERVER_ERROR, "{}").testConnection())
                .expectNext(false)
                .verifyComplete();
        StepVerifier.create(provider(HttpStatus.OK, COMPLETION).testConnection())
                .expectNext(true)
                .verifyComplete();
    }

    @Test
    void testDisabledWithoutApiKey() {
        properties.getProviders().get("openai").setApiKey(" ");
        OpenAiProvider provider = provider(HttpStatus.OK, COMPLETION);

        assertFalse(provider.isEnabled());
        StepVerifier.create(provider.generate("prompt", null, 100, 0.1, Duration.ofSeconds(5)))
                .expectError(ProviderException.class)
                .verify();
        assertTrue(requests.isEmpty());
    }

    @Test
    void testDefaultModelFromConfig() {
        OpenAiProvider provider = provider(HttpStatus.OK, COMPLETION);
        assertEquals("gpt-4", provider.getDefaultModel());

        properties.getProviders().get("openai").setDefaultModel("gpt-4o");
        assertEquals("gpt-4o", provider.getDefaultModel());
    }

    @Test
    void testCostUsesLongestMatchingModel() {
        OpenAiProvider provider = provider(HttpStatus.OK, COMPLETION);

        assertEquals(0.010, provider.estimateCost("gpt-4o-2024-05-13", 1000), 1e-9);
        assertEquals(0.045, provider.estimateCost("gpt-4-0613", 1000), 1e-9);
        assertEquals(0.01, provider.estimateCost("mystery-model", 1000), 1e-9);
    }
}
