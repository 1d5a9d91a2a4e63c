package com.counselflow.provider;

import com.counselflow.config.CounselFlowProperties;
import com.counselflow.config.JacksonConfiguration;
import com.counselflow.exception.ProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeAsyncClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BedrockProviderTest {

    private static final String BODY = """
            {"id": "msg_bdrk", "type": "message", "content": [{"type": "text", "text": "Clause 7 is void."}],
             "stop_reason": "end_turn", "usage": {"input_tokens": 30, "output_tokens": 6}}
            """;

    private CounselFlowProperties properties;
    private BedrockRuntimeAsyncClient client;
    private BedrockProvider provider;

    @BeforeEach
    void setUp() {
        properties = new CounselFlowProperties();
        CounselFlowProperties.ProviderConfig config = new CounselFlowProperties.ProviderConfig();
        config.setApiKey("AKIA:secret");
        config.setRegion("us-west-2");
        properties.getProviders().put("bedrock", config);

        client = mock(BedrockRuntimeAsyncClient.class);
        provider = new BedrockProvider(WebClient.create(), properties, JacksonConfiguration.createObjectMapper(), client);
    }

    @Test
    void testInvokesModelAndParsesMessage() {
        when(client.invokeModel(any(InvokeModelRequest.class))).thenReturn(CompletableFuture.completedFuture(
                InvokeModelResponse.builder().body(SdkBytes.fromUtf8String(BODY)).build()));

        StepVerifier.create(provider.generate("Is clause 7 valid?", "claude-3-haiku", 100, 0.1, Duration.ofSeconds(5)))
                .assertNext(response -> {
                    assertEquals("bedrock", response.getProvider());
                    assertEquals("Clause 7 is void.", response.getContent());
                    assertEquals("anthropic.claude-3-haiku-20240307-v1:0", response.getModel());
                    assertEquals(36, response.getTokensUsed());
                })
                .verifyComplete();

        ArgumentCaptor<InvokeModelRequest> captor = ArgumentCaptor.forClass(InvokeModelRequest.class);
        verify(client).invokeModel(captor.capture());
        assertEquals("anthropic.claude-3-haiku-20240307-v1:0", captor.getValue().modelId());
        assertTrue(captor.getValue().body().asUtf8String().contains("\"anthropic_version\":\"bedrock-2023-05-31\""));
    }

    @Test
    void testSdkFailureIsProviderException() {
        when(client.invokeModel(any(InvokeModelRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("throttled")));

        StepVerifier.create(provider.generate("prompt", null, 100, 0.1, Duration.ofSeconds(5)))
                .expectError(ProviderException.class)
                .verify();
    }

    @Test
    void testResolvesModelIds() {
        assertEquals("anthropic.claude-3-opus-20240229-v1:0", provider.resolveModelId("claude-3-opus"));
        assertEquals("anthropic.claude-v2", provider.resolveModelId("anthropic.claude-v2"));
        assertEquals("anthropic.claude-3-sonnet-20240229-v1:0", provider.resolveModelId("gpt-4"));
    }

    @Test
    void testDisabledWithoutClient() {
        BedrockProvider withoutClient =
                new BedrockProvider(WebClient.create(), properties, JacksonConfiguration.createObjectMapper(), null);
        assertFalse(withoutClient.isEnabled());
        assertTrue(provider.isEnabled());
    }
}
