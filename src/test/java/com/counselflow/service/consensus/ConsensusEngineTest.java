package com.counselflow.service.consensus;

import com.counselflow.config.CounselFlowProperties;
import com.counselflow.exception.InsufficientProvidersException;
import com.counselflow.exception.ProviderUnavailableException;
import com.counselflow.model.GenerationRequest;
import com.counselflow.model.NormalizedResponse;
import com.counselflow.service.OrchestratorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConsensusEngineTest {

    private OrchestratorService orchestrator;
    private ConsensusEngine engine;

    @BeforeEach
    void setUp() {
        orchestrator = mock(OrchestratorService.class);
        engine = new ConsensusEngine(orchestrator, new CounselFlowProperties());
    }

    @Test
    void testNumericFieldsAreAveraged() {
        List<ProviderAnalysis> analyses = List.of(
                structured("openai", Map.of("risk_score", 6)),
                structured("anthropic", Map.of("risk_score", 7)),
                structured("google", Map.of("risk_score", 8.0)));

        StepVerifier.create(engine.combine(analyses, 3))
                .assertNext(result -> {
                    assertEquals(7.0, result.getNumericFields().get("risk_score"), 1e-6);
                    FieldAgreement agreement = result.getProviderAgreement().get("risk_score");
                    assertEquals(2.0 / 3.0, agreement.variance(), 1e-6);
                    assertEquals(6.0, agreement.min());
                    assertEquals(8.0, agreement.max());
                    assertEquals(3, agreement.reportingProviders());
                    assertEquals(100.0, result.getConfidenceScore());
                    assertEquals(126, result.getTotalTokens());
                })
                .verifyComplete();

        verify(orchestrator, never()).generateText(any());
    }

    @Test
    void testListItemsRankedByAgreement() {
        List<ProviderAnalysis> analyses = List.of(
                structured("openai", Map.of("key_risks", List.of("Unlimited liability", "Auto-renewal"))),
                structured("anthropic", Map.of("key_risks", List.of("unlimited liability!", "Weak IP clause"))),
                structured("google", Map.of("key_risks", List.of(Map.of("risk", "Unlimited  Liability")))));

        StepVerifier.create(engine.combine(analyses, 3))
                .assertNext(result -> assertEquals(
                        List.of("Unlimited liability", "Auto-renewal", "Weak IP clause"),
                        result.getListFields().get("key_risks")))
                .verifyComplete();
    }

    @Test
    void testRankingCountsEachProviderOnce() {
        List<String> ranked = ConsensusEngine.rankItems(List.of(
                List.of("Indemnity", "indemnity", "INDEMNITY"),
                List.of("Termination"),
                List.of("Termination")), 10);

        assertEquals(List.of("Termination", "Indemnity"), ranked);
    }

    @Test
    void testRankingHonoursTopN() {
        List<String> ranked = ConsensusEngine.rankItems(List.of(List.of("a", "b", "c", "d")), 2);
        assertEquals(List.of("a", "b"), ranked);
    }

    @Test
    void testTextFieldsDecidedByMajority() {
        List<ProviderAnalysis> analyses = List.of(
                structured("openai", Map.of("risk_level", "low")),
                structured("anthropic", Map.of("risk_level", "High")),
                structured("google", Map.of("risk_level", "high")));

        StepVerifier.create(engine.combine(analyses, 3))
                .assertNext(result -> assertEquals("High", result.getTextFields().get("risk_level")))
                .verifyComplete();
    }

    @Test
    void testTieGoesToPrimaryProvider() {
        List<ProviderAnalysis> analyses = List.of(
                structured("anthropic", Map.of("risk_level", "high")),
                structured("openai", Map.of("risk_level", "medium")));

        StepVerifier.create(engine.combine(analyses, 2))
                .assertNext(result -> assertEquals("medium", result.getTextFields().get("risk_level")))
                .verifyComplete();
    }

    @Test
    void testUnderscoreFieldsAreIgnored() {
        List<ProviderAnalysis> analyses = List.of(
                structured("openai", Map.of("risk_score", 4, "_raw", "x")),
                structured("anthropic", Map.of("risk_score", 6, "_raw", "y")));

        StepVerifier.create(engine.combine(analyses, 2))
                .assertNext(result -> {
                    Map<String, Object> map = result.toResultMap();
                    assertFalse(map.containsKey("_raw"));
                    assertEquals(5.0, map.get("risk_score"));
                    assertTrue(map.containsKey("_consensus"));
                })
                .verifyComplete();
    }

    @Test
    void testConfidenceScalesWithProviders() {
        List<ProviderAnalysis> analyses = List.of(
                structured("openai", Map.of("risk_score", 4)),
                structured("anthropic", Map.of("risk_score", 6)));

        StepVerifier.create(engine.combine(analyses, 3))
                .assertNext(result -> {
                    assertEquals(200.0 / 3.0, result.getConfidenceScore(), 1e-6);
                    assertEquals(List.of("openai", "anthropic"), result.getProvidersUsed());
                    assertEquals(3, result.getTotalProviders());
                })
                .verifyComplete();
    }

    @Test
    void testFewerThanTwoUsableResultsFails() {
        List<ProviderAnalysis> analyses = List.of(
                structured("openai", Map.of("risk_score", 4)),
                new RawTextAnalysis("anthropic", "   ", 10, 100),
                structured("google", Map.of()));

        StepVerifier.create(engine.combine(analyses, 3))
                .expectErrorSatisfies(error -> {
                    assertTrue(error instanceof InsufficientProvidersException);
                    assertEquals(1, ((InsufficientProvidersException) error).getUsableResults());
                })
                .verify();
    }

    @Test
    void testProseIsSynthesizedByPrimary() {
        when(orchestrator.generateText(any())).thenReturn(Mono.just(NormalizedResponse.builder()
                .content("Combined view")
                .provider("openai")
                .build()));

        List<ProviderAnalysis> analyses = List.of(
                new RawTextAnalysis("openai", "The clause is one-sided.", 40, 900),
                new RawTextAnalysis("anthropic", "The clause favours the vendor.", 50, 1100));

        StepVerifier.create(engine.combine(analyses, 2))
                .assertNext(result -> {
                    assertEquals("Combined view", result.getSynthesizedText());
                    assertEquals("Combined view", result.toResultMap().get("analysis"));
                    assertEquals(1000.0, result.getAvgProcessingTimeMs());
                })
                .verifyComplete();

        ArgumentCaptor<GenerationRequest> captor = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(orchestrator).generateText(captor.capture());
        assertEquals("openai", captor.getValue().getProvider());
        assertFalse(captor.getValue().isAllowFallback());
        assertTrue(captor.getValue().getPrompt().contains("The clause favours the vendor."));
    }

    @Test
    void testSynthesisFailureConcatenatesAnswers() {
        when(orchestrator.generateText(any()))
                .thenReturn(Mono.error(new ProviderUnavailableException("All providers failed")));

        List<ProviderAnalysis> texts = List.of(
                new RawTextAnalysis("openai", "First view.", 40, 900),
                new RawTextAnalysis("anthropic", "Second view.", 50, 1100));

        StepVerifier.create(engine.combine(texts, 2))
                .assertNext(result -> assertEquals(
                        "[openai]\nFirst view.\n\n[anthropic]\nSecond view.", result.getSynthesizedText()))
                .verifyComplete();
    }

    private static StructuredAnalysis structured(String provider, Map<String, Object> data) {
        return new StructuredAnalysis(provider, data, 42, 1000);
    }
}
