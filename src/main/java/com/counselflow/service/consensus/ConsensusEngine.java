package com.counselflow.service.consensus;

import com.counselflow.config.CounselFlowProperties;
import com.counselflow.exception.InsufficientProvidersException;
import com.counselflow.model.GenerationRequest;
import com.counselflow.service.OrchestratorService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Combines several providers' answers to the same analysis.
 * <p>
 * Numeric fields are averaged, list fields ranked by how many providers mention an
 * item, scalar text fields decided by majority. Prose answers are merged by the
 * primary provider, or concatenated with provider labels if that call fails.
 */
@Slf4j
@Component
public class ConsensusEngine {

    private static final int MIN_PROVIDERS = 2;
    private static final double FULL_CONFIDENCE_PROVIDERS = 3.0;
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final List<String> ITEM_TEXT_FIELDS = List.of("risk", "description", "text", "name", "clause", "title", "issue");

    private final OrchestratorService orchestrator;
    private final CounselFlowProperties properties;

    public ConsensusEngine(OrchestratorService orchestrator, CounselFlowProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    /**
     * Build the consensus answer.
     *
     * @param analyses       answers from the providers that responded
     * @param totalProviders providers that were asked, including those that failed
     * @return fails with {@link InsufficientProvidersException} below two usable answers
     */
    public Mono<ConsensusResult> combine(List<ProviderAnalysis> analyses, int totalProviders) {
        List<ProviderAnalysis> usable = analyses.stream()
                .filter(ProviderAnalysis::isUsable)
                .toList();
        if (usable.size() < MIN_PROVIDERS) {
            return Mono.error(new InsufficientProvidersException(usable.size()));
        }

        String primary = properties.getConsensus().getPrimaryProvider();
        List<StructuredAnalysis> structured = new ArrayList<>();
        List<RawTextAnalysis> texts = new ArrayList<>();
        for (ProviderAnalysis analysis : usable) {
            if (analysis instanceof StructuredAnalysis) {
                structured.add((StructuredAnalysis) analysis);
            } else if (analysis instanceof RawTextAnalysis) {
                texts.add((RawTextAnalysis) analysis);
            }
        }

        ConsensusResult.ConsensusResultBuilder result = ConsensusResult.builder();
        aggregateStructured(structured, primary, result);

        long totalTokens = usable.stream().mapToLong(ProviderAnalysis::tokensUsed).sum();
        double avgTime = usable.stream().mapToLong(ProviderAnalysis::processingTimeMs).average().orElse(0.0);
        result.confidenceScore(Math.min(100.0, usable.size() / FULL_CONFIDENCE_PROVIDERS * 100.0))
                .providersUsed(usable.stream().map(ProviderAnalysis::provider).toList())
                .totalProviders(Math.max(totalProviders, usable.size()))
                .totalTokens(totalTokens)
                .avgProcessingTimeMs(avgTime);

        log.info("Consensus over {} of {} providers ({} structured, {} prose)",
                usable.size(), totalProviders, structured.size(), texts.size());

        return synthesizeText(texts, primary)
                .map(text -> result.synthesizedText(text).build())
                .defaultIfEmpty(result.build());
    }

    private void aggregateStructured(
            List<StructuredAnalysis> analyses, String primary, ConsensusResult.ConsensusResultBuilder result) {
        Map<String, List<Double>> numbers = new LinkedHashMap<>();
        Map<String, List<Collection<?>>> lists = new LinkedHashMap<>();
        Map<String, List<TextVote>> texts = new LinkedHashMap<>();
        Map<String, Object> others = new LinkedHashMap<>();

        for (StructuredAnalysis analysis : analyses) {
            for (Map.Entry<String, Object> field : analysis.data().entrySet()) {
                String name = field.getKey();
                Object value = field.getValue();
                if (name.startsWith("_") || value == null) {
                    continue;
                }

                if (value instanceof Number) {
                    numbers.computeIfAbsent(name, k -> new ArrayList<>()).add(((Number) value).doubleValue());
                } else if (value instanceof Collection) {
                    lists.computeIfAbsent(name, k -> new ArrayList<>()).add((Collection<?>) value);
                } else if (value instanceof String || value instanceof Boolean) {
                    texts.computeIfAbsent(name, k -> new ArrayList<>())
                            .add(new TextVote(analysis.provider(), String.valueOf(value)));
                } else if (!others.containsKey(name) || analysis.provider().equals(primary)) {
                    others.put(name, value);
                }
            }
        }

        Map<String, Double> means = new LinkedHashMap<>();
        Map<String, FieldAgreement> agreement = new LinkedHashMap<>();
        numbers.forEach((name, values) -> {
            FieldAgreement stats = agreementOf(values);
            means.put(name, stats.mean());
            agreement.put(name, stats);
        });

        int topN = properties.getConsensus().getTopN();
        Map<String, List<String>> ranked = new LinkedHashMap<>();
        lists.forEach((name, values) -> ranked.put(name, rankItems(values, topN)));

        Map<String, String> majority = new LinkedHashMap<>();
        texts.forEach((name, votes) -> majority.put(name, majorityOf(votes, primary)));

        result.numericFields(means)
                .providerAgreement(agreement)
                .listFields(ranked)
                .textFields(majority)
                .otherFields(others);
    }

    static FieldAgreement agreementOf(List<Double> values) {
        double mean = values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        double variance = values.stream().mapToDouble(v -> (v - mean) * (v - mean)).average().orElse(0.0);
        double min = values.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double max = values.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        return new FieldAgreement(mean, variance, min, max, values.size());
    }

    /**
     * Items ranked by the number of providers that mention them, then by first appearance.
     * Each item keeps the wording it had when first seen.
     */
    static List<String> rankItems(List<Collection<?>> perProvider, int topN) {
        Map<String, ItemCount> counts = new LinkedHashMap<>();
        for (Collection<?> items : perProvider) {
            Set<String> seenByThisProvider = new LinkedHashSet<>();
            for (Object item : items) {
                String text = itemText(item);
                String key = normalizeItem(text);
                if (key.isEmpty() || !seenByThisProvider.add(key)) {
                    continue;
                }
                counts.computeIfAbsent(key, k -> new ItemCount(text, counts.size())).count++;
            }
        }

        return counts.values().stream()
                .sorted((a, b) -> a.count != b.count ? Integer.compare(b.count, a.count) : Integer.compare(a.order, b.order))
                .limit(topN)
                .map(c -> c.text)
                .collect(Collectors.toList());
    }

    static String normalizeItem(String text) {
        String stripped = PUNCTUATION.matcher(text.toLowerCase()).replaceAll(" ");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    private static String itemText(Object item) {
        if (item instanceof Map) {
            Map<?, ?> map = (Map<?, ?>) item;
            for (String field : ITEM_TEXT_FIELDS) {
                Object value = map.get(field);
                if (value instanceof String) {
                    return (String) value;
                }
            }
        }
        return String.valueOf(item);
    }

    private static String majorityOf(List<TextVote> votes, String primary) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, String> firstWording = new LinkedHashMap<>();
        for (TextVote vote : votes) {
            String key = normalizeItem(vote.value());
            counts.merge(key, 1, Integer::sum);
            firstWording.putIfAbsent(key, vote.value());
        }

        int best = counts.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        List<String> leaders = counts.entrySet().stream()
                .filter(e -> e.getValue() == best)
                .map(Map.Entry::getKey)
                .toList();

        // Ties go to the primary provider's answer
        if (leaders.size() > 1) {
            for (TextVote vote : votes) {
                if (vote.provider().equals(primary) && leaders.contains(normalizeItem(vote.value()))) {
                    return vote.value();
                }
            }
        }
        return firstWording.get(leaders.get(0));
    }

    private Mono<String> synthesizeText(List<RawTextAnalysis> texts, String primary) {
        if (texts.isEmpty()) {
            return Mono.empty();
        }
        if (texts.size() == 1) {
            return Mono.just(texts.get(0).text());
        }

        StringBuilder prompt = new StringBuilder()
                .append("Several legal analysts reviewed the same material independently. ")
                .append("Combine their analyses into one coherent answer. Keep points most of them agree on, ")
                .append("note material disagreements, and do not add new claims.\n\n");
        for (RawTextAnalysis text : texts) {
            prompt.append("Analysis from ").append(text.provider()).append(":\n")
                    .append(text.text()).append("\n\n");
        }

        GenerationRequest request = GenerationRequest.builder()
                .prompt(prompt.toString())
                .provider(primary)
                .temperature(0.1)
                .useCache(false)
                .allowFallback(false)
                .build();

        return orchestrator.generateText(request)
                .map(response -> response.getContent())
                .onErrorResume(error -> {
                    log.warn("Consensus synthesis by {} failed, concatenating answers: {}", primary, error.getMessage());
                    return Mono.just(concatenate(texts));
                });
    }

    static String concatenate(List<RawTextAnalysis> texts) {
        return texts.stream()
                .map(text -> "[" + text.provider() + "]\n" + text.text().trim())
                .collect(Collectors.joining("\n\n"));
    }

    private record TextVote(String provider, String value) {
    }

    private static final class ItemCount {
        private final String text;
        private final int order;
        private int count;

        private ItemCount(String text, int order) {
            this.text = text;
            this.order = order;
        }
    }
}
