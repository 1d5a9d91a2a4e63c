package com.counselflow.service;

import com.counselflow.model.NormalizedResponse;
import com.counselflow.service.consensus.ProviderAnalysis;
import com.counselflow.service.consensus.RawTextAnalysis;
import com.counselflow.service.consensus.StructuredAnalysis;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a model answer into a structured or prose analysis.
 */
@Slf4j
@Component
public class AnalysisResponseParser {

    private static final Pattern FENCED_JSON = Pattern.compile("```(?:json)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public AnalysisResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ProviderAnalysis parse(NormalizedResponse response) {
        String content = response.getContent();
        return parseObject(content)
                .<ProviderAnalysis>map(data -> new StructuredAnalysis(
                        response.getProvider(), data, response.getTokensUsed(), response.getProcessingTimeMs()))
                .orElseGet(() -> new RawTextAnalysis(
                        response.getProvider(), content, response.getTokensUsed(), response.getProcessingTimeMs()));
    }

    /**
     * JSON object from the whole answer, a fenced block, or the outermost braces.
     */
    Optional<Map<String, Object>> parseObject(String content) {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }

        Optional<Map<String, Object>> whole = tryParse(content.trim());
        if (whole.isPresent()) {
            return whole;
        }

        Matcher fenced = FENCED_JSON.matcher(content);
        if (fenced.find()) {
            Optional<Map<String, Object>> block = tryParse(fenced.group(1));
            if (block.isPresent()) {
                return block;
            }
        }

        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return tryParse(content.substring(start, end + 1));
        }
        return Optional.empty();
    }

    private Optional<Map<String, Object>> tryParse(String candidate) {
        if (!candidate.startsWith("{")) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(candidate, MAP_TYPE));
        } catch (JsonProcessingException e) {
            log.debug("Answer is not a JSON object: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
