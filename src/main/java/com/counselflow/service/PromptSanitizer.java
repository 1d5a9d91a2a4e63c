package com.counselflow.service;

import com.counselflow.config.CounselFlowProperties;
import com.counselflow.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Strips script and code-execution fragments from prompts and enforces the length limit.
 */
@Slf4j
@Component
public class PromptSanitizer {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;

    private static final List<Pattern> DISALLOWED = List.of(
            Pattern.compile("<script[^>]*>.*?</script>", FLAGS),
            Pattern.compile("<iframe[^>]*>.*?</iframe>", FLAGS),
            Pattern.compile("<(object|embed)[^>]*>", FLAGS),
            Pattern.compile("javascript:", FLAGS),
            Pattern.compile("vbscript:", FLAGS),
            Pattern.compile("\\bon(load|error|click|mouseover|focus|blur)\\s*=", FLAGS),
            Pattern.compile("\\beval\\s*\\(", FLAGS),
            Pattern.compile("\\bexec\\s*\\(", FLAGS)
    );

    private final int maxLength;

    @Autowired
    public PromptSanitizer(CounselFlowProperties properties) {
        this(properties.getOrchestrator().getMaxPromptLength());
    }

    public PromptSanitizer(int maxLength) {
        this.maxLength = maxLength;
    }

    /**
     * Sanitized, trimmed and truncated text.
     *
     * @throws ValidationException if nothing is left after trimming
     */
    public String sanitize(String text) {
        if (text == null) {
            throw new ValidationException("Prompt must not be empty");
        }

        String cleaned = text.replace("\u0000", "");
        // Removing one fragment can join the text around it into a new one
        String previous;
        do {
            previous = cleaned;
            for (Pattern pattern : DISALLOWED) {
                cleaned = pattern.matcher(cleaned).replaceAll("");
            }
        } while (!cleaned.equals(previous));
        cleaned = cleaned.trim();

        if (cleaned.isEmpty()) {
            throw new ValidationException("Prompt must not be empty");
        }

        if (cleaned.length() > maxLength) {
            log.warn("Prompt truncated from {} to {} characters", cleaned.length(), maxLength);
            cleaned = cleaned.substring(0, maxLength);
        }
        return cleaned;
    }
}
