package com.counselflow.cache.content;

import org.apache.commons.codec.digest.DigestUtils;

import java.util.regex.Pattern;

/**
 * Normalizes and hashes content so trivially different inputs share a cache entry.
 */
public final class ContentNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DATE = Pattern.compile(
            "\\b\\d{4}-\\d{1,2}-\\d{1,2}\\b|\\b\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}\\b");
    private static final Pattern AMOUNT = Pattern.compile("\\$[\\d,]+(\\.\\d+)?");

    static final String DATE_TOKEN = "[date]";
    static final String AMOUNT_TOKEN = "[amount]";

    private static final int CONTENT_HASH_LENGTH = 32;
    private static final int PARAMS_HASH_LENGTH = 16;

    private ContentNormalizer() {
    }

    /**
     * Collapse whitespace and lowercase; analysis types also mask dates and amounts.
     * Idempotent: the mask tokens survive a second pass unchanged.
     */
    public static String normalize(String content, OperationType type) {
        String normalized = WHITESPACE.matcher(content.strip()).replaceAll(" ").toLowerCase();
        if (type.masksVolatileValues()) {
            normalized = DATE.matcher(normalized).replaceAll(DATE_TOKEN);
            normalized = AMOUNT.matcher(normalized).replaceAll(AMOUNT_TOKEN);
        }
        return normalized;
    }

    /**
     * First 32 hex chars of the SHA-256 of the normalized content.
     */
    public static String contentHash(String content, OperationType type) {
        return DigestUtils.sha256Hex(normalize(content, type)).substring(0, CONTENT_HASH_LENGTH);
    }

    /**
     * First 16 hex chars of the SHA-256 of the canonical (key-sorted) params JSON.
     */
    public static String paramsHash(String canonicalParamsJson) {
        return DigestUtils.sha256Hex(canonicalParamsJson).substring(0, PARAMS_HASH_LENGTH);
    }
}
