package com.counselflow.cache.content;

import org.apache.commons.codec.digest.MurmurHash3;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 64-bit SimHash of normalized content. Near-duplicate texts get fingerprints
 * with a small Hamming distance.
 */
public final class SimHashFingerprint {

    private static final int BITS = 64;
    private static final int SHINGLE_SIZE = 3;
    private static final Pattern WHITESPACE = Pattern.compile(" ");

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "from", "as", "is", "was", "are", "be", "been",
            "shall", "will", "may", "this", "that", "such", "any", "all"
    );

    private SimHashFingerprint() {
    }

    /**
     * Fingerprint of already normalized text (see {@link ContentNormalizer#normalize}).
     */
    public static long of(String normalized) {
        if (normalized == null || normalized.isEmpty()) {
            return 0L;
        }

        int[] weights = new int[BITS];
        for (Map.Entry<String, Integer> feature : features(normalized).entrySet()) {
            long hash = MurmurHash3.hash128x64(feature.getKey().getBytes(StandardCharsets.UTF_8))[0];
            int weight = feature.getValue();
            for (int bit = 0; bit < BITS; bit++) {
                weights[bit] += ((hash >>> bit) & 1L) == 1L ? weight : -weight;
            }
        }

        long fingerprint = 0L;
        for (int bit = 0; bit < BITS; bit++) {
            if (weights[bit] > 0) {
                fingerprint |= 1L << bit;
            }
        }
        return fingerprint;
    }

    /**
     * 1 - hamming / 64, in [0, 1].
     */
    public static double similarity(long a, long b) {
        return 1.0 - (double) Long.bitCount(a ^ b) / BITS;
    }

    // Word tokens plus word shingles, so ordering matters as well as vocabulary
    private static Map<String, Integer> features(String text) {
        String[] words = WHITESPACE.split(text);
        Map<String, Integer> features = new HashMap<>();

        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            int weight = STOP_WORDS.contains(word) ? 1 : (word.length() > 8 ? 4 : 3);
            features.merge(word, weight, Integer::sum);
        }

        for (int i = 0; i + SHINGLE_SIZE <= words.length; i++) {
            String shingle = String.join(" ", Arrays.copyOfRange(words, i, i + SHINGLE_SIZE));
            features.merge(shingle, 2, Integer::sum);
        }
        return features;
    }
}
