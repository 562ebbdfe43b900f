package io.mnemo.core.text;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalization, tokenization and set similarity shared by deduplication,
 * scoring and consolidation.
 */
public final class TextSimilarity {
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextSimilarity() {
    }

    /**
     * Lowercases, replaces anything outside {@code [a-z0-9\s]} with a space,
     * collapses whitespace and trims.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String lowered = text.toLowerCase(Locale.ROOT);
        String stripped = NON_ALNUM.matcher(lowered).replaceAll(" ");
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim();
    }

    /**
     * Distinct normalized tokens longer than two characters, in first-seen order.
     */
    public static Set<String> tokenize(String text) {
        String normalized = normalize(text);
        Set<String> tokens = new LinkedHashSet<>();
        if (normalized.isEmpty()) {
            return tokens;
        }
        for (String token : normalized.split(" ")) {
            if (token.length() > 2) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    public static double jaccard(Set<String> a, Set<String> b) {
        if (a == null || b == null || a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        for (String token : a) {
            if (b.contains(token)) {
                intersection++;
            }
        }
        int union = a.size() + b.size() - intersection;
        return union > 0 ? (double) intersection / union : 0.0;
    }

    public static double jaccard(String a, String b) {
        return jaccard(tokenize(a), tokenize(b));
    }

    /**
     * Fraction of {@code queryTokens} present in {@code documentTokens}.
     */
    public static double coverage(Collection<String> queryTokens, Set<String> documentTokens) {
        if (queryTokens == null || queryTokens.isEmpty() || documentTokens == null || documentTokens.isEmpty()) {
            return 0.0;
        }
        int hits = 0;
        for (String token : queryTokens) {
            if (documentTokens.contains(token)) {
                hits++;
            }
        }
        return (double) hits / queryTokens.size();
    }

    /**
     * SHA-256 hex digest of {@link #normalize(String)}.
     */
    public static String contentHash(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(normalize(text).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    public static double clamp01(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
