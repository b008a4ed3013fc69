package com.demo.eligibility.service.validation;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.Locale;

/**
 * Edit-distance similarity between two person names in [0, 1]. Case, accents, punctuation
 * and word order are ignored.
 */
public final class NameSimilarity {

    private NameSimilarity() {}

    public static double of(String a, String b) {
        if (a == null || b == null) return 0.0;
        String na = normalize(a);
        String nb = normalize(b);
        if (na.isEmpty() || nb.isEmpty()) return 0.0;
        return Math.max(ratio(na, nb), ratio(sortTokens(na), sortTokens(nb)));
    }

    static String normalize(String s) {
        String stripped = Normalizer.normalize(s, Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        return stripped.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z\\s]", " ")
                .replaceAll("\\s+", " ")
                .strip();
    }

    private static String sortTokens(String s) {
        String[] parts = s.split(" ");
        Arrays.sort(parts);
        return String.join(" ", parts);
    }

    private static double ratio(String a, String b) {
        int max = Math.max(a.length(), b.length());
        return 1.0 - (double) levenshtein(a, b) / max;
    }

    private static int levenshtein(String a, String b) {
        int[][] dp = new int[a.length() + 1][b.length() + 1];
        for (int i = 0; i <= a.length(); i++) dp[i][0] = i;
        for (int j = 0; j <= b.length(); j++) dp[0][j] = j;
        for (int i = 1; i <= a.length(); i++) {
            for (int j = 1; j <= b.length(); j++) {
                int cost = (a.charAt(i - 1) == b.charAt(j - 1)) ? 0 : 1;
                dp[i][j] = Math.min(Math.min(dp[i - 1][j] + 1, dp[i][j - 1] + 1), dp[i - 1][j - 1] + cost);
            }
        }
        return dp[a.length()][b.length()];
    }
}
