package com.baskettecase.mongostudio.util;

import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Finds "did you mean?" suggestions for misspelled collection and connection names.
 *
 * Similarity is 1 minus the Levenshtein distance divided by the longer length, compared
 * case-insensitively.
 */
@Slf4j
public class FuzzyMatcher {

    private static final int MAX_SUGGESTIONS = 3;
    private static final double SIMILARITY_THRESHOLD = 0.4;

    /**
     * Closest candidate, or null when nothing reaches the similarity threshold
     */
    public static String findClosestMatch(String input, List<String> candidates) {
        List<String> matches = findClosestMatches(input, candidates, 1);
        if (matches.isEmpty()) {
            log.debug("No fuzzy match found for '{}'", input);
            return null;
        }
        log.debug("Fuzzy match: '{}' -> '{}'", input, matches.get(0));
        return matches.get(0);
    }

    /**
     * Up to {@code maxSuggestions} candidates ordered by similarity, best first
     */
    public static List<String> findClosestMatches(String input, List<String> candidates, int maxSuggestions) {
        if (input == null || input.isEmpty() || candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        String normalizedInput = input.toLowerCase();

        return candidates.stream()
            .map(candidate -> new Match(candidate, similarity(normalizedInput, candidate.toLowerCase())))
            .filter(match -> match.similarity() >= SIMILARITY_THRESHOLD)
            .sorted(Comparator.comparingDouble(Match::similarity).reversed())
            .limit(maxSuggestions)
            .map(Match::value)
            .collect(Collectors.toList());
    }

    public static List<String> findClosestMatches(String input, List<String> candidates) {
        return findClosestMatches(input, candidates, MAX_SUGGESTIONS);
    }

    static double similarity(String s1, String s2) {
        int maxLength = Math.max(s1.length(), s2.length());
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - ((double) levenshteinDistance(s1, s2) / maxLength);
    }

    // Two-row edit distance
    private static int levenshteinDistance(String s1, String s2) {
        int[] previous = new int[s2.length() + 1];
        int[] current = new int[s2.length() + 1];

        for (int j = 0; j <= s2.length(); j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= s1.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= s2.length(); j++) {
                int cost = s1.charAt(i - 1) == s2.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(previous[j] + 1, current[j - 1] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }

        return previous[s2.length()];
    }

    private record Match(String value, double similarity) {}
}
