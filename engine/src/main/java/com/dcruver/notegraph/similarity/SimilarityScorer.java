package com.dcruver.notegraph.similarity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * String similarity measures used to spot near-duplicate link targets.
 *
 * <p>Four measures are combined into one score:
 * <ul>
 *   <li>Jaro-Winkler: character alignment with a common-prefix bonus, good for typos</li>
 *   <li>Bigram Dice coefficient: shared character pairs</li>
 *   <li>Token Jaccard: shared words, with trailing Korean particles stripped</li>
 *   <li>Containment: one string inside the other</li>
 * </ul>
 * When one string mostly contains the other, containment gets its own weight.
 */
public final class SimilarityScorer {

    public static final double DEFAULT_THRESHOLD = 0.7;
    public static final double DEFAULT_PREFIX_SCALE = 0.1;
    public static final int DEFAULT_NGRAM_SIZE = 2;

    private static final int MAX_PREFIX_LENGTH = 4;

    private static final Pattern TOKEN_SEPARATORS = Pattern.compile("[\\s\\-_.,;:!?'\"()\\[\\]{}]+");
    private static final Pattern ENDS_WITH_HANGUL = Pattern.compile("[\\uAC00-\\uD7A3]$");

    // Compound particles are tried before single-character ones
    private static final Pattern COMPOUND_PARTICLES = Pattern.compile("(으로|에서|에게|까지|부터|처럼|만큼|보다)$");
    private static final Pattern SINGLE_PARTICLES = Pattern.compile("[은는이가을를의에와과로]$");

    private SimilarityScorer() {
    }

    /**
     * Jaro-Winkler similarity. Case-sensitive.
     *
     * @param prefixScale weight of each common prefix character, up to four
     */
    public static double jaroWinklerSimilarity(String s1, String s2, double prefixScale) {
        double jaro = jaroSimilarity(s1, s2);

        int prefixLength = 0;
        int maxPrefix = Math.min(MAX_PREFIX_LENGTH, Math.min(s1.length(), s2.length()));
        for (int i = 0; i < maxPrefix; i++) {
            if (s1.charAt(i) != s2.charAt(i)) {
                break;
            }
            prefixLength++;
        }

        return jaro + prefixLength * prefixScale * (1 - jaro);
    }

    public static double jaroWinklerSimilarity(String s1, String s2) {
        return jaroWinklerSimilarity(s1, s2, DEFAULT_PREFIX_SCALE);
    }

    static double jaroSimilarity(String s1, String s2) {
        if (s1.equals(s2)) {
            return 1;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0;
        }

        int matchWindow = Math.max(0, Math.max(s1.length(), s2.length()) / 2 - 1);
        boolean[] s1Matches = new boolean[s1.length()];
        boolean[] s2Matches = new boolean[s2.length()];

        int matches = 0;
        for (int i = 0; i < s1.length(); i++) {
            int start = Math.max(0, i - matchWindow);
            int end = Math.min(i + matchWindow + 1, s2.length());

            for (int j = start; j < end; j++) {
                if (s2Matches[j] || s1.charAt(i) != s2.charAt(j)) {
                    continue;
                }
                s1Matches[i] = true;
                s2Matches[j] = true;
                matches++;
                break;
            }
        }

        if (matches == 0) {
            return 0;
        }

        int transpositions = 0;
        int k = 0;
        for (int i = 0; i < s1.length(); i++) {
            if (!s1Matches[i]) {
                continue;
            }
            while (!s2Matches[k]) {
                k++;
            }
            if (s1.charAt(i) != s2.charAt(k)) {
                transpositions++;
            }
            k++;
        }

        double m = matches;
        return (m / s1.length() + m / s2.length() + (m - transpositions / 2.0) / m) / 3;
    }

    /**
     * Dice coefficient over character n-grams of the lowercased, trimmed strings.
     * A string shorter than {@code n} is a single gram.
     */
    public static double ngramSimilarity(String s1, String s2, int n) {
        if (s1.equals(s2)) {
            return 1;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0;
        }

        Set<String> grams1 = ngrams(s1, n);
        Set<String> grams2 = ngrams(s2, n);
        if (grams1.isEmpty() || grams2.isEmpty()) {
            return 0;
        }

        int intersection = 0;
        for (String gram : grams1) {
            if (grams2.contains(gram)) {
                intersection++;
            }
        }

        return (2.0 * intersection) / (grams1.size() + grams2.size());
    }

    public static double ngramSimilarity(String s1, String s2) {
        return ngramSimilarity(s1, s2, DEFAULT_NGRAM_SIZE);
    }

    static Set<String> ngrams(String value, int n) {
        Set<String> grams = new HashSet<>();
        String normalized = value.toLowerCase(Locale.ROOT).trim();

        if (normalized.isEmpty()) {
            return grams;
        }
        if (normalized.length() < n) {
            grams.add(normalized);
            return grams;
        }

        for (int i = 0; i <= normalized.length() - n; i++) {
            grams.add(normalized.substring(i, i + n));
        }
        return grams;
    }

    /**
     * Jaccard similarity of the token sets.
     */
    public static double tokenOverlapSimilarity(String s1, String s2) {
        if (s1.equals(s2)) {
            return 1;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0;
        }

        Set<String> tokens1 = new HashSet<>(tokenize(s1));
        Set<String> tokens2 = new HashSet<>(tokenize(s2));
        if (tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0;
        }

        int intersection = 0;
        for (String token : tokens1) {
            if (tokens2.contains(token)) {
                intersection++;
            }
        }

        Set<String> union = new HashSet<>(tokens1);
        union.addAll(tokens2);
        return (double) intersection / union.size();
    }

    /**
     * Lowercase tokens split on whitespace and punctuation. Tokens ending in a Hangul
     * syllable lose a trailing particle: a compound particle if the token is longer
     * than two characters, otherwise a single-character particle.
     */
    static List<String> tokenize(String value) {
        List<String> tokens = new ArrayList<>();
        for (String token : TOKEN_SEPARATORS.split(value.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(stripParticle(token));
            }
        }
        return tokens;
    }

    private static String stripParticle(String token) {
        boolean endsWithHangul = ENDS_WITH_HANGUL.matcher(token).find();

        if (endsWithHangul && token.length() > 2) {
            String withoutCompound = COMPOUND_PARTICLES.matcher(token).replaceFirst("");
            if (!withoutCompound.equals(token)) {
                return withoutCompound;
            }
        }
        if (endsWithHangul && token.length() > 1) {
            return SINGLE_PARTICLES.matcher(token).replaceFirst("");
        }
        return token;
    }

    /**
     * Length ratio when one lowercased, trimmed string contains the other, else 0.
     */
    public static double containmentSimilarity(String s1, String s2) {
        String n1 = s1.toLowerCase(Locale.ROOT).trim();
        String n2 = s2.toLowerCase(Locale.ROOT).trim();

        if (n1.equals(n2)) {
            return 1;
        }
        if (n1.contains(n2)) {
            return (double) n2.length() / n1.length();
        }
        if (n2.contains(n1)) {
            return (double) n1.length() / n2.length();
        }
        return 0;
    }

    /**
     * Weighted combination of the four measures. Containment above 0.5 gets a 30% weight;
     * otherwise Jaro-Winkler, bigrams and tokens share the score 40/30/30.
     */
    public static SimilarityScore calculateSimilarity(String s1, String s2) {
        if (s1.equals(s2) && !s1.isEmpty()) {
            return SimilarityScore.identical();
        }

        double jw = jaroWinklerSimilarity(s1, s2);
        double ng = ngramSimilarity(s1, s2);
        double to = tokenOverlapSimilarity(s1, s2);
        double ct = containmentSimilarity(s1, s2);

        double score;
        if (ct > 0.5) {
            score = 0.3 * jw + 0.2 * ng + 0.2 * to + 0.3 * ct;
        } else {
            score = 0.4 * jw + 0.3 * ng + 0.3 * to;
        }

        return SimilarityScore.builder()
            .score(Math.max(0, Math.min(1, score)))
            .jaroWinkler(jw)
            .ngram(ng)
            .tokenOverlap(to)
            .containment(ct)
            .build();
    }

    public static boolean isSimilar(String s1, String s2, double threshold) {
        return calculateSimilarity(s1, s2).getScore() >= threshold;
    }

    public static boolean isSimilar(String s1, String s2) {
        return isSimilar(s1, s2, DEFAULT_THRESHOLD);
    }

    /**
     * All pairs scoring at least {@code threshold}, best first. Quadratic in the input size.
     */
    public static List<SimilarPair> findSimilarPairs(List<String> strings, double threshold) {
        List<SimilarPair> pairs = new ArrayList<>();

        for (int i = 0; i < strings.size(); i++) {
            for (int j = i + 1; j < strings.size(); j++) {
                SimilarityScore similarity = calculateSimilarity(strings.get(i), strings.get(j));
                if (similarity.getScore() >= threshold) {
                    pairs.add(SimilarPair.builder()
                        .firstIndex(i)
                        .secondIndex(j)
                        .similarity(similarity)
                        .build());
                }
            }
        }

        pairs.sort(Comparator.comparingDouble((SimilarPair p) -> p.getSimilarity().getScore()).reversed());
        return pairs;
    }

    public static List<SimilarPair> findSimilarPairs(List<String> strings) {
        return findSimilarPairs(strings, DEFAULT_THRESHOLD);
    }
}
