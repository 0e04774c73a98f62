package com.ai.clinicdesk.component;

import com.ai.clinicdesk.utils.TextNormalizer;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fuzzy matching of free text against reference names (doctors, services, branches).
 * Similarity is the normalized Levenshtein ratio between a name alias and a window of the
 * message's words. Among near-equal scores the name with more of its words present wins, so
 * "Ahmed Zahrani" picks one doctor while "Ahmed" alone stays ambiguous between two.
 */
@Component
public class ReferenceMatcher {

    static final double TOKEN_ALIAS_WEIGHT = 0.95;
    static final double AMBIGUITY_MARGIN = 0.03;
    private static final int MIN_TOKEN_ALIAS_LENGTH = 4;

    private static final Set<String> STOP_WORDS = Set.of(
            "dr", "doctor", "clinic", "branch", "center", "centre", "the", "and", "for", "with",
            "د", "دكتور", "الدكتور", "دكتوره", "الدكتوره", "فرع", "عياده", "عيادة", "مركز");

    private final double threshold;

    public ReferenceMatcher(@Value("${clinicdesk.classifier.fuzzy-threshold:0.80}") double threshold) {
        this.threshold = threshold;
    }

    public record Match(List<String> ids, double score, boolean fullName) {

        public static final Match NONE = new Match(List.of(), 0.0, false);

        public boolean isEmpty() {
            return ids.isEmpty();
        }

        public boolean isResolved() {
            return ids.size() == 1;
        }

        public boolean isAmbiguous() {
            return ids.size() > 1;
        }

        public String id() {
            return isResolved() ? ids.get(0) : null;
        }
    }

    /**
     * @param text       user text (raw or normalized)
     * @param namesById  candidate names keyed by id, in a stable order
     */
    public Match match(String text, Map<String, String> namesById) {
        List<String> words = TextNormalizer.tokens(TextNormalizer.normalize(text));
        if (words.isEmpty() || namesById == null || namesById.isEmpty()) return Match.NONE;

        Map<String, Double> scores = new LinkedHashMap<>();
        Map<String, Boolean> full = new LinkedHashMap<>();
        Map<String, Integer> hits = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : namesById.entrySet()) {
            String fullAlias = String.join(" ", significantTokens(e.getValue()));
            double best = 0.0;
            boolean bestIsFull = false;
            int tokenHits = 0;
            if (!fullAlias.isEmpty()) {
                double s = bestWindowSimilarity(words, fullAlias);
                if (s > best) {
                    best = s;
                    bestIsFull = true;
                }
            }
            for (String token : significantTokens(e.getValue())) {
                if (token.length() < MIN_TOKEN_ALIAS_LENGTH || token.equals(fullAlias)) continue;
                double s = bestWindowSimilarity(words, token) * TOKEN_ALIAS_WEIGHT;
                if (s >= threshold) tokenHits++;
                if (s > best) {
                    best = s;
                    bestIsFull = false;
                }
            }
            if (best >= threshold) {
                scores.put(e.getKey(), best);
                full.put(e.getKey(), bestIsFull);
                hits.put(e.getKey(), tokenHits);
            }
        }
        if (scores.isEmpty()) return Match.NONE;

        double top = scores.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        int mostHits = scores.entrySet().stream()
                .filter(e -> top - e.getValue() <= AMBIGUITY_MARGIN)
                .mapToInt(e -> hits.get(e.getKey()))
                .max().orElse(0);
        List<String> ids = new ArrayList<>();
        boolean allFull = true;
        for (Map.Entry<String, Double> e : scores.entrySet()) {
            if (top - e.getValue() <= AMBIGUITY_MARGIN && hits.get(e.getKey()) == mostHits) {
                ids.add(e.getKey());
                allFull &= full.get(e.getKey());
            }
        }
        return new Match(List.copyOf(ids), top, allFull);
    }

    /**
     * Picks an option by its 1-based position in a listed menu ("2", "option 2").
     */
    public static String byNumber(String text, List<String> optionIds) {
        if (optionIds == null || optionIds.isEmpty()) return null;
        List<String> words = TextNormalizer.tokens(TextNormalizer.normalize(text));
        if (words.isEmpty() || words.size() > 2) return null;
        String last = words.get(words.size() - 1);
        if (!StringUtils.isNumeric(last) || last.length() > 2) return null;
        int n = Integer.parseInt(last);
        return n >= 1 && n <= optionIds.size() ? optionIds.get(n - 1) : null;
    }

    static List<String> significantTokens(String name) {
        Set<String> out = new LinkedHashSet<>();
        for (String t : TextNormalizer.tokens(TextNormalizer.normalize(name))) {
            if (!STOP_WORDS.contains(t) && t.length() > 1) out.add(t);
        }
        return new ArrayList<>(out);
    }

    private static double bestWindowSimilarity(List<String> words, String alias) {
        int size = alias.split(" ").length;
        double best = 0.0;
        for (int w = Math.max(1, size - 1); w <= size + 1; w++) {
            for (int i = 0; i + w <= words.size(); i++) {
                String window = String.join(" ", words.subList(i, i + w));
                best = Math.max(best, similarity(window, alias));
                if (best == 1.0) return best;
            }
        }
        return best;
    }

    static double similarity(String a, String b) {
        int max = Math.max(a.length(), b.length());
        if (max == 0) return 1.0;
        return 1.0 - (double) StringUtils.getLevenshteinDistance(a, b) / max;
    }
}
