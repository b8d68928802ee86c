package fun.fengwk.discovery.core.service.search.dedup;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Business name normalization and fuzzy comparison.
 *
 * @author fengwk
 */
public final class NameSimilarity {

    /**
     * Legal and business-form tokens that carry no identity.
     */
    static final Set<String> SUFFIX_TOKENS = Set.of("inc", "llc", "ltd", "corp", "corporation", "co", "company");

    private NameSimilarity() {
    }

    /**
     * "Tony's Pizza, Inc." -> "tonys pizza"
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String folded = name.toLowerCase(Locale.ROOT)
            .replace("'", "")
            .replace("’", "")
            .replaceAll("[^\\p{L}\\p{N}]+", " ")
            .trim();
        if (folded.isEmpty()) {
            return "";
        }
        return Arrays.stream(folded.split(" "))
            .filter(token -> !token.isEmpty() && !SUFFIX_TOKENS.contains(token))
            .collect(Collectors.joining(" "));
    }

    /**
     * Similarity of two names in [0, 1], the better of token-set overlap and edit-distance ratio.
     * Names that normalize to nothing are never similar.
     */
    public static double similarity(String left, String right) {
        String a = normalize(left);
        String b = normalize(right);
        if (a.isEmpty() || b.isEmpty()) {
            return 0D;
        }
        if (a.equals(b)) {
            return 1D;
        }
        double editRatio = 1D - (double) levenshtein(a, b) / Math.max(a.length(), b.length());
        return Math.max(jaccard(a, b), editRatio);
    }

    static double jaccard(String a, String b) {
        Set<String> left = new HashSet<>(Arrays.asList(a.split(" ")));
        Set<String> right = new HashSet<>(Arrays.asList(b.split(" ")));
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        left.retainAll(right);
        return union.isEmpty() ? 0D : (double) left.size() / union.size();
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

}
