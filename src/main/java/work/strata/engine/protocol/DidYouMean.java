package work.strata.engine.protocol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Nearest-match suggestions for misspelled names.
 */
public final class DidYouMean {
    private DidYouMean() {}

    /**
     * Candidate with the smallest edit distance to {@code attempted}; ties go to the lexicographically first name.
     */
    public static Optional<String> suggest(Collection<String> candidates, String attempted) {
        if (candidates == null || candidates.isEmpty() || attempted == null) {
            return Optional.empty();
        }
        var ranked = new ArrayList<Ranked>(candidates.size());
        for (var candidate : candidates) {
            ranked.add(new Ranked(candidate, levenshtein(candidate, attempted)));
        }
        ranked.sort(Comparator.comparingInt(Ranked::distance).thenComparing(Ranked::name));
        return Optional.of(ranked.get(0).name());
    }

    /**
     * Column suggestion: smallest edit distance, ties broken by the record's column order.
     */
    public static Optional<String> nearestColumn(List<String> columns, String attempted) {
        String best = null;
        int bestDistance = Integer.MAX_VALUE;
        for (var column : columns) {
            int distance = levenshtein(column, attempted);
            if (distance < bestDistance) {
                best = column;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Unit-cost edit distance over code points. The single rolling row is sized by {@code candidate}.
     */
    public static int levenshtein(String candidate, String attempted) {
        int[] c = candidate.codePoints().toArray();
        int[] a = attempted.codePoints().toArray();
        int[] row = new int[c.length + 1];
        for (int j = 0; j <= c.length; j++) {
            row[j] = j;
        }
        for (int i = 1; i <= a.length; i++) {
            int diagonal = row[0];
            row[0] = i;
            for (int j = 1; j <= c.length; j++) {
                int above = row[j];
                int cost = a[i - 1] == c[j - 1] ? 0 : 1;
                row[j] = Math.min(Math.min(row[j] + 1, row[j - 1] + 1), diagonal + cost);
                diagonal = above;
            }
        }
        return row[c.length];
    }

    private record Ranked(String name, int distance) {}
}
