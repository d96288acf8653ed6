package org.speeches.evaluator.model;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Picks the speaker with the extreme value of a counter.
 *
 * <p>Only the two best ranked entries are compared: if their values are equal
 * there is no unique winner and {@code null} is returned, no matter how many
 * further entries share that value.
 */
public final class RankSelector {

    public enum Direction {
        MAX,
        MIN
    }

    private RankSelector() {
    }

    public static String select(Map<String, Long> counts, Direction direction) {
        if (counts.isEmpty()) {
            return null;
        }

        Comparator<Map.Entry<String, Long>> order = Map.Entry.comparingByValue();
        if (direction == Direction.MAX) {
            order = order.reversed();
        }

        List<Map.Entry<String, Long>> ranked = counts.entrySet().stream()
                .sorted(order)
                .limit(2)
                .toList();

        if (ranked.size() > 1 && ranked.get(0).getValue().equals(ranked.get(1).getValue())) {
            return null;
        }
        return ranked.get(0).getKey();
    }
}
