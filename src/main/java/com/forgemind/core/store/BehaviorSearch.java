package com.forgemind.core.store;

import com.forgemind.core.model.Behavior;
import com.forgemind.core.model.Trigger;

import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Token-overlap ranking shared by the store implementations.
 * Name matches weigh most, then domain tags, then description and trigger patterns.
 */
final class BehaviorSearch {

    private static final int NAME_WEIGHT = 3;
    private static final int TAG_WEIGHT = 2;
    private static final int TEXT_WEIGHT = 1;

    private BehaviorSearch() {}

    static List<Behavior> rank(Collection<Behavior> behaviors, String query, int limit) {
        Set<String> queryTokens = tokens(query);
        if (queryTokens.isEmpty()) {
            return List.of();
        }
        record Scored(Behavior behavior, int score) {}
        return behaviors.stream()
                .map(b -> new Scored(b, score(b, queryTokens)))
                .filter(s -> s.score() > 0)
                .sorted(Comparator.comparingInt(Scored::score).reversed()
                        .thenComparing(s -> s.behavior().id()))
                .limit(Math.max(0, limit))
                .map(Scored::behavior)
                .toList();
    }

    static int score(Behavior behavior, Set<String> queryTokens) {
        Set<String> name = tokens(behavior.name());
        Set<String> tags = tokens(String.join(" ", behavior.domainTags()));
        Set<String> text = tokens(behavior.description() + " " + behavior.triggers().stream()
                .map(Trigger::pattern)
                .collect(Collectors.joining(" ")));
        int score = 0;
        for (String token : queryTokens) {
            if (name.contains(token)) score += NAME_WEIGHT;
            if (tags.contains(token)) score += TAG_WEIGHT;
            if (text.contains(token)) score += TEXT_WEIGHT;
        }
        return score;
    }

    static Set<String> tokens(String text) {
        if (text == null || text.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(t -> !t.isBlank())
                .collect(Collectors.toSet());
    }
}
