package com.forgemind.core.tracking;

import com.forgemind.core.model.ExecutionRecord;
import com.forgemind.core.model.FailurePattern;
import com.forgemind.core.model.Outcome;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Clusters failing executions by outcome and shared input features.
 * <p>
 * The signature of an execution is its action name, its sorted input keys and a
 * normalized leading-token signature of its first textual input value (lowercased,
 * digits folded to {@code #}, first {@value #LEADING_TOKENS} words).
 */
final class FailurePatternAnalyzer {

    static final int LEADING_TOKENS = 3;
    static final int MAX_EXAMPLES = 3;

    private FailurePatternAnalyzer() {}

    static List<FailurePattern> analyze(List<ExecutionRecord> records, int limit) {
        record Key(Outcome outcome, String actionName, String signature) {}
        Map<Key, List<ExecutionRecord>> clusters = new LinkedHashMap<>();
        for (ExecutionRecord r : records) {
            if (r.success()) {
                continue;
            }
            Outcome outcome = r.outcome() != null ? r.outcome() : Outcome.ERROR;
            clusters.computeIfAbsent(new Key(outcome, r.actionName(), signature(r)), k -> new ArrayList<>()).add(r);
        }
        List<FailurePattern> patterns = new ArrayList<>();
        clusters.forEach((key, members) -> patterns.add(new FailurePattern(
                key.outcome(), key.actionName(), key.signature(), members.size(),
                members.stream().limit(MAX_EXAMPLES).map(ExecutionRecord::input).toList())));
        patterns.sort(Comparator.comparingInt(FailurePattern::count).reversed()
                .thenComparing(FailurePattern::signature));
        return patterns.stream().limit(Math.max(0, limit)).toList();
    }

    static String signature(ExecutionRecord record) {
        String keys = String.join(",", new TreeSet<>(record.input().keySet()));
        return record.actionName() + "|" + keys + "|" + leadingTokens(record.input());
    }

    private static String leadingTokens(Map<String, Object> input) {
        return new TreeSet<>(input.keySet()).stream()
                .map(input::get)
                .filter(v -> v instanceof CharSequence)
                .map(Object::toString)
                .filter(s -> !s.isBlank())
                .findFirst()
                .map(FailurePatternAnalyzer::normalize)
                .orElse("");
    }

    private static String normalize(String text) {
        String[] words = text.toLowerCase(Locale.ROOT)
                .replaceAll("\\d", "#")
                .replaceAll("[^a-z#\\s]", " ")
                .trim()
                .split("\\s+");
        return String.join(" ", Arrays.copyOf(words, Math.min(words.length, LEADING_TOKENS)));
    }
}
