package com.devpipeline.orchestrator.policy;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Deterministic phrase matching used by the policy evaluator.
 *
 * A policy entry is reduced to its significant stems; the score of a request
 * against the entry is the share of those stems the request contains (1.0 if
 * the entry occurs verbatim). Two stems match when equal, or when the shorter
 * one (at least 5 characters) is a prefix of the other.
 */
final class TextMatcher {

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "the", "and", "or", "of", "to", "in", "on", "for", "with", "by",
            "from", "into", "at", "as", "is", "are", "be", "it", "its", "this", "that",
            "any", "all", "our", "we", "via", "use", "using", "new", "add", "make");

    private static final String[][] SUFFIXES = {
            {"ies", "y"}, {"ing", ""}, {"ion", ""}, {"ors", ""}, {"ers", ""},
            {"or", ""}, {"er", ""}, {"es", ""}, {"ed", ""}, {"s", ""}
    };

    private static final int MIN_PREFIX = 5;

    private TextMatcher() {}

    static double score(String entry, String text) {
        String normalizedEntry = normalize(entry);
        if (normalizedEntry.isEmpty()) {
            return 0.0;
        }
        if (normalize(text).contains(normalizedEntry)) {
            return 1.0;
        }
        Set<String> entryStems = stems(entry);
        if (entryStems.isEmpty()) {
            return 0.0;
        }
        Set<String> textStems = stems(text);
        long matched = entryStems.stream()
                .filter(e -> textStems.stream().anyMatch(t -> sameStem(e, t)))
                .count();
        return (double) matched / entryStems.size();
    }

    static Set<String> stems(String text) {
        Set<String> out = new LinkedHashSet<>();
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")) {
            if (token.length() < 2 || STOP_WORDS.contains(token)) {
                continue;
            }
            out.add(stem(token));
        }
        return out;
    }

    static String stem(String word) {
        for (String[] rule : SUFFIXES) {
            String suffix = rule[0];
            if (word.endsWith(suffix) && word.length() - suffix.length() >= 4) {
                return word.substring(0, word.length() - suffix.length()) + rule[1];
            }
        }
        return word;
    }

    private static boolean sameStem(String a, String b) {
        if (a.equals(b)) {
            return true;
        }
        String shorter = a.length() <= b.length() ? a : b;
        String longer  = shorter == a ? b : a;
        return shorter.length() >= MIN_PREFIX && longer.startsWith(shorter);
    }

    private static String normalize(String text) {
        return String.join(" ", text.toLowerCase(Locale.ROOT).split("[^a-z0-9]+")).trim();
    }
}
