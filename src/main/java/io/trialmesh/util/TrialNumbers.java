package io.trialmesh.util;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Parses trial selections such as {@code "4,7,9-12"} into a sorted, de-duplicated list.
 */
public final class TrialNumbers {
    private TrialNumbers() {
    }

    public static List<Integer> parse(String spec) {
        if (spec == null || spec.isBlank()) {
            return List.of();
        }
        return expand(spec, Integer.MAX_VALUE);
    }

    /**
     * Like {@link #parse(String)} but rejects trials outside {@code [0, trialCount)}; a blank
     * selection means every trial.
     */
    public static List<Integer> parse(String spec, int trialCount) {
        if (spec == null || spec.isBlank()) {
            return all(trialCount);
        }
        return expand(spec, trialCount);
    }

    // Bounds are checked before a range is expanded, so the loop index never passes limit.
    private static List<Integer> expand(String spec, int limit) {
        TreeSet<Integer> out = new TreeSet<>();
        for (String raw : spec.split(",")) {
            String token = raw.trim();
            if (token.isEmpty()) {
                continue;
            }
            int dash = token.indexOf('-', 1);
            if (dash < 0) {
                out.add(checkLimit(parseTrial(token, spec), limit));
                continue;
            }
            int low = parseTrial(token.substring(0, dash).trim(), spec);
            int high = checkLimit(parseTrial(token.substring(dash + 1).trim(), spec), limit);
            if (high < low) {
                throw new IllegalArgumentException("Descending trial range '" + token + "' in: " + spec);
            }
            for (int i = low; i <= high; i++) {
                out.add(i);
            }
        }
        return new ArrayList<>(out);
    }

    private static int checkLimit(int trial, int limit) {
        if (trial >= limit) {
            throw new IllegalArgumentException("Trial " + trial + " is outside 0.." + (limit - 1));
        }
        return trial;
    }

    public static List<Integer> all(int trialCount) {
        List<Integer> out = new ArrayList<>(Math.max(0, trialCount));
        for (int i = 0; i < trialCount; i++) {
            out.add(i);
        }
        return out;
    }

    private static int parseTrial(String token, String spec) {
        try {
            int value = Integer.parseInt(token);
            if (value < 0) {
                throw new IllegalArgumentException("Negative trial number in: " + spec);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid trial number '" + token + "' in: " + spec, e);
        }
    }
}
