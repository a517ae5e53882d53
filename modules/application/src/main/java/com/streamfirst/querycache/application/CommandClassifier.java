package com.streamfirst.querycache.application;

import java.util.List;
import java.util.Locale;

/**
 * Tells mutating commands apart from reads by their leading verb.
 * A line-based heuristic, not a grammar: each line is trimmed and checked for a verb prefix,
 * which accommodates multi-line formatted SQL. Unusually formatted writes may be missed.
 */
public class CommandClassifier {

    private static final List<String> CRUD_MARKERS = List.of("insert ", "update ", "delete ", "create ");

    /**
     * Is the command an {@code insert}, {@code update}, {@code delete} or {@code create}?
     *
     * @param commandText raw command text, may be null
     * @return true if any line starts with a mutating verb, ignoring case and indentation
     */
    public boolean isMutatingCommand(String commandText) {
        if (commandText == null || commandText.isBlank()) {
            return false;
        }

        for (String line : commandText.split("\n")) {
            String normalized = line.trim().toLowerCase(Locale.ROOT);
            for (String marker : CRUD_MARKERS) {
                if (normalized.startsWith(marker)) {
                    return true;
                }
            }
        }

        return false;
    }
}
