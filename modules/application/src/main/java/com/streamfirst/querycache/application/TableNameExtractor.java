package com.streamfirst.querycache.application;

import java.util.Arrays;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Extracts possible table names from command text without parsing it.
 * The token following each {@code FROM}, {@code JOIN}, {@code INTO} or {@code UPDATE} marker is
 * taken as a candidate. A qualified candidate keeps only its second dot separated segment, so
 * {@code dbo.Products} yields {@code Products} while {@code server.dbo.Products} yields {@code dbo}.
 * Bracket and quote characters are stripped.
 */
public class TableNameExtractor {

    private static final List<String> TABLE_MARKERS = List.of("FROM", "JOIN", "INTO", "UPDATE");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NAME_QUOTES = Pattern.compile("[\\[\\]`'\"]");

    /**
     * Returns the candidate table names found in the command.
     *
     * @param commandText raw command text, may be null
     * @return sorted candidates, empty if no marker is followed by a usable token
     */
    public SortedSet<String> extractCandidateIdentifiers(String commandText) {
        SortedSet<String> tableNames = new TreeSet<>();
        if (commandText == null || commandText.isBlank()) {
            return tableNames;
        }

        String[] tokens = WHITESPACE.split(commandText.trim());
        for (int i = 0; i < tokens.length - 1; i++) {
            if (!isTableMarker(tokens[i])) {
                continue;
            }

            String tableName = normalize(tokens[i + 1]);
            if (!tableName.isEmpty()) {
                tableNames.add(tableName);
            }
        }

        return tableNames;
    }

    private static boolean isTableMarker(String token) {
        for (String marker : TABLE_MARKERS) {
            if (marker.equalsIgnoreCase(token)) {
                return true;
            }
        }
        return false;
    }

    static String normalize(String token) {
        List<String> segments = Arrays.stream(token.split("\\."))
            .filter(part -> !part.isEmpty())
            .toList();

        String tableName;
        if (segments.isEmpty()) {
            return "";
        } else if (segments.size() == 1) {
            tableName = segments.get(0);
        } else {
            tableName = segments.get(1);
        }

        return NAME_QUOTES.matcher(tableName.trim()).replaceAll("").trim();
    }
}
