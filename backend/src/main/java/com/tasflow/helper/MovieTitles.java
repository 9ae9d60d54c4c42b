package com.tasflow.helper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Formatting shared by submission and publication titles.
 */
public final class MovieTitles {

    private MovieTitles() {
    }

    /**
     * Joins author names as "A", "A & B" or "A, B & C".
     * External authors are given as a comma separated list and follow the registered ones.
     */
    public static String joinAuthors(List<String> authors, String additionalAuthors) {
        List<String> names = new ArrayList<>(authors);
        names.addAll(splitCsv(additionalAuthors));

        if (names.isEmpty()) {
            return "";
        }
        if (names.size() == 1) {
            return names.get(0);
        }
        return String.join(", ", names.subList(0, names.size() - 1))
            + " & " + names.get(names.size() - 1);
    }

    /**
     * Formats a run time as mm:ss.cc, or h:mm:ss.cc for runs of an hour or more.
     * Returns "00:00.00" when the frame rate is unknown.
     */
    public static String formatTime(int frames, Double frameRate) {
        if (frameRate == null || frameRate <= 0) {
            return "00:00.00";
        }

        long centiseconds = Math.round(frames / frameRate * 100);
        long hours = centiseconds / 360_000;
        long minutes = (centiseconds / 6_000) % 60;
        long seconds = (centiseconds / 100) % 60;
        long fraction = centiseconds % 100;

        return hours > 0
            ? String.format(Locale.ROOT, "%d:%02d:%02d.%02d", hours, minutes, seconds, fraction)
            : String.format(Locale.ROOT, "%02d:%02d.%02d", minutes, seconds, fraction);
    }

    /**
     * Trims each entry of a comma separated list and drops empty ones.
     */
    public static String normalizeCsv(String csv) {
        List<String> parts = splitCsv(csv);
        return parts.isEmpty() ? null : String.join(", ", parts);
    }

    /**
     * Strips surrounding double quotes, which the title adds itself.
     */
    public static String trimQuotes(String goal) {
        if (goal == null) {
            return null;
        }
        int start = 0;
        int end = goal.length();
        while (start < end && goal.charAt(start) == '"') {
            start++;
        }
        while (end > start && goal.charAt(end - 1) == '"') {
            end--;
        }
        return goal.substring(start, end);
    }

    public static String goalSuffix(String goal) {
        if (goal == null || goal.isBlank()) {
            return "";
        }
        return " \"" + goal.trim() + "\"";
    }

    private static List<String> splitCsv(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        return Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toList());
    }
}
