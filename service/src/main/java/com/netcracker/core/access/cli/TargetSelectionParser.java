package com.netcracker.core.access.cli;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Parses a 1-based selection such as {@code "3"}, {@code "1,3,5"}, {@code "2-5"}, {@code "1,3-5,7"}
 * or {@code "all"} into sorted 0-based indices. Malformed and out-of-range parts are skipped.
 */
@Slf4j
public final class TargetSelectionParser {

    private TargetSelectionParser() {
    }

    public static List<Integer> parse(String selection, int count) {
        if (selection == null || selection.isBlank()) {
            return List.of();
        }
        String value = selection.trim().toLowerCase(Locale.ROOT);
        if (value.equals("all")) {
            return IntStream.range(0, count).boxed().toList();
        }

        Set<Integer> indices = new LinkedHashSet<>();
        for (String rawPart : value.split(",")) {
            String part = rawPart.trim();
            if (part.isEmpty()) {
                continue;
            }
            try {
                if (part.contains("-")) {
                    String[] bounds = part.split("-", 2);
                    int start = Integer.parseInt(bounds[0].trim());
                    int end = Integer.parseInt(bounds[1].trim());
                    if (start > end) {
                        int swap = start;
                        start = end;
                        end = swap;
                    }
                    for (int number = start; number <= end; number++) {
                        addIfInRange(indices, number, count);
                    }
                } else {
                    addIfInRange(indices, Integer.parseInt(part), count);
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid selection '{}' - skipping", part);
            }
        }
        List<Integer> sorted = new ArrayList<>(indices);
        sorted.sort(null);
        return sorted;
    }

    private static void addIfInRange(Set<Integer> indices, int number, int count) {
        if (number >= 1 && number <= count) {
            indices.add(number - 1);
        } else {
            log.warn("Selection {} is out of range (1-{}) - skipping", number, count);
        }
    }
}
