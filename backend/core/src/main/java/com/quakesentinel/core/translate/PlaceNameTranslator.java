package com.quakesentinel.core.translate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps Japanese feed place names to the uppercase display vocabulary by whole-substring replacement.
 * Each table is applied longest key first so that a single-glyph direction cannot pre-empt a longer
 * compound term. Untranslatable text passes through unchanged.
 */
public final class PlaceNameTranslator {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private final List<Map.Entry<String, String>> regions;
    private final List<Map.Entry<String, String>> suffixes;

    public PlaceNameTranslator(PlaceNameDictionary dictionary) {
        this.regions = longestFirst(dictionary.regions());
        this.suffixes = longestFirst(dictionary.suffixes());
    }

    public static PlaceNameTranslator withDefaultDictionary() {
        return new PlaceNameTranslator(PlaceNameDictionary.loadDefault());
    }

    public String translate(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String text = raw;
        for (Map.Entry<String, String> entry : regions) {
            text = text.replace(entry.getKey(), entry.getValue());
        }
        for (Map.Entry<String, String> entry : suffixes) {
            text = text.replace(entry.getKey(), entry.getValue());
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim().toUpperCase(Locale.ROOT);
    }

    // List.sort is stable, so equal-length keys keep dictionary order.
    private static List<Map.Entry<String, String>> longestFirst(Map<String, String> table) {
        List<Map.Entry<String, String>> entries = new ArrayList<>(table.entrySet());
        entries.removeIf(entry -> entry.getKey() == null || entry.getKey().isEmpty());
        entries.sort(Comparator.comparingInt((Map.Entry<String, String> entry) -> entry.getKey().length()).reversed());
        return List.copyOf(entries);
    }
}
