package com.quakesentinel.core.translate;

import com.fasterxml.jackson.core.type.TypeReference;
import com.quakesentinel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Two ordered substitution tables: region names first, then descriptive suffixes and directions.
 * Insertion order is significant as the tie-break between keys of equal length.
 */
public record PlaceNameDictionary(Map<String, String> regions, Map<String, String> suffixes) {
    public static final String DEFAULT_RESOURCE = "place-names.json";

    public PlaceNameDictionary {
        regions = Collections.unmodifiableMap(new LinkedHashMap<>(regions == null ? Map.of() : regions));
        suffixes = Collections.unmodifiableMap(new LinkedHashMap<>(suffixes == null ? Map.of() : suffixes));
    }

    public static PlaceNameDictionary loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public static PlaceNameDictionary loadResource(String resource) {
        try (InputStream in = PlaceNameDictionary.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Place-name dictionary not found on classpath: " + resource);
            }
            Tables tables = JsonUtils.objectMapper().readValue(in, new TypeReference<>() {
            });
            return new PlaceNameDictionary(tables.regions(), tables.suffixes());
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading place-name dictionary " + resource, e);
        }
    }

    private record Tables(LinkedHashMap<String, String> regions, LinkedHashMap<String, String> suffixes) {
    }
}
