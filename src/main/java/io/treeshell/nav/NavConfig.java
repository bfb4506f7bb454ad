package io.treeshell.nav;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.treeshell.util.Jsons;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Nav definition: ordered family list, optional per-family priorities and optional explicit
 * coordinates. {@code coordinateMapping} is the older coordinate-to-family form of
 * {@code familyCoordinates}; both are honored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NavConfig(
        @JsonProperty("prefix") String prefix,
        @JsonProperty("first_slot") Integer firstSlot,
        @JsonProperty("nav_tree_order") List<String> navTreeOrder,
        @JsonProperty("family_priorities") Map<String, Integer> familyPriorities,
        @JsonProperty("family_coordinates") Map<String, String> familyCoordinates,
        @JsonProperty("coordinate_mapping") Map<String, String> coordinateMapping
) {
    public static final String DEFAULT_PREFIX = "0";
    public static final int DEFAULT_FIRST_SLOT = 1;

    public NavConfig {
        prefix = prefix == null || prefix.isBlank() ? DEFAULT_PREFIX : prefix.trim();
        firstSlot = firstSlot == null || firstSlot < 0 ? DEFAULT_FIRST_SLOT : firstSlot;
        navTreeOrder = navTreeOrder == null ? List.of() : List.copyOf(navTreeOrder);
        familyPriorities = frozen(familyPriorities);
        familyCoordinates = frozen(familyCoordinates);
        coordinateMapping = frozen(coordinateMapping);
    }

    public static NavConfig empty() {
        return new NavConfig(null, null, null, null, null, null);
    }

    public static NavConfig of(List<String> order) {
        return new NavConfig(null, null, order, null, null, null);
    }

    /**
     * Reads a nav file, returning {@code null} when it does not exist.
     */
    public static NavConfig read(Path file) throws IOException {
        JsonNode tree = Jsons.readTreeIfExists(file);
        if (tree == null) {
            return null;
        }
        return Jsons.mapper().treeToValue(tree, NavConfig.class);
    }

    private static <V> Map<String, V> frozen(Map<String, V> in) {
        return in == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(in));
    }
}
