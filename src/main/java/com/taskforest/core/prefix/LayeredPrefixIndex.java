package com.taskforest.core.prefix;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One {@link PrefixIndex} per prefix length, so that a lookup at length L
 * only ever sees declarations normalized at length L.
 * <p>
 * A declaration is inserted into every layer. Lookups walk the layers from
 * the longest length to the shortest.
 */
public class LayeredPrefixIndex {

    /**
     * Hit in one layer.
     *
     * @param prefixLength the layer's normalization length
     * @param key          the normalized key that matched
     * @param entries      the owners registered under that key, in insertion order
     */
    public record Match(int prefixLength, String key, List<IndexEntry> entries) {}

    private final List<Integer> lengths;
    private final Map<Integer, PrefixIndex> layers = new LinkedHashMap<>();

    /**
     * @param lengths layer lengths; non-positive values and duplicates are dropped
     *                and the rest ordered longest first
     */
    public LayeredPrefixIndex(List<Integer> lengths) {
        this.lengths = lengths.stream()
                .filter(l -> l != null && l > 0)
                .distinct()
                .sorted((a, b) -> Integer.compare(b, a))
                .toList();
        for (int length : this.lengths) {
            layers.put(length, new PrefixIndex());
        }
    }

    public List<Integer> lengths() {
        return lengths;
    }

    /**
     * Normalizes {@code declaredPrefix} at every layer length and registers the owner in that layer.
     */
    public void insert(String declaredPrefix, String ownerTaskId) {
        for (Map.Entry<Integer, PrefixIndex> layer : layers.entrySet()) {
            layer.getValue().insert(PrefixNormalizer.normalize(declaredPrefix, layer.getKey()),
                    ownerTaskId, declaredPrefix);
        }
    }

    /**
     * Every non-empty hit for {@code text}, longest length first.
     */
    public List<Match> matchesDecreasing(String text) {
        var matches = new ArrayList<Match>();
        for (Map.Entry<Integer, PrefixIndex> layer : layers.entrySet()) {
            String key = PrefixNormalizer.normalize(text, layer.getKey());
            List<IndexEntry> entries = layer.getValue().lookupEntries(key);
            if (!entries.isEmpty()) {
                matches.add(new Match(layer.getKey(), key, entries));
            }
        }
        return matches;
    }

    /** The hit at the longest length that has one. */
    public Optional<Match> lookupDecreasing(String text) {
        List<Match> matches = matchesDecreasing(text);
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }

    public PrefixIndex layer(int length) {
        PrefixIndex layer = layers.get(length);
        if (layer == null) {
            throw new IllegalArgumentException("No layer for prefix length " + length);
        }
        return layer;
    }

    /** Distinct keys summed over all layers. */
    public int size() {
        return layers.values().stream().mapToInt(PrefixIndex::size).sum();
    }

    public void clear() {
        layers.values().forEach(PrefixIndex::clear);
    }
}
