package com.taskforest.core.prefix;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Exact-prefix index from a normalized sub-task instruction to the tasks that
 * declared it.
 * <p>
 * Backed by a character trie. Lookups are exact key matches only: a key that
 * is merely a prefix of, or contains, an indexed key does not match. When
 * several owners insert the same key every owner is kept, in insertion order,
 * so callers can see the ambiguity.
 * <p>
 * One instance holds keys of a single normalization length; see
 * {@link LayeredPrefixIndex} for the per-length arrangement a run uses.
 * <p>
 * Instances are scoped to a single reconstruction run and are not thread-safe.
 */
public class PrefixIndex {

    private Node root = new Node();
    private int keyCount;
    private int entryCount;

    public void insert(String prefix, String ownerTaskId) {
        insert(prefix, ownerTaskId, prefix);
    }

    /**
     * Registers {@code ownerTaskId} under {@code key}. Empty keys and blank
     * owners are ignored; re-inserting the same owner and declared prefix
     * under a key is a no-op.
     *
     * @param key            normalized lookup key
     * @param ownerTaskId    task that declared the instruction
     * @param declaredPrefix full-length prefix the key was derived from
     */
    public void insert(String key, String ownerTaskId, String declaredPrefix) {
        if (key == null || key.isEmpty() || ownerTaskId == null || ownerTaskId.isBlank()) {
            return;
        }
        Node node = root;
        for (int i = 0; i < key.length(); i++) {
            node = node.children.computeIfAbsent(key.charAt(i), c -> new Node());
        }
        if (node.entries == null) {
            node.entries = new LinkedHashSet<>();
            keyCount++;
        }
        if (node.entries.add(new IndexEntry(ownerTaskId, declaredPrefix != null ? declaredPrefix : key))) {
            entryCount++;
        }
    }

    /**
     * Distinct owners registered under exactly {@code prefix}, in insertion order.
     */
    public List<String> lookup(String prefix) {
        var owners = new LinkedHashSet<String>();
        for (IndexEntry entry : lookupEntries(prefix)) {
            owners.add(entry.ownerTaskId());
        }
        return List.copyOf(owners);
    }

    public List<IndexEntry> lookupEntries(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            return List.of();
        }
        Node node = root;
        for (int i = 0; i < prefix.length() && node != null; i++) {
            node = node.children.get(prefix.charAt(i));
        }
        if (node == null || node.entries == null) {
            return List.of();
        }
        return List.copyOf(node.entries);
    }

    /** Number of distinct keys. */
    public int size() {
        return keyCount;
    }

    /** Number of key/owner registrations. */
    public int entryCount() {
        return entryCount;
    }

    public boolean isEmpty() {
        return keyCount == 0;
    }

    public void clear() {
        root = new Node();
        keyCount = 0;
        entryCount = 0;
    }

    private static final class Node {
        private final Map<Character, Node> children = new HashMap<>(4);
        private LinkedHashSet<IndexEntry> entries;
    }
}
