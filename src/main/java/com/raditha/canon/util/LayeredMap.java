package com.raditha.canon.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * An immutable map stored as a base shared between versions plus an overlay of changes made
 * since the base was built. Deriving a new version copies the overlay only, never the base.
 * <p>
 * The overlay is folded into a fresh base once it holds more than half as many keys as the base,
 * so a lookup costs at most two hash lookups and the copying done by a chain of derivations is paid back
 * by the edits that caused it.
 *
 * @param <K> key type
 * @param <V> value type; null values are not allowed
 */
public final class LayeredMap<K, V> {

    private static final int MIN_OVERLAY = 64;

    private static final LayeredMap<Object, Object> EMPTY = new LayeredMap<>(Map.of(), Map.of(), 0);

    private final Map<K, V> base;
    /** Changed keys; a null value marks a key removed from the base. */
    private final Map<K, V> overlay;
    private final int size;

    private LayeredMap(Map<K, V> base, Map<K, V> overlay, int size) {
        this.base = base;
        this.overlay = overlay;
        this.size = size;
    }

    @SuppressWarnings("unchecked")
    public static <K, V> LayeredMap<K, V> empty() {
        return (LayeredMap<K, V>) EMPTY;
    }

    /**
     * A map holding a copy of {@code entries}, in their iteration order.
     */
    public static <K, V> LayeredMap<K, V> of(Map<K, V> entries) {
        Map<K, V> copy = new LinkedHashMap<>(entries);
        if (copy.containsValue(null)) {
            throw new IllegalArgumentException("LayeredMap does not hold null values");
        }
        return new LayeredMap<>(Collections.unmodifiableMap(copy), Map.of(), copy.size());
    }

    public V get(K key) {
        if (overlay.containsKey(key)) {
            return overlay.get(key);
        }
        return base.get(key);
    }

    public boolean containsKey(K key) {
        return get(key) != null;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Number of keys changed since the base was last rebuilt.
     */
    public int overlaySize() {
        return overlay.size();
    }

    /**
     * This map with {@code changes} applied. A null value in {@code changes} removes its key.
     */
    public LayeredMap<K, V> with(Map<K, V> changes) {
        if (changes.isEmpty()) {
            return this;
        }
        Map<K, V> merged = new LinkedHashMap<>(overlay);
        int newSize = size;
        for (Map.Entry<K, V> change : changes.entrySet()) {
            K key = change.getKey();
            V value = change.getValue();
            boolean had = containsKey(key);
            if (value != null && !had) {
                newSize++;
            } else if (value == null && had) {
                newSize--;
            }
            if (value == null && !base.containsKey(key)) {
                merged.remove(key);
            } else {
                merged.put(key, value);
            }
        }
        if (merged.size() > Math.max(MIN_OVERLAY, base.size() / 2)) {
            return compact(merged);
        }
        return new LayeredMap<>(base, Collections.unmodifiableMap(merged), newSize);
    }

    private LayeredMap<K, V> compact(Map<K, V> merged) {
        Map<K, V> flat = new LinkedHashMap<>(base);
        for (Map.Entry<K, V> change : merged.entrySet()) {
            if (change.getValue() == null) {
                flat.remove(change.getKey());
            } else {
                flat.put(change.getKey(), change.getValue());
            }
        }
        return new LayeredMap<>(Collections.unmodifiableMap(flat), Map.of(), flat.size());
    }

    /**
     * Visits every entry: keys of the base in their original order, then keys added later in the
     * order they were added.
     */
    public void forEach(BiConsumer<? super K, ? super V> action) {
        for (Map.Entry<K, V> entry : base.entrySet()) {
            V value = overlay.containsKey(entry.getKey()) ? overlay.get(entry.getKey()) : entry.getValue();
            if (value != null) {
                action.accept(entry.getKey(), value);
            }
        }
        for (Map.Entry<K, V> entry : overlay.entrySet()) {
            if (entry.getValue() != null && !base.containsKey(entry.getKey())) {
                action.accept(entry.getKey(), entry.getValue());
            }
        }
    }

    public List<V> values() {
        List<V> result = new ArrayList<>(size);
        forEach((k, v) -> result.add(v));
        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return "LayeredMap[" + size + " entries, " + overlay.size() + " changed]";
    }
}
