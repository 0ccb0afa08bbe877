package com.raditha.canon.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LayeredMapTest {

    private static LayeredMap<Integer, String> numbers(int count) {
        Map<Integer, String> entries = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            entries.put(i, "v" + i);
        }
        return LayeredMap.of(entries);
    }

    private static <K, V> Map<K, V> change(K key, V value) {
        Map<K, V> changes = new HashMap<>();
        changes.put(key, value);
        return changes;
    }

    @Test
    void testDerivedVersionStoresOnlyChanges() {
        LayeredMap<Integer, String> base = numbers(1000);

        LayeredMap<Integer, String> edited = base.with(change(5, "five"));

        assertEquals(1, edited.overlaySize());
        assertEquals("five", edited.get(5));
        assertEquals("v5", base.get(5));
        assertEquals(1000, edited.size());
    }

    @Test
    void testRemoveAndAdd() {
        LayeredMap<Integer, String> base = numbers(3);

        LayeredMap<Integer, String> removed = base.with(change(1, null));
        assertFalse(removed.containsKey(1));
        assertEquals(2, removed.size());

        LayeredMap<Integer, String> added = removed.with(change(7, "seven"));
        assertEquals(3, added.size());
        assertEquals("seven", added.get(7));

        LayeredMap<Integer, String> gone = added.with(change(7, null));
        assertEquals(2, gone.size());
        assertNull(gone.get(7));
        assertEquals(0, base.with(change(42, null)).overlaySize());
    }

    @Test
    void testIterationKeepsBaseOrderThenAdditions() {
        LayeredMap<Integer, String> map = numbers(3)
                .with(change(9, "nine"))
                .with(change(0, "zero"))
                .with(change(1, null));

        List<Integer> keys = new ArrayList<>();
        map.forEach((k, v) -> keys.add(k));

        assertEquals(List.of(0, 2, 9), keys);
        assertEquals(List.of("zero", "v2", "nine"), map.values());
    }

    @Test
    void testLargeOverlayIsCompacted() {
        LayeredMap<Integer, String> map = numbers(10);
        for (int i = 0; i < 100; i++) {
            map = map.with(change(100 + i, "n" + i));
        }

        assertEquals(110, map.size());
        assertTrue(map.overlaySize() <= 64, map.toString());
        assertEquals("n99", map.get(199));
        assertEquals("v3", map.get(3));
    }

    @Test
    void testNullValuesRejected() {
        Map<Integer, String> entries = new HashMap<>();
        entries.put(1, null);

        assertThrows(IllegalArgumentException.class, () -> LayeredMap.of(entries));
        assertTrue(LayeredMap.<Integer, String>empty().isEmpty());
    }
}
