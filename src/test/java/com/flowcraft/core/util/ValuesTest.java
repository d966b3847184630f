package com.flowcraft.core.util;

import org.junit.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class ValuesTest {

    @Test
    public void testIsSet() {
        assertFalse(Values.isSet(null));
        assertFalse(Values.isSet(""));
        assertFalse(Values.isSet(List.of()));
        assertFalse(Values.isSet(Map.of()));
        assertFalse(Values.isSet(false));
        assertFalse(Values.isSet(0));
        assertFalse(Values.isSet(0.0));

        assertTrue(Values.isSet("x"));
        assertTrue(Values.isSet(List.of("a")));
        assertTrue(Values.isSet(Map.of("k", "v")));
        assertTrue(Values.isSet(true));
        assertTrue(Values.isSet(7));
    }

    @Test
    public void testSortedCopyRecursesIntoListsAndMaps() {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("z", 1);
        item.put("a", 2);
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("list", List.of(item));
        map.put("b", "x");

        Map<String, Object> sorted = Values.sortedCopy(map);

        assertEquals(List.of("b", "list"), List.copyOf(sorted.keySet()));
        Map<?, ?> nested = (Map<?, ?>) ((List<?>) sorted.get("list")).get(0);
        assertEquals(List.of("a", "z"), List.copyOf(nested.keySet()));
    }

    @Test
    public void testFrozenCopyKeepsNullsAndDetachesFromSource() {
        Map<String, Object> source = new HashMap<>();
        source.put("k", null);
        Map<String, Object> frozen = Values.frozenCopy(source);
        source.put("other", 1);

        assertTrue(frozen.containsKey("k"));
        assertEquals(1, frozen.size());
        try {
            frozen.put("x", 1);
            fail("Frozen copy should be read-only");
        } catch (UnsupportedOperationException expected) {
            // ok
        }
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testFrozenCopyIsDeep() {
        List<Object> answers = new ArrayList<>(List.of("yes"));
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("timeout", 30);
        params.put("tags", answers);
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("parameters", params);

        Map<String, Object> frozen = Values.frozenCopy(source);
        params.put("timeout", 60);
        answers.add("no");

        Map<?, ?> frozenParams = (Map<?, ?>) frozen.get("parameters");
        assertEquals(30, frozenParams.get("timeout"));
        assertEquals(List.of("yes"), frozenParams.get("tags"));
        try {
            ((List<Object>) frozenParams.get("tags")).add("maybe");
            fail("Nested list should be read-only");
        } catch (UnsupportedOperationException expected) {
            // ok
        }
    }

    @Test
    public void testAsStringList() {
        List<Object> mixed = new ArrayList<>();
        mixed.add("yes");
        mixed.add(1);
        assertEquals(List.of("yes", "1"), Values.asStringList(mixed));
        assertTrue(Values.asStringList("yes").isEmpty());
    }
}
