package me.arr28.cache.policy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import me.arr28.cache.KeyNotFoundException;

class FILOCacheTest
{
  @Test
  void newestEntryMakesWayWhenFull()
  {
    FILOCache<Integer, Integer> lCache = new FILOCache<>(2);
    lCache.put(1, 1);
    lCache.put(2, 2);

    lCache.put(3, 3); // evicts key 2
    assertThrows(KeyNotFoundException.class, () -> lCache.get(2));
    assertEquals(3, lCache.get(3));

    lCache.put(4, 4); // evicts key 3
    assertThrows(KeyNotFoundException.class, () -> lCache.get(3));
    assertEquals(1, lCache.get(1));
    assertEquals(4, lCache.get(4));
  }

  @Test
  void updateDoesNotMoveEntry()
  {
    FILOCache<Integer, Integer> lCache = new FILOCache<>(3);
    lCache.put(1, 1);
    lCache.put(2, 2);
    lCache.put(3, 3);

    // Key 1 is the bottom of the stack.  Updating it mustn't make it the newest.
    lCache.put(1, 10);
    lCache.put(4, 4);

    assertEquals(10, lCache.get(1));
    assertEquals(2, lCache.get(2));
    assertFalse(lCache.containsKey(3));
    assertEquals(4, lCache.get(4));
  }

  @Test
  void lookupsDoNotReorder()
  {
    FILOCache<String, String> lCache = new FILOCache<>(2);
    lCache.put("a", "A");
    lCache.put("b", "B");
    assertEquals("A", lCache.get("a"));

    lCache.put("c", "C");

    assertTrue(lCache.containsKey("a"));
    assertFalse(lCache.containsKey("b"));
  }

  @Test
  void keyRemovedByShrinkIsReinsertedOnTheSamePut()
  {
    FILOCache<Integer, Integer> lCache = new FILOCache<>(3);
    lCache.put(1, 1);
    lCache.put(2, 2);
    lCache.put(3, 3);

    // The excess eviction pops key 3 itself, so it goes back in as a new key, popping key 2.
    lCache.setCapacity(2);
    lCache.put(3, 30);

    assertEquals(2, lCache.size());
    assertEquals(1, lCache.get(1));
    assertEquals(30, lCache.get(3));
    assertFalse(lCache.containsKey(2));
  }
}
