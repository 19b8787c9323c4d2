package me.arr28.cache.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Locale;

import org.junit.jupiter.api.Test;

class IndexMapTest
{
  /**
   * Case-insensitive string keys.
   */
  static final KeyEquivalence<String> IGNORE_CASE = new KeyEquivalence<String>()
  {
    @Override
    public int hash(String xiKey)
    {
      return xiKey.toLowerCase(Locale.ROOT).hashCode();
    }

    @Override
    public boolean equivalent(String xiA, String xiB)
    {
      return xiA.equalsIgnoreCase(xiB);
    }
  };

  @Test
  void naturalEquivalenceUsesEquals()
  {
    IndexMap<String, Integer> lMap = new IndexMap<>(KeyEquivalence.natural(), 4);
    lMap.put("key", 1);

    assertEquals(1, lMap.get("key"));
    assertNull(lMap.get("KEY"));
    assertFalse(lMap.containsKey("KEY"));
  }

  @Test
  void suppliedEquivalenceIsUsedForEveryOperation()
  {
    IndexMap<String, Integer> lMap = new IndexMap<>(IGNORE_CASE, 4);
    lMap.put("Key", 1);
    lMap.put("KEY", 2);

    assertEquals(1, lMap.size());
    assertEquals(2, lMap.get("key"));
    assertTrue(lMap.containsKey("kEY"));
    assertEquals(2, lMap.remove("kEy"));
    assertEquals(0, lMap.size());
    assertSame(IGNORE_CASE, lMap.getEquivalence());
  }

  @Test
  void collidingHashesStillDistinguishKeys()
  {
    KeyEquivalence<Integer> lConstantHash = new KeyEquivalence<Integer>()
    {
      @Override
      public int hash(Integer xiKey)
      {
        return 42;
      }

      @Override
      public boolean equivalent(Integer xiA, Integer xiB)
      {
        return xiA.intValue() == xiB.intValue();
      }
    };

    IndexMap<Integer, String> lMap = new IndexMap<>(lConstantHash, 4);
    for (int lii = 0; lii < 100; lii++)
    {
      lMap.put(lii, "v" + lii);
    }

    assertEquals(100, lMap.size());
    assertEquals("v57", lMap.get(57));
    assertNull(lMap.get(100));
  }

  @Test
  void nullKeysAreRejected()
  {
    IndexMap<String, Integer> lMap = new IndexMap<>(KeyEquivalence.natural(), 4);
    assertThrows(NullPointerException.class, () -> lMap.get(null));
    assertThrows(NullPointerException.class, () -> lMap.put(null, 1));
  }

  @Test
  void hugeSizeHintIsAccepted()
  {
    IndexMap<String, Integer> lMap = new IndexMap<>(KeyEquivalence.natural(), Integer.MAX_VALUE);
    lMap.put("a", 1);
    assertEquals(1, lMap.size());
  }
}
