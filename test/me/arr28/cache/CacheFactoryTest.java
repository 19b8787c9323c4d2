package me.arr28.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import me.arr28.cache.policy.FIFOCache;
import me.arr28.cache.policy.FILOCache;
import me.arr28.cache.policy.LFUCache;
import me.arr28.cache.policy.LRUCache;

class CacheFactoryTest
{
  @Test
  void createsEachPolicy()
  {
    assertInstanceOf(FILOCache.class, CacheFactory.create(EvictionPolicy.FILO, 1));
    assertInstanceOf(FIFOCache.class, CacheFactory.create(EvictionPolicy.FIFO, 1));
    assertInstanceOf(LRUCache.class, CacheFactory.create(EvictionPolicy.LRU, 1));
    assertInstanceOf(LFUCache.class, CacheFactory.create(EvictionPolicy.LFU, 1));
  }

  @Test
  void createsByName()
  {
    Cache<String, String> lCache = CacheFactory.create(" lfu ", 7);
    assertInstanceOf(LFUCache.class, lCache);
    assertEquals(7, lCache.getCapacity());
    assertEquals(0, lCache.size());
  }

  @Test
  void policyNamesAreCaseInsensitive()
  {
    assertEquals(EvictionPolicy.FILO, EvictionPolicy.fromName("filo"));
    assertEquals(EvictionPolicy.FIFO, EvictionPolicy.fromName("Fifo"));
    assertEquals(EvictionPolicy.LRU, EvictionPolicy.fromName("LRU"));
  }

  @Test
  void unknownPolicyNameIsRejected()
  {
    assertThrows(IllegalArgumentException.class, () -> EvictionPolicy.fromName("clock"));
    assertThrows(IllegalArgumentException.class, () -> EvictionPolicy.fromName(null));
  }

  @Test
  void negativeCapacityIsRejected()
  {
    assertThrows(IllegalArgumentException.class, () -> CacheFactory.create(EvictionPolicy.LRU, -1));
  }

  @Test
  void nullPolicyIsRejected()
  {
    assertThrows(NullPointerException.class, () -> CacheFactory.create((EvictionPolicy)null, 1));
  }
}
