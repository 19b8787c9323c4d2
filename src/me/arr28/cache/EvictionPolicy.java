package me.arr28.cache;

import java.util.Locale;

/**
 * The eviction policies that {@link CacheFactory} can build.
 */
public enum EvictionPolicy
{
  /**
   * Stack discipline: when full, the most recently inserted key makes way for the new one.
   */
  FILO,

  /**
   * Queue discipline: when full, the oldest inserted key is evicted.
   */
  FIFO,

  /**
   * When full, the least recently used key is evicted.
   */
  LRU,

  /**
   * When full, the least frequently used key is evicted, the least recently promoted first among equals.
   */
  LFU;

  /**
   * @return the policy with the specified name, ignoring case and surrounding whitespace.
   *
   * @param xiName - the policy name, e.g. "lru".
   *
   * @throws IllegalArgumentException if there's no such policy.
   */
  public static EvictionPolicy fromName(String xiName)
  {
    if (xiName != null)
    {
      String lName = xiName.trim().toUpperCase(Locale.ROOT);
      for (EvictionPolicy lPolicy : values())
      {
        if (lPolicy.name().equals(lName))
        {
          return lPolicy;
        }
      }
    }
    throw new IllegalArgumentException("Unknown eviction policy: " + xiName);
  }
}
