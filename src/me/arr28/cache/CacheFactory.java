package me.arr28.cache;

import java.util.Objects;

import me.arr28.cache.index.KeyEquivalence;
import me.arr28.cache.policy.FIFOCache;
import me.arr28.cache.policy.FILOCache;
import me.arr28.cache.policy.LFUCache;
import me.arr28.cache.policy.LRUCache;

/**
 * Creates caches by eviction policy, for callers that choose the policy at run time.
 */
public final class CacheFactory
{
  private CacheFactory()
  {
    // Static methods only.
  }

  /**
   * @return a new, empty cache keyed by the keys' own hashCode() and equals().
   *
   * @param xiPolicy - the eviction policy.
   * @param xiCapacity - the maximum number of entries.
   */
  public static <K, V> Cache<K, V> create(EvictionPolicy xiPolicy, int xiCapacity)
  {
    return create(xiPolicy, xiCapacity, KeyEquivalence.<K>natural());
  }

  /**
   * @return a new, empty cache.
   *
   * @param xiPolicy - the eviction policy.
   * @param xiCapacity - the maximum number of entries.
   * @param xiEquivalence - the hash and equality function for keys.
   */
  public static <K, V> Cache<K, V> create(EvictionPolicy xiPolicy, int xiCapacity, KeyEquivalence<K> xiEquivalence)
  {
    switch (Objects.requireNonNull(xiPolicy, "policy"))
    {
      case FILO:
        return new FILOCache<>(xiCapacity, xiEquivalence);

      case FIFO:
        return new FIFOCache<>(xiCapacity, xiEquivalence);

      case LRU:
        return new LRUCache<>(xiCapacity, xiEquivalence);

      case LFU:
        return new LFUCache<>(xiCapacity, xiEquivalence);

      default:
        throw new IllegalArgumentException("Unsupported eviction policy: " + xiPolicy);
    }
  }

  /**
   * @return a new, empty cache using the named policy.
   *
   * @param xiPolicyName - the policy name, as accepted by {@link EvictionPolicy#fromName(String)}.
   * @param xiCapacity - the maximum number of entries.
   */
  public static <K, V> Cache<K, V> create(String xiPolicyName, int xiCapacity)
  {
    return create(EvictionPolicy.fromName(xiPolicyName), xiCapacity);
  }
}
