package me.arr28.cache;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A fixed-capacity key-value cache.  Each sub-class decides which entry to evict when a new key arrives and the cache
 * is full.
 *
 * Caches are not thread-safe.  Callers that share an instance between threads must serialize access themselves.
 *
 * @param <K> - the key type.
 * @param <V> - the value type.
 */
public abstract class Cache<K, V>
{
  private static final Logger LOG = LogManager.getLogger(Cache.class);

  private int mCapacity;

  /**
   * Read-only statistics.
   */
  private long mHits;
  private long mMisses;
  private long mEvictions;

  /**
   * Create a cache.
   *
   * @param xiCapacity - the maximum number of entries, which may be 0 (in which case nothing is ever stored).
   */
  protected Cache(int xiCapacity)
  {
    mCapacity = checkCapacity(xiCapacity);
  }

  public int getCapacity()
  {
    return mCapacity;
  }

  /**
   * Change the capacity.
   *
   * Shrinking the capacity below the current size does NOT evict anything immediately.  The excess entries are
   * evicted by the next {@link #put(Object, Object)}, so until then {@link #size()} may exceed the capacity.
   *
   * @param xiCapacity - the new capacity.
   */
  public void setCapacity(int xiCapacity)
  {
    checkCapacity(xiCapacity);
    int lSize = size();
    if (xiCapacity < lSize)
    {
      LOG.debug("Capacity of {} reduced to {} with {} entries, excess evicted on next put",
                getClass().getSimpleName(),
                xiCapacity,
                lSize);
    }
    mCapacity = xiCapacity;
  }

  /**
   * Look up a key.  Depending on the eviction policy, this may count as a use of the entry.
   *
   * @return the value stored against the key.
   *
   * @param xiKey - the key.
   *
   * @throws KeyNotFoundException if the key isn't in the cache.
   */
  public abstract V get(K xiKey);

  /**
   * Store a value against a key, replacing any existing value and evicting another entry if necessary.  Never fails.
   * If the capacity is 0, nothing is stored.
   *
   * @param xiKey - the key.
   * @param xiValue - the value.
   */
  public abstract void put(K xiKey, V xiValue);

  /**
   * Remove every entry.  The capacity is unchanged.
   */
  public abstract void clear();

  /**
   * @return the number of entries in the cache.
   */
  public abstract int size();

  /**
   * @return whether the key is in the cache.  This never counts as a use of the entry.
   *
   * @param xiKey - the key.
   */
  public abstract boolean containsKey(K xiKey);

  public long getHits()
  {
    return mHits;
  }

  public long getMisses()
  {
    return mMisses;
  }

  public long getEvictions()
  {
    return mEvictions;
  }

  /**
   * Zero the hit, miss and eviction counts.
   */
  public void resetStatistics()
  {
    mHits = 0;
    mMisses = 0;
    mEvictions = 0;
  }

  protected void recordHit()
  {
    mHits++;
  }

  protected void recordEviction()
  {
    mEvictions++;
  }

  /**
   * Record a miss.
   *
   * @return the exception for the caller to throw.
   */
  protected KeyNotFoundException keyNotFound(K xiKey)
  {
    mMisses++;
    return new KeyNotFoundException(xiKey);
  }

  private static int checkCapacity(int xiCapacity)
  {
    if (xiCapacity < 0)
    {
      throw new IllegalArgumentException("Capacity must not be negative: " + xiCapacity);
    }
    return xiCapacity;
  }

  @Override
  public String toString()
  {
    return getClass().getSimpleName() + "[size=" + size() + ", capacity=" + mCapacity + "]";
  }
}
