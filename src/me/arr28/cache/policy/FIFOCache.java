package me.arr28.cache.policy;

import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import me.arr28.cache.Cache;
import me.arr28.cache.index.IndexMap;
import me.arr28.cache.index.KeyEquivalence;
import me.arr28.cache.list.CacheEntry;
import me.arr28.cache.list.IntrusiveLinkedList;

/**
 * A cache that evicts the oldest entry (First In, First Out).
 *
 * Entries are appended at the tail of the insertion-ordered list and evicted from the head.  Updating the value of an
 * existing key doesn't change its position, and lookups never reorder anything.
 *
 * @param <K> - the key type.
 * @param <V> - the value type.
 */
public class FIFOCache<K, V> extends Cache<K, V>
{
  private static final Logger LOG = LogManager.getLogger(FIFOCache.class);

  private final IndexMap<K, CacheEntry<K, V>> mIndex;
  private final IntrusiveLinkedList<CacheEntry<K, V>> mInsertionOrder = new IntrusiveLinkedList<>();

  public FIFOCache(int xiCapacity)
  {
    this(xiCapacity, KeyEquivalence.natural());
  }

  /**
   * Create a FIFO cache.
   *
   * @param xiCapacity - the maximum number of entries.
   * @param xiEquivalence - the hash and equality function for keys.
   */
  public FIFOCache(int xiCapacity, KeyEquivalence<K> xiEquivalence)
  {
    super(xiCapacity);
    mIndex = new IndexMap<>(xiEquivalence, xiCapacity);
  }

  @Override
  public V get(K xiKey)
  {
    CacheEntry<K, V> lEntry = mIndex.get(xiKey);
    if (lEntry == null)
    {
      throw keyNotFound(xiKey);
    }

    recordHit();
    return lEntry.getValue();
  }

  @Override
  public void put(K xiKey, V xiValue)
  {
    Objects.requireNonNull(xiKey, "key");

    // Catch up with any capacity reduction.
    while (mIndex.size() > getCapacity())
    {
      evict();
    }

    if (getCapacity() == 0)
    {
      return;
    }

    CacheEntry<K, V> lEntry = mIndex.get(xiKey);
    if (lEntry != null)
    {
      // Update in place.  Insertion order is unaffected.
      lEntry.setValue(xiValue);
      return;
    }

    if (mIndex.size() == getCapacity())
    {
      lEntry = evict();
      lEntry.reset(xiKey, xiValue, 0);
    }
    else
    {
      lEntry = new CacheEntry<>(xiKey, xiValue, 0);
    }

    mInsertionOrder.addLast(lEntry);
    mIndex.put(xiKey, lEntry);
  }

  /**
   * Evict the oldest entry.
   *
   * @return the evicted (unlinked) entry.
   */
  private CacheEntry<K, V> evict()
  {
    CacheEntry<K, V> lEvicted = mInsertionOrder.removeFirst();
    mIndex.remove(lEvicted.getKey());
    recordEviction();
    LOG.trace("Evicted oldest key {}", lEvicted.getKey());
    return lEvicted;
  }

  @Override
  public void clear()
  {
    LOG.debug("Clearing {} entries", mIndex.size());
    mInsertionOrder.clear();
    mIndex.clear();
  }

  @Override
  public int size()
  {
    return mIndex.size();
  }

  @Override
  public boolean containsKey(K xiKey)
  {
    return mIndex.containsKey(xiKey);
  }
}
