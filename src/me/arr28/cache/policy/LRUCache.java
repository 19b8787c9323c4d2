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
 * A cache that evicts the least recently used entry.
 *
 * The list is kept in recency order: most recently used at the head, least recently used at the tail.  Both get()
 * and put() move the entry to the head.
 *
 * @param <K> - the key type.
 * @param <V> - the value type.
 */
public class LRUCache<K, V> extends Cache<K, V>
{
  private static final Logger LOG = LogManager.getLogger(LRUCache.class);

  private final IndexMap<K, CacheEntry<K, V>> mIndex;
  private final IntrusiveLinkedList<CacheEntry<K, V>> mRUOrderedList = new IntrusiveLinkedList<>();

  public LRUCache(int xiCapacity)
  {
    this(xiCapacity, KeyEquivalence.natural());
  }

  /**
   * Create an LRU cache.
   *
   * @param xiCapacity - the maximum number of entries.
   * @param xiEquivalence - the hash and equality function for keys.
   */
  public LRUCache(int xiCapacity, KeyEquivalence<K> xiEquivalence)
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

    // Record the hit and move the item to the head of the LRU list.
    recordHit();
    mRUOrderedList.moveToFirst(lEntry);
    return lEntry.getValue();
  }

  @Override
  public void put(K xiKey, V xiValue)
  {
    Objects.requireNonNull(xiKey, "key");

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
      lEntry.setValue(xiValue);
      mRUOrderedList.moveToFirst(lEntry);
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

    mRUOrderedList.addFirst(lEntry);
    mIndex.put(xiKey, lEntry);
  }

  /**
   * Evict the least recently used entry.
   *
   * @return the evicted (unlinked) entry.
   */
  private CacheEntry<K, V> evict()
  {
    CacheEntry<K, V> lEvicted = mRUOrderedList.removeLast();
    mIndex.remove(lEvicted.getKey());
    recordEviction();
    LOG.trace("Evicted least recently used key {}", lEvicted.getKey());
    return lEvicted;
  }

  @Override
  public void clear()
  {
    LOG.debug("Clearing {} entries", mIndex.size());
    mRUOrderedList.clear();
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
