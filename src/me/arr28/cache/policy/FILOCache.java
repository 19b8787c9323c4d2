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
 * A cache with stack discipline (First In, Last Out).
 *
 * New keys are pushed onto the tail of the list.  When the cache is full, the newest entry is popped to make room,
 * so the oldest entries stay resident for as long as the cache lives.
 *
 * @param <K> - the key type.
 * @param <V> - the value type.
 */
public class FILOCache<K, V> extends Cache<K, V>
{
  private static final Logger LOG = LogManager.getLogger(FILOCache.class);

  private final IndexMap<K, CacheEntry<K, V>> mIndex;
  private final IntrusiveLinkedList<CacheEntry<K, V>> mStack = new IntrusiveLinkedList<>();

  public FILOCache(int xiCapacity)
  {
    this(xiCapacity, KeyEquivalence.natural());
  }

  /**
   * Create a FILO cache.
   *
   * @param xiCapacity - the maximum number of entries.
   * @param xiEquivalence - the hash and equality function for keys.
   */
  public FILOCache(int xiCapacity, KeyEquivalence<K> xiEquivalence)
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

    mStack.addLast(lEntry);
    mIndex.put(xiKey, lEntry);
  }

  /**
   * Pop the most recently inserted entry.
   *
   * @return the evicted (unlinked) entry.
   */
  private CacheEntry<K, V> evict()
  {
    CacheEntry<K, V> lEvicted = mStack.removeLast();
    mIndex.remove(lEvicted.getKey());
    recordEviction();
    LOG.trace("Evicted newest key {}", lEvicted.getKey());
    return lEvicted;
  }

  @Override
  public void clear()
  {
    LOG.debug("Clearing {} entries", mIndex.size());
    mStack.clear();
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
