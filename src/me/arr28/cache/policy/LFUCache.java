package me.arr28.cache.policy;

import java.util.HashMap;
import java.util.Objects;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import me.arr28.cache.Cache;
import me.arr28.cache.index.IndexMap;
import me.arr28.cache.index.KeyEquivalence;
import me.arr28.cache.list.CacheEntry;
import me.arr28.cache.list.IntrusiveLinkedList;

/**
 * A cache that evicts the least frequently used entry.
 *
 * Each entry counts its uses (the put that created it, then every get() and put()).  Entries are grouped into one
 * list per use count, with the most recent arrival at the head of each list.  When the cache is full, the tail of
 * the list for the lowest count is evicted: the least frequently used entry, and of those, the one that reached that
 * count longest ago.
 *
 * The lowest count is tracked incrementally rather than searched for, so every operation is O(1) on average.
 *
 * @param <K> - the key type.
 * @param <V> - the value type.
 */
public class LFUCache<K, V> extends Cache<K, V>
{
  private static final Logger LOG = LogManager.getLogger(LFUCache.class);

  private final IndexMap<K, CacheEntry<K, V>> mIndex;

  // Use count -> entries with that count.  Only non-empty lists are present.
  private final HashMap<Integer, IntrusiveLinkedList<CacheEntry<K, V>>> mFrequencyBuckets = new HashMap<>();

  // The lowest key in mFrequencyBuckets.  Meaningless while the cache is empty.
  private int mMinimalFrequency;

  // An emptied bucket, kept for re-use by the next bucket to be created.
  private IntrusiveLinkedList<CacheEntry<K, V>> mSpareBucket;

  public LFUCache(int xiCapacity)
  {
    this(xiCapacity, KeyEquivalence.natural());
  }

  /**
   * Create an LFU cache.
   *
   * @param xiCapacity - the maximum number of entries.
   * @param xiEquivalence - the hash and equality function for keys.
   */
  public LFUCache(int xiCapacity, KeyEquivalence<K> xiEquivalence)
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
    promote(lEntry);
    return lEntry.getValue();
  }

  @Override
  public void put(K xiKey, V xiValue)
  {
    Objects.requireNonNull(xiKey, "key");

    // Catch up with any capacity reduction.  Several evictions in a row can empty the lowest bucket without a new
    // entry arriving to reset the minimum, so look for the new minimum after each one.
    while (mIndex.size() > getCapacity())
    {
      evict();
      if (!mFrequencyBuckets.isEmpty() && !mFrequencyBuckets.containsKey(mMinimalFrequency))
      {
        mMinimalFrequency = lowestFrequency();
      }
    }

    if (getCapacity() == 0)
    {
      return;
    }

    CacheEntry<K, V> lEntry = mIndex.get(xiKey);
    if (lEntry != null)
    {
      lEntry.setValue(xiValue);
      promote(lEntry);
      return;
    }

    if (mIndex.size() == getCapacity())
    {
      lEntry = evict();
      lEntry.reset(xiKey, xiValue, 1);
    }
    else
    {
      lEntry = new CacheEntry<>(xiKey, xiValue, 1);
    }

    // A new entry always has the lowest possible count.
    mMinimalFrequency = 1;
    bucket(1).addFirst(lEntry);
    mIndex.put(xiKey, lEntry);
  }

  /**
   * Move an entry from its current bucket to the head of the next one up.
   */
  private void promote(CacheEntry<K, V> xiEntry)
  {
    int lFrequency = xiEntry.getFrequency();
    IntrusiveLinkedList<CacheEntry<K, V>> lBucket = mFrequencyBuckets.get(lFrequency);
    lBucket.remove(xiEntry);

    if (lBucket.isEmpty())
    {
      discardBucket(lFrequency, lBucket);
      if (mMinimalFrequency == lFrequency)
      {
        // The entry was the only one at the lowest count, so the lowest count is now its new count.
        mMinimalFrequency++;
      }
    }

    xiEntry.setFrequency(lFrequency + 1);
    bucket(lFrequency + 1).addFirst(xiEntry);
  }

  /**
   * Evict the entry that reached the lowest count longest ago.  The caller is responsible for mMinimalFrequency
   * afterwards.
   *
   * @return the evicted (unlinked) entry.
   */
  private CacheEntry<K, V> evict()
  {
    IntrusiveLinkedList<CacheEntry<K, V>> lBucket = mFrequencyBuckets.get(mMinimalFrequency);
    assert(lBucket != null) : "No bucket for minimal frequency " + mMinimalFrequency;

    CacheEntry<K, V> lEvicted = lBucket.removeLast();
    if (lBucket.isEmpty())
    {
      discardBucket(mMinimalFrequency, lBucket);
    }

    mIndex.remove(lEvicted.getKey());
    recordEviction();
    LOG.trace("Evicted key {} with use count {}", lEvicted.getKey(), lEvicted.getFrequency());
    return lEvicted;
  }

  /**
   * @return the bucket for the specified count, creating it if necessary.
   */
  private IntrusiveLinkedList<CacheEntry<K, V>> bucket(int xiFrequency)
  {
    IntrusiveLinkedList<CacheEntry<K, V>> lBucket = mFrequencyBuckets.get(xiFrequency);
    if (lBucket == null)
    {
      if (mSpareBucket != null)
      {
        lBucket = mSpareBucket;
        mSpareBucket = null;
      }
      else
      {
        lBucket = new IntrusiveLinkedList<>();
      }
      mFrequencyBuckets.put(xiFrequency, lBucket);
    }
    return lBucket;
  }

  private void discardBucket(int xiFrequency, IntrusiveLinkedList<CacheEntry<K, V>> xiBucket)
  {
    assert(xiBucket.isEmpty());
    mFrequencyBuckets.remove(xiFrequency);
    mSpareBucket = xiBucket;
  }

  /**
   * @return the lowest count with any entries, found by a full search.  Only needed after a capacity reduction.
   */
  private int lowestFrequency()
  {
    int lLowest = Integer.MAX_VALUE;
    for (int lFrequency : mFrequencyBuckets.keySet())
    {
      lLowest = Math.min(lLowest, lFrequency);
    }
    return lLowest;
  }

  /**
   * @return the use count of the specified key, or 0 if it isn't in the cache.  This doesn't count as a use.
   *
   * @param xiKey - the key.
   */
  public int getFrequency(K xiKey)
  {
    CacheEntry<K, V> lEntry = mIndex.get(xiKey);
    return (lEntry == null) ? 0 : lEntry.getFrequency();
  }

  @Override
  public void clear()
  {
    LOG.debug("Clearing {} entries in {} frequency buckets", mIndex.size(), mFrequencyBuckets.size());
    for (IntrusiveLinkedList<CacheEntry<K, V>> lBucket : mFrequencyBuckets.values())
    {
      lBucket.clear();
    }
    mFrequencyBuckets.clear();
    mIndex.clear();
    mMinimalFrequency = 0;
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
