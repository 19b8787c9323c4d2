package me.arr28.cache.list;

/**
 * A key-value entry held by a cache.  The entry is its own node in the cache's ordered list, so the index map can
 * point straight at it.
 *
 * @param <K> - the key type.
 * @param <V> - the value type.
 */
public class CacheEntry<K, V> implements Linkable<CacheEntry<K, V>>
{
  private K mKey;
  private V mValue;

  // Access count.  Only maintained by the LFU cache, where it always matches the frequency bucket holding the entry.
  private int mFrequency;

  private CacheEntry<K, V> mPrev;
  private CacheEntry<K, V> mNext;

  public CacheEntry(K xiKey, V xiValue, int xiFrequency)
  {
    mKey = xiKey;
    mValue = xiValue;
    mFrequency = xiFrequency;
  }

  /**
   * Re-initialise an unlinked entry for a different key, so that an evicted entry can be re-used for the insertion
   * that caused the eviction.
   */
  public void reset(K xiKey, V xiValue, int xiFrequency)
  {
    assert(mPrev == null && mNext == null) : "Can't reset an entry that is still linked";
    mKey = xiKey;
    mValue = xiValue;
    mFrequency = xiFrequency;
  }

  public K getKey()
  {
    return mKey;
  }

  public V getValue()
  {
    return mValue;
  }

  public void setValue(V xiValue)
  {
    mValue = xiValue;
  }

  public int getFrequency()
  {
    return mFrequency;
  }

  public void setFrequency(int xiFrequency)
  {
    mFrequency = xiFrequency;
  }

  @Override
  public void setPrev(CacheEntry<K, V> xiPrev)
  {
    mPrev = xiPrev;
  }

  @Override
  public CacheEntry<K, V> getPrev()
  {
    return mPrev;
  }

  @Override
  public void setNext(CacheEntry<K, V> xiNext)
  {
    mNext = xiNext;
  }

  @Override
  public CacheEntry<K, V> getNext()
  {
    return mNext;
  }

  @Override
  public String toString()
  {
    return mKey + "=" + mValue + " (freq " + mFrequency + ")";
  }
}
