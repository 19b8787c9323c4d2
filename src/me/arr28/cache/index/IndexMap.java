package me.arr28.cache.index;

import java.util.HashMap;
import java.util.Objects;

/**
 * Map from cache key to the node that holds the key.
 *
 * With the natural key equivalence the keys are stored directly.  Otherwise each key is wrapped in a holder whose
 * hashCode() and equals() delegate to the supplied equivalence.
 *
 * @param <K> - the key type.
 * @param <N> - the node type.
 */
public class IndexMap<K, N>
{
  // Upper bound on the initial table size, so that a cache with a huge capacity doesn't allocate a huge table up-front.
  private static final int MAX_INITIAL_CAPACITY = 1 << 10;

  private final KeyEquivalence<K> mEquivalence;
  private final boolean mNatural;
  private final HashMap<Object, N> mMap;

  public IndexMap(KeyEquivalence<K> xiEquivalence, int xiSizeHint)
  {
    mEquivalence = Objects.requireNonNull(xiEquivalence, "equivalence");
    mNatural = (xiEquivalence == KeyEquivalence.<K>natural());
    mMap = new HashMap<>(Math.min(xiSizeHint, MAX_INITIAL_CAPACITY));
  }

  public N get(K xiKey)
  {
    return mMap.get(wrap(xiKey));
  }

  public boolean containsKey(K xiKey)
  {
    return mMap.containsKey(wrap(xiKey));
  }

  public void put(K xiKey, N xiNode)
  {
    mMap.put(wrap(xiKey), xiNode);
  }

  public N remove(K xiKey)
  {
    return mMap.remove(wrap(xiKey));
  }

  public int size()
  {
    return mMap.size();
  }

  public void clear()
  {
    mMap.clear();
  }

  public KeyEquivalence<K> getEquivalence()
  {
    return mEquivalence;
  }

  private Object wrap(K xiKey)
  {
    Objects.requireNonNull(xiKey, "key");
    return mNatural ? xiKey : new EquivalentKey<>(xiKey, mEquivalence);
  }

  /**
   * Key holder that hashes and compares using a supplied equivalence.
   */
  private static final class EquivalentKey<K>
  {
    private final K mKey;
    private final KeyEquivalence<K> mEquivalence;
    private final int mHash;

    EquivalentKey(K xiKey, KeyEquivalence<K> xiEquivalence)
    {
      mKey = xiKey;
      mEquivalence = xiEquivalence;
      mHash = xiEquivalence.hash(xiKey);
    }

    @Override
    public int hashCode()
    {
      return mHash;
    }

    @Override
    public boolean equals(Object xiOther)
    {
      if (this == xiOther)
      {
        return true;
      }
      if (!(xiOther instanceof EquivalentKey))
      {
        return false;
      }

      @SuppressWarnings("unchecked")
      EquivalentKey<K> lOther = (EquivalentKey<K>)xiOther;
      return mHash == lOther.mHash && mEquivalence.equivalent(mKey, lOther.mKey);
    }

    @Override
    public String toString()
    {
      return String.valueOf(mKey);
    }
  }
}
