package me.arr28.cache.index;

/**
 * A hash and equality function for cache keys, supplied by whoever creates the cache.
 *
 * Implementations must be consistent: keys that are equivalent must have the same hash.
 *
 * @param <K> - the key type.
 */
public interface KeyEquivalence<K>
{
  /**
   * @return the hash of the specified key.
   *
   * @param xiKey - the key, never null.
   */
  public int hash(K xiKey);

  /**
   * @return whether the two keys identify the same cache entry.
   *
   * @param xiA - a key, never null.
   * @param xiB - another key, never null.
   */
  public boolean equivalent(K xiA, K xiB);

  /**
   * @return the equivalence given by the key's own hashCode() and equals().
   *
   * @param <K> - the key type.
   */
  @SuppressWarnings("unchecked")
  public static <K> KeyEquivalence<K> natural()
  {
    return (KeyEquivalence<K>)Natural.INSTANCE;
  }

  /**
   * The key's own hashCode() and equals().
   */
  static final class Natural implements KeyEquivalence<Object>
  {
    static final Natural INSTANCE = new Natural();

    private Natural()
    {
      // Singleton.
    }

    @Override
    public int hash(Object xiKey)
    {
      return xiKey.hashCode();
    }

    @Override
    public boolean equivalent(Object xiA, Object xiB)
    {
      return xiA.equals(xiB);
    }

    @Override
    public String toString()
    {
      return "natural";
    }
  }
}
