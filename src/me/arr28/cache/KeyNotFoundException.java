package me.arr28.cache;

/**
 * Thrown by {@link Cache#get(Object)} when the key isn't in the cache.  This is the normal miss signal: callers that
 * would rather not catch it can check {@link Cache#containsKey(Object)} first.
 */
public class KeyNotFoundException extends RuntimeException
{
  private static final long serialVersionUID = 1L;

  private final transient Object mKey;

  public KeyNotFoundException(Object xiKey)
  {
    super("Key is not found: " + xiKey);
    mKey = xiKey;
  }

  /**
   * @return the key that was looked up.
   */
  public Object getKey()
  {
    return mKey;
  }
}
