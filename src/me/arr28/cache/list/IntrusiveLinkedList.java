package me.arr28.cache.list;

/**
 * A doubly-linked list whose links are stored in the items themselves.
 *
 * Adding or removing an item never allocates and never disturbs any other item, so a reference to an item remains a
 * valid position in the list until that item is removed.
 *
 * @param <T> - the type of item held in the list.
 */
public class IntrusiveLinkedList<T extends Linkable<T>>
{
  private T mHead;
  private T mTail;
  private int mSize;

  /**
   * Add an item at the head of the list.
   *
   * @param xiItem - the item, which must not currently be in any list.
   */
  public void addFirst(T xiItem)
  {
    assert(xiItem.getPrev() == null);
    assert(xiItem.getNext() == null);

    mSize++;

    if (mHead == null)
    {
      // No items in the list.
      assert(mTail == null);
      mHead = xiItem;
      mTail = xiItem;
    }
    else
    {
      mHead.setPrev(xiItem);
      xiItem.setNext(mHead);
      mHead = xiItem;
    }
  }

  /**
   * Add an item at the tail of the list.
   *
   * @param xiItem - the item, which must not currently be in any list.
   */
  public void addLast(T xiItem)
  {
    assert(xiItem.getPrev() == null);
    assert(xiItem.getNext() == null);

    mSize++;

    if (mTail == null)
    {
      // No items in the list.
      assert(mHead == null);
      mHead = xiItem;
      mTail = xiItem;
    }
    else
    {
      mTail.setNext(xiItem);
      xiItem.setPrev(mTail);
      mTail = xiItem;
    }
  }

  /**
   * Remove an item from anywhere in the list.
   *
   * @param xiItem - the item, which must be in this list.
   */
  public void remove(T xiItem)
  {
    T lPrev = xiItem.getPrev();
    T lNext = xiItem.getNext();

    assert(mSize > 0);
    mSize--;

    if (lPrev == null)
    {
      // Item was at the head of the list
      assert(mHead == xiItem);
      mHead = lNext;
    }
    else
    {
      lPrev.setNext(lNext);
    }

    if (lNext == null)
    {
      // Item was at the tail of the list
      assert(mTail == xiItem);
      mTail = lPrev;
    }
    else
    {
      lNext.setPrev(lPrev);
    }

    xiItem.setPrev(null);
    xiItem.setNext(null);
  }

  /**
   * Move an item that is already in the list to the head.
   */
  public void moveToFirst(T xiItem)
  {
    if (xiItem != mHead)
    {
      remove(xiItem);
      addFirst(xiItem);
    }
  }

  /**
   * @return the item at the head of the list, removed from the list, or null if the list is empty.
   */
  public T removeFirst()
  {
    T lFirst = mHead;
    if (lFirst != null)
    {
      remove(lFirst);
    }
    return lFirst;
  }

  /**
   * @return the item at the tail of the list, removed from the list, or null if the list is empty.
   */
  public T removeLast()
  {
    T lLast = mTail;
    if (lLast != null)
    {
      remove(lLast);
    }
    return lLast;
  }

  public T getFirst()
  {
    return mHead;
  }

  public T getLast()
  {
    return mTail;
  }

  /**
   * Unlink every item.  Items are unlinked individually so that none keeps stale references into the list.
   */
  public void clear()
  {
    T lItem = mHead;
    while (lItem != null)
    {
      T lNext = lItem.getNext();
      lItem.setPrev(null);
      lItem.setNext(null);
      lItem = lNext;
    }

    mHead = null;
    mTail = null;
    mSize = 0;
  }

  public boolean isEmpty()
  {
    return mSize == 0;
  }

  public int size()
  {
    return mSize;
  }
}
