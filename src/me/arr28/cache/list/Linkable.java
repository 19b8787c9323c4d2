package me.arr28.cache.list;

/**
 * Interface for objects that can be held in a (single) {@link IntrusiveLinkedList}.  The links live in the object
 * itself, so the object doubles as a stable position handle into the list.
 *
 * @param <T> - the type of object that can be added to the list.
 */
public interface Linkable<T>
{
  public void setPrev(T xiPrev);
  public T getPrev();
  public void setNext(T xiNext);
  public T getNext();
}
