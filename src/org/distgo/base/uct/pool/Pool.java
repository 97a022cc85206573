package org.distgo.base.uct.pool;


/**
 * An arena of items addressed by index.
 *
 * @param <ItemType> - the type of items stored in this pool.
 */
public interface Pool<ItemType>
{
  /**
   * Interface to be implemented by classes capable of allocating (and resetting) objects in a pool.
   *
   * @param <ItemType> the type of item to be allocated.
   */
  public interface ObjectAllocator<ItemType>
  {
    /**
     * @return a newly allocated object.
     *
     * @param xiPoolIndex - index in the pool at which this object will live for its whole life.
     */
    public ItemType newObject(int xiPoolIndex);

    /**
     * Reset an object, ready for re-use.
     *
     * @param xiObject - the object to reset.
     */
    public void resetObject(ItemType xiObject);
  }

  /**
   * Allocate an item from the pool, re-using a freed one where possible.
   *
   * @param xiAllocator - object allocator to use.
   *
   * @return the new item.
   */
  public ItemType allocate(ObjectAllocator<ItemType> xiAllocator);

  /**
   * Return an item to the pool.
   *
   * @param xiIndex - index of the item being freed.
   */
  public void free(int xiIndex);

  /**
   * @return the item at the specified index.
   *
   * @param xiIndex - the index.
   */
  public ItemType get(int xiIndex);

  /**
   * @return the capacity of the pool.
   */
  public int getCapacity();

  /**
   * @return whether the pool is (nearly) full.
   */
  public boolean isFull();

  /**
   * @return the number of items currently in use.
   */
  public int getNumItemsInUse();

  /**
   * @return the percentage of this pool that is in use.
   */
  public int getPoolUsage();
}
