package org.distgo.base.uct.pool;

/**
 * A pool with a fixed maximum size.
 *
 * Items never move: an item keeps its index from first allocation onwards, so the index is a stable handle for as
 * long as the item is in use.  Freed indices go on a LIFO stack and are handed out again before any new item is
 * created.
 *
 * Not thread-safe.
 *
 * @param <ItemType> the type of item to be kept in the pool.
 */
public class CappedPool<ItemType> implements Pool<ItemType>
{
  // Maximum number of items to allocate.
  private final int                                    mPoolSize;

  // Number of free entries required for isFull() to return false
  private final int                                    mFreeThresholdForNonFull;

  // The pool of items.
  private final ItemType[]                             mItems;

  // Indices that are available for re-use, and whether each index is currently in use.
  private final int[]                                  mFreeIndices;
  private final boolean[]                              mInUse;
  private int                                          mNumFreeIndices;

  // Array index of the largest allocated item.  Used to track whether an attempt to allocate a new item should really
  // allocate a new item (if we're not yet at the maximum) or re-use and existing item.  This can never exceed
  // mPoolSize.
  private int                                          mLargestUsedIndex = -1;

  private int                                          mNumItemsInUse = 0;

  /**
   * Create a new pool of the specified maximum size.
   *
   * @param xiPoolSize - the pool size.
   */
  @SuppressWarnings("unchecked")
  public CappedPool(int xiPoolSize)
  {
    mPoolSize    = xiPoolSize;
    mItems       = (ItemType[])(new Object[xiPoolSize]);
    mFreeIndices = new int[xiPoolSize];
    mInUse       = new boolean[xiPoolSize];

    mFreeThresholdForNonFull = Math.max(1, xiPoolSize / 100);  // 1% free
  }

  @Override
  public int getCapacity()
  {
    return mPoolSize;
  }

  @Override
  public int getNumItemsInUse()
  {
    return mNumItemsInUse;
  }

  @Override
  public int getPoolUsage()
  {
    return (int)((long)mNumItemsInUse * 100 / mPoolSize);
  }

  @Override
  public ItemType allocate(ObjectAllocator<ItemType> xiAllocator)
  {
    ItemType lAllocatedItem;
    int lIndex;

    if (mNumFreeIndices != 0)
    {
      lIndex = mFreeIndices[--mNumFreeIndices];
      lAllocatedItem = mItems[lIndex];

      // Reset the item so that it's ready for re-use.
      xiAllocator.resetObject(lAllocatedItem);
    }
    else
    {
      if (mLargestUsedIndex >= mPoolSize - 1)
      {
        throw new IllegalStateException("Pool exhausted (" + mPoolSize + " items)");
      }
      lIndex = ++mLargestUsedIndex;
      lAllocatedItem = xiAllocator.newObject(lIndex);
      mItems[lIndex] = lAllocatedItem;
    }

    mInUse[lIndex] = true;
    mNumItemsInUse++;
    return lAllocatedItem;
  }

  @Override
  public ItemType get(int xiIndex)
  {
    assert(mInUse[xiIndex]) : "Access to free pool item " + xiIndex;
    return mItems[xiIndex];
  }

  @Override
  public void free(int xiIndex)
  {
    assert(mInUse[xiIndex]) : "Double free of pool item " + xiIndex;
    mInUse[xiIndex] = false;
    mNumItemsInUse--;
    mFreeIndices[mNumFreeIndices++] = xiIndex;
  }

  /**
   * @return whether the item at an index is currently allocated.
   *
   * @param xiIndex - the index.
   */
  public boolean isInUse(int xiIndex)
  {
    return xiIndex >= 0 && xiIndex <= mLargestUsedIndex && mInUse[xiIndex];
  }

  @Override
  public boolean isFull()
  {
    return (mNumItemsInUse > mPoolSize - mFreeThresholdForNonFull);
  }
}
