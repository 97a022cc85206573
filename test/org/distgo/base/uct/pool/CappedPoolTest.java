package org.distgo.base.uct.pool;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.distgo.base.uct.pool.Pool.ObjectAllocator;
import org.junit.Test;

public class CappedPoolTest
{
  private static class Item
  {
    final int mIndex;
    int       mValue;

    Item(int xiIndex)
    {
      mIndex = xiIndex;
    }
  }

  private static class ItemAllocator implements ObjectAllocator<Item>
  {
    int mResets = 0;

    @Override
    public Item newObject(int xiPoolIndex)
    {
      return new Item(xiPoolIndex);
    }

    @Override
    public void resetObject(Item xiItem)
    {
      mResets++;
      xiItem.mValue = 0;
    }
  }

  @Test
  public void testAllocateAndFree()
  {
    ItemAllocator lAllocator = new ItemAllocator();
    CappedPool<Item> lPool = new CappedPool<>(3);

    Item lFirst = lPool.allocate(lAllocator);
    Item lSecond = lPool.allocate(lAllocator);
    assertEquals(0, lFirst.mIndex);
    assertEquals(1, lSecond.mIndex);
    assertSame(lSecond, lPool.get(1));
    assertEquals(2, lPool.getNumItemsInUse());
    assertTrue(lPool.isInUse(0));
    assertFalse(lPool.isInUse(2));

    lSecond.mValue = 42;
    lPool.free(1);
    assertFalse(lPool.isInUse(1));
    assertEquals(1, lPool.getNumItemsInUse());

    // Freed items are re-used (and reset) before new ones are created.
    Item lReused = lPool.allocate(lAllocator);
    assertSame(lSecond, lReused);
    assertEquals(0, lReused.mValue);
    assertEquals(1, lAllocator.mResets);
  }

  @Test
  public void testExhaustion()
  {
    ItemAllocator lAllocator = new ItemAllocator();
    CappedPool<Item> lPool = new CappedPool<>(3);
    lPool.allocate(lAllocator);
    lPool.allocate(lAllocator);
    assertFalse(lPool.isFull());
    lPool.allocate(lAllocator);
    assertTrue(lPool.isFull());
    assertEquals(100, lPool.getPoolUsage());

    try
    {
      lPool.allocate(lAllocator);
      fail("Allocated from an exhausted pool");
    }
    catch (IllegalStateException lEx)
    {
      // Expected.
    }

    lPool.free(0);
    assertEquals(0, lPool.allocate(lAllocator).mIndex);
  }
}
