package org.distgo.base.uct;

import gnu.trove.list.array.TIntArrayList;

import org.distgo.base.board.Coord;
import org.distgo.base.uct.pool.Pool.ObjectAllocator;

/**
 * A node in the search tree.
 *
 * Nodes live in a {@link org.distgo.base.uct.pool.CappedPool} and refer to each other by pool index.  A node owns the
 * nodes in its child list; the parent index is a back-reference only.  The child list is kept sorted by coordinate.
 */
public class TreeNode
{
  /**
   * Parent index of a root node.
   */
  public static final int NO_PARENT = -1;

  /**
   * Hint: don't blend AMAF statistics into the value of this node.
   */
  public static final int HINT_NOAMAF = 0x1;

  /**
   * Utility class for allocating tree nodes from a pool.
   */
  public static class TreeNodeAllocator implements ObjectAllocator<TreeNode>
  {
    @Override
    public TreeNode newObject(int xiPoolIndex)
    {
      return new TreeNode(xiPoolIndex);
    }

    @Override
    public void resetObject(TreeNode xiNode)
    {
      xiNode.reset();
    }
  }

  // Index in the pool.  Fixed for the lifetime of the object.  The sequence number is bumped on every re-use so that
  // the diagnostic id is unique.
  private final int                     mIndex;
  private int                           mSequence       = 0;

  int                                   mCoord          = Coord.PASS;
  int                                   mDepth          = 0;
  int                                   mHints          = 0;
  int                                   mParent         = NO_PARENT;
  final TIntArrayList                   mChildren       = new TIntArrayList(0);

  final MoveStats                       mU              = new MoveStats();
  final MoveStats                       mAmaf           = new MoveStats();
  final MoveStats                       mPrior          = new MoveStats();

  // Baselines: the values of mU and mAmaf at the last synchronisation point.
  final MoveStats                       mBaseU          = new MoveStats();
  final MoveStats                       mBaseAmaf       = new MoveStats();

  TreeNode(int xiPoolIndex)
  {
    mIndex = xiPoolIndex;
  }

  void reset()
  {
    mSequence++;
    mCoord = Coord.PASS;
    mDepth = 0;
    mHints = 0;
    mParent = NO_PARENT;
    mChildren.resetQuick();
    mU.reset();
    mAmaf.reset();
    mPrior.reset();
    mBaseU.reset();
    mBaseAmaf.reset();
  }

  /**
   * @return the index of this node in its pool.
   */
  public int getIndex()
  {
    return mIndex;
  }

  /**
   * @return an opaque id for diagnostics.  Unique across re-use of the underlying pool slot.
   */
  public long getId()
  {
    return ((long)mSequence << 32) | mIndex;
  }

  public int getCoord()
  {
    return mCoord;
  }

  public int getDepth()
  {
    return mDepth;
  }

  public int getHints()
  {
    return mHints;
  }

  public void addHints(int xiHints)
  {
    mHints |= xiHints;
  }

  /**
   * @return the pool index of the parent, or NO_PARENT for a root.
   */
  public int getParentIndex()
  {
    return mParent;
  }

  public int getNumChildren()
  {
    return mChildren.size();
  }

  /**
   * @return whether this node has been expanded.
   */
  public boolean isLeaf()
  {
    return mChildren.isEmpty();
  }

  /**
   * @return the simulation statistics.
   */
  public MoveStats getU()
  {
    return mU;
  }

  /**
   * @return the all-moves-as-first statistics.
   */
  public MoveStats getAmaf()
  {
    return mAmaf;
  }

  /**
   * @return the prior.  Must not be modified once the node has been created.
   */
  public MoveStats getPrior()
  {
    return mPrior;
  }

  public MoveStats getBaseU()
  {
    return mBaseU;
  }

  public MoveStats getBaseAmaf()
  {
    return mBaseAmaf;
  }

  /**
   * @return whether this node has collected any simulations or AMAF updates since its baseline.
   */
  public boolean hasDelta()
  {
    return (mU.mPlayouts != mBaseU.mPlayouts) || (mAmaf.mPlayouts != mBaseAmaf.mPlayouts);
  }

  /**
   * Record a batch of results against this node.
   *
   * @param xiPlayouts - number of playouts.
   * @param xiWins     - total result of those playouts.
   * @param xiAmafPrior - whether AMAF is blended into the value.
   */
  public void addResult(long xiPlayouts, double xiWins, boolean xiAmafPrior)
  {
    mU.addRaw(xiPlayouts, xiWins);
    updateValue(xiAmafPrior);
  }

  /**
   * Record a batch of AMAF results against this node.
   *
   * @param xiPlayouts - number of playouts.
   * @param xiWins     - total result of those playouts.
   * @param xiAmafPrior - whether the prior is blended into the AMAF value.
   */
  public void addAmafResult(long xiPlayouts, double xiWins, boolean xiAmafPrior)
  {
    mAmaf.addRaw(xiPlayouts, xiWins);
    updateRaveValue(xiAmafPrior);
  }

  /**
   * Recompute the cached value of the simulation statistics, blending in the prior (and AMAF if requested).
   *
   * @param xiAddAmaf - whether to blend in AMAF.
   */
  void updateValue(boolean xiAddAmaf)
  {
    boolean lAmaf = xiAddAmaf && ((mHints & HINT_NOAMAF) == 0);

    long lPlayouts = mU.mPlayouts + mPrior.mPlayouts + (lAmaf ? mAmaf.mPlayouts : 0);
    double lWins = mU.mWins + mPrior.mWins + (lAmaf ? mAmaf.mWins : 0);
    mU.mValue = (lPlayouts == 0) ? 0 : lWins / lPlayouts;
  }

  /**
   * Recompute the cached value of the AMAF statistics, blending in the prior if requested.
   *
   * @param xiAddPrior - whether to blend in the prior.
   */
  void updateRaveValue(boolean xiAddPrior)
  {
    long lPlayouts = mAmaf.mPlayouts + (xiAddPrior ? mPrior.mPlayouts : 0);
    double lWins = mAmaf.mWins + (xiAddPrior ? mPrior.mWins : 0);
    mAmaf.mValue = (lPlayouts == 0) ? 0 : lWins / lPlayouts;
  }

  /**
   * Take the current statistics as the new baseline.
   */
  void snapshotBaseline()
  {
    mBaseU.copyFrom(mU);
    mBaseAmaf.copyFrom(mAmaf);
  }

  /**
   * Copy the payload (everything but the tree linkage) of another node into this one.
   */
  void copyPayload(TreeNode xiOther)
  {
    mCoord = xiOther.mCoord;
    mDepth = xiOther.mDepth;
    mHints = xiOther.mHints;
    mU.copyFrom(xiOther.mU);
    mAmaf.copyFrom(xiOther.mAmaf);
    mPrior.copyFrom(xiOther.mPrior);
    mBaseU.copyFrom(xiOther.mBaseU);
    mBaseAmaf.copyFrom(xiOther.mBaseAmaf);
  }

  @Override
  public String toString()
  {
    return "Node " + getId() + " coord " + mCoord + " depth " + mDepth + " u " + mU + " amaf " + mAmaf;
  }
}
