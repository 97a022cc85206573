package org.distgo.base.uct;

import gnu.trove.list.array.TIntArrayList;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.distgo.base.board.Board;
import org.distgo.base.board.BoardSymmetry;
import org.distgo.base.board.Coord;
import org.distgo.base.board.Stone;
import org.distgo.base.uct.TreeNode.TreeNodeAllocator;
import org.distgo.base.uct.pool.CappedPool;

/**
 * A search tree rooted at a virtual pass move.
 *
 * The tree is single-owner: nothing here is synchronised.  Trees that are to be merged must share a node pool so that
 * subtrees can be moved between them without copying.
 *
 * Whole-tree walks use explicit stacks, so tree depth is bounded by the pool rather than by the thread stack.
 */
public class UctTree
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final TreeNodeAllocator ALLOCATOR = new TreeNodeAllocator();

  private final CappedPool<TreeNode>  mNodePool;
  private final int                   mBoardSize;
  private final boolean               mAmafPrior;

  private TreeNode                    mRoot;
  private Stone                       mRootColor;
  private BoardSymmetry               mRootSymmetry;
  private int                         mMaxDepth = 0;

  /**
   * Create a tree for searching a position.
   *
   * @param xiNodePool    - pool from which to allocate nodes.
   * @param xiBoard       - the position.
   * @param xiColorToPlay - the colour to move.  (The virtual root belongs to the other colour.)
   * @param xiAmafPrior   - whether priors seed the AMAF value (otherwise the simulation value).
   */
  public UctTree(CappedPool<TreeNode> xiNodePool, Board xiBoard, Stone xiColorToPlay, boolean xiAmafPrior)
  {
    mNodePool = xiNodePool;
    mBoardSize = xiBoard.getSize();
    mAmafPrior = xiAmafPrior;
    mRootSymmetry = xiBoard.getSymmetry().copy();
    mRootColor = xiColorToPlay.other();
    mRoot = newNode(Coord.PASS, 0);
  }

  // Used by copy().
  private UctTree(UctTree xiOther)
  {
    mNodePool = xiOther.mNodePool;
    mBoardSize = xiOther.mBoardSize;
    mAmafPrior = xiOther.mAmafPrior;
    mRootSymmetry = xiOther.mRootSymmetry.copy();
    mRootColor = xiOther.mRootColor;
    mMaxDepth = xiOther.mMaxDepth;
  }

  private TreeNode newNode(int xiCoord, int xiDepth)
  {
    TreeNode lNode = mNodePool.allocate(ALLOCATOR);
    lNode.mCoord = xiCoord;
    lNode.mDepth = xiDepth;
    if (xiDepth > mMaxDepth)
    {
      mMaxDepth = xiDepth;
    }
    return lNode;
  }

  public TreeNode getRoot()
  {
    assert(mRoot != null) : "Tree has been consumed";
    return mRoot;
  }

  /**
   * @return the colour of the virtual root, i.e. the opponent of the colour whose moves are at depth 1.
   */
  public Stone getRootColor()
  {
    return mRootColor;
  }

  public BoardSymmetry getRootSymmetry()
  {
    return mRootSymmetry;
  }

  public int getMaxDepth()
  {
    return mMaxDepth;
  }

  public int getBoardSize()
  {
    return mBoardSize;
  }

  public boolean isAmafPrior()
  {
    return mAmafPrior;
  }

  public CappedPool<TreeNode> getNodePool()
  {
    return mNodePool;
  }

  /**
   * @return whether this tree has been disposed of, or consumed by a merge.
   */
  public boolean isDisposed()
  {
    return mRoot == null;
  }

  /**
   * @return the node with the specified pool index.
   *
   * @param xiIndex - the index.
   */
  public TreeNode getNode(int xiIndex)
  {
    return mNodePool.get(xiIndex);
  }

  /**
   * @return the parent of a node, or null for the root.
   *
   * @param xiNode - the node.
   */
  public TreeNode getParent(TreeNode xiNode)
  {
    return (xiNode.mParent == TreeNode.NO_PARENT) ? null : mNodePool.get(xiNode.mParent);
  }

  /**
   * @return the n'th child of a node.
   *
   * @param xiNode  - the parent.
   * @param xiIndex - position in the (coordinate-sorted) child list.
   */
  public TreeNode getChild(TreeNode xiNode, int xiIndex)
  {
    return mNodePool.get(xiNode.mChildren.get(xiIndex));
  }

  /**
   * @return the children of a node, in coordinate order.
   *
   * @param xiNode - the parent.
   */
  public List<TreeNode> getChildren(TreeNode xiNode)
  {
    List<TreeNode> lChildren = new ArrayList<>(xiNode.mChildren.size());
    for (int lii = 0; lii < xiNode.mChildren.size(); lii++)
    {
      lChildren.add(mNodePool.get(xiNode.mChildren.get(lii)));
    }
    return lChildren;
  }

  /**
   * @return the child of a node for the specified move, or null if there isn't one.
   *
   * @param xiNode  - the parent.
   * @param xiCoord - the move.
   */
  public TreeNode findChild(TreeNode xiNode, int xiCoord)
  {
    for (int lii = 0; lii < xiNode.mChildren.size(); lii++)
    {
      TreeNode lChild = mNodePool.get(xiNode.mChildren.get(lii));
      if (lChild.mCoord == xiCoord)
      {
        return lChild;
      }
    }
    return null;
  }

  /**
   * Find the child of a node for the specified move, creating it (in coordinate order) if it doesn't yet exist.
   *
   * @param xiNode  - the parent.
   * @param xiCoord - the move.
   *
   * @return the child.
   */
  public TreeNode getOrCreateChild(TreeNode xiNode, int xiCoord)
  {
    int lPos = 0;
    while (lPos < xiNode.mChildren.size())
    {
      TreeNode lChild = mNodePool.get(xiNode.mChildren.get(lPos));
      if (lChild.mCoord == xiCoord)
      {
        return lChild;
      }
      if (lChild.mCoord > xiCoord)
      {
        break;
      }
      lPos++;
    }

    TreeNode lChild = newNode(xiCoord, xiNode.mDepth + 1);
    lChild.mParent = xiNode.getIndex();
    xiNode.mChildren.insert(lPos, lChild.getIndex());
    return lChild;
  }

  /**
   * Expand a leaf: create a child for every legal move in the symmetry playground of the position, plus pass, with its
   * prior preloaded.
   *
   * @param xiNode   - the leaf to expand.
   * @param xiBoard  - the position at the leaf.
   * @param xiColor  - the colour to move at the leaf.
   * @param xiRadar  - if positive, on a non-empty board only consider points with a stone within this distance.
   * @param xiPriors - source of prior estimates (may be null for no priors).
   */
  public void expand(TreeNode xiNode, Board xiBoard, Stone xiColor, int xiRadar, PriorEstimator xiPriors)
  {
    assert(xiNode.isLeaf()) : "Expanding a node which already has children: " + xiNode;
    assert(xiBoard.getSize() == mBoardSize);

    // First, get a map of prior values to initialize the new nodes with.
    PriorMap lMap = new PriorMap(xiBoard, xiColor);
    lMap.setConsidered(Coord.PASS);
    for (int lCoord = 0; lCoord < mBoardSize * mBoardSize; lCoord++)
    {
      if (xiBoard.getStoneAt(lCoord) != Stone.NONE)
      {
        continue;
      }

      // Weeds out huge numbers of crufty moves on large boards.
      if (!xiBoard.isEmpty() && xiRadar > 0 && !xiBoard.hasStoneWithin(lCoord, xiRadar))
      {
        continue;
      }

      if (!xiBoard.isValidMove(xiColor, lCoord))
      {
        continue;
      }
      lMap.setConsidered(lCoord);
    }

    if (xiPriors != null)
    {
      xiPriors.estimate(xiNode, lMap);
    }

    // Now create the nodes.  Pass first, then the playground in raster order, which keeps the list sorted.
    addExpandedChild(xiNode, Coord.PASS, lMap);

    BoardSymmetry lSymmetry = xiBoard.getSymmetry();
    LOGGER.trace("Expanding " + Coord.toString(xiNode.mCoord, mBoardSize) + " within " + lSymmetry);

    for (int lY = lSymmetry.mY1; lY <= lSymmetry.mY2; lY++)
    {
      for (int lX = lSymmetry.mX1; lX <= lSymmetry.mX2; lX++)
      {
        if (!lSymmetry.contains(lX, lY, mBoardSize))
        {
          continue;
        }

        int lCoord = Coord.fromXY(lX, lY, mBoardSize);
        if (!lMap.isConsidered(lCoord))
        {
          continue;
        }
        assert(lCoord != xiNode.mCoord) : "Expanding the move just played: " + lCoord;

        addExpandedChild(xiNode, lCoord, lMap);
      }
    }
  }

  private void addExpandedChild(TreeNode xiParent, int xiCoord, PriorMap xiMap)
  {
    TreeNode lChild = newNode(xiCoord, xiParent.mDepth + 1);
    lChild.mParent = xiParent.getIndex();
    xiParent.mChildren.add(lChild.getIndex());

    lChild.mPrior.copyFrom(xiMap.getPrior(xiCoord));
    if (lChild.mPrior.mPlayouts > 0)
    {
      if (mAmafPrior)
      {
        lChild.updateRaveValue(true);
      }
      else
      {
        lChild.updateValue(false);
      }
    }
  }

  /**
   * Work out which flips take the played move's canonical representative (the one the tree was expanded with) onto
   * the move itself.
   *
   * @return bit 0 = horizontal flip, bit 1 = vertical flip, bit 2 = diagonal transpose.
   */
  private int symmetryFlips(int xiCoord)
  {
    if (!Coord.isOnBoard(xiCoord, mBoardSize))
    {
      return 0;
    }

    BoardSymmetry lSym = mRootSymmetry;
    int lX = Coord.getX(xiCoord, mBoardSize);
    int lY = Coord.getY(xiCoord, mBoardSize);

    //  playground   X->h->v->d normalization
    //  :::..        .d...
    //  .::..        v....
    //  ..:..        .....
    //  .....        h...X
    //  .....        .....
    boolean lFlipHoriz = lX < lSym.mX1 || lX > lSym.mX2;
    boolean lFlipVert = lY < lSym.mY1 || lY > lSym.mY2;

    boolean lFlipDiag = false;
    if (lSym.mDiagonal)
    {
      boolean lDown = (lSym.mType == BoardSymmetry.SymmetryType.DIAG_DOWN);
      int lFoldX = (lDown ^ lFlipHoriz ^ lFlipVert) ? mBoardSize - 1 - lX : lX;
      lFlipDiag = lFlipVert ? (lFoldX < lY) : (lFoldX > lY);

      if (lDown && lFlipDiag)
      {
        // Mirroring in the anti-diagonal is a transpose plus both flips.
        lFlipHoriz = !lFlipHoriz;
        lFlipVert = !lFlipVert;
      }
    }

    return (lFlipHoriz ? 1 : 0) | (lFlipVert ? 2 : 0) | (lFlipDiag ? 4 : 0);
  }

  private int flipCoord(int xiCoord, int xiFlips)
  {
    if (!Coord.isOnBoard(xiCoord, mBoardSize))
    {
      return xiCoord;
    }

    int lX = Coord.getX(xiCoord, mBoardSize);
    int lY = Coord.getY(xiCoord, mBoardSize);
    if ((xiFlips & 4) != 0)
    {
      int lTemp = lX;
      lX = lY;
      lY = lTemp;
    }
    if ((xiFlips & 1) != 0)
    {
      lX = mBoardSize - 1 - lX;
    }
    if ((xiFlips & 2) != 0)
    {
      lY = mBoardSize - 1 - lY;
    }
    return Coord.fromXY(lX, lY, mBoardSize);
  }

  /**
   * Rewrite every coordinate in the tree so that the move actually played becomes the one present in the tree, if the
   * tree was expanded with a symmetric equivalent.  Shape and statistics are untouched.
   *
   * @param xiCoord - the move played.
   */
  public void fixSymmetry(int xiCoord)
  {
    int lFlips = symmetryFlips(xiCoord);
    if (lFlips == 0)
    {
      return;
    }

    LOGGER.debug(Coord.toString(xiCoord, mBoardSize) + " will flip " + lFlips + " -> " +
                 Coord.toString(flipCoord(xiCoord, lFlips), mBoardSize) + ", sym " + mRootSymmetry);

    TIntArrayList lStack = new TIntArrayList();
    lStack.add(mRoot.getIndex());
    while (!lStack.isEmpty())
    {
      TreeNode lNode = mNodePool.get(lStack.removeAt(lStack.size() - 1));
      lNode.mCoord = flipCoord(lNode.mCoord, lFlips);
      for (int lii = 0; lii < lNode.mChildren.size(); lii++)
      {
        lStack.add(lNode.mChildren.get(lii));
      }
    }

    // The flip scrambles sibling order.  Restore it, since merging relies on it.
    lStack.add(mRoot.getIndex());
    while (!lStack.isEmpty())
    {
      TreeNode lNode = mNodePool.get(lStack.removeAt(lStack.size() - 1));
      sortChildren(lNode);
      for (int lii = 0; lii < lNode.mChildren.size(); lii++)
      {
        lStack.add(lNode.mChildren.get(lii));
      }
    }
  }

  private void sortChildren(TreeNode xiNode)
  {
    TIntArrayList lChildren = xiNode.mChildren;
    for (int lii = 1; lii < lChildren.size(); lii++)
    {
      int lIndex = lChildren.get(lii);
      int lCoord = mNodePool.get(lIndex).mCoord;
      int ljj = lii - 1;
      while (ljj >= 0 && mNodePool.get(lChildren.get(ljj)).mCoord > lCoord)
      {
        lChildren.set(ljj + 1, lChildren.get(ljj));
        ljj--;
      }
      lChildren.set(ljj + 1, lIndex);
    }
  }

  /**
   * Advance the root to the child for a move that has been played, discarding the rest of the tree.
   *
   * @param xiCoord - the move played.
   *
   * @return whether the move was found.  If not, the tree is left unchanged and the caller should start afresh.
   */
  public boolean promote(int xiCoord)
  {
    int lFlips = symmetryFlips(xiCoord);

    TreeNode lFound = null;
    for (int lii = 0; lii < mRoot.mChildren.size(); lii++)
    {
      TreeNode lChild = mNodePool.get(mRoot.mChildren.get(lii));
      if (flipCoord(lChild.mCoord, lFlips) == xiCoord)
      {
        lFound = lChild;
        break;
      }
    }

    if (lFound == null)
    {
      return false;
    }

    fixSymmetry(xiCoord);
    promoteNode(lFound);
    return true;
  }

  private void promoteNode(TreeNode xiNode)
  {
    assert(xiNode.mParent == mRoot.getIndex()) : "Promoting a node which isn't a child of the root";

    unlink(xiNode);
    freeSubtree(mRoot);
    mRoot = xiNode;
    mRootColor = mRootColor.other();
    mRootSymmetry.update(mBoardSize, xiNode.mCoord);
  }

  /**
   * Remove a node (and everything under it) from the tree.
   *
   * @param xiNode - the node.  Must not be the root.
   */
  public void deleteNode(TreeNode xiNode)
  {
    assert(xiNode != mRoot) : "Can't delete the root";
    unlink(xiNode);
    freeSubtree(xiNode);
  }

  private void unlink(TreeNode xiNode)
  {
    TreeNode lParent = mNodePool.get(xiNode.mParent);
    boolean lRemoved = lParent.mChildren.remove(xiNode.getIndex());
    assert(lRemoved) : "Node missing from its parent's child list";
    xiNode.mParent = TreeNode.NO_PARENT;
  }

  private void freeSubtree(TreeNode xiNode)
  {
    TIntArrayList lStack = new TIntArrayList();
    lStack.add(xiNode.getIndex());
    while (!lStack.isEmpty())
    {
      int lIndex = lStack.removeAt(lStack.size() - 1);
      TreeNode lNode = mNodePool.get(lIndex);
      for (int lii = 0; lii < lNode.mChildren.size(); lii++)
      {
        lStack.add(lNode.mChildren.get(lii));
      }
      mNodePool.free(lIndex);
    }
  }

  /**
   * Free every node of the tree.  The tree can't be used afterwards.
   */
  public void dispose()
  {
    if (mRoot != null)
    {
      freeSubtree(mRoot);
      mRoot = null;
    }
  }

  /**
   * @return a deep copy of this tree, allocated from the same pool.
   */
  public UctTree copy()
  {
    UctTree lCopy = new UctTree(this);
    lCopy.mRoot = mNodePool.allocate(ALLOCATOR);
    lCopy.mRoot.copyPayload(mRoot);

    // Pairs of (original, copy).
    TIntArrayList lStack = new TIntArrayList();
    lStack.add(mRoot.getIndex());
    lStack.add(lCopy.mRoot.getIndex());
    while (!lStack.isEmpty())
    {
      TreeNode lCopyNode = mNodePool.get(lStack.removeAt(lStack.size() - 1));
      TreeNode lOriginal = mNodePool.get(lStack.removeAt(lStack.size() - 1));

      for (int lii = 0; lii < lOriginal.mChildren.size(); lii++)
      {
        TreeNode lChild = mNodePool.get(lOriginal.mChildren.get(lii));
        TreeNode lChildCopy = mNodePool.allocate(ALLOCATOR);
        lChildCopy.copyPayload(lChild);
        lChildCopy.mParent = lCopyNode.getIndex();
        lCopyNode.mChildren.add(lChildCopy.getIndex());

        lStack.add(lChild.getIndex());
        lStack.add(lChildCopy.getIndex());
      }
    }

    return lCopy;
  }

  /**
   * Merge another tree, grown independently from the same position and the same baseline, into this one.  The
   * statistics each source node gathered since its baseline are added to the matching node here; subtrees only found
   * in the source are moved across.
   *
   * The source tree is consumed.
   *
   * @param xiSource - the tree to merge in.
   */
  public void merge(UctTree xiSource)
  {
    assert(xiSource.mNodePool == mNodePool) : "Can only merge trees from the same pool";
    assert(xiSource != this);

    if (xiSource.mMaxDepth > mMaxDepth)
    {
      mMaxDepth = xiSource.mMaxDepth;
    }

    // Pairs of (destination, source).
    TIntArrayList lStack = new TIntArrayList();
    lStack.add(mRoot.getIndex());
    lStack.add(xiSource.mRoot.getIndex());

    TIntArrayList lMerged = new TIntArrayList();
    TIntArrayList lKept = new TIntArrayList();

    while (!lStack.isEmpty())
    {
      TreeNode lSrc = mNodePool.get(lStack.removeAt(lStack.size() - 1));
      TreeNode lDest = mNodePool.get(lStack.removeAt(lStack.size() - 1));

      assert(lDest.mBaseU.mPlayouts == lSrc.mBaseU.mPlayouts) : "Baseline mismatch (u) merging " + lSrc;
      assert(lDest.mBaseAmaf.mPlayouts == lSrc.mBaseAmaf.mPlayouts) : "Baseline mismatch (amaf) merging " + lSrc;

      // Do not merge nodes that weren't touched at all.
      if (!lSrc.hasDelta())
      {
        continue;
      }

      lDest.mHints |= lSrc.mHints;

      // Zip the two coordinate-sorted child lists.
      lMerged.resetQuick();
      lKept.resetQuick();
      int lDi = 0;
      int lSi = 0;
      while (lDi < lDest.mChildren.size() || lSi < lSrc.mChildren.size())
      {
        TreeNode lDChild = (lDi < lDest.mChildren.size()) ? mNodePool.get(lDest.mChildren.get(lDi)) : null;
        TreeNode lSChild = (lSi < lSrc.mChildren.size()) ? mNodePool.get(lSrc.mChildren.get(lSi)) : null;

        if (lSChild == null || (lDChild != null && lDChild.mCoord < lSChild.mCoord))
        {
          // Source lacks this one.  Leave it be.
          lMerged.add(lDChild.getIndex());
          lDi++;
        }
        else if (lDChild == null || lSChild.mCoord < lDChild.mCoord)
        {
          // Only in the source.  Move it across.
          lSChild.mParent = lDest.getIndex();
          lMerged.add(lSChild.getIndex());
          lSi++;
        }
        else
        {
          // Matching nodes - merge them too.
          lMerged.add(lDChild.getIndex());
          lKept.add(lSChild.getIndex());
          lStack.add(lDChild.getIndex());
          lStack.add(lSChild.getIndex());
          lDi++;
          lSi++;
        }
      }
      lDest.mChildren.resetQuick();
      lDest.mChildren.addAll(lMerged);
      lSrc.mChildren.resetQuick();
      lSrc.mChildren.addAll(lKept);

      // Priors should be constant.
      assert(lDest.mPrior.sameCounts(lSrc.mPrior)) : "Prior mismatch merging " + lSrc;

      lDest.mAmaf.addRaw(lSrc.mAmaf.mPlayouts - lSrc.mBaseAmaf.mPlayouts, lSrc.mAmaf.mWins - lSrc.mBaseAmaf.mWins);
      if (lDest.mAmaf.mPlayouts > 0)
      {
        lDest.updateRaveValue(mAmafPrior);
      }

      lDest.mU.addRaw(lSrc.mU.mPlayouts - lSrc.mBaseU.mPlayouts, lSrc.mU.mWins - lSrc.mBaseU.mWins);
      if (lDest.mU.mPlayouts > 0)
      {
        lDest.updateValue(mAmafPrior);
      }
    }

    xiSource.dispose();
  }

  /**
   * Scale down everything gathered since the baselines by the given factor, then take the result as the new
   * baseline.
   *
   * @param xiFactor - the factor.
   */
  public void normalize(int xiFactor)
  {
    assert(xiFactor > 0);

    TIntArrayList lStack = new TIntArrayList();
    lStack.add(mRoot.getIndex());
    while (!lStack.isEmpty())
    {
      TreeNode lNode = mNodePool.get(lStack.removeAt(lStack.size() - 1));
      for (int lii = 0; lii < lNode.mChildren.size(); lii++)
      {
        lStack.add(lNode.mChildren.get(lii));
      }

      normalize(lNode.mBaseAmaf, lNode.mAmaf, xiFactor);
      normalize(lNode.mBaseU, lNode.mU, xiFactor);
      if (lNode.mAmaf.mPlayouts > 0)
      {
        lNode.updateRaveValue(mAmafPrior);
      }
      if (lNode.mU.mPlayouts > 0)
      {
        lNode.updateValue(mAmafPrior);
      }
      lNode.snapshotBaseline();
    }
  }

  private static void normalize(MoveStats xiBase, MoveStats xbStats, int xiFactor)
  {
    xbStats.mPlayouts = xiBase.mPlayouts + (xbStats.mPlayouts - xiBase.mPlayouts) / xiFactor;
    xbStats.mWins = xiBase.mWins + (xbStats.mWins - xiBase.mWins) / xiFactor;
  }

  /**
   * Take the current statistics of every node as the baseline for future merges.
   */
  public void snapshotBaselines()
  {
    TIntArrayList lStack = new TIntArrayList();
    lStack.add(mRoot.getIndex());
    while (!lStack.isEmpty())
    {
      TreeNode lNode = mNodePool.get(lStack.removeAt(lStack.size() - 1));
      lNode.snapshotBaseline();
      for (int lii = 0; lii < lNode.mChildren.size(); lii++)
      {
        lStack.add(lNode.mChildren.get(lii));
      }
    }
  }

  /**
   * @return the number of nodes in the tree.
   */
  public int countNodes()
  {
    int lCount = 0;
    TIntArrayList lStack = new TIntArrayList();
    lStack.add(mRoot.getIndex());
    while (!lStack.isEmpty())
    {
      TreeNode lNode = mNodePool.get(lStack.removeAt(lStack.size() - 1));
      lCount++;
      for (int lii = 0; lii < lNode.mChildren.size(); lii++)
      {
        lStack.add(lNode.mChildren.get(lii));
      }
    }
    return lCount;
  }

  /**
   * Save the tree as an opening book.
   *
   * @param xiFile      - where to save it.
   * @param xiThreshold - children of nodes with fewer playouts than this aren't saved.
   */
  public void save(File xiFile, long xiThreshold)
  {
    TreeBook.save(this, xiFile, xiThreshold);
  }

  /**
   * Load an opening book into this (fresh) tree.  A missing book is not an error.
   *
   * @param xiFile - the book.
   */
  public void load(File xiFile)
  {
    TreeBook.load(this, xiFile);
  }

  void noteDepth(int xiDepth)
  {
    if (xiDepth > mMaxDepth)
    {
      mMaxDepth = xiDepth;
    }
  }

  TreeNode allocateNode()
  {
    return mNodePool.allocate(ALLOCATOR);
  }

  /**
   * Dump the tree to the log.
   *
   * @param xiThreshold - only show nodes with more playouts than this.
   */
  public void dump(long xiThreshold)
  {
    long lThreshold = xiThreshold;
    if (lThreshold != 0 && mRoot.mU.mPlayouts / lThreshold > 100)
    {
      // Be a bit sensible about this; the opening book can create huge dumps at first.
      lThreshold = mRoot.mU.mPlayouts / 100 * (lThreshold < 1000 ? 1 : lThreshold / 1000);
    }

    // Pairs of (node, indent).
    TIntArrayList lStack = new TIntArrayList();
    lStack.add(mRoot.getIndex());
    lStack.add(0);
    while (!lStack.isEmpty())
    {
      int lIndent = lStack.removeAt(lStack.size() - 1);
      TreeNode lNode = mNodePool.get(lStack.removeAt(lStack.size() - 1));

      StringBuilder lLine = new StringBuilder();
      for (int lii = 0; lii < lIndent; lii++)
      {
        lLine.append(' ');
      }
      lLine.append(describe(lNode));
      LOGGER.info(lLine.toString());

      // Children sorted by playouts, most first.  Pushed in reverse so that they pop in order.
      List<TreeNode> lShown = new ArrayList<>();
      for (int lii = 0; lii < lNode.mChildren.size(); lii++)
      {
        TreeNode lChild = mNodePool.get(lNode.mChildren.get(lii));
        if (lChild.mU.mPlayouts > lThreshold)
        {
          lShown.add(lChild);
        }
      }
      lShown.sort((a, b) -> Long.compare(b.mU.mPlayouts, a.mU.mPlayouts));
      for (int lii = lShown.size() - 1; lii >= 0; lii--)
      {
        lStack.add(lShown.get(lii).getIndex());
        lStack.add(lIndent + 1);
      }
    }
  }

  private String describe(TreeNode xiNode)
  {
    return "[" + Coord.toString(xiNode.mCoord, mBoardSize) + "] " + String.format("%f", xiNode.mU.mValue) +
           " (" + (long)xiNode.mU.mWins + "/" + xiNode.mU.mPlayouts + " playouts [prior " +
           (long)xiNode.mPrior.mWins + "/" + xiNode.mPrior.mPlayouts + " amaf " +
           (long)xiNode.mAmaf.mWins + "/" + xiNode.mAmaf.mPlayouts + "]; hints " +
           Integer.toHexString(xiNode.mHints) + "; " + xiNode.mChildren.size() + " children) <" + xiNode.getId() + ">";
  }
}
