package org.distgo.base.distributed;

import java.io.File;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.distgo.base.board.Board;
import org.distgo.base.board.BoardSymmetry;
import org.distgo.base.board.Coord;
import org.distgo.base.board.Stone;
import org.distgo.base.uct.MoveStats;
import org.distgo.base.uct.TreeBook;
import org.distgo.base.uct.TreeNode;
import org.distgo.base.uct.UctTree;
import org.distgo.base.uct.pool.CappedPool;

/**
 * The coordinator's own tree.  Each decision's combined worker statistics are folded into the children of the root,
 * and the root follows the moves played.  The tree can be seeded from, and saved to, an opening book.
 */
public class ConsensusBook
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final CappedPool<TreeNode> mPool;
  private final File                 mBookDirectory;
  private final long                 mSaveThreshold;

  private UctTree                    mTree;

  /**
   * @param xiPoolSize      - the most nodes the tree may have.
   * @param xiBookDirectory - where opening books live.
   * @param xiSaveThreshold - only save the children of nodes with at least this many playouts.
   */
  public ConsensusBook(int xiPoolSize, File xiBookDirectory, long xiSaveThreshold)
  {
    mPool = new CappedPool<>(xiPoolSize);
    mBookDirectory = xiBookDirectory;
    mSaveThreshold = xiSaveThreshold;
  }

  /**
   * @return the current tree, or null if there isn't one.
   */
  public UctTree getTree()
  {
    return mTree;
  }

  /**
   * @return the book file for a position's game parameters.
   *
   * @param xiBoard - the position.
   */
  public File getBookFile(Board xiBoard)
  {
    return new File(mBookDirectory, TreeBook.getBookName(xiBoard));
  }

  /**
   * Start a new game: a fresh tree, seeded from the opening book if there is one.
   *
   * @param xiBoard - the (empty) board.
   */
  public void newGame(Board xiBoard)
  {
    Stone lFirst = (xiBoard.getHandicap() > 0) ? Stone.WHITE : Stone.BLACK;
    freshTree(xiBoard, lFirst);
    mTree.load(getBookFile(xiBoard));
  }

  /**
   * Fold a decision's combined statistics into the tree.
   *
   * @param xiBoard - the position the decision was made in.
   * @param xiColor - the colour to move.
   * @param xiTable - the statistics.
   */
  public void recordDecision(Board xiBoard, Stone xiColor, CandidateStatsTable xiTable)
  {
    if (mTree == null || mTree.getRootColor() != xiColor.other() || mTree.getBoardSize() != xiBoard.getSize())
    {
      freshTree(xiBoard, xiColor);
    }

    int lSize = xiBoard.getSize();
    BoardSymmetry lSymmetry = mTree.getRootSymmetry();
    TreeNode lRoot = mTree.getRoot();
    long lTotalPlayouts = 0;
    double lTotalWins = 0;

    for (int lCoord = Coord.PASS; lCoord < lSize * lSize; lCoord++)
    {
      MoveStats lU = xiTable.getU(lCoord);
      if (lU.mPlayouts == 0)
      {
        continue;
      }

      // Symmetric duplicates are only kept in canonical form.
      if (Coord.isOnBoard(lCoord, lSize) &&
          !lSymmetry.contains(Coord.getX(lCoord, lSize), Coord.getY(lCoord, lSize), lSize))
      {
        continue;
      }

      MoveStats lAmaf = xiTable.getAmaf(lCoord);
      TreeNode lChild = mTree.getOrCreateChild(lRoot, lCoord);
      lChild.addResult(lU.mPlayouts, lU.mValue * lU.mPlayouts, mTree.isAmafPrior());
      lChild.addAmafResult(lAmaf.mPlayouts, lAmaf.mValue * lAmaf.mPlayouts, mTree.isAmafPrior());

      lTotalPlayouts += lU.mPlayouts;
      lTotalWins += (1 - lU.mValue) * lU.mPlayouts;
    }

    lRoot.addResult(lTotalPlayouts, lTotalWins, mTree.isAmafPrior());
  }

  /**
   * Follow a move.  If the tree doesn't know the move, it's discarded and a fresh one started at the next decision.
   *
   * @param xiColor - the colour which played.
   * @param xiCoord - the move.
   */
  public void play(Stone xiColor, int xiCoord)
  {
    if (mTree == null)
    {
      return;
    }

    if (mTree.getRootColor() == xiColor || !mTree.promote(xiCoord))
    {
      LOGGER.debug("Move " + xiColor + " " + Coord.toString(xiCoord, mTree.getBoardSize()) +
                   " not in tree - starting afresh");
      mTree.dispose();
      mTree = null;
    }
  }

  /**
   * Save the tree as the opening book for the current game parameters.
   *
   * @param xiBoard - the current position.
   */
  public void save(Board xiBoard)
  {
    if (mTree == null)
    {
      LOGGER.warn("No tree to save");
      return;
    }
    if (xiBoard.getMoveCount() != 0)
    {
      LOGGER.warn("Not saving opening book from move " + xiBoard.getMoveCount() + " - books start at move 0");
      return;
    }
    mTree.save(getBookFile(xiBoard), mSaveThreshold);
  }

  /**
   * Dump the tree to the log.
   *
   * @param xiThreshold - only show nodes with more playouts than this.
   */
  public void dump(long xiThreshold)
  {
    if (mTree == null)
    {
      LOGGER.info("(no tree)");
      return;
    }
    mTree.dump(xiThreshold);
  }

  /**
   * Release the tree.
   */
  public void dispose()
  {
    if (mTree != null)
    {
      mTree.dispose();
      mTree = null;
    }
  }

  private void freshTree(Board xiBoard, Stone xiColorToPlay)
  {
    dispose();
    mTree = new UctTree(mPool, xiBoard, xiColorToPlay, false);
  }
}
