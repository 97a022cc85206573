package org.distgo.base.uct;

import gnu.trove.list.array.TIntArrayList;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.Locale;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.distgo.base.board.Board;

/**
 * Opening book persistence for search trees.
 *
 * A book is a pre-order dump of the tree.  Each node is a presence byte (1) followed by its payload, then its children,
 * then a terminating 0 byte.  One further 0 byte follows the root.
 */
public final class TreeBook
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Statistics loaded from a book are clamped to this many playouts.
   */
  public static final long MAX_PLAYOUTS = 10000000;

  private TreeBook()
  {
    // Utility class.
  }

  /**
   * @return the book file name for a position's game parameters.
   *
   * @param xiBoard - the position.
   */
  public static String getBookName(Board xiBoard)
  {
    String lHandicap = (xiBoard.getHandicap() > 0) ? ("-h" + xiBoard.getHandicap()) : "";
    return String.format(Locale.US,
                         "uctbook-%d-%02.1f%s.pachitree",
                         xiBoard.getSize(),
                         xiBoard.getKomi(),
                         lHandicap);
  }

  /**
   * Save a tree.  Failures are logged and otherwise ignored.
   *
   * @param xiTree      - the tree.
   * @param xiFile      - the book file.
   * @param xiThreshold - only save the children of nodes with at least this many playouts.
   */
  static void save(UctTree xiTree, File xiFile, long xiThreshold)
  {
    LOGGER.info("Saving " + xiFile + "...");
    int lSaved = 0;

    try (DataOutputStream lOut = new DataOutputStream(new BufferedOutputStream(new FileOutputStream(xiFile))))
    {
      // Each stack entry is a node index, or the complement of one for "close this node's child list".
      TIntArrayList lStack = new TIntArrayList();
      lStack.add(xiTree.getRoot().getIndex());
      while (!lStack.isEmpty())
      {
        int lEntry = lStack.removeAt(lStack.size() - 1);
        if (lEntry < 0)
        {
          lOut.writeByte(0);
          continue;
        }

        TreeNode lNode = xiTree.getNode(lEntry);
        lOut.writeByte(1);
        writePayload(lOut, lNode);
        lSaved++;

        lStack.add(~lEntry);
        if (lNode.mU.mPlayouts >= xiThreshold)
        {
          for (int lii = lNode.mChildren.size() - 1; lii >= 0; lii--)
          {
            lStack.add(lNode.mChildren.get(lii));
          }
        }
      }
      lOut.writeByte(0);
    }
    catch (IOException lEx)
    {
      LOGGER.error("Failed to save opening book " + xiFile, lEx);
      return;
    }

    LOGGER.info("Saved " + lSaved + " nodes to " + xiFile);
  }

  /**
   * Load a book into a fresh tree.  A missing book leaves the tree unchanged.  A corrupt book leaves it empty.
   *
   * @param xiTree - the tree.  Its root must not have been expanded.
   * @param xiFile - the book file.
   */
  static void load(UctTree xiTree, File xiFile)
  {
    if (!xiFile.exists())
    {
      LOGGER.debug("No opening book " + xiFile);
      return;
    }

    TreeNode lRoot = xiTree.getRoot();
    assert(lRoot.isLeaf()) : "Loading a book into a tree which has already been expanded";
    int lRootCoord = lRoot.mCoord;
    int lRootDepth = lRoot.mDepth;

    LOGGER.info("Loading " + xiFile + "...");
    int lLoaded = 0;

    try (DataInputStream lIn = new DataInputStream(new BufferedInputStream(new FileInputStream(xiFile))))
    {
      if (lIn.readByte() == 0)
      {
        return;
      }
      readPayload(lIn, lRoot, xiTree.isAmafPrior());
      lLoaded++;

      TIntArrayList lStack = new TIntArrayList();
      lStack.add(lRoot.getIndex());
      while (!lStack.isEmpty())
      {
        if (lIn.readByte() == 0)
        {
          lStack.removeAt(lStack.size() - 1);
          continue;
        }

        TreeNode lParent = xiTree.getNode(lStack.get(lStack.size() - 1));
        TreeNode lNode = xiTree.allocateNode();
        lNode.mParent = lParent.getIndex();
        lParent.mChildren.add(lNode.getIndex());
        readPayload(lIn, lNode, xiTree.isAmafPrior());
        xiTree.noteDepth(lNode.mDepth);
        lLoaded++;

        lStack.add(lNode.getIndex());
      }
    }
    catch (IOException lEx)
    {
      LOGGER.error("Failed to load opening book " + xiFile + " - starting with an empty tree", lEx);
      clear(xiTree);
      lRoot.mCoord = lRootCoord;
      lRoot.mDepth = lRootDepth;
      return;
    }

    LOGGER.info("Loaded " + lLoaded + " nodes from " + xiFile);
  }

  private static void clear(UctTree xiTree)
  {
    TreeNode lRoot = xiTree.getRoot();
    while (!lRoot.isLeaf())
    {
      xiTree.deleteNode(xiTree.getChild(lRoot, 0));
    }
    lRoot.mHints = 0;
    lRoot.mU.reset();
    lRoot.mAmaf.reset();
    lRoot.mPrior.reset();
    lRoot.snapshotBaseline();
  }

  private static void writePayload(DataOutputStream xiOut, TreeNode xiNode) throws IOException
  {
    xiOut.writeInt(xiNode.mCoord);
    xiOut.writeInt(xiNode.mDepth);
    xiOut.writeInt(xiNode.mHints);
    writeStats(xiOut, xiNode.mU);
    writeStats(xiOut, xiNode.mAmaf);
    writeStats(xiOut, xiNode.mPrior);
  }

  private static void writeStats(DataOutputStream xiOut, MoveStats xiStats) throws IOException
  {
    xiOut.writeLong(xiStats.mPlayouts);
    xiOut.writeDouble(xiStats.mWins);
  }

  private static void readPayload(DataInputStream xiIn, TreeNode xbNode, boolean xiAmafPrior) throws IOException
  {
    xbNode.mCoord = xiIn.readInt();
    xbNode.mDepth = xiIn.readInt();
    xbNode.mHints = xiIn.readInt();
    readStats(xiIn, xbNode.mU);
    readStats(xiIn, xbNode.mAmaf);
    readStats(xiIn, xbNode.mPrior);

    clamp(xbNode.mU);
    clamp(xbNode.mAmaf);

    xbNode.updateValue(xiAmafPrior);
    xbNode.updateRaveValue(xiAmafPrior);
    xbNode.snapshotBaseline();
  }

  private static void readStats(DataInputStream xiIn, MoveStats xbStats) throws IOException
  {
    xbStats.mPlayouts = xiIn.readLong();
    xbStats.mWins = xiIn.readDouble();
  }

  /**
   * Scale down statistics with too many playouts, preserving their mean.
   */
  private static void clamp(MoveStats xbStats)
  {
    if (xbStats.mPlayouts > MAX_PLAYOUTS)
    {
      long lOver = xbStats.mPlayouts - MAX_PLAYOUTS;
      xbStats.mWins -= (xbStats.mWins / xbStats.mPlayouts) * lOver;
      xbStats.mPlayouts = MAX_PLAYOUTS;
    }
  }
}
