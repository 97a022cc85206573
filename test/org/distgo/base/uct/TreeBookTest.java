package org.distgo.base.uct;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.nio.file.Files;

import org.distgo.base.board.Coord;
import org.distgo.base.board.SimpleBoard;
import org.distgo.base.board.Stone;
import org.distgo.base.uct.pool.CappedPool;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TreeBookTest
{
  private static final double EPSILON = 1e-9;

  @Rule
  public TemporaryFolder       mFolder = new TemporaryFolder();

  private CappedPool<TreeNode> mPool;
  private SimpleBoard          mBoard;

  @Before
  public void setUp()
  {
    mPool = new CappedPool<>(1000);
    mBoard = new SimpleBoard(9);
  }

  private static int at(int xiX, int xiY)
  {
    return Coord.fromXY(xiX, xiY, 9);
  }

  private UctTree newTree()
  {
    return new UctTree(mPool, mBoard, Stone.BLACK, false);
  }

  @Test
  public void testBookName()
  {
    mBoard.setKomi(7.5);
    assertEquals("uctbook-9-7.5.pachitree", TreeBook.getBookName(mBoard));

    mBoard.setHandicap(2);
    mBoard.setKomi(0.5);
    assertEquals("uctbook-9-0.5-h2.pachitree", TreeBook.getBookName(mBoard));

    SimpleBoard lBig = new SimpleBoard(19);
    assertEquals("uctbook-19-0.0.pachitree", TreeBook.getBookName(lBig));
  }

  @Test
  public void testSaveAndLoad() throws IOException
  {
    UctTree lTree = newTree();
    TreeNode lRoot = lTree.getRoot();
    lRoot.addResult(100, 40, false);
    TreeNode lF6 = lTree.getOrCreateChild(lRoot, at(5, 5));
    lF6.addResult(60, 36, false);
    lF6.addAmafResult(20, 5, false);
    lTree.getOrCreateChild(lRoot, at(4, 4)).addResult(40, 10, false);
    lTree.getOrCreateChild(lF6, at(3, 5)).addResult(30, 12, false);

    File lFile = new File(mFolder.getRoot(), "book.pachitree");
    lTree.save(lFile, 0);
    assertTrue(lFile.exists());

    UctTree lLoaded = newTree();
    lLoaded.load(lFile);
    assertEquals(4, lLoaded.countNodes());
    assertEquals(2, lLoaded.getMaxDepth());

    TreeNode lLoadedRoot = lLoaded.getRoot();
    assertEquals(100, lLoadedRoot.getU().mPlayouts);
    assertEquals(2, lLoadedRoot.getNumChildren());
    assertEquals(at(4, 4), lLoaded.getChild(lLoadedRoot, 0).getCoord());

    TreeNode lLoadedF6 = lLoaded.findChild(lLoadedRoot, at(5, 5));
    assertNotNull(lLoadedF6);
    assertEquals(60, lLoadedF6.getU().mPlayouts);
    assertEquals(0.6, lLoadedF6.getU().mValue, EPSILON);
    assertEquals(20, lLoadedF6.getAmaf().mPlayouts);
    assertEquals(0.25, lLoadedF6.getAmaf().mValue, EPSILON);
    assertEquals(1, lLoadedF6.getDepth());

    // Loaded statistics are the baseline.
    assertEquals(60, lLoadedF6.getBaseU().mPlayouts);

    TreeNode lGrandchild = lLoaded.findChild(lLoadedF6, at(3, 5));
    assertEquals(30, lGrandchild.getU().mPlayouts);
    assertEquals(2, lGrandchild.getDepth());
  }

  @Test
  public void testSaveThreshold()
  {
    UctTree lTree = newTree();
    TreeNode lRoot = lTree.getRoot();
    lRoot.addResult(100, 50, false);
    TreeNode lWeak = lTree.getOrCreateChild(lRoot, at(5, 5));
    lWeak.addResult(5, 2, false);
    lTree.getOrCreateChild(lWeak, at(6, 6)).addResult(3, 1, false);

    File lFile = new File(mFolder.getRoot(), "book.pachitree");
    lTree.save(lFile, 10);

    UctTree lLoaded = newTree();
    lLoaded.load(lFile);

    // The weak node is kept, but not its children.
    assertEquals(2, lLoaded.countNodes());
    assertTrue(lLoaded.findChild(lLoaded.getRoot(), at(5, 5)).isLeaf());
  }

  @Test
  public void testLoadClampsPlayouts()
  {
    UctTree lTree = newTree();
    TreeNode lChild = lTree.getOrCreateChild(lTree.getRoot(), at(5, 5));
    lChild.addResult(20000000, 15000000, false);

    File lFile = new File(mFolder.getRoot(), "book.pachitree");
    lTree.save(lFile, 0);

    UctTree lLoaded = newTree();
    lLoaded.load(lFile);
    TreeNode lLoadedChild = lLoaded.findChild(lLoaded.getRoot(), at(5, 5));
    assertEquals(TreeBook.MAX_PLAYOUTS, lLoadedChild.getU().mPlayouts);
    assertEquals(7500000, lLoadedChild.getU().mWins, 1e-3);
    assertEquals(0.75, lLoadedChild.getU().mValue, EPSILON);
  }

  @Test
  public void testMissingBook()
  {
    UctTree lTree = newTree();
    lTree.load(new File(mFolder.getRoot(), "no-such-book.pachitree"));
    assertTrue(lTree.getRoot().isLeaf());
    assertEquals(1, mPool.getNumItemsInUse());
  }

  @Test
  public void testCorruptBook() throws IOException
  {
    UctTree lTree = newTree();
    TreeNode lChild = lTree.getOrCreateChild(lTree.getRoot(), at(5, 5));
    lChild.addResult(50, 25, false);
    lTree.getOrCreateChild(lChild, at(6, 6));

    File lFile = new File(mFolder.getRoot(), "book.pachitree");
    lTree.save(lFile, 0);

    // Chop the book off part way through the second node.
    long lLength = lFile.length();
    byte[] lBytes = Files.readAllBytes(lFile.toPath());
    try (FileOutputStream lOut = new FileOutputStream(lFile))
    {
      lOut.write(lBytes, 0, (int)(lLength / 2));
    }

    UctTree lLoaded = newTree();
    lLoaded.load(lFile);
    TreeNode lRoot = lLoaded.getRoot();
    assertTrue(lRoot.isLeaf());
    assertEquals(0, lRoot.getU().mPlayouts);
    assertEquals(Coord.PASS, lRoot.getCoord());
    assertNull(lLoaded.getParent(lRoot));
    assertEquals(1 + 3, mPool.getNumItemsInUse());
  }
}
