package org.distgo.base.distributed;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.util.Collections;

import org.distgo.base.board.Coord;
import org.distgo.base.board.SimpleBoard;
import org.distgo.base.board.Stone;
import org.distgo.base.uct.TreeNode;
import org.distgo.base.uct.UctTree;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class ConsensusBookTest
{
  private static final String REPLY = "=1 100 300 1 1\nF6 100 0.6 20 0.5\nD4 50 0.4 0 0\nG7 30 0.3 0 0\n";

  @Rule
  public TemporaryFolder mFolder = new TemporaryFolder();

  private ConsensusBook  mBook;
  private SimpleBoard    mBoard;
  private int            mF6;

  @Before
  public void setUp()
  {
    mBook = new ConsensusBook(1000, mFolder.getRoot(), 0);
    mBoard = new SimpleBoard(9);
    mF6 = Coord.parse("F6", 9);
  }

  private static CandidateStatsTable table(String xiReply)
  {
    CandidateStatsTable lTable = new CandidateStatsTable(9);
    lTable.fold(Collections.singletonList(xiReply));
    return lTable;
  }

  @Test
  public void testRecordDecision()
  {
    mBook.newGame(mBoard);
    mBook.recordDecision(mBoard, Stone.BLACK, table(REPLY));

    UctTree lTree = mBook.getTree();
    TreeNode lRoot = lTree.getRoot();

    // D4 is the mirror image of a point in the canonical octant, so it isn't recorded.
    assertEquals(2, lRoot.getNumChildren());
    assertNull(lTree.findChild(lRoot, Coord.parse("D4", 9)));

    TreeNode lF6 = lTree.findChild(lRoot, mF6);
    assertEquals(100, lF6.getU().mPlayouts);
    assertEquals(0.6, lF6.getU().mValue, 1e-9);
    assertEquals(20, lF6.getAmaf().mPlayouts);
    assertEquals(130, lRoot.getU().mPlayouts);

    // A second decision in the same position adds to the first.
    mBook.recordDecision(mBoard, Stone.BLACK, table(REPLY));
    assertEquals(200, lF6.getU().mPlayouts);
  }

  @Test
  public void testPlayFollowsTree()
  {
    mBook.newGame(mBoard);
    mBook.recordDecision(mBoard, Stone.BLACK, table(REPLY));
    mBook.play(Stone.BLACK, mF6);

    TreeNode lRoot = mBook.getTree().getRoot();
    assertEquals(mF6, lRoot.getCoord());
    assertEquals(Stone.BLACK, mBook.getTree().getRootColor());
    assertEquals(100, lRoot.getU().mPlayouts);
  }

  @Test
  public void testUnknownMoveDiscardsTree()
  {
    mBook.newGame(mBoard);
    mBook.recordDecision(mBoard, Stone.BLACK, table(REPLY));
    mBook.play(Stone.BLACK, Coord.parse("E5", 9));
    assertNull(mBook.getTree());

    // Harmless with no tree.
    mBook.play(Stone.WHITE, Coord.parse("C3", 9));
    assertNull(mBook.getTree());

    // The next decision starts a fresh tree.
    mBoard.play(Stone.BLACK, Coord.parse("E5", 9));
    mBook.recordDecision(mBoard, Stone.WHITE, table("=1 0 0 1 1\nC3 10 0.5 0 0\n"));
    assertNotNull(mBook.getTree());
    assertEquals(Stone.BLACK, mBook.getTree().getRootColor());
  }

  @Test
  public void testWrongColourDiscardsTree()
  {
    mBook.newGame(mBoard);
    mBook.recordDecision(mBoard, Stone.BLACK, table(REPLY));
    mBook.play(Stone.WHITE, mF6);
    assertNull(mBook.getTree());
  }

  @Test
  public void testSaveAndReload()
  {
    mBoard.setKomi(7.5);
    mBook.newGame(mBoard);
    mBook.recordDecision(mBoard, Stone.BLACK, table(REPLY));
    mBook.save(mBoard);

    File lFile = mBook.getBookFile(mBoard);
    assertEquals("uctbook-9-7.5.pachitree", lFile.getName());
    assertTrue(lFile.exists());

    ConsensusBook lOther = new ConsensusBook(1000, mFolder.getRoot(), 0);
    lOther.newGame(mBoard);
    TreeNode lF6 = lOther.getTree().findChild(lOther.getTree().getRoot(), mF6);
    assertNotNull(lF6);
    assertEquals(100, lF6.getU().mPlayouts);
  }

  @Test
  public void testSaveOnlyAtGameStart()
  {
    mBook.newGame(mBoard);
    mBoard.play(Stone.BLACK, mF6);
    mBook.recordDecision(mBoard, Stone.WHITE, table("=1 0 0 1 1\nC3 10 0.5 0 0\n"));
    mBook.save(mBoard);
    assertFalse(mBook.getBookFile(mBoard).exists());
  }

  @Test
  public void testHandicapGame()
  {
    mBoard.setHandicap(2);
    mBook.newGame(mBoard);

    // White moves first.
    assertEquals(Stone.BLACK, mBook.getTree().getRootColor());
    mBook.dispose();
    assertNull(mBook.getTree());
  }
}
