package org.distgo.base.distributed;

import static org.junit.Assert.assertEquals;

import java.util.Collections;

import org.distgo.base.board.Coord;
import org.distgo.base.board.SimpleBoard;
import org.distgo.base.board.Stone;
import org.distgo.base.distributed.CandidateStatsTable.Selection;
import org.distgo.base.uct.TreeNode;
import org.distgo.base.uct.UctTree;
import org.distgo.base.uct.pool.CappedPool;
import org.junit.Test;

public class WorkerStatsReporterTest
{
  @Test
  public void testReportsChangesSinceBaseline()
  {
    SimpleBoard lBoard = new SimpleBoard(9);
    UctTree lTree = new UctTree(new CappedPool<TreeNode>(100), lBoard, Stone.BLACK, false);
    lTree.expand(lTree.getRoot(), lBoard, Stone.BLACK, 0, null);

    TreeNode lF6 = lTree.findChild(lTree.getRoot(), Coord.parse("F6", 9));
    TreeNode lE5 = lTree.findChild(lTree.getRoot(), Coord.parse("E5", 9));

    // Already known to the coordinator.
    lF6.addResult(100, 50, false);
    lTree.getRoot().addResult(100, 50, false);
    lTree.snapshotBaselines();

    lF6.addResult(40, 30, false);
    lF6.addAmafResult(10, 4, false);
    lE5.addResult(20, 5, false);
    lTree.getRoot().addResult(60, 25, false);

    String lReport = WorkerStatsReporter.report(12, lTree, 60, 4, true);
    assertEquals("=12 60 160 4 1\n" +
                 "E5 20 0.2500000 0 0.0000000\n" +
                 "F6 40 0.7500000 10 0.4000000\n" +
                 "\n",
                 lReport);

    // The coordinator reads it back.
    CandidateStatsTable lTable = new CandidateStatsTable(9);
    Selection lSelection = lTable.fold(Collections.singletonList(lReport));
    assertEquals(Coord.parse("F6", 9), lSelection.mBest);
    assertEquals(60, lSelection.mPlayed);
    assertEquals(0.75, lTable.getU(lSelection.mBest).mValue, 1e-9);
  }

  @Test
  public void testNothingNew()
  {
    SimpleBoard lBoard = new SimpleBoard(9);
    UctTree lTree = new UctTree(new CappedPool<TreeNode>(100), lBoard, Stone.WHITE, false);
    lTree.expand(lTree.getRoot(), lBoard, Stone.WHITE, 0, null);
    assertEquals("=3 0 0 1 0\n\n", WorkerStatsReporter.report(3, lTree, 0, 1, false));
  }
}
