package org.distgo.base.distributed;

import java.util.Locale;

import org.distgo.base.board.Coord;
import org.distgo.base.uct.MoveStats;
import org.distgo.base.uct.TreeNode;
import org.distgo.base.uct.UctTree;

/**
 * Formats a worker's genmoves reply from its search tree.  Only what the tree has gathered since its baseline (the
 * last point at which it was in step with the coordinator) is reported, so the coordinator can simply sum replies.
 */
public final class WorkerStatsReporter
{
  private WorkerStatsReporter()
  {
    // Static helpers only.
  }

  /**
   * @return the reply text, terminated by a blank line.
   *
   * @param xiId          - id of the request being answered.
   * @param xiTree        - the worker's tree.
   * @param xiPlayed      - games played by this worker for the current move.
   * @param xiThreads     - the number of search threads.
   * @param xiKeepLooking - whether the worker would like to keep searching.
   */
  public static String report(int xiId, UctTree xiTree, long xiPlayed, int xiThreads, boolean xiKeepLooking)
  {
    TreeNode lRoot = xiTree.getRoot();
    StringBuilder lReply = new StringBuilder();
    lReply.append(String.format(Locale.US,
                                "=%d %d %d %d %d\n",
                                xiId,
                                xiPlayed,
                                lRoot.getU().mPlayouts,
                                xiThreads,
                                xiKeepLooking ? 1 : 0));

    for (TreeNode lChild : xiTree.getChildren(lRoot))
    {
      long lPlayouts = lChild.getU().mPlayouts - lChild.getBaseU().mPlayouts;
      if (lPlayouts <= 0)
      {
        continue;
      }

      long lAmafPlayouts = lChild.getAmaf().mPlayouts - lChild.getBaseAmaf().mPlayouts;
      lReply.append(String.format(Locale.US,
                                  "%s %d %.7f %d %.7f\n",
                                  Coord.toString(lChild.getCoord(), xiTree.getBoardSize()),
                                  lPlayouts,
                                  deltaValue(lChild.getU(), lChild.getBaseU()),
                                  lAmafPlayouts,
                                  deltaValue(lChild.getAmaf(), lChild.getBaseAmaf())));
    }

    lReply.append('\n');
    return lReply.toString();
  }

  private static double deltaValue(MoveStats xiStats, MoveStats xiBase)
  {
    long lPlayouts = xiStats.mPlayouts - xiBase.mPlayouts;
    return (lPlayouts <= 0) ? 0 : (xiStats.mWins - xiBase.mWins) / lPlayouts;
  }
}
