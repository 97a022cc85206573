package org.distgo.base.distributed;

import java.util.List;
import java.util.Locale;

import org.distgo.base.board.Coord;
import org.distgo.base.distributed.GenmovesReply.Candidate;
import org.distgo.base.uct.MoveStats;

/**
 * Statistics for each candidate move combined over all workers' replies.
 */
public class CandidateStatsTable
{
  // Offset so that pass and resign get slots too.
  private static final int OFFSET = 2;

  /**
   * Summary of one round of replies.
   */
  public static class Selection
  {
    /**
     * The move with the most combined playouts.
     */
    public final int     mBest;

    /**
     * Total games played, as reported by the workers.
     */
    public final long    mPlayed;

    /**
     * Total playouts in the workers' trees.
     */
    public final long    mPlayouts;

    /**
     * Total search threads.
     */
    public final int     mThreads;

    /**
     * Whether a strict majority of replies asked to keep looking.
     */
    public final boolean mKeepLooking;

    /**
     * The number of replies.
     */
    public final int     mReplies;

    Selection(int xiBest, long xiPlayed, long xiPlayouts, int xiThreads, boolean xiKeepLooking, int xiReplies)
    {
      mBest = xiBest;
      mPlayed = xiPlayed;
      mPlayouts = xiPlayouts;
      mThreads = xiThreads;
      mKeepLooking = xiKeepLooking;
      mReplies = xiReplies;
    }
  }

  private final int         mBoardSize;
  private final MoveStats[] mU;
  private final MoveStats[] mAmaf;

  public CandidateStatsTable(int xiBoardSize)
  {
    mBoardSize = xiBoardSize;
    int lSlots = xiBoardSize * xiBoardSize + OFFSET;
    mU = new MoveStats[lSlots];
    mAmaf = new MoveStats[lSlots];
    for (int lii = 0; lii < lSlots; lii++)
    {
      mU[lii] = new MoveStats();
      mAmaf[lii] = new MoveStats();
    }
  }

  public int getBoardSize()
  {
    return mBoardSize;
  }

  /**
   * @return the combined simulation statistics for a move.
   */
  public MoveStats getU(int xiCoord)
  {
    return mU[xiCoord + OFFSET];
  }

  /**
   * @return the combined AMAF statistics for a move.
   */
  public MoveStats getAmaf(int xiCoord)
  {
    return mAmaf[xiCoord + OFFSET];
  }

  public void reset()
  {
    for (int lii = 0; lii < mU.length; lii++)
    {
      mU[lii].reset();
      mAmaf[lii].reset();
    }
  }

  /**
   * Rebuild the table from a round of replies and pick the best move.
   *
   * Ties on playouts go to whichever move reached the count first, scanning replies in order and lines within each
   * reply in order.
   *
   * @param xiReplies - the replies.
   *
   * @return the summary.
   */
  public Selection fold(List<String> xiReplies)
  {
    reset();

    int lBest = Coord.PASS;
    long lBestPlayouts = -1;
    long lPlayed = 0;
    long lPlayouts = 0;
    int lThreads = 0;
    int lKeep = 0;

    for (String lText : xiReplies)
    {
      GenmovesReply lReply = GenmovesReply.parse(lText, mBoardSize);
      if (lReply == null)
      {
        continue;
      }

      lPlayed += lReply.mPlayed;
      lPlayouts += lReply.mPlayouts;
      lThreads += lReply.mThreads;
      lKeep += lReply.mKeepLooking;

      for (Candidate lCandidate : lReply.mCandidates)
      {
        MoveStats lU = getU(lCandidate.mCoord);
        lU.add(lCandidate.mValue, lCandidate.mPlayouts);
        getAmaf(lCandidate.mCoord).add(lCandidate.mAmafValue, lCandidate.mAmafPlayouts);

        if (lU.mPlayouts > lBestPlayouts)
        {
          lBestPlayouts = lU.mPlayouts;
          lBest = lCandidate.mCoord;
        }
      }
    }

    boolean lKeepLooking = lKeep > xiReplies.size() / 2;
    return new Selection(lBest, lPlayed, lPlayouts, lThreads, lKeepLooking, xiReplies.size());
  }

  /**
   * Append a line for every board point with more than the given number of playouts.  Pass and resign are never
   * included.
   *
   * @param xbBuffer      - the buffer to append to.
   * @param xiMinPlayouts - the threshold.
   */
  public void appendStats(StringBuilder xbBuffer, long xiMinPlayouts)
  {
    for (int lCoord = 0; lCoord < mBoardSize * mBoardSize; lCoord++)
    {
      MoveStats lU = getU(lCoord);
      if (lU.mPlayouts <= xiMinPlayouts)
      {
        continue;
      }

      MoveStats lAmaf = getAmaf(lCoord);
      xbBuffer.append(String.format(Locale.US,
                                    "%s %d %.7f %d %.7f\n",
                                    Coord.toString(lCoord, mBoardSize),
                                    lU.mPlayouts,
                                    lU.mValue,
                                    lAmaf.mPlayouts,
                                    lAmaf.mValue));
    }
  }
}
