package org.distgo.base.distributed;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.apache.commons.lang.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.distgo.base.board.Board;
import org.distgo.base.board.Coord;
import org.distgo.base.board.Stone;
import org.distgo.base.distributed.CandidateStatsTable.Selection;
import org.distgo.base.distributed.DistributedConfiguration.CfgItem;
import org.distgo.base.time.TimeInfo;
import org.distgo.base.time.TimeInfo.Dimension;
import org.distgo.base.time.TimeInfo.Period;
import org.distgo.base.time.TimeStop;
import org.distgo.base.time.TimeStopCalculator;
import org.distgo.base.uct.MoveStats;

/**
 * Plays by consensus of a pool of workers.
 *
 * Each decision is a series of rounds.  The coordinator issues a genmoves request, collects the replies that arrive
 * within a short window, combines them and sends the combined statistics back out as an update to the same request
 * so that every worker can take account of the others.  Once the budget is spent, or most workers want to stop, the
 * move with the most playouts is chosen and the request is overwritten with a command to play it.
 *
 * Not thread-safe: all calls come from the command front end.
 */
public class Coordinator
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * How long to wait for replies to commands other than genmoves, in milliseconds.
   */
  public static final long MAX_FAST_CMD_WAIT = 1000;

  /**
   * How often to send statistics updates to workers, in milliseconds.
   */
  public static final long STATS_UPDATE_INTERVAL = 100;

  /**
   * Commands that the workers never see, because they're handled here, folded into genmoves or sent later in another
   * form.  "quit" is handled separately.
   */
  private static final Set<String> NOT_FORWARDED = new HashSet<>(Arrays.asList("uct_genbook",
                                                                               "uct_dumpbook",
                                                                               "kgs-chat",
                                                                               "time_left",
                                                                               "genmove",
                                                                               "kgs-genmove_cleanup",
                                                                               "final_score",
                                                                               "final_status_list"));

  /**
   * The outcome of a search.
   */
  private static class Decision
  {
    final CandidateStatsTable mTable;
    final Selection           mSelection;
    final double              mElapsed;

    Decision(CandidateStatsTable xiTable, Selection xiSelection, double xiElapsed)
    {
      mTable = xiTable;
      mSelection = xiSelection;
      mElapsed = xiElapsed;
    }
  }

  private final Protocol                 mProtocol;
  private final DistributedConfiguration mConfig;
  private final TimeStopCalculator       mTimeStopCalculator;
  private final ConsensusBook            mBook;

  // The last decision, for answering "winrate".
  private Stone                          mLastColor     = Stone.NONE;
  private int                            mLastMove      = Coord.PASS;
  private int                            mLastBoardSize = 0;
  private final MoveStats                mLastStats     = new MoveStats();

  /**
   * @param xiProtocol           - shared state with the worker connections.
   * @param xiConfig             - configuration.
   * @param xiTimeStopCalculator - works out the budget for each move.
   * @param xiBook               - the coordinator's own tree.
   */
  public Coordinator(Protocol xiProtocol,
                     DistributedConfiguration xiConfig,
                     TimeStopCalculator xiTimeStopCalculator,
                     ConsensusBook xiBook)
  {
    mProtocol = xiProtocol;
    mConfig = xiConfig;
    mTimeStopCalculator = xiTimeStopCalculator;
    mBook = xiBook;
  }

  public ConsensusBook getBook()
  {
    return mBook;
  }

  /**
   * @return whether a command is passed straight on to the workers.
   *
   * @param xiVerb - the command verb.
   */
  public boolean isForwarded(String xiVerb)
  {
    String lVerb = StringUtils.lowerCase(xiVerb);
    if (lVerb.equals("quit"))
    {
      return mConfig.getBoolean(CfgItem.SLAVES_QUIT);
    }
    return !NOT_FORWARDED.contains(lVerb);
  }

  /**
   * Pass a command on to the workers (unless it's one they don't need to see) and wait briefly for their replies.
   *
   * @param xiVerb - the verb.
   * @param xiArgs - the arguments.
   *
   * @return whether the command was forwarded.
   */
  public boolean notify(String xiVerb, String xiArgs)
  {
    if (!isForwarded(xiVerb))
    {
      return false;
    }

    mProtocol.newCommand(xiVerb, xiArgs);

    // Wait for replies here.  If we don't, most workers will fall out of step and need history sent too often.
    mProtocol.getReplies(System.currentTimeMillis() + MAX_FAST_CMD_WAIT);
    return true;
  }

  /**
   * A new game has started.
   *
   * @param xiBoard - the empty board.
   */
  public void newGame(Board xiBoard)
  {
    mBook.newGame(xiBoard);
  }

  /**
   * A move has been played (other than one chosen by {@link #genmove}).
   *
   * @param xiColor - who played.
   * @param xiCoord - the move.
   */
  public void played(Stone xiColor, int xiCoord)
  {
    mBook.play(xiColor, xiCoord);
  }

  /**
   * Decide on a move.
   *
   * @param xiBoard        - the position.
   * @param xiTimeInfo     - the time control.
   * @param xiColor        - the colour to move.
   * @param xiPassAllAlive - whether to play the game out so that all dead stones are captured.
   *
   * @return the move.  Workers have already been told to play it.
   */
  public int genmove(Board xiBoard, TimeInfo xiTimeInfo, Stone xiColor, boolean xiPassAllAlive)
  {
    String lVerb = xiPassAllAlive ? "pachi-genmoves_cleanup" : "pachi-genmoves";
    Decision lDecision = search(xiBoard, xiTimeInfo, xiColor, lVerb);
    Selection lSelection = lDecision.mSelection;
    int lBest = lSelection.mBest;
    MoveStats lBestStats = lDecision.mTable.getU(lBest);

    mLastColor = xiColor;
    mLastMove = lBest;
    mLastBoardSize = xiBoard.getSize();
    mLastStats.copyFrom(lBestStats);

    // Tell the workers to commit to the move, overwriting the genmoves request in the history.
    String lCoord = Coord.toString(lBest, xiBoard.getSize());
    mProtocol.updateCommand("play", xiColor + " " + lCoord + "\n", true);

    mBook.recordDecision(xiBoard, xiColor, lDecision.mTable);
    mBook.play(xiColor, lBest);

    double lTime = lDecision.mElapsed + 0.000001;
    int lReplies = Math.max(1, lSelection.mReplies);
    int lThreads = Math.max(1, lSelection.mThreads);
    LOGGER.info(String.format(Locale.US,
                              "GLOBAL WINNER is %s %s with score %1.4f (%d/%d games)",
                              xiColor, lCoord, valueFor(lBestStats.mValue, xiColor),
                              lBestStats.mPlayouts, lSelection.mPlayouts));
    LOGGER.info(String.format(Locale.US,
                              "genmove %d games in %.2fs %d workers %d threads " +
                              "(%d games/s, %d games/s/worker, %d games/s/thread)",
                              lSelection.mPlayed, lTime, lSelection.mReplies, lSelection.mThreads,
                              (long)(lSelection.mPlayed / lTime),
                              (long)(lSelection.mPlayed / lTime / lReplies),
                              (long)(lSelection.mPlayed / lTime / lThreads)));
    return lBest;
  }

  /**
   * Search the current position without playing, fold the result into the coordinator's tree and save it as the
   * opening book.
   *
   * @param xiBoard    - the position.
   * @param xiTimeInfo - the time control.
   * @param xiColor    - the colour to move.
   */
  public void genbook(Board xiBoard, TimeInfo xiTimeInfo, Stone xiColor)
  {
    Decision lDecision = search(xiBoard, xiTimeInfo, xiColor, "pachi-genmoves");

    // Nothing is played, so the request mustn't be replayed to anyone.
    mProtocol.retractCommand();

    mBook.recordDecision(xiBoard, xiColor, lDecision.mTable);
    mBook.save(xiBoard);
  }

  private Decision search(Board xiBoard, TimeInfo xiTimeInfo, Stone xiColor, String xiVerb)
  {
    TimeInfo lTimeInfo = xiTimeInfo;
    if (lTimeInfo.getPeriod() == Period.NONE)
    {
      lTimeInfo = TimeInfo.forGames(mConfig.getLong(CfgItem.DEFAULT_GAMES));
    }
    TimeStop lStop = mTimeStopCalculator.compute(lTimeInfo, xiBoard);
    long lSilenceLimit = mConfig.getLong(CfgItem.SILENCE_LIMIT);

    CandidateStatsTable lTable = new CandidateStatsTable(xiBoard.getSize());
    long lStart = System.currentTimeMillis();
    long lNow = lStart;
    long lLastHeard = lStart;

    // The first request goes out without statistics.
    mProtocol.newCommand(xiVerb, genmovesArgs(xiColor, 0, lTimeInfo, 0, null, 0));

    Selection lSelection;
    while (true)
    {
      List<String> lReplies = mProtocol.getReplies(lNow + STATS_UPDATE_INTERVAL);
      lNow = System.currentTimeMillis();
      double lElapsed = (lNow - lStart) / 1000.0;

      lSelection = lTable.fold(lReplies);

      if (lReplies.isEmpty())
      {
        // Silence is no contribution, not a vote to stop.
        if (lNow - lLastHeard >= lSilenceLimit)
        {
          LOGGER.warn("No replies from any worker for " + (lNow - lLastHeard) + "ms - giving up");
          break;
        }
      }
      else
      {
        lLastHeard = lNow;
        if (!lSelection.mKeepLooking)
        {
          break;
        }
      }

      if (lStop.mDimension == Dimension.WALLTIME)
      {
        if (lElapsed >= lStop.mWorst)
        {
          break;
        }
      }
      else if (lSelection.mPlayed >= lStop.mWorst)
      {
        break;
      }

      MoveStats lBest = lTable.getU(lSelection.mBest);
      if (LOGGER.isDebugEnabled())
      {
        LOGGER.debug(String.format(Locale.US,
                                   "temp winner is %s %s with score %1.4f (%d/%d games) %d workers %d threads",
                                   xiColor, Coord.toString(lSelection.mBest, xiBoard.getSize()),
                                   valueFor(lBest.mValue, xiColor), lBest.mPlayouts, lSelection.mPlayouts,
                                   lSelection.mReplies, lSelection.mThreads));
      }

      // Same id, so that replies to the previous round are still accepted.
      mProtocol.updateCommand(xiVerb,
                              genmovesArgs(xiColor,
                                           lSelection.mPlayed,
                                           lTimeInfo,
                                           lElapsed,
                                           lTable,
                                           lBest.mPlayouts / 100),
                              false);
    }

    return new Decision(lTable, lSelection, (lNow - lStart) / 1000.0);
  }

  /**
   * @return the arguments of a genmoves request.
   *
   * @param xiColor       - the colour to move.
   * @param xiPlayed      - games played so far, over all workers.
   * @param xiTimeInfo    - the time control.
   * @param xiElapsed     - time spent on this move so far, in seconds.
   * @param xiTable       - combined statistics, or null to send none.
   * @param xiMinPlayouts - only send statistics for moves with more playouts than this.
   */
  static String genmovesArgs(Stone xiColor,
                             long xiPlayed,
                             TimeInfo xiTimeInfo,
                             double xiElapsed,
                             CandidateStatsTable xiTable,
                             long xiMinPlayouts)
  {
    StringBuilder lArgs = new StringBuilder();
    lArgs.append(xiColor).append(' ').append(xiPlayed);

    if (xiTimeInfo.isWallTime())
    {
      double lMainTime = xiTimeInfo.getMainTime();
      double lByoyomiTime = xiTimeInfo.getByoyomiTime();
      if (lMainTime > 0)
      {
        lMainTime = Math.max(0, lMainTime - xiElapsed);
      }
      else
      {
        lByoyomiTime = Math.max(0, lByoyomiTime - xiElapsed);
      }
      lArgs.append(String.format(Locale.US,
                                 " %.3f %.3f %d %d",
                                 lMainTime,
                                 lByoyomiTime,
                                 xiTimeInfo.getByoyomiPeriods(),
                                 xiTimeInfo.getByoyomiStones()));
    }
    lArgs.append('\n');

    if (xiTable != null)
    {
      xiTable.appendStats(lArgs, xiMinPlayouts);
    }
    lArgs.append('\n');
    return lArgs.toString();
  }

  /**
   * Ask the workers which stones are dead.  The answer is whichever complete reply is given most often.
   *
   * @param xiBoard - the position.
   *
   * @return one stone of each dead group.
   */
  public List<Integer> deadGroupList(Board xiBoard)
  {
    mProtocol.newCommand("final_status_list", "dead\n");
    List<String> lReplies = mProtocol.getReplies(System.currentTimeMillis() + MAX_FAST_CMD_WAIT);
    return selectDeadGroups(lReplies, xiBoard.getSize());
  }

  /**
   * Pick the most popular reply and return the first point on each of its lines.  Ties go to the reply that sorts
   * first (case-insensitively).
   *
   * @param xiReplies   - replies to final_status_list dead.
   * @param xiBoardSize - board size.
   *
   * @return the points.
   */
  static List<Integer> selectDeadGroups(List<String> xiReplies, int xiBoardSize)
  {
    if (xiReplies.isEmpty())
    {
      return Collections.emptyList();
    }

    List<String> lSorted = new ArrayList<>(xiReplies);
    Collections.sort(lSorted, String.CASE_INSENSITIVE_ORDER);

    int lBestReply = 0;
    int lBestCount = 1;
    int lCount = 1;
    for (int lii = 1; lii < lSorted.size(); lii++)
    {
      lCount = lSorted.get(lii).equals(lSorted.get(lii - 1)) ? lCount + 1 : 1;
      if (lCount > lBestCount)
      {
        lBestCount = lCount;
        lBestReply = lii;
      }
    }

    List<Integer> lDead = new ArrayList<>();
    String lReply = lSorted.get(lBestReply);

    // Skip "=id ".
    int lStart = lReply.indexOf(' ');
    if (lStart < 0)
    {
      return lDead;
    }

    for (String lLine : StringUtils.splitPreserveAllTokens(lReply.substring(lStart + 1), '\n'))
    {
      if (lLine.isEmpty())
      {
        break;
      }

      String lFirst = StringUtils.substringBefore(lLine.trim(), " ");
      try
      {
        lDead.add(Coord.parse(lFirst, xiBoardSize));
      }
      catch (IllegalArgumentException lEx)
      {
        LOGGER.debug("Ignoring bad dead group line: " + lLine);
      }
    }
    return lDead;
  }

  /**
   * Answer a chat message.
   *
   * @param xiMessage - the message.
   *
   * @return the answer, or null if there's nothing to say.
   */
  public String chat(String xiMessage)
  {
    String lMessage = StringUtils.stripStart(xiMessage, " \n\t");
    if (!StringUtils.startsWithIgnoreCase(lMessage, "winrate") || mLastColor == Stone.NONE)
    {
      return null;
    }

    return String.format(Locale.US,
                         "In %d playouts at %d machines, %s %s can win with %.2f%% probability.",
                         mLastStats.mPlayouts,
                         mProtocol.getNumWorkers(),
                         mLastColor,
                         Coord.toString(mLastMove, mLastBoardSize),
                         100 * valueFor(mLastStats.mValue, mLastColor));
  }

  /**
   * @return the last move chosen, or PASS if none.
   */
  public int getLastMove()
  {
    return mLastMove;
  }

  public MoveStats getLastStats()
  {
    return mLastStats;
  }

  /**
   * Values are from black's point of view.
   */
  private static double valueFor(double xiValue, Stone xiColor)
  {
    return (xiColor == Stone.BLACK) ? xiValue : 1 - xiValue;
  }
}
