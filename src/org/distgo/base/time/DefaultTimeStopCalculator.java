package org.distgo.base.time;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.distgo.base.board.Board;
import org.distgo.base.time.TimeInfo.Dimension;
import org.distgo.base.time.TimeInfo.Period;

/**
 * Spreads the remaining main time evenly over the moves we expect still to play, allowing up to double for moves
 * in the middle game.
 */
public class DefaultTimeStopCalculator implements TimeStopCalculator
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * End of the opening, as a percentage of the board's points.
   */
  public static final int FUSEKI_END = 20;

  /**
   * Start of the endgame, as a percentage of the board's points.
   */
  public static final int YOSE_START = 40;

  /**
   * Never plan for fewer than this many moves of our own still to play.
   */
  public static final int MIN_MOVES_LEFT = 30;

  /**
   * Time held back for network and processing latency, in seconds.
   */
  public static final double LATENCY_MARGIN = 0.5;

  @Override
  public TimeStop compute(TimeInfo xiTimeInfo, Board xiBoard)
  {
    assert(xiTimeInfo.getPeriod() != Period.NONE);

    if (xiTimeInfo.getDimension() == Dimension.GAMES)
    {
      return new TimeStop(Dimension.GAMES, xiTimeInfo.getGames(), xiTimeInfo.getGames());
    }

    if (xiTimeInfo.getPeriod() == Period.MOVE)
    {
      double lTime = Math.max(0, xiTimeInfo.getMainTime() - LATENCY_MARGIN);
      return new TimeStop(Dimension.WALLTIME, lTime, lTime);
    }

    TimeStop lStop;
    if (xiTimeInfo.getMainTime() <= 0)
    {
      lStop = byoyomiStop(xiTimeInfo);
    }
    else
    {
      lStop = mainTimeStop(xiTimeInfo, xiBoard);
    }

    LOGGER.debug("Time budget for move " + (xiBoard.getMoveCount() + 1) + ": " + lStop);
    return lStop;
  }

  private static TimeStop byoyomiStop(TimeInfo xiTimeInfo)
  {
    int lStones = Math.max(1, xiTimeInfo.getByoyomiStones());
    double lPerStone = Math.max(0, xiTimeInfo.getByoyomiTime() - LATENCY_MARGIN) / lStones;
    return new TimeStop(Dimension.WALLTIME, lPerStone * 0.9, lPerStone);
  }

  private static TimeStop mainTimeStop(TimeInfo xiTimeInfo, Board xiBoard)
  {
    int lPoints = xiBoard.getSize() * xiBoard.getSize();
    int lMoves = xiBoard.getMoveCount();
    int lMovesLeft = Math.max(MIN_MOVES_LEFT, (lPoints - lMoves) / 2);

    double lAvailable = Math.max(0, xiTimeInfo.getMainTime() - LATENCY_MARGIN);
    double lDesired = lAvailable / lMovesLeft;

    // Byoyomi is a floor: we can always spend that much.
    if (xiTimeInfo.getByoyomiPeriods() > 0 && xiTimeInfo.getByoyomiStones() > 0)
    {
      double lPerStone = xiTimeInfo.getByoyomiTime() / xiTimeInfo.getByoyomiStones();
      lDesired = Math.max(lDesired, lPerStone * 0.9);
    }

    double lWorst = lDesired;
    boolean lMiddleGame = (lMoves >= lPoints * FUSEKI_END / 100) && (lMoves < lPoints * YOSE_START / 100);
    if (lMiddleGame)
    {
      lWorst = Math.max(lDesired, Math.min(lDesired * 2, lAvailable / 2));
    }

    return new TimeStop(Dimension.WALLTIME, lDesired, lWorst);
  }
}
