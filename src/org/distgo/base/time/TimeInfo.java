package org.distgo.base.time;

/**
 * Time control for one side, as understood by the coordinator.
 *
 * The budget is either measured in wall-clock seconds or in games (playouts summed over all workers).
 */
public class TimeInfo
{
  /**
   * The scope of the budget.
   */
  public static enum Period
  {
    /**
     * No time control has been set.
     */
    NONE,

    /**
     * The budget applies to each move separately.
     */
    MOVE,

    /**
     * The budget applies to the rest of the game.
     */
    TOTAL
  }

  /**
   * What the budget is measured in.
   */
  public static enum Dimension
  {
    WALLTIME,
    GAMES
  }

  private Period    mPeriod;
  private Dimension mDimension;

  private long      mGames;

  // All in seconds.
  private double    mMainTime;
  private double    mByoyomiTime;
  private int       mByoyomiPeriods;
  private int       mByoyomiStones;

  private TimeInfo(Period xiPeriod, Dimension xiDimension)
  {
    mPeriod = xiPeriod;
    mDimension = xiDimension;
  }

  /**
   * @return a time control with no limit set.
   */
  public static TimeInfo none()
  {
    return new TimeInfo(Period.NONE, Dimension.GAMES);
  }

  /**
   * @return a budget of a fixed number of games per move.
   *
   * @param xiGames - the number of games.
   */
  public static TimeInfo forGames(long xiGames)
  {
    TimeInfo lInfo = new TimeInfo(Period.MOVE, Dimension.GAMES);
    lInfo.mGames = xiGames;
    return lInfo;
  }

  /**
   * @return a budget of a fixed wall-clock time per move.
   *
   * @param xiSeconds - the time per move.
   */
  public static TimeInfo forMoveTime(double xiSeconds)
  {
    TimeInfo lInfo = new TimeInfo(Period.MOVE, Dimension.WALLTIME);
    lInfo.mMainTime = xiSeconds;
    return lInfo;
  }

  /**
   * @return a whole-game budget with optional Canadian byoyomi.
   *
   * @param xiMainTime       - main time, in seconds.
   * @param xiByoyomiTime    - time per byoyomi period, in seconds.
   * @param xiByoyomiPeriods - number of byoyomi periods.
   * @param xiByoyomiStones  - stones to play per byoyomi period.
   */
  public static TimeInfo forGameTime(double xiMainTime,
                                     double xiByoyomiTime,
                                     int xiByoyomiPeriods,
                                     int xiByoyomiStones)
  {
    TimeInfo lInfo = new TimeInfo(Period.TOTAL, Dimension.WALLTIME);
    lInfo.mMainTime = xiMainTime;
    lInfo.mByoyomiTime = xiByoyomiTime;
    lInfo.mByoyomiPeriods = xiByoyomiPeriods;
    lInfo.mByoyomiStones = xiByoyomiStones;
    return lInfo;
  }

  /**
   * Update the remaining time, as reported by the game server.
   *
   * @param xiTime   - time left, in seconds.
   * @param xiStones - stones left to play in the current byoyomi period, or 0 if still in main time.
   */
  public void setTimeLeft(double xiTime, int xiStones)
  {
    if (mPeriod != Period.TOTAL || mDimension != Dimension.WALLTIME)
    {
      mPeriod = Period.TOTAL;
      mDimension = Dimension.WALLTIME;
    }

    if (xiStones == 0)
    {
      mMainTime = xiTime;
    }
    else
    {
      mMainTime = 0;
      mByoyomiTime = xiTime;
      mByoyomiStones = xiStones;
      if (mByoyomiPeriods < 1)
      {
        mByoyomiPeriods = 1;
      }
    }
  }

  public Period getPeriod()
  {
    return mPeriod;
  }

  public Dimension getDimension()
  {
    return mDimension;
  }

  public long getGames()
  {
    return mGames;
  }

  public double getMainTime()
  {
    return mMainTime;
  }

  public double getByoyomiTime()
  {
    return mByoyomiTime;
  }

  public int getByoyomiPeriods()
  {
    return mByoyomiPeriods;
  }

  public int getByoyomiStones()
  {
    return mByoyomiStones;
  }

  /**
   * @return whether this is a wall-clock budget.
   */
  public boolean isWallTime()
  {
    return (mPeriod != Period.NONE) && (mDimension == Dimension.WALLTIME);
  }

  @Override
  public String toString()
  {
    if (mPeriod == Period.NONE)
    {
      return "no time control";
    }
    if (mDimension == Dimension.GAMES)
    {
      return mGames + " games per move";
    }
    if (mPeriod == Period.MOVE)
    {
      return mMainTime + "s per move";
    }
    return mMainTime + "s main time, " + mByoyomiPeriods + "x" + mByoyomiTime + "s/" + mByoyomiStones + " byoyomi";
  }
}
