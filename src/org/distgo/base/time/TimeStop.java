package org.distgo.base.time;

import org.distgo.base.time.TimeInfo.Dimension;

/**
 * When to stop searching for one move.  In seconds for wall-clock budgets, in games otherwise.
 */
public class TimeStop
{
  /**
   * What the limits are measured in.
   */
  public final Dimension mDimension;

  /**
   * The amount we'd like to spend.
   */
  public final double    mDesired;

  /**
   * The most we may spend.
   */
  public final double    mWorst;

  public TimeStop(Dimension xiDimension, double xiDesired, double xiWorst)
  {
    assert(xiWorst >= xiDesired) : "Worst case " + xiWorst + " below desired " + xiDesired;
    mDimension = xiDimension;
    mDesired = xiDesired;
    mWorst = xiWorst;
  }

  @Override
  public String toString()
  {
    String lUnit = (mDimension == Dimension.WALLTIME) ? "s" : " games";
    return "desired " + mDesired + lUnit + ", worst " + mWorst + lUnit;
  }
}
