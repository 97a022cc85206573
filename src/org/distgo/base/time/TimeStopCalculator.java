package org.distgo.base.time;

import org.distgo.base.board.Board;

/**
 * Works out how much of the budget to spend on the next move.
 */
public interface TimeStopCalculator
{
  /**
   * @return the stopping conditions for the next move.
   *
   * @param xiTimeInfo - the time control.  Must not be Period.NONE.
   * @param xiBoard    - the current position.
   */
  public TimeStop compute(TimeInfo xiTimeInfo, Board xiBoard);
}
