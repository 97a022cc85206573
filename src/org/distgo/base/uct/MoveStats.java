package org.distgo.base.uct;

/**
 * One statistics accumulator: a playout count, the sum of the playout results and a cached value.
 *
 * Results are in [0, 1].  For tree nodes the cached value is maintained by {@link TreeNode} and may blend in the
 * prior; for combined worker statistics it is simply wins / playouts.
 */
public class MoveStats
{
  /**
   * Number of playouts.
   */
  public long   mPlayouts;

  /**
   * Sum of playout results.
   */
  public double mWins;

  /**
   * Cached value.
   */
  public double mValue;

  /**
   * Fold in a batch of playouts with the given average result.
   *
   * @param xiValue    - average result of the batch.
   * @param xiPlayouts - number of playouts in the batch.
   */
  public void add(double xiValue, long xiPlayouts)
  {
    if (xiPlayouts <= 0)
    {
      return;
    }

    mPlayouts += xiPlayouts;
    mWins += xiValue * xiPlayouts;
    mValue = mWins / mPlayouts;
  }

  /**
   * Add raw counts without touching the cached value.
   *
   * @param xiPlayouts - playouts to add.
   * @param xiWins     - wins to add.
   */
  public void addRaw(long xiPlayouts, double xiWins)
  {
    mPlayouts += xiPlayouts;
    mWins += xiWins;
  }

  /**
   * @return wins / playouts, or 0 if there have been no playouts.
   */
  public double getMeanValue()
  {
    return (mPlayouts == 0) ? 0 : mWins / mPlayouts;
  }

  public void set(long xiPlayouts, double xiWins)
  {
    mPlayouts = xiPlayouts;
    mWins = xiWins;
    mValue = getMeanValue();
  }

  public void copyFrom(MoveStats xiOther)
  {
    mPlayouts = xiOther.mPlayouts;
    mWins = xiOther.mWins;
    mValue = xiOther.mValue;
  }

  public void reset()
  {
    mPlayouts = 0;
    mWins = 0;
    mValue = 0;
  }

  /**
   * @return whether two accumulators hold identical counts.
   *
   * @param xiOther - the other accumulator.
   */
  public boolean sameCounts(MoveStats xiOther)
  {
    return mPlayouts == xiOther.mPlayouts && mWins == xiOther.mWins;
  }

  @Override
  public String toString()
  {
    return mWins + "/" + mPlayouts;
  }
}
