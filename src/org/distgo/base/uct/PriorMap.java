package org.distgo.base.uct;

import org.apache.lucene.util.OpenBitSet;
import org.distgo.base.board.Board;
import org.distgo.base.board.Stone;

/**
 * The set of moves considered for expansion of a node, together with the prior estimate of each one.
 *
 * Slots are indexed by coordinate + 1 so that pass gets a slot of its own.
 */
public class PriorMap
{
  private final Board       mBoard;
  private final Stone       mColorToPlay;
  private final OpenBitSet  mConsider;
  private final MoveStats[] mPriors;

  /**
   * Create an empty prior map for a position.
   *
   * @param xiBoard       - the position.
   * @param xiColorToPlay - the colour whose moves are being expanded.
   */
  public PriorMap(Board xiBoard, Stone xiColorToPlay)
  {
    mBoard = xiBoard;
    mColorToPlay = xiColorToPlay;

    int lSlots = xiBoard.getSize() * xiBoard.getSize() + 1;
    mConsider = new OpenBitSet(lSlots);
    mPriors = new MoveStats[lSlots];
    for (int lii = 0; lii < lSlots; lii++)
    {
      mPriors[lii] = new MoveStats();
    }
  }

  public Board getBoard()
  {
    return mBoard;
  }

  public Stone getColorToPlay()
  {
    return mColorToPlay;
  }

  /**
   * @return whether a move is to be expanded.
   *
   * @param xiCoord - the move.
   */
  public boolean isConsidered(int xiCoord)
  {
    return mConsider.get(xiCoord + 1);
  }

  void setConsidered(int xiCoord)
  {
    mConsider.set(xiCoord + 1);
  }

  /**
   * @return the number of moves to be expanded.
   */
  public long getNumConsidered()
  {
    return mConsider.cardinality();
  }

  /**
   * @return the prior accumulator for a move.
   *
   * @param xiCoord - the move.
   */
  public MoveStats getPrior(int xiCoord)
  {
    return mPriors[xiCoord + 1];
  }

  /**
   * Add pseudo-playouts to the prior of a move.
   *
   * @param xiCoord    - the move.
   * @param xiValue    - expected value of the move.
   * @param xiPlayouts - weight of the estimate, in playouts.
   */
  public void addPrior(int xiCoord, double xiValue, long xiPlayouts)
  {
    mPriors[xiCoord + 1].add(xiValue, xiPlayouts);
  }
}
