package org.distgo.base.board;

/**
 * The board legality oracle.
 *
 * The tree and the coordinator only ever need to ask a position a handful of questions, which are collected here.
 */
public interface Board
{
  /**
   * @return the board size (number of lines).
   */
  public int getSize();

  /**
   * @return the komi.
   */
  public double getKomi();

  /**
   * @return the number of handicap stones.
   */
  public int getHandicap();

  /**
   * @return the number of moves played so far.
   */
  public int getMoveCount();

  /**
   * @return whether no stones have been placed yet.
   */
  public boolean isEmpty();

  /**
   * @return the stone on a point.
   *
   * @param xiCoord - the point.
   */
  public Stone getStoneAt(int xiCoord);

  /**
   * @return whether a move is legal for the given colour.
   *
   * @param xiColor - colour to move.
   * @param xiCoord - the point (or pass).
   */
  public boolean isValidMove(Stone xiColor, int xiCoord);

  /**
   * @return whether there's any stone within the given (Chebyshev) distance of a point.
   *
   * @param xiCoord  - the point.
   * @param xiRadius - the distance.
   */
  public boolean hasStoneWithin(int xiCoord, int xiRadius);

  /**
   * @return the symmetry playground of the current position.
   */
  public BoardSymmetry getSymmetry();
}
