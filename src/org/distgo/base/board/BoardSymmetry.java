package org.distgo.base.board;

/**
 * The symmetry playground of a position: the rectangle (optionally folded along a diagonal) containing one
 * representative of every class of symmetrically equivalent points.
 *
 * Coordinates are 0-based and inclusive.
 */
public class BoardSymmetry
{
  /**
   * Kind of symmetry the position still has.
   */
  public static enum SymmetryType
  {
    /**
     * All eight symmetries (empty board, or only tengen played).
     */
    FULL,

    /**
     * Mirror symmetry along the x == y diagonal.
     */
    DIAG_UP,

    /**
     * Mirror symmetry along the x == size - 1 - y diagonal.
     */
    DIAG_DOWN,

    /**
     * Left-right mirror symmetry.
     */
    HORIZ,

    /**
     * Top-bottom mirror symmetry.
     */
    VERT,

    /**
     * No symmetry left.  Once here, we never go back.
     */
    NONE
  }

  public int          mX1;
  public int          mY1;
  public int          mX2;
  public int          mY2;

  /**
   * Whether the playground is additionally folded along the diagonal of mType.
   */
  public boolean      mDiagonal;
  public SymmetryType mType;

  /**
   * Create a symmetry descriptor.
   */
  public BoardSymmetry(int xiX1, int xiY1, int xiX2, int xiY2, boolean xiDiagonal, SymmetryType xiType)
  {
    mX1 = xiX1;
    mY1 = xiY1;
    mX2 = xiX2;
    mY2 = xiY2;
    mDiagonal = xiDiagonal;
    mType = xiType;
  }

  /**
   * @return the symmetry of an empty board: one octant around the centre.
   *
   * @param xiSize - board size.
   */
  public static BoardSymmetry forEmptyBoard(int xiSize)
  {
    int lCentre = xiSize / 2;
    return new BoardSymmetry(lCentre, lCentre, xiSize - 1, xiSize - 1, true, SymmetryType.FULL);
  }

  /**
   * @return a playground covering the whole board.
   *
   * @param xiSize - board size.
   */
  public static BoardSymmetry none(int xiSize)
  {
    return new BoardSymmetry(0, 0, xiSize - 1, xiSize - 1, false, SymmetryType.NONE);
  }

  /**
   * @return an independent copy of this descriptor.
   */
  public BoardSymmetry copy()
  {
    return new BoardSymmetry(mX1, mY1, mX2, mY2, mDiagonal, mType);
  }

  /**
   * @return whether a point lies inside the playground (taking any diagonal fold into account).
   *
   * @param xiX    - x co-ordinate.
   * @param xiY    - y co-ordinate.
   * @param xiSize - board size.
   */
  public boolean contains(int xiX, int xiY, int xiSize)
  {
    if (xiX < mX1 || xiX > mX2 || xiY < mY1 || xiY > mY2)
    {
      return false;
    }

    if (mDiagonal)
    {
      int lX = (mType == SymmetryType.DIAG_DOWN) ? xiSize - 1 - xiX : xiX;
      if (lX > xiY)
      {
        return false;
      }
    }

    return true;
  }

  /**
   * Update the symmetry after a stone has been placed.
   *
   * Restoration of a lost symmetry isn't detected - that's too rare to be worth handling.
   *
   * @param xiSize  - board size.
   * @param xiCoord - the move just played.
   */
  public void update(int xiSize, int xiCoord)
  {
    if (mType == SymmetryType.NONE || Coord.isPass(xiCoord) || xiCoord == Coord.RESIGN)
    {
      return;
    }

    int lX = Coord.getX(xiCoord, xiSize);
    int lY = Coord.getY(xiCoord, xiSize);
    int lCentre = xiSize / 2;
    int lDownX = xiSize - 1 - lX;

    switch (mType)
    {
      case FULL:
        if (lX == lCentre && lY == lCentre)
        {
          // Tengen keeps full symmetry.
          return;
        }

        if (lX == lY)
        {
          set(0, 0, xiSize - 1, xiSize - 1, true, SymmetryType.DIAG_UP);
        }
        else if (lDownX == lY)
        {
          set(0, 0, xiSize - 1, xiSize - 1, true, SymmetryType.DIAG_DOWN);
        }
        else if (lX == lCentre)
        {
          // Left-right mirror survives.  Keep the right half only.
          set(mX1, 0, mX2, xiSize - 1, false, SymmetryType.HORIZ);
        }
        else if (lY == lCentre)
        {
          // Top-bottom mirror survives.  Keep the upper half only.
          set(0, mY1, xiSize - 1, mY2, false, SymmetryType.VERT);
        }
        else
        {
          breakSymmetry(xiSize);
        }
        break;

      case DIAG_UP:
        if (lX != lY)
        {
          breakSymmetry(xiSize);
        }
        break;

      case DIAG_DOWN:
        if (lDownX != lY)
        {
          breakSymmetry(xiSize);
        }
        break;

      case HORIZ:
        if (lX != lCentre)
        {
          breakSymmetry(xiSize);
        }
        break;

      case VERT:
        if (lY != lCentre)
        {
          breakSymmetry(xiSize);
        }
        break;

      default:
        assert(false) : "Unexpected symmetry " + mType;
        break;
    }
  }

  private void breakSymmetry(int xiSize)
  {
    set(0, 0, xiSize - 1, xiSize - 1, false, SymmetryType.NONE);
  }

  private void set(int xiX1, int xiY1, int xiX2, int xiY2, boolean xiDiagonal, SymmetryType xiType)
  {
    mX1 = xiX1;
    mY1 = xiY1;
    mX2 = xiX2;
    mY2 = xiY2;
    mDiagonal = xiDiagonal;
    mType = xiType;
  }

  @Override
  public String toString()
  {
    return "[" + mX1 + "," + mY1 + "],[" + mX2 + "," + mY2 + "] " + mType + (mDiagonal ? "-d" : "");
  }
}
