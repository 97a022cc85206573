package org.distgo.base.board;

import java.util.Arrays;

/**
 * A minimal board: tracks stones, move count and symmetry.  There's no capture or ko logic - a move is legal if its
 * point is empty.
 */
public class SimpleBoard implements Board
{
  private int           mSize;
  private double        mKomi;
  private int           mHandicap;
  private int           mMoveCount;
  private int           mNumStones;
  private Stone[]       mPoints;
  private BoardSymmetry mSymmetry;

  /**
   * Create an empty board.
   *
   * @param xiSize - board size.
   */
  public SimpleBoard(int xiSize)
  {
    setSize(xiSize);
  }

  /**
   * Resize (and clear) the board.
   *
   * @param xiSize - the new size.
   */
  public void setSize(int xiSize)
  {
    if (xiSize < 2 || xiSize > Coord.MAX_BOARD_SIZE)
    {
      throw new IllegalArgumentException("Unsupported board size " + xiSize);
    }
    mSize = xiSize;
    clear();
  }

  /**
   * Remove all stones.  Komi and handicap are kept.
   */
  public void clear()
  {
    mPoints = new Stone[mSize * mSize];
    Arrays.fill(mPoints, Stone.NONE);
    mMoveCount = 0;
    mNumStones = 0;
    mSymmetry = BoardSymmetry.forEmptyBoard(mSize);
  }

  public void setKomi(double xiKomi)
  {
    mKomi = xiKomi;
  }

  public void setHandicap(int xiHandicap)
  {
    mHandicap = xiHandicap;
  }

  /**
   * Play a move.
   *
   * @param xiColor - colour to play.
   * @param xiCoord - the point, or pass.
   *
   * @throws IllegalArgumentException if the move is illegal.
   */
  public void play(Stone xiColor, int xiCoord)
  {
    if (!isValidMove(xiColor, xiCoord))
    {
      throw new IllegalArgumentException("Illegal move " + xiColor + " " + Coord.toString(xiCoord, mSize));
    }

    mMoveCount++;
    if (Coord.isOnBoard(xiCoord, mSize))
    {
      mPoints[xiCoord] = xiColor;
      mNumStones++;
      mSymmetry.update(mSize, xiCoord);
    }
  }

  @Override
  public int getSize()
  {
    return mSize;
  }

  @Override
  public double getKomi()
  {
    return mKomi;
  }

  @Override
  public int getHandicap()
  {
    return mHandicap;
  }

  @Override
  public int getMoveCount()
  {
    return mMoveCount;
  }

  @Override
  public boolean isEmpty()
  {
    return mNumStones == 0;
  }

  @Override
  public Stone getStoneAt(int xiCoord)
  {
    return mPoints[xiCoord];
  }

  @Override
  public boolean isValidMove(Stone xiColor, int xiCoord)
  {
    if (xiColor == Stone.NONE)
    {
      return false;
    }
    if (Coord.isPass(xiCoord) || xiCoord == Coord.RESIGN)
    {
      return true;
    }
    return Coord.isOnBoard(xiCoord, mSize) && mPoints[xiCoord] == Stone.NONE;
  }

  @Override
  public boolean hasStoneWithin(int xiCoord, int xiRadius)
  {
    int lX = Coord.getX(xiCoord, mSize);
    int lY = Coord.getY(xiCoord, mSize);

    for (int lY2 = Math.max(0, lY - xiRadius); lY2 <= Math.min(mSize - 1, lY + xiRadius); lY2++)
    {
      for (int lX2 = Math.max(0, lX - xiRadius); lX2 <= Math.min(mSize - 1, lX + xiRadius); lX2++)
      {
        if (mPoints[Coord.fromXY(lX2, lY2, mSize)] != Stone.NONE)
        {
          return true;
        }
      }
    }
    return false;
  }

  @Override
  public BoardSymmetry getSymmetry()
  {
    return mSymmetry;
  }
}
