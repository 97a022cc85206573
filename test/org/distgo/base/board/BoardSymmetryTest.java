package org.distgo.base.board;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.distgo.base.board.BoardSymmetry.SymmetryType;
import org.junit.Test;

public class BoardSymmetryTest
{
  @Test
  public void testEmptyBoard()
  {
    BoardSymmetry lSym = BoardSymmetry.forEmptyBoard(9);
    assertEquals(SymmetryType.FULL, lSym.mType);
    assertTrue(lSym.mDiagonal);
    assertEquals(4, lSym.mX1);
    assertEquals(4, lSym.mY1);
    assertEquals(8, lSym.mX2);
    assertEquals(8, lSym.mY2);

    // One octant, including both edges of the fold.
    assertTrue(lSym.contains(4, 4, 9));
    assertTrue(lSym.contains(5, 7, 9));
    assertTrue(lSym.contains(8, 8, 9));
    assertFalse(lSym.contains(7, 5, 9));
    assertFalse(lSym.contains(2, 7, 9));

    int lCount = 0;
    for (int lY = 0; lY < 9; lY++)
    {
      for (int lX = 0; lX < 9; lX++)
      {
        if (lSym.contains(lX, lY, 9))
        {
          lCount++;
        }
      }
    }
    assertEquals(15, lCount);
  }

  @Test
  public void testTengenKeepsFullSymmetry()
  {
    BoardSymmetry lSym = BoardSymmetry.forEmptyBoard(9);
    lSym.update(9, Coord.fromXY(4, 4, 9));
    assertEquals(SymmetryType.FULL, lSym.mType);
  }

  @Test
  public void testPassIgnored()
  {
    BoardSymmetry lSym = BoardSymmetry.forEmptyBoard(9);
    lSym.update(9, Coord.PASS);
    lSym.update(9, Coord.RESIGN);
    assertEquals(SymmetryType.FULL, lSym.mType);
  }

  @Test
  public void testDiagonalMoves()
  {
    BoardSymmetry lSym = BoardSymmetry.forEmptyBoard(9);
    lSym.update(9, Coord.fromXY(2, 2, 9));
    assertEquals(SymmetryType.DIAG_UP, lSym.mType);
    assertTrue(lSym.mDiagonal);
    assertTrue(lSym.contains(0, 8, 9));
    assertFalse(lSym.contains(8, 0, 9));

    // Staying on the diagonal keeps it.
    lSym.update(9, Coord.fromXY(6, 6, 9));
    assertEquals(SymmetryType.DIAG_UP, lSym.mType);

    lSym.update(9, Coord.fromXY(6, 5, 9));
    assertEquals(SymmetryType.NONE, lSym.mType);
    assertFalse(lSym.mDiagonal);

    lSym = BoardSymmetry.forEmptyBoard(9);
    lSym.update(9, Coord.fromXY(2, 6, 9));
    assertEquals(SymmetryType.DIAG_DOWN, lSym.mType);
    assertTrue(lSym.contains(8, 8, 9));
    assertFalse(lSym.contains(0, 0, 9));
  }

  @Test
  public void testMirrorMoves()
  {
    BoardSymmetry lSym = BoardSymmetry.forEmptyBoard(9);
    lSym.update(9, Coord.fromXY(4, 1, 9));
    assertEquals(SymmetryType.HORIZ, lSym.mType);
    assertEquals(4, lSym.mX1);
    assertEquals(0, lSym.mY1);
    assertEquals(8, lSym.mY2);

    lSym = BoardSymmetry.forEmptyBoard(9);
    lSym.update(9, Coord.fromXY(1, 4, 9));
    assertEquals(SymmetryType.VERT, lSym.mType);
    assertEquals(0, lSym.mX1);
    assertEquals(4, lSym.mY1);

    lSym.update(9, Coord.fromXY(1, 2, 9));
    assertEquals(SymmetryType.NONE, lSym.mType);
  }

  @Test
  public void testAsymmetricMove()
  {
    BoardSymmetry lSym = BoardSymmetry.forEmptyBoard(19);
    lSym.update(19, Coord.fromXY(3, 2, 19));
    assertEquals(SymmetryType.NONE, lSym.mType);
    assertEquals(0, lSym.mX1);
    assertEquals(18, lSym.mX2);

    // Never comes back.
    lSym.update(19, Coord.fromXY(9, 9, 19));
    assertEquals(SymmetryType.NONE, lSym.mType);
  }

  @Test
  public void testCopyIsIndependent()
  {
    BoardSymmetry lSym = BoardSymmetry.forEmptyBoard(9);
    BoardSymmetry lCopy = lSym.copy();
    lCopy.update(9, Coord.fromXY(0, 1, 9));
    assertEquals(SymmetryType.FULL, lSym.mType);
    assertEquals(SymmetryType.NONE, lCopy.mType);
  }
}
