package org.distgo.base.distributed;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.distgo.base.board.Coord;
import org.distgo.base.distributed.GenmovesReply.Candidate;
import org.junit.Test;

public class GenmovesReplyTest
{
  private static final double EPSILON = 1e-9;

  @Test
  public void testParse()
  {
    GenmovesReply lReply = GenmovesReply.parse("=7 100 500 4 1\nC3 50 0.6 10 0.55\nD4 80 0.4 5 0.3\n", 9);
    assertEquals(7, lReply.mId);
    assertEquals(100, lReply.mPlayed);
    assertEquals(500, lReply.mPlayouts);
    assertEquals(4, lReply.mThreads);
    assertEquals(1, lReply.mKeepLooking);
    assertEquals(2, lReply.mCandidates.size());

    Candidate lC3 = lReply.mCandidates.get(0);
    assertEquals(Coord.parse("C3", 9), lC3.mCoord);
    assertEquals(50, lC3.mPlayouts);
    assertEquals(0.6, lC3.mValue, EPSILON);
    assertEquals(10, lC3.mAmafPlayouts);
    assertEquals(0.55, lC3.mAmafValue, EPSILON);
  }

  @Test
  public void testReservedHeaderFields()
  {
    GenmovesReply lReply = GenmovesReply.parse("=3 1 2 3 0 extra fields\npass 5 0.5 0 0\n", 9);
    assertEquals(0, lReply.mKeepLooking);
    assertEquals(Coord.PASS, lReply.mCandidates.get(0).mCoord);
  }

  @Test
  public void testMalformedLinesSkipped()
  {
    GenmovesReply lReply = GenmovesReply.parse("=1 10 20 1 1\nbogus\nZ99 1 0.5 0 0\nC3 5 x 1 0.5\nD4 5 0.5 1 0.5\n",
                                               9);
    assertEquals(1, lReply.mCandidates.size());
    assertEquals(Coord.parse("D4", 9), lReply.mCandidates.get(0).mCoord);
  }

  @Test
  public void testStopsAtBlankLine()
  {
    GenmovesReply lReply = GenmovesReply.parse("=1 10 20 1 1\nC3 5 0.5 1 0.5\n\nD4 5 0.5 1 0.5\n", 9);
    assertEquals(1, lReply.mCandidates.size());
  }

  @Test
  public void testMalformedHeader()
  {
    assertNull(GenmovesReply.parse("=1 10 20\n", 9));
    assertNull(GenmovesReply.parse("?1 unknown command\n", 9));
    assertNull(GenmovesReply.parse("=1 ten 20 1 1\n", 9));
    assertNull(GenmovesReply.parse("", 9));
  }
}
