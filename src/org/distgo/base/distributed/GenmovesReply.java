package org.distgo.base.distributed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.distgo.base.board.Coord;

import com.google.common.base.Splitter;

/**
 * One worker's reply to a genmoves request.
 *
 * <pre>
 * =id played playouts threads keep_looking [reserved...]
 * coord playouts value amaf_playouts amaf_value
 * ...
 * </pre>
 */
public class GenmovesReply
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final Splitter LINES = Splitter.on('\n');
  private static final Splitter FIELDS = Splitter.on(' ').omitEmptyStrings();

  /**
   * Statistics for one candidate move.
   */
  public static class Candidate
  {
    public final int    mCoord;
    public final long   mPlayouts;
    public final double mValue;
    public final long   mAmafPlayouts;
    public final double mAmafValue;

    public Candidate(int xiCoord, long xiPlayouts, double xiValue, long xiAmafPlayouts, double xiAmafValue)
    {
      mCoord = xiCoord;
      mPlayouts = xiPlayouts;
      mValue = xiValue;
      mAmafPlayouts = xiAmafPlayouts;
      mAmafValue = xiAmafValue;
    }
  }

  public final int             mId;
  public final long            mPlayed;
  public final long            mPlayouts;
  public final int             mThreads;
  public final int             mKeepLooking;
  public final List<Candidate> mCandidates;

  private GenmovesReply(int xiId,
                        long xiPlayed,
                        long xiPlayouts,
                        int xiThreads,
                        int xiKeepLooking,
                        List<Candidate> xiCandidates)
  {
    mId = xiId;
    mPlayed = xiPlayed;
    mPlayouts = xiPlayouts;
    mThreads = xiThreads;
    mKeepLooking = xiKeepLooking;
    mCandidates = Collections.unmodifiableList(xiCandidates);
  }

  /**
   * Parse a reply.  Malformed candidate lines are skipped.
   *
   * @param xiReply     - the reply text.
   * @param xiBoardSize - board size, for parsing coordinates.
   *
   * @return the parsed reply, or null if the header line is malformed.
   */
  public static GenmovesReply parse(String xiReply, int xiBoardSize)
  {
    List<String> lLines = LINES.splitToList(xiReply);
    List<String> lHeader = FIELDS.splitToList(lLines.get(0));
    if (lHeader.size() < 5 || !lHeader.get(0).startsWith("="))
    {
      return null;
    }

    int lId;
    long lPlayed;
    long lPlayouts;
    int lThreads;
    int lKeep;
    try
    {
      lId = Integer.parseInt(lHeader.get(0).substring(1));
      lPlayed = Long.parseLong(lHeader.get(1));
      lPlayouts = Long.parseLong(lHeader.get(2));
      lThreads = Integer.parseInt(lHeader.get(3));
      lKeep = Integer.parseInt(lHeader.get(4));
    }
    catch (NumberFormatException lEx)
    {
      return null;
    }

    List<Candidate> lCandidates = new ArrayList<>();
    for (int lii = 1; lii < lLines.size(); lii++)
    {
      String lLine = lLines.get(lii);
      if (lLine.isEmpty())
      {
        break;
      }

      Candidate lCandidate = parseCandidate(lLine, xiBoardSize);
      if (lCandidate == null)
      {
        LOGGER.debug("Skipping malformed line in reply " + lId + ": " + lLine);
        continue;
      }
      lCandidates.add(lCandidate);
    }

    return new GenmovesReply(lId, lPlayed, lPlayouts, lThreads, lKeep, lCandidates);
  }

  private static Candidate parseCandidate(String xiLine, int xiBoardSize)
  {
    List<String> lFields = FIELDS.splitToList(xiLine);
    if (lFields.size() < 5)
    {
      return null;
    }

    try
    {
      return new Candidate(Coord.parse(lFields.get(0), xiBoardSize),
                           Long.parseLong(lFields.get(1)),
                           Double.parseDouble(lFields.get(2)),
                           Long.parseLong(lFields.get(3)),
                           Double.parseDouble(lFields.get(4)));
    }
    catch (IllegalArgumentException lEx)
    {
      // Includes NumberFormatException.
      return null;
    }
  }
}
