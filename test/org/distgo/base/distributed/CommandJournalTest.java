package org.distgo.base.distributed;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

public class CommandJournalTest
{
  private static List<Integer> ids(List<JournalEntry> xiEntries)
  {
    List<Integer> lIds = new ArrayList<>();
    for (JournalEntry lEntry : xiEntries)
    {
      lIds.add(lEntry.mId);
    }
    return lIds;
  }

  private static List<Integer> ids(int... xiIds)
  {
    List<Integer> lIds = new ArrayList<>();
    for (int lId : xiIds)
    {
      lIds.add(lId);
    }
    return lIds;
  }

  private static CommandJournal sixCommands()
  {
    CommandJournal lJournal = new CommandJournal();
    lJournal.append("komi", "6.5\n");
    for (int lii = 0; lii < 5; lii++)
    {
      lJournal.append("play", ((lii % 2 == 0) ? "black" : "white") + " D" + (lii + 1) + "\n");
    }
    return lJournal;
  }

  @Test
  public void testAppend()
  {
    CommandJournal lJournal = new CommandJournal();
    assertNull(lJournal.getHead());
    assertTrue(lJournal.entriesAfter(0, -1).isEmpty());

    JournalEntry lEntry = lJournal.append("komi", "7.5\n");
    assertEquals(1, lEntry.mId);
    assertEquals(lEntry, lJournal.getHead());
    assertEquals("1 komi 7.5\n", lEntry.toWireFormat());

    long lVersion = lJournal.getVersion();
    assertEquals(2, lJournal.append("name", "").mId);
    assertEquals("2 name\n", lJournal.getHead().toWireFormat());
    assertTrue(lJournal.getVersion() > lVersion);
  }

  @Test
  public void testCatchUp()
  {
    CommandJournal lJournal = sixCommands();
    long lVersion = lJournal.getVersion();

    assertEquals(ids(3, 4, 5, 6), ids(lJournal.entriesAfter(2, lVersion)));
    assertEquals(ids(1, 2, 3, 4, 5, 6), ids(lJournal.entriesAfter(0, lVersion)));
    assertTrue(lJournal.entriesAfter(6, lVersion).isEmpty());

    // An id the journal has never heard of means a full replay.
    assertEquals(ids(1, 2, 3, 4, 5, 6), ids(lJournal.entriesAfter(99, lVersion)));
  }

  @Test
  public void testRewriteHeadKeepingId()
  {
    CommandJournal lJournal = sixCommands();
    long lSent = lJournal.getVersion();

    JournalEntry lUpdated = lJournal.rewriteHead("pachi-genmoves", "black 100\n\n", false);
    assertEquals(6, lUpdated.mId);
    assertEquals(6, lJournal.size());

    // A worker which acked the old version is sent the new one again.
    List<JournalEntry> lToSend = lJournal.entriesAfter(6, lSent);
    assertEquals(1, lToSend.size());
    assertEquals("pachi-genmoves", lToSend.get(0).mVerb);

    // Once sent, it's up to date.
    assertTrue(lJournal.entriesAfter(6, lJournal.getVersion()).isEmpty());
  }

  @Test
  public void testRewriteHeadWithNewId()
  {
    CommandJournal lJournal = sixCommands();
    lJournal.rewriteHead("pachi-genmoves", "black 0\n\n", false);
    long lSent = lJournal.getVersion();

    JournalEntry lPlay = lJournal.rewriteHead("play", "black C3\n", true);
    assertEquals(7, lPlay.mId);
    assertEquals(6, lPlay.mReplacesId);
    assertEquals(6, lJournal.size());

    // A worker which acked the genmoves is sent the play that replaced it.
    assertEquals(ids(7), ids(lJournal.entriesAfter(6, lSent)));
    assertEquals(ids(7), ids(lJournal.entriesAfter(5, lSent)));
    assertTrue(lJournal.entriesAfter(7, lJournal.getVersion()).isEmpty());
    assertEquals(8, lJournal.append("play", "white D4\n").mId);
  }

  @Test
  public void testRetractHead()
  {
    CommandJournal lJournal = sixCommands();
    lJournal.append("pachi-genmoves", "black 0\n\n");
    lJournal.rewriteHead("pachi-genmoves", "black 50\n\n", false);
    long lSent = lJournal.getVersion();

    lJournal.retractHead();
    assertEquals(6, lJournal.size());
    assertEquals(6, lJournal.getHead().mId);

    // A worker which saw the retracted command isn't sent anything more.
    assertTrue(lJournal.entriesAfter(7, lSent).isEmpty());
    assertTrue(lJournal.entriesAfter(6, lSent).isEmpty());

    // Nor is it sent anything old when the next command comes along.
    JournalEntry lNext = lJournal.append("play", "black E5\n");
    assertEquals(ids(lNext.mId), ids(lJournal.entriesAfter(7, lSent)));
  }

  @Test
  public void testNewGameTruncatesHistory()
  {
    CommandJournal lJournal = new CommandJournal();
    lJournal.append("boardsize", "9\n");
    lJournal.append("komi", "7\n");
    lJournal.append("clear_board", "");
    lJournal.append("play", "black E5\n");
    lJournal.append("play", "white C3\n");

    lJournal.append("clear_board", "");
    assertEquals(ids(1, 2, 6), ids(lJournal.getEntries()));

    // A worker which was part way through the old game is replayed from scratch.
    assertEquals(ids(1, 2, 6), ids(lJournal.entriesAfter(4, lJournal.getVersion())));

    lJournal.append("komi", "6.5\n");
    lJournal.append("boardsize", "19\n");
    assertEquals(ids(7, 8), ids(lJournal.getEntries()));
    assertEquals("komi", lJournal.getEntries().get(0).mVerb);
    assertEquals("6.5\n", lJournal.getEntries().get(0).mArgs);
  }

  @Test
  public void testFirstId()
  {
    CommandJournal lJournal = new CommandJournal(100);
    assertEquals(100, lJournal.append("name", "").mId);
    assertEquals(101, lJournal.append("version", "").mId);
    assertEquals(ids(101), ids(lJournal.entriesAfter(100, lJournal.getVersion())));
  }
}
