package org.distgo.base.distributed;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.lang.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The history of commands sent to workers, used to bring a worker that has fallen behind (or just connected) back
 * into step by replaying what it missed.
 *
 * Not thread-safe.  All access is under the {@link Protocol} lock.
 */
public class CommandJournal
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Commands that start a new game.  History before them (other than game setup) is dropped.
   */
  private static final Set<String> GAME_START_VERBS = new HashSet<>(Arrays.asList("boardsize", "clear_board"));

  /**
   * Game setup commands, which survive the start of a new game.  Only the latest of each is kept.
   */
  private static final Set<String> SETUP_VERBS = new HashSet<>(Arrays.asList("boardsize",
                                                                              "komi",
                                                                              "kgs-rules",
                                                                              "time_settings",
                                                                              "kgs-time_settings"));

  private final List<JournalEntry>   mEntries   = new ArrayList<>();

  // Retracted command id -> id of the command now preceding where it was (0 for none).
  private final Map<Integer, Integer> mRetracted = new HashMap<>();

  private int                         mNextId;
  private long                        mVersion   = 0;

  /**
   * Create an empty journal whose first command will have id 1.
   */
  public CommandJournal()
  {
    this(1);
  }

  /**
   * Create an empty journal.
   *
   * @param xiFirstId - id of the first command.  Must be positive.
   */
  public CommandJournal(int xiFirstId)
  {
    assert(xiFirstId > 0);
    mNextId = xiFirstId;
  }

  /**
   * Record a new command.
   *
   * @param xiVerb - the verb.
   * @param xiArgs - the arguments (possibly empty).
   *
   * @return the new entry, which is now the head of the journal.
   */
  public JournalEntry append(String xiVerb, String xiArgs)
  {
    if (isGameStart(xiVerb))
    {
      truncateForNewGame(xiVerb);
    }

    mVersion++;
    JournalEntry lEntry = new JournalEntry(mNextId++, xiVerb, xiArgs, 0, mVersion);
    mEntries.add(lEntry);
    return lEntry;
  }

  /**
   * Overwrite the most recent command.
   *
   * @param xiVerb  - the new verb.
   * @param xiArgs  - the new arguments.
   * @param xiNewId - whether to give the command a new id.  If not, workers that already have the command will be
   *                  sent it again and replies to either version are accepted.
   *
   * @return the new head of the journal.
   */
  public JournalEntry rewriteHead(String xiVerb, String xiArgs, boolean xiNewId)
  {
    assert(!mEntries.isEmpty()) : "No command to rewrite";

    JournalEntry lHead = getHead();
    mVersion++;
    JournalEntry lEntry;
    if (xiNewId)
    {
      lEntry = new JournalEntry(mNextId++, xiVerb, xiArgs, lHead.mId, mVersion);
    }
    else
    {
      lEntry = new JournalEntry(lHead.mId, xiVerb, xiArgs, lHead.mReplacesId, mVersion);
    }

    mEntries.set(mEntries.size() - 1, lEntry);
    return lEntry;
  }

  /**
   * Remove the most recent command from the history.  Workers that already have it are treated as being up to date
   * with what precedes it.
   */
  public void retractHead()
  {
    assert(!mEntries.isEmpty()) : "No command to retract";

    JournalEntry lHead = mEntries.remove(mEntries.size() - 1);
    int lPredecessor = mEntries.isEmpty() ? 0 : getHead().mId;
    mRetracted.put(lHead.mId, lPredecessor);
    if (lHead.mReplacesId != 0)
    {
      mRetracted.put(lHead.mReplacesId, lPredecessor);
    }
    mVersion++;
  }

  /**
   * @return the most recent command, or null if there isn't one.
   */
  public JournalEntry getHead()
  {
    return mEntries.isEmpty() ? null : mEntries.get(mEntries.size() - 1);
  }

  /**
   * @return a counter that changes whenever the journal does, even if the head id doesn't.
   */
  public long getVersion()
  {
    return mVersion;
  }

  public int size()
  {
    return mEntries.size();
  }

  /**
   * @return a snapshot of the retained history, oldest first.
   */
  public List<JournalEntry> getEntries()
  {
    return new ArrayList<>(mEntries);
  }

  /**
   * Work out what a worker needs to be sent to catch up.
   *
   * @param xiLastAckedId - the last command the worker acknowledged, or 0 if it's starting from scratch.
   * @param xiSentVersion - the journal version when the worker was last sent anything.
   *
   * @return the commands to send, oldest first.  Empty if the worker is up to date.
   */
  public List<JournalEntry> entriesAfter(int xiLastAckedId, long xiSentVersion)
  {
    if (mEntries.isEmpty())
    {
      return Collections.emptyList();
    }

    int lAcked = xiLastAckedId;
    while (mRetracted.containsKey(lAcked))
    {
      lAcked = mRetracted.get(lAcked);
    }

    if (lAcked == 0)
    {
      return getEntries();
    }

    JournalEntry lHead = getHead();
    if (lAcked == lHead.mId)
    {
      // Up to date unless the head has been rewritten since.
      return (xiSentVersion < lHead.mRevision) ? Collections.singletonList(lHead) :
                                          Collections.<JournalEntry>emptyList();
    }

    for (int lii = 0; lii < mEntries.size(); lii++)
    {
      JournalEntry lEntry = mEntries.get(lii);
      if (lEntry.mId == lAcked)
      {
        return new ArrayList<>(mEntries.subList(lii + 1, mEntries.size()));
      }
      if (lEntry.mReplacesId == lAcked)
      {
        return new ArrayList<>(mEntries.subList(lii, mEntries.size()));
      }
    }

    // The worker's position has been dropped from the history.  Start it from scratch.
    LOGGER.debug("Command " + xiLastAckedId + " no longer in history - full replay");
    return getEntries();
  }

  private static boolean isGameStart(String xiVerb)
  {
    return GAME_START_VERBS.contains(StringUtils.lowerCase(xiVerb));
  }

  private void truncateForNewGame(String xiVerb)
  {
    String lVerb = StringUtils.lowerCase(xiVerb);
    Map<String, JournalEntry> lSetup = new LinkedHashMap<>();
    for (JournalEntry lEntry : mEntries)
    {
      String lEntryVerb = StringUtils.lowerCase(lEntry.mVerb);
      if (SETUP_VERBS.contains(lEntryVerb) && !lEntryVerb.equals(lVerb))
      {
        lSetup.remove(lEntryVerb);
        lSetup.put(lEntryVerb, lEntry);
      }
    }

    int lBefore = mEntries.size();
    mEntries.clear();
    for (JournalEntry lEntry : lSetup.values())
    {
      mEntries.add(lEntry);
    }
    mEntries.sort((a, b) -> Integer.compare(a.mId, b.mId));
    mRetracted.clear();

    LOGGER.debug("New game: history cut from " + lBefore + " to " + mEntries.size() + " commands");
  }
}
