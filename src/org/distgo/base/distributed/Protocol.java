package org.distgo.base.distributed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Shared state between the coordinator and its worker connections: the command journal, the replies to the current
 * command and the synchronisation state of each worker.
 *
 * Everything is guarded by this object's monitor.  The lock is never held across network I/O; connection threads
 * take what they need to send, release the lock, talk to their worker and then report back.
 */
public class Protocol
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final CommandJournal             mJournal;
  private final ReplyAggregator            mAggregator;
  private final Map<String, WorkerSession> mSessions = new LinkedHashMap<>();
  private final int                        mMaxWorkers;
  private boolean                          mClosed   = false;

  /**
   * @param xiMaxWorkers - the most workers that may be connected at once.
   */
  public Protocol(int xiMaxWorkers)
  {
    this(xiMaxWorkers, new CommandJournal());
  }

  Protocol(int xiMaxWorkers, CommandJournal xiJournal)
  {
    mMaxWorkers = xiMaxWorkers;
    mJournal = xiJournal;
    mAggregator = new ReplyAggregator(xiMaxWorkers);
  }

  /**
   * Register a newly connected worker.  It will be sent the full command history.
   *
   * @param xiName - a name for the worker.  Must be unique among connected workers.
   *
   * @return the worker's session, or null if there are already as many workers as allowed.
   */
  public synchronized WorkerSession register(String xiName)
  {
    if (mClosed || mSessions.size() >= mMaxWorkers)
    {
      return null;
    }

    assert(!mSessions.containsKey(xiName)) : "Duplicate worker name " + xiName;
    WorkerSession lSession = new WorkerSession(xiName);
    mSessions.put(xiName, lSession);
    LOGGER.info("Worker " + xiName + " connected (" + mSessions.size() + " active)");
    notifyAll();
    return lSession;
  }

  /**
   * Forget a worker, e.g. because its connection has dropped.  Its reply to the current command (if any) is
   * discarded.
   *
   * @param xiSession - the worker.
   */
  public synchronized void unregister(WorkerSession xiSession)
  {
    if (mSessions.remove(xiSession.getName()) != null)
    {
      mAggregator.remove(xiSession.getName());
      LOGGER.info("Worker " + xiSession.getName() + " disconnected (" + mSessions.size() + " active)");
      notifyAll();
    }
  }

  /**
   * @return the number of connected workers.
   */
  public synchronized int getNumWorkers()
  {
    return mSessions.size();
  }

  public int getMaxWorkers()
  {
    return mMaxWorkers;
  }

  /**
   * Issue a new command to all workers.  Replies to earlier commands are discarded.
   *
   * @param xiVerb - the verb.
   * @param xiArgs - the arguments.
   *
   * @return the journal entry for the command.
   */
  public synchronized JournalEntry newCommand(String xiVerb, String xiArgs)
  {
    JournalEntry lEntry = mJournal.append(xiVerb, xiArgs);
    mAggregator.clear();
    LOGGER.debug("New command " + lEntry);
    notifyAll();
    return lEntry;
  }

  /**
   * Replace the command in flight.
   *
   * @param xiVerb  - the new verb.
   * @param xiArgs  - the new arguments.
   * @param xiNewId - whether the replacement is a new command (in which case replies so far are discarded) or an
   *                  update to the one in flight (in which case they're kept).
   *
   * @return the journal entry for the replacement.
   */
  public synchronized JournalEntry updateCommand(String xiVerb, String xiArgs, boolean xiNewId)
  {
    JournalEntry lEntry = mJournal.rewriteHead(xiVerb, xiArgs, xiNewId);
    if (xiNewId)
    {
      mAggregator.clear();
    }
    LOGGER.trace("Updated command " + lEntry);
    notifyAll();
    return lEntry;
  }

  /**
   * Withdraw the command in flight from the history.
   */
  public synchronized void retractCommand()
  {
    mJournal.retractHead();
    mAggregator.clear();
    notifyAll();
  }

  /**
   * Wait for replies to the current command from every connected worker, or until the deadline, whichever comes
   * first.  With no workers connected, waits for the deadline in case one connects.
   *
   * @param xiDeadline - deadline, in milliseconds since the epoch.
   *
   * @return the replies received so far.
   */
  public synchronized List<String> getReplies(long xiDeadline)
  {
    while (!mClosed && mAggregator.size() < Math.max(1, mSessions.size()))
    {
      long lRemaining = xiDeadline - System.currentTimeMillis();
      if (lRemaining <= 0)
      {
        break;
      }

      try
      {
        wait(lRemaining);
      }
      catch (InterruptedException lEx)
      {
        Thread.currentThread().interrupt();
        break;
      }
    }

    return mAggregator.getReplies();
  }

  /**
   * Block until there is something to send to a worker.
   *
   * @param xiSession - the worker.
   *
   * @return the commands to send, oldest first.  Empty if the worker has been unregistered or the protocol closed.
   *
   * @throws InterruptedException if interrupted while waiting.
   */
  public synchronized List<JournalEntry> awaitWork(WorkerSession xiSession) throws InterruptedException
  {
    while (!mClosed && mSessions.containsKey(xiSession.getName()))
    {
      List<JournalEntry> lEntries = mJournal.entriesAfter(xiSession.mLastAckedId, xiSession.mSentVersion);
      if (!lEntries.isEmpty())
      {
        xiSession.mSentVersion = mJournal.getVersion();
        if (lEntries.size() > 1)
        {
          LOGGER.debug("Sending " + lEntries.size() + " commands of history to " + xiSession.getName());
        }
        return lEntries;
      }
      wait();
    }

    return Collections.emptyList();
  }

  /**
   * Process a worker's reply to a command.
   *
   * @param xiSession - the worker.
   * @param xiSent    - the command it was replying to.
   * @param xiReply   - the reply.
   *
   * @return whether the worker is still in step.  If not, it will be sent the full history next time.
   */
  public synchronized boolean handleReply(WorkerSession xiSession, JournalEntry xiSent, String xiReply)
  {
    int lId = parseReplyId(xiReply);
    if (xiReply.startsWith("?") || lId != xiSent.mId)
    {
      LOGGER.info("Worker " + xiSession.getName() + " out of step on " + xiSent + ": " + firstLine(xiReply));
      xiSession.mLastAckedId = 0;
      notifyAll();
      return false;
    }

    xiSession.mLastAckedId = lId;

    // Only replies to the command in flight count.  Anything else is stale history.
    JournalEntry lHead = mJournal.getHead();
    if (lHead != null && lHead.mId == lId && mSessions.containsKey(xiSession.getName()))
    {
      mAggregator.record(xiSession.getName(), xiReply);
      notifyAll();
    }
    return true;
  }

  /**
   * Shut down.  Connection threads waiting for work are released.
   */
  public synchronized void close()
  {
    mClosed = true;
    notifyAll();
  }

  public synchronized boolean isClosed()
  {
    return mClosed;
  }

  /**
   * @return a snapshot of the command history.
   */
  public synchronized List<JournalEntry> getHistory()
  {
    return mJournal.getEntries();
  }

  /**
   * @return the names of the connected workers.
   */
  public synchronized List<String> getWorkerNames()
  {
    return new ArrayList<>(mSessions.keySet());
  }

  /**
   * @return the id at the start of a reply ("=12 ..." or "?12 ..."), or -1 if there isn't one.
   *
   * @param xiReply - the reply.
   */
  static int parseReplyId(String xiReply)
  {
    if (xiReply.length() < 2 || (xiReply.charAt(0) != '=' && xiReply.charAt(0) != '?'))
    {
      return -1;
    }

    int lEnd = 1;
    while (lEnd < xiReply.length() && Character.isDigit(xiReply.charAt(lEnd)))
    {
      lEnd++;
    }
    if (lEnd == 1)
    {
      return -1;
    }

    try
    {
      return Integer.parseInt(xiReply.substring(1, lEnd));
    }
    catch (NumberFormatException lEx)
    {
      return -1;
    }
  }

  private static String firstLine(String xiReply)
  {
    int lEnd = xiReply.indexOf('\n');
    return (lEnd < 0) ? xiReply : xiReply.substring(0, lEnd);
  }
}
